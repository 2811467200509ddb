package com.encarbot.acquisition;

import com.encarbot.browser.SessionSnapshot;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable cookie/header set harvested from one browser visit, valid until
 * {@link #expiresAt()}. Never persisted.
 */
public final class AcquisitionSession {
    private final Map<String, String> headers;
    private final int cookieCount;
    private final Instant createdAt;
    private final Instant expiresAt;

    private AcquisitionSession(Map<String, String> headers, int cookieCount, Instant createdAt, Instant expiresAt) {
        this.headers = Collections.unmodifiableMap(headers);
        this.cookieCount = cookieCount;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    /**
     * Builds the request header set around the browser's own user agent, since a synthetic
     * identity that does not match the cookies gets silently rejected.
     */
    public static AcquisitionSession from(SessionSnapshot snapshot, String referer, String origin,
                                          Instant now, Duration ttl) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", snapshot.userAgent());
        headers.put("Accept", "application/json, text/plain, */*");
        headers.put("Accept-Language", "ko-KR,ko;q=0.9,en-US;q=0.8,en;q=0.7");
        headers.put("Referer", referer);
        headers.put("Origin", origin);
        headers.put("X-Requested-With", "XMLHttpRequest");
        headers.put("Sec-Fetch-Dest", "empty");
        headers.put("Sec-Fetch-Mode", "cors");
        headers.put("Sec-Fetch-Site", "same-site");
        headers.put("Cache-Control", "no-cache");
        headers.put("Pragma", "no-cache");
        headers.put("Cookie", snapshot.cookieHeader());
        return new AcquisitionSession(headers, snapshot.cookies().size(), now, now.plus(ttl));
    }

    public boolean isValidAt(Instant now) {
        return now.isBefore(expiresAt);
    }

    public Map<String, String> headers() {
        return headers;
    }

    public int cookieCount() {
        return cookieCount;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    @Override
    public String toString() {
        return "AcquisitionSession{cookies=" + cookieCount + ", headers=" + headers.size()
                + ", expiresAt=" + expiresAt + "}";
    }
}
