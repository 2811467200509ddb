package com.encarbot.browser;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cookies and client identity observed while a real browser rendered the marketplace.
 */
public record SessionSnapshot(Map<String, String> cookies, String userAgent, String pageUrl) {
    public SessionSnapshot {
        cookies = cookies == null ? Map.of() : new LinkedHashMap<>(cookies);
        userAgent = userAgent == null ? "" : userAgent;
        pageUrl = pageUrl == null ? "" : pageUrl;
    }

    public String cookieHeader() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> cookie : cookies.entrySet()) {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append(cookie.getKey()).append('=').append(cookie.getValue());
        }
        return sb.toString();
    }
}
