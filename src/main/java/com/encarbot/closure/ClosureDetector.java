package com.encarbot.closure;

import com.encarbot.browser.RenderedPage;
import com.encarbot.model.ClosureReason;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads closure evidence off a rendered listing page. Checks run from the most to the
 * least specific; the first hit decides the reason. An empty result means the listing
 * still looks active.
 */
public final class ClosureDetector {
    static final List<String> NO_DATA_PHRASES = List.of("판매되었거나 삭제된", "판매완료");
    static final List<String> ERROR_TITLES = List.of(
            "404", "not found", "page not found", "error", "페이지를 찾을 수 없습니다", "존재하지 않는", "오류"
    );
    static final List<String> WITHDRAWN_PHRASES = List.of(
            "이 차량은 판매되었거나 삭제된 차량입니다",
            "차량정보가 존재하지 않습니다",
            "해당 매물을 찾을 수 없습니다",
            "삭제되었거나 존재하지 않는",
            "판매가 완료된 차량"
    );
    private static final int MIN_ERROR_ELEMENT_CHARS = 10;
    // whole path or query tokens only; listing ids routinely contain "404"
    private static final Pattern ERROR_URL = Pattern.compile("(?:^|[/?=&_.-])(?:error|404|notfound|not-found)(?:$|[/?=&_.-])");

    private ClosureDetector() {
    }

    public static Optional<ClosureReason> detect(RenderedPage page) {
        if (!page.hasResponse()) {
            return Optional.of(ClosureReason.NO_RESPONSE);
        }
        if (page.status() == 404) {
            return Optional.of(ClosureReason.HTTP_404);
        }
        if (isInconclusive(page)) {
            return Optional.empty();
        }
        for (String text : page.noDataTexts()) {
            if (containsAny(text, NO_DATA_PHRASES)) {
                return Optional.of(ClosureReason.CONFIRMED_MESSAGE);
            }
        }
        String title = page.title().toLowerCase(Locale.ROOT);
        if (containsAny(title, ERROR_TITLES)) {
            return Optional.of(ClosureReason.ERROR_PAGE);
        }
        if (containsAny(page.bodyText(), WITHDRAWN_PHRASES) || containsAny(page.html(), WITHDRAWN_PHRASES)) {
            return Optional.of(ClosureReason.CONFIRMED_MESSAGE);
        }
        for (String text : page.errorElementTexts()) {
            if (text.trim().length() > MIN_ERROR_ELEMENT_CHARS) {
                return Optional.of(ClosureReason.ERROR_ELEMENT);
            }
        }
        if (ERROR_URL.matcher(page.finalUrl().toLowerCase(Locale.ROOT)).find()) {
            return Optional.of(ClosureReason.REDIRECT_ERROR);
        }
        return Optional.empty();
    }

    /**
     * Error statuses other than 404 (blocks, throttling, server faults) say nothing about
     * the listing itself.
     */
    public static boolean isInconclusive(RenderedPage page) {
        return page.hasResponse() && page.status() >= 400 && page.status() != 404;
    }

    private static boolean containsAny(String text, List<String> needles) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
