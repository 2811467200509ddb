package com.encarbot.price;

import org.jsoup.Jsoup;

public final class PageText {
    private PageText() {
    }

    /**
     * Visible text of an HTML document or fragment, whitespace collapsed.
     */
    public static String fromHtml(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text();
    }

    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.replace('\u00A0', ' ').replaceAll("\\s+", " ").trim();
    }
}
