package com.encarbot.browser;

import java.util.List;

/**
 * What a detail page looked like after rendering.
 *
 * @param status            HTTP status of the main navigation, or null when the browser got no response
 * @param noDataTexts       text of elements in the "no data" region of the detail page
 * @param errorElementTexts text of elements whose class marks them as error/not-found blocks
 */
public record RenderedPage(
        Integer status,
        String title,
        String finalUrl,
        String html,
        String bodyText,
        List<String> noDataTexts,
        List<String> errorElementTexts
) {
    public RenderedPage {
        title = title == null ? "" : title;
        finalUrl = finalUrl == null ? "" : finalUrl;
        html = html == null ? "" : html;
        bodyText = bodyText == null ? "" : bodyText;
        noDataTexts = noDataTexts == null ? List.of() : List.copyOf(noDataTexts);
        errorElementTexts = errorElementTexts == null ? List.of() : List.copyOf(errorElementTexts);
    }

    public static RenderedPage noResponse(String url) {
        return new RenderedPage(null, "", url, "", "", List.of(), List.of());
    }

    public boolean hasResponse() {
        return status != null;
    }
}
