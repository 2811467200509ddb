package com.encarbot.classify;

import com.encarbot.browser.RenderedPage;
import com.encarbot.model.LeaseTerms;
import com.encarbot.model.ListingDetail;
import com.encarbot.price.PageText;
import com.encarbot.price.PriceNormalizer;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls views, first registration date and lease terms out of a rendered detail page.
 */
public final class DetailExtractor {
    private static final Pattern VIEWS = Pattern.compile("조회수\\s*:?\\s*([\\d,]+)");
    private static final Pattern REGISTERED = Pattern.compile("최초\\s*등록일\\s*:?\\s*(\\d{4}[/.-]\\d{2}[/.-]\\d{2})");

    private DetailExtractor() {
    }

    public static ListingDetail extract(RenderedPage page) {
        String text = page.bodyText().isBlank() ? PageText.fromHtml(page.html()) : page.bodyText();
        return extract(text);
    }

    public static ListingDetail extract(String pageText) {
        String text = PageText.normalize(pageText);
        int views = 0;
        Matcher m = VIEWS.matcher(text);
        if (m.find()) {
            try {
                views = Integer.parseInt(m.group(1).replace(",", ""));
            } catch (NumberFormatException ignored) {
                views = 0;
            }
        }
        String registered = null;
        Matcher r = REGISTERED.matcher(text);
        if (r.find()) {
            registered = RegistrationDates.normalize(r.group(1));
        }
        LeaseTerms lease = PriceNormalizer.extractLeaseTerms(text).orElse(null);
        return new ListingDetail(views, registered, lease);
    }
}
