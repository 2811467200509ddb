package com.encarbot.classify;

import com.encarbot.browser.BrowserException;
import com.encarbot.browser.BrowserGateway;
import com.encarbot.browser.RenderedPage;
import com.encarbot.model.Listing;
import com.encarbot.model.ListingDetail;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Renders a listing's detail page and extracts what the list endpoint does not carry.
 */
public final class ListingEnricher {
    private static final Logger LOG = LogManager.getLogger(ListingEnricher.class);

    private final BrowserGateway browser;

    public ListingEnricher(BrowserGateway browser) {
        this.browser = browser;
    }

    public ListingDetail fetchDetail(Listing listing) throws BrowserException {
        RenderedPage page = browser.render(listing.getListingUrl());
        if (!page.hasResponse() || page.status() >= 400) {
            throw new BrowserException("detail page unavailable id=" + listing.getId() + " status=" + page.status());
        }
        ListingDetail detail = DetailExtractor.extract(page);
        LOG.debug("detail id={} views={} registered={} lease={}",
                listing.getId(), detail.viewCount(), detail.registrationDate(), detail.leaseTerms() != null);
        return detail;
    }
}
