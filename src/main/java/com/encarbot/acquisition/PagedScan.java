package com.encarbot.acquisition;

import com.encarbot.model.SearchItem;
import com.encarbot.model.SearchPage;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of walking several list pages. {@code failure} is set when a page after the
 * first could not be fetched and the walk stopped early.
 */
public record PagedScan(List<SearchPage> pages, int totalCount, AcquisitionException failure) {
    public PagedScan {
        pages = pages == null ? List.of() : List.copyOf(pages);
    }

    public List<SearchItem> items() {
        List<SearchItem> out = new ArrayList<>();
        for (SearchPage page : pages) {
            out.addAll(page.items());
        }
        return out;
    }

    public boolean truncated() {
        return failure != null;
    }
}
