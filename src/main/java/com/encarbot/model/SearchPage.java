package com.encarbot.model;

import java.util.List;

public record SearchPage(List<SearchItem> items, int totalCount) {
    public SearchPage {
        items = items == null ? List.of() : List.copyOf(items);
        totalCount = Math.max(0, totalCount);
    }
}
