package com.encarbot.model;

/**
 * One item of a marketplace list response, typed but not yet normalized.
 * {@code rawPrice} keeps the upstream representation so the price normalizer decides
 * its unit.
 */
public record SearchItem(
        String id,
        String manufacturer,
        String model,
        String badge,
        Integer yearMonth,
        String rawPrice,
        Integer mileage,
        String fuelType,
        String transmission,
        String modifiedDate,
        int viewCount,
        String registrationDate
) {
    public SearchItem {
        id = id == null ? "" : id.trim();
        manufacturer = manufacturer == null ? "" : manufacturer.trim();
        model = model == null ? "" : model.trim();
        badge = badge == null ? "" : badge.trim();
        viewCount = Math.max(0, viewCount);
    }

    public String title() {
        StringBuilder sb = new StringBuilder();
        for (String part : new String[]{manufacturer, model, badge}) {
            if (!part.isEmpty()) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(part);
            }
        }
        return sb.toString();
    }

    public Integer modelYear() {
        if (yearMonth == null || yearMonth <= 0) {
            return null;
        }
        return yearMonth > 9999 ? yearMonth / 100 : yearMonth;
    }
}
