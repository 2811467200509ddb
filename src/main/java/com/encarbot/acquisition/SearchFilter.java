package com.encarbot.acquisition;

import com.encarbot.config.Config;

/**
 * Caller-supplied search constraints. Manufacturer and model group identify the product
 * and are always present; the remaining bounds are optional. Prices are in 만원.
 */
public record SearchFilter(
        String carType,
        String manufacturer,
        String modelGroup,
        Integer yearMin,
        Integer yearMax,
        Integer priceMin,
        Integer priceMax,
        Integer mileageMax
) {
    public SearchFilter {
        if (manufacturer == null || manufacturer.isBlank() || modelGroup == null || modelGroup.isBlank()) {
            throw new IllegalArgumentException("manufacturer and model group are required");
        }
        carType = carType == null || carType.isBlank() ? "N" : carType.trim();
        manufacturer = manufacturer.trim();
        modelGroup = modelGroup.trim();
    }

    public static SearchFilter baseline(String manufacturer, String modelGroup) {
        return new SearchFilter("N", manufacturer, modelGroup, null, null, null, null, null);
    }

    public static SearchFilter fromConfig(Config config) {
        return new SearchFilter(
                config.getString("search.car_type"),
                config.getString("search.manufacturer"),
                config.getString("search.model_group"),
                optionalInt(config, "search.year_min"),
                optionalInt(config, "search.year_max"),
                optionalInt(config, "search.price_min"),
                optionalInt(config, "search.price_max"),
                optionalInt(config, "search.mileage_max")
        );
    }

    public boolean hasConstraints() {
        return yearMin != null || yearMax != null || priceMin != null || priceMax != null || mileageMax != null;
    }

    private static Integer optionalInt(Config config, String key) {
        String raw = config.getString(key);
        if (raw.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("config " + key + " must be an integer: " + raw, e);
        }
    }
}
