package com.encarbot.acquisition;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the marketplace's filter expression, e.g.
 * {@code (And.Hidden.N._.(C.CarType.N._.(C.Manufacturer.벤츠._.ModelGroup.GLE-클래스.))_.Year.range(202100..)._.Price.range(..9000).)}.
 */
public final class QueryBuilder {
    private QueryBuilder() {
    }

    public static String build(SearchFilter filter) {
        String base = "(And.Hidden.N._.(C.CarType." + filter.carType()
                + "._.(C.Manufacturer." + filter.manufacturer()
                + "._.ModelGroup." + filter.modelGroup() + ".))";

        List<String> parts = new ArrayList<>();
        String years = range(
                filter.yearMin() == null ? null : filter.yearMin() + "00",
                filter.yearMax() == null ? null : filter.yearMax() + "99"
        );
        if (years != null) {
            parts.add("Year.range(" + years + ")");
        }
        String prices = range(
                filter.priceMin() == null ? null : String.valueOf(filter.priceMin()),
                filter.priceMax() == null ? null : String.valueOf(filter.priceMax())
        );
        if (prices != null) {
            parts.add("Price.range(" + prices + ")");
        }
        if (filter.mileageMax() != null) {
            parts.add("Mileage.range(.." + filter.mileageMax() + ")");
        }

        if (parts.isEmpty()) {
            return base + ")";
        }
        return base + "_." + String.join("._.", parts) + ".)";
    }

    private static String range(String min, String max) {
        if (min == null && max == null) {
            return null;
        }
        return (min == null ? "" : min) + ".." + (max == null ? "" : max);
    }
}
