package com.encarbot.acquisition;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * List-endpoint payloads shaped like the marketplace's.
 */
public final class SearchFixtures {
    private SearchFixtures() {
    }

    public static String page(int total, long firstId, int count) {
        return page(total, firstId, count, "GLE450 4MATIC 쿠페");
    }

    public static String page(int total, long firstId, int count, String badge) {
        JSONArray results = new JSONArray();
        for (int i = 0; i < count; i++) {
            results.put(item(firstId + i, badge, 8500 + i));
        }
        return new JSONObject().put("Count", total).put("SearchResults", results).toString();
    }

    public static JSONObject item(long id, String badge, int price) {
        return new JSONObject()
                .put("Id", id)
                .put("Manufacturer", "벤츠")
                .put("Model", "GLE-클래스 W167")
                .put("Badge", badge)
                .put("Year", 202301.0)
                .put("Price", price)
                .put("Mileage", 12000.0)
                .put("FuelType", "가솔린")
                .put("Transmission", "오토")
                .put("ModifiedDate", "2024-03-01 10:00:00.000 +09");
    }
}
