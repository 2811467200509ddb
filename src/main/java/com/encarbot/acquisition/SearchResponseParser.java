package com.encarbot.acquisition;

import com.encarbot.model.SearchItem;
import com.encarbot.model.SearchPage;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts the list endpoint's JSON ({@code {Count, SearchResults[]}}) into typed items.
 * Conversion happens here once; nothing downstream sees the raw payload.
 */
public final class SearchResponseParser {
    private SearchResponseParser() {
    }

    public static SearchPage parse(String body) throws JSONException {
        JSONObject root = new JSONObject(body == null ? "" : body.trim());
        int total = root.optInt("Count", 0);
        JSONArray results = root.optJSONArray("SearchResults");
        List<SearchItem> items = new ArrayList<>();
        if (results != null) {
            for (int i = 0; i < results.length(); i++) {
                JSONObject node = results.optJSONObject(i);
                if (node == null) {
                    continue;
                }
                SearchItem item = toItem(node);
                if (!item.id().isEmpty()) {
                    items.add(item);
                }
            }
        }
        return new SearchPage(items, total);
    }

    static SearchItem toItem(JSONObject node) {
        return new SearchItem(
                idOf(node.opt("Id")),
                node.optString("Manufacturer", ""),
                node.optString("Model", ""),
                node.optString("Badge", ""),
                optionalInt(node, "Year"),
                node.has("Price") && !node.isNull("Price") ? String.valueOf(node.get("Price")) : null,
                optionalInt(node, "Mileage"),
                node.optString("FuelType", ""),
                node.optString("Transmission", ""),
                node.optString("ModifiedDate", ""),
                0,
                null
        );
    }

    private static String idOf(Object raw) {
        if (raw == null || JSONObject.NULL.equals(raw)) {
            return "";
        }
        if (raw instanceof Number number) {
            return String.valueOf(number.longValue());
        }
        return raw.toString().trim();
    }

    private static Integer optionalInt(JSONObject node, String key) {
        if (!node.has(key) || node.isNull(key)) {
            return null;
        }
        Object raw = node.get(key);
        if (raw instanceof Number number) {
            return (int) Math.round(number.doubleValue());
        }
        try {
            return (int) Math.round(Double.parseDouble(raw.toString().trim()));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
