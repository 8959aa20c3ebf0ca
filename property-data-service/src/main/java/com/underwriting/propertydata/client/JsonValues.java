package com.underwriting.propertydata.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.Iterator;

/**
 * Lenient readers for provider payloads. Providers disagree on field names and on whether
 * numbers arrive as JSON numbers or strings; these helpers take the first usable value.
 */
final class JsonValues {

    private JsonValues() {}

    static Double firstDouble(JsonNode node, String... names) {
        for (String name : names) {
            Double value = asDouble(node.path(name));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /** Rounded to the nearest integer; a value outside the {@code int} range counts as absent. */
    static Integer firstInt(JsonNode node, String... names) {
        Double value = firstDouble(node, names);
        if (value == null || Double.isInfinite(value)) {
            return null;
        }
        long rounded = Math.round(value);
        if (rounded < Integer.MIN_VALUE || rounded > Integer.MAX_VALUE) {
            return null;
        }
        return (int) rounded;
    }

    static Double asDouble(JsonNode value) {
        if (value == null || value.isMissingNode() || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            String text = value.asText().replace(",", "").trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                double parsed = Double.parseDouble(text);
                return Double.isNaN(parsed) ? null : parsed;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Reads the entry with the numerically greatest key from a year-keyed object such as
     * {@code {"2022": {...}, "2023": {...}}}. Returns a missing node when there is none.
     */
    static JsonNode latestByYear(JsonNode yearKeyed) {
        if (yearKeyed == null || !yearKeyed.isObject()) {
            return MissingNode.getInstance();
        }
        int bestYear = Integer.MIN_VALUE;
        JsonNode best = MissingNode.getInstance();
        Iterator<String> names = yearKeyed.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!name.matches("\\d{4}")) {
                continue;
            }
            int year = Integer.parseInt(name);
            if (year > bestYear) {
                bestYear = year;
                best = yearKeyed.get(name);
            }
        }
        return best;
    }
}
