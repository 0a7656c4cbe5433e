package com.atlas.api;

import com.atlas.domain.DetectionSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsing helpers for comma-separated query parameters.
 */
final class RequestParams {

    private RequestParams() {
    }

    static List<String> split(String value) {
        List<String> values = new ArrayList<>();
        if (value == null) {
            return values;
        }
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                values.add(trimmed);
            }
        }
        return values;
    }

    /**
     * @throws IllegalArgumentException on an unknown source name
     */
    static List<DetectionSource> sources(String value) {
        List<DetectionSource> sources = new ArrayList<>();
        for (String name : split(value)) {
            sources.add(DetectionSource.parse(name));
        }
        return sources;
    }

    static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
