package com.surfer.bot.usage.store;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * JSON scalar -> 數值。讀不懂的值一律當作 absent，由 ledger 邊界補預設值。
 */
public final class StoreValues {

    private StoreValues() {}

    public static Optional<Long> nonNegativeLong(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return Optional.empty();

        Long v = null;
        if (node.isIntegralNumber()) {
            v = node.asLong();
        } else if (node.isNumber()) {
            v = (long) node.asDouble();
        } else if (node.isTextual()) {
            try {
                v = Long.parseLong(node.asText().trim());
            } catch (NumberFormatException ignore) {
                return Optional.empty();
            }
        }
        if (v == null || v < 0) return Optional.empty();
        return Optional.of(v);
    }

    public static Optional<Integer> nonNegativeInt(JsonNode node) {
        return nonNegativeLong(node)
                .filter(v -> v <= Integer.MAX_VALUE)
                .map(Long::intValue);
    }

    public static Optional<Double> nonNegativeDouble(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return Optional.empty();

        double v;
        if (node.isNumber()) {
            v = node.asDouble();
        } else if (node.isTextual()) {
            try {
                v = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException ignore) {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        if (Double.isNaN(v) || Double.isInfinite(v) || v < 0) return Optional.empty();
        return Optional.of(v);
    }
}
