package org.simforge.compiler.mapping.special;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Assigns material unit labels to product types in first-seen order: {@code PartA},
 * {@code PartB}, ..., {@code PartZ}, {@code PartAA}, {@code PartAB}, ...
 * <p>
 * A registry lives for one mapping run.
 */
public final class MaterialUnitRegistry {

    public static final String LABEL_PREFIX = "Part";

    private final Map<String, String> labels = new LinkedHashMap<>();

    /**
     * Returns the label for a product type, assigning the next free one on first use.
     */
    public String labelFor(String productType) {
        return labels.computeIfAbsent(productType, k -> LABEL_PREFIX + letters(labels.size()));
    }

    /**
     * @return Product type to label, in assignment order.
     */
    public Map<String, String> labels() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }

    static String letters(int index) {
        StringBuilder sb = new StringBuilder();
        int n = index + 1;
        while (n > 0) {
            n--;
            sb.append((char) ('A' + n % 26));
            n /= 26;
        }
        return sb.reverse().toString();
    }
}
