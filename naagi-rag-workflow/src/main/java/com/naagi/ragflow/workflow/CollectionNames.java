package com.naagi.ragflow.workflow;

import com.naagi.ragflow.model.WorkflowState;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Category name to vector collection name, e.g. "Munkajog / HR" -> "cat_munkajog___hr".
 */
public final class CollectionNames {

    public static final String PREFIX = "cat_";
    private static final int MIN_LENGTH = 3;
    private static final int MAX_LENGTH = 63;

    private CollectionNames() {}

    public static String forCategory(String category) {
        if (WorkflowState.ALL_CATEGORIES.equals(category)) {
            return WorkflowState.ALL_CATEGORIES;
        }
        return PREFIX + slugify(category);
    }

    public static String slugify(String text) {
        String value = text == null ? "" : text;
        value = Normalizer.normalize(value, Normalizer.Form.NFKD);
        // drops the combining marks NFKD split off
        value = value.replaceAll("[^\\p{ASCII}]", "");
        value = value.toLowerCase(Locale.ROOT).replace(" ", "_").replace("/", "_");
        value = value.replaceAll("[^a-z0-9_-]", "");
        value = value.replaceAll("^[_-]+", "").replaceAll("[_-]+$", "");
        StringBuilder slug = new StringBuilder(value);
        while (slug.length() < MIN_LENGTH) {
            slug.append('x');
        }
        return slug.length() > MAX_LENGTH ? slug.substring(0, MAX_LENGTH) : slug.toString();
    }
}
