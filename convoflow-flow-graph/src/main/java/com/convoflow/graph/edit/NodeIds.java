package com.convoflow.graph.edit;

import java.util.Collection;
import java.util.Locale;

/** Generates readable node ids from labels. */
public final class NodeIds {

    private NodeIds() {
    }

    /**
     * Slug of the label ({@code "Order Pizza!"} to {@code order_pizza}), suffixed with {@code _2},
     * {@code _3}, ... until it is not in {@code existingIds}.
     */
    public static String fromLabel(String label, Collection<String> existingIds) {
        String base = slug(label);
        if (!existingIds.contains(base)) return base;
        int n = 2;
        while (existingIds.contains(base + "_" + n)) {
            n++;
        }
        return base + "_" + n;
    }

    static String slug(String label) {
        if (label == null) return "node";
        String slug = label.trim().toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
        return slug.isEmpty() ? "node" : slug;
    }
}
