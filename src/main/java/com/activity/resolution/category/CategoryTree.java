package com.activity.resolution.category;

import com.activity.resolution.core.model.Category;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory snapshot of the category table, rendering full paths such as
 * {@code Run : Trail : Long}.
 */
public class CategoryTree {

    public static final String SEPARATOR = " : ";
    public static final String UNCATEGORIZED = "Uncategorized";

    private final Map<Long, Category> byId = new HashMap<>();

    public CategoryTree(List<Category> categories) {
        for (Category category : categories) {
            byId.put(category.id(), category);
        }
    }

    public int size() {
        return byId.size();
    }

    /**
     * Renders the path from the root down to {@code categoryId}.
     * A missing or zero id is {@value #UNCATEGORIZED}. An id absent from the table
     * renders as {@code [<id>]} and a repeated ancestor as {@code [cycle:<id>]};
     * both end the walk.
     */
    public String pathOf(Long categoryId) {
        if (categoryId == null || categoryId == 0L) {
            return UNCATEGORIZED;
        }
        Deque<String> parts = new ArrayDeque<>();
        Set<Long> seen = new HashSet<>();
        Long current = categoryId;
        while (current != null) {
            if (!seen.add(current)) {
                parts.addFirst("[cycle:" + current + "]");
                break;
            }
            Category node = byId.get(current);
            if (node == null) {
                parts.addFirst("[" + current + "]");
                break;
            }
            parts.addFirst(node.name());
            current = node.parentId();
        }
        return String.join(SEPARATOR, parts);
    }
}
