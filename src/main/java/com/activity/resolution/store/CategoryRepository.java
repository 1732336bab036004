package com.activity.resolution.store;

import com.activity.resolution.core.model.Category;

import java.util.List;

/**
 * Repository for the operator-edited category tree.
 */
public class CategoryRepository {

    private final StoreConnection store;

    public CategoryRepository(StoreConnection store) {
        this.store = store;
    }

    public List<Category> findAll() {
        return store.query("SELECT id, parent_id, name FROM category ORDER BY id").stream()
                .map(row -> new Category(
                        Rows.longValue(row, "id"),
                        Rows.text(row, "name"),
                        Rows.longValue(row, "parent_id")))
                .toList();
    }
}
