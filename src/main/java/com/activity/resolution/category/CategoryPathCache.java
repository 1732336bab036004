package com.activity.resolution.category;

import com.activity.resolution.metrics.MetricsService;
import com.activity.resolution.store.CategoryRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Read-through cache of rendered category paths. The tree is loaded once on the
 * first lookup; {@link #invalidateAll()} drops both the tree and the rendered
 * paths, so the next lookup sees operator edits.
 */
public class CategoryPathCache {
    private static final Logger log = LoggerFactory.getLogger(CategoryPathCache.class);

    private static final long NO_CATEGORY = 0L;

    private final CategoryRepository categories;
    private final MetricsService metrics;
    private final Cache<Long, String> paths;
    private final AtomicReference<CategoryTree> tree = new AtomicReference<>();

    public CategoryPathCache(CategoryRepository categories, MetricsService metrics, long maxSize) {
        this.categories = categories;
        this.metrics = metrics;
        this.paths = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .recordStats()
                .build();
    }

    public String pathOf(Long categoryId) {
        long key = categoryId == null ? NO_CATEGORY : categoryId;
        String cached = paths.getIfPresent(key);
        if (cached != null) {
            metrics.recordCacheHit();
            return cached;
        }
        metrics.recordCacheMiss();
        return paths.get(key, id -> tree().pathOf(id));
    }

    public void invalidateAll() {
        paths.invalidateAll();
        tree.set(null);
        log.debug("category.cache.invalidated");
    }

    public long estimatedSize() {
        return paths.estimatedSize();
    }

    private CategoryTree tree() {
        CategoryTree current = tree.get();
        if (current == null) {
            current = new CategoryTree(categories.findAll());
            tree.set(current);
            log.debug("category.tree.loaded categories={}", current.size());
        }
        return current;
    }
}
