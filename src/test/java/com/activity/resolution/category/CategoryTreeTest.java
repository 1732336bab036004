package com.activity.resolution.category;

import com.activity.resolution.core.model.Category;
import com.activity.resolution.metrics.MetricsService;
import com.activity.resolution.store.CategoryRepository;
import com.activity.resolution.testing.TestDatabase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("Category path Tests")
class CategoryTreeTest {

    @Nested
    @DisplayName("CategoryTree")
    class Tree {

        private final CategoryTree tree = new CategoryTree(List.of(
                new Category(1, "Run", null),
                new Category(2, "Trail", 1L),
                new Category(3, "Long", 2L),
                new Category(4, "Orphan", 99L),
                new Category(5, "Loop A", 6L),
                new Category(6, "Loop B", 5L)));

        @Test
        @DisplayName("Renders the full path from the root")
        void fullPath() {
            assertEquals("Run : Trail : Long", tree.pathOf(3L));
            assertEquals("Run", tree.pathOf(1L));
            assertEquals(6, tree.size());
        }

        @Test
        @DisplayName("Missing or zero id is uncategorized")
        void uncategorized() {
            assertEquals(CategoryTree.UNCATEGORIZED, tree.pathOf(null));
            assertEquals(CategoryTree.UNCATEGORIZED, tree.pathOf(0L));
        }

        @Test
        @DisplayName("Unknown ids and cycles are marked and end the walk")
        void brokenTrees() {
            assertEquals("[42]", tree.pathOf(42L));
            assertEquals("[99] : Orphan", tree.pathOf(4L));
            assertEquals("[cycle:5] : Loop B : Loop A", tree.pathOf(5L));
        }
    }

    @Nested
    @DisplayName("CategoryPathCache")
    class Cache {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("Second lookup is a hit and invalidation reloads edits")
        void readThrough() {
            try (TestDatabase db = TestDatabase.create(tempDir)) {
                db.category(1, null, "Bike");
                db.category(2, 1L, "Indoor");
                MetricsService metrics = mock(MetricsService.class);
                CategoryPathCache cache = new CategoryPathCache(new CategoryRepository(db.store()), metrics, 100);

                assertEquals("Bike : Indoor", cache.pathOf(2L));
                assertEquals("Bike : Indoor", cache.pathOf(2L));
                assertEquals(CategoryTree.UNCATEGORIZED, cache.pathOf(null));
                verify(metrics, times(1)).recordCacheHit();
                verify(metrics, times(2)).recordCacheMiss();
                assertEquals(2, cache.estimatedSize());

                db.category(3, 1L, "Commute");
                assertEquals("[3]", cache.pathOf(3L));

                cache.invalidateAll();
                assertEquals("Bike : Commute", cache.pathOf(3L));
            }
        }
    }
}
