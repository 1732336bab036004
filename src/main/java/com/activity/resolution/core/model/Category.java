package com.activity.resolution.core.model;

/**
 * Operator-edited category node. A null parent marks a root.
 */
public record Category(long id, String name, Long parentId) {
}
