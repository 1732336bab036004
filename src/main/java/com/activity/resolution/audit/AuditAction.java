package com.activity.resolution.audit;

/**
 * Mutations of the store worth an audit entry.
 */
public enum AuditAction {
    ACTIVITY_CREATED,
    SOURCE_LINKED,
    ANNOTATION_LINKED,
    TIMEZONE_ASSIGNED,
    OFFSET_RECOMPUTED,
    ACTIVITIES_MERGED,
    ANNOTATION_UNLINKED
}
