package com.activity.resolution.ingest;

import com.activity.resolution.core.model.SourceSystem;
import com.activity.resolution.store.SourceRowRepository;

import java.util.List;

/**
 * One source flavor as seen by the {@link SourceIngestor}: how to find its
 * unlinked rows and how to normalize one of them.
 *
 * @param <R> the raw row type
 */
public interface SourceAdapter<R> {

    SourceSystem source();

    List<R> loadUnlinked(SourceRowRepository rows);

    String nativeId(R row);

    String sport(R row);

    /**
     * Normalizes a raw row.
     *
     * @throws com.activity.resolution.core.exception.ValueParseException if a timestamp or number is unreadable
     */
    IngestCandidate normalize(R row);
}
