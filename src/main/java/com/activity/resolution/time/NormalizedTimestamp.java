package com.activity.resolution.time;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * A parsed source timestamp: the local wall clock the athlete saw and the absolute instant.
 */
public record NormalizedTimestamp(LocalDateTime localWallClock, Instant utcInstant) {

    private static final DateTimeFormatter LOCAL_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss");

    public NormalizedTimestamp {
        Objects.requireNonNull(localWallClock, "localWallClock is required");
        Objects.requireNonNull(utcInstant, "utcInstant is required");
    }

    /**
     * Local wall clock as {@code yyyy-MM-dd'T'HH:mm:ss}.
     */
    public String localText() {
        return LOCAL_FORMAT.format(localWallClock);
    }

    /**
     * UTC instant as {@code yyyy-MM-dd'T'HH:mm:ss'Z'}.
     */
    public String utcText() {
        return UtcTimestamps.format(utcInstant);
    }
}
