package com.activity.resolution.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One physical workout, independent of which source systems reported it.
 * Core domain object for activity resolution.
 */
public class CanonicalActivity {
    private final Long id;
    private final Instant startTimeUtc;
    private final Instant endTimeUtc;
    private final Long elapsedTimeS;
    private final Long movingTimeS;
    private final Double distanceM;
    private final String sport;
    private final String name;
    private String timezoneName;
    private Integer utcOffsetMinutes;
    private TimezoneProvenance timezoneProvenance;
    private final int sourceQuality;
    private final Instant createdAt;
    private Instant updatedAt;

    private CanonicalActivity(Builder builder) {
        this.id = builder.id;
        this.startTimeUtc = Objects.requireNonNull(builder.startTimeUtc, "startTimeUtc is required");
        this.endTimeUtc = builder.endTimeUtc;
        this.elapsedTimeS = builder.elapsedTimeS;
        this.movingTimeS = builder.movingTimeS;
        this.distanceM = builder.distanceM;
        this.sport = builder.sport;
        this.name = builder.name;
        this.timezoneName = builder.timezoneName;
        this.utcOffsetMinutes = builder.utcOffsetMinutes;
        this.timezoneProvenance = builder.timezoneProvenance;
        this.sourceQuality = builder.sourceQuality;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    /**
     * Store-assigned id, null until the activity has been inserted.
     */
    public Long getId() {
        return id;
    }

    public Instant getStartTimeUtc() {
        return startTimeUtc;
    }

    public Instant getEndTimeUtc() {
        return endTimeUtc;
    }

    public Long getElapsedTimeS() {
        return elapsedTimeS;
    }

    public Long getMovingTimeS() {
        return movingTimeS;
    }

    public Double getDistanceM() {
        return distanceM;
    }

    public String getSport() {
        return sport;
    }

    public String getName() {
        return name;
    }

    public String getTimezoneName() {
        return timezoneName;
    }

    public Integer getUtcOffsetMinutes() {
        return utcOffsetMinutes;
    }

    public TimezoneProvenance getTimezoneProvenance() {
        return timezoneProvenance;
    }

    public int getSourceQuality() {
        return sourceQuality;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public boolean hasTimezone() {
        return timezoneName != null && !timezoneName.isBlank();
    }

    /**
     * Applies a resolved timezone to this activity.
     */
    public void assignTimezone(String timezoneName, Integer utcOffsetMinutes, TimezoneProvenance provenance) {
        this.timezoneName = timezoneName;
        this.utcOffsetMinutes = utcOffsetMinutes;
        this.timezoneProvenance = provenance;
        this.updatedAt = Instant.now();
    }

    /**
     * End of the activity interval: the explicit end, else start plus elapsed time.
     * Empty when neither is known or the interval would not be positive.
     */
    public Optional<Instant> effectiveEnd() {
        Instant end = endTimeUtc;
        if (end == null && elapsedTimeS != null) {
            end = startTimeUtc.plus(Duration.ofSeconds(elapsedTimeS));
        }
        if (end == null || !end.isAfter(startTimeUtc)) {
            return Optional.empty();
        }
        return Optional.of(end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CanonicalActivity that = (CanonicalActivity) o;
        if (id == null || that.id == null) {
            return false;
        }
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "CanonicalActivity{" +
                "id=" + id +
                ", startTimeUtc=" + startTimeUtc +
                ", sport='" + sport + '\'' +
                ", distanceM=" + distanceM +
                ", elapsedTimeS=" + elapsedTimeS +
                ", timezoneName='" + timezoneName + '\'' +
                ", timezoneProvenance=" + timezoneProvenance +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(CanonicalActivity activity) {
        return new Builder()
                .id(activity.id)
                .startTimeUtc(activity.startTimeUtc)
                .endTimeUtc(activity.endTimeUtc)
                .elapsedTimeS(activity.elapsedTimeS)
                .movingTimeS(activity.movingTimeS)
                .distanceM(activity.distanceM)
                .sport(activity.sport)
                .name(activity.name)
                .timezoneName(activity.timezoneName)
                .utcOffsetMinutes(activity.utcOffsetMinutes)
                .timezoneProvenance(activity.timezoneProvenance)
                .sourceQuality(activity.sourceQuality)
                .createdAt(activity.createdAt)
                .updatedAt(activity.updatedAt);
    }

    public static class Builder {
        private Long id;
        private Instant startTimeUtc;
        private Instant endTimeUtc;
        private Long elapsedTimeS;
        private Long movingTimeS;
        private Double distanceM;
        private String sport;
        private String name;
        private String timezoneName;
        private Integer utcOffsetMinutes;
        private TimezoneProvenance timezoneProvenance;
        private int sourceQuality;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder startTimeUtc(Instant startTimeUtc) {
            this.startTimeUtc = startTimeUtc;
            return this;
        }

        public Builder endTimeUtc(Instant endTimeUtc) {
            this.endTimeUtc = endTimeUtc;
            return this;
        }

        public Builder elapsedTimeS(Long elapsedTimeS) {
            this.elapsedTimeS = elapsedTimeS;
            return this;
        }

        public Builder movingTimeS(Long movingTimeS) {
            this.movingTimeS = movingTimeS;
            return this;
        }

        public Builder distanceM(Double distanceM) {
            this.distanceM = distanceM;
            return this;
        }

        public Builder sport(String sport) {
            this.sport = sport;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder timezoneName(String timezoneName) {
            this.timezoneName = timezoneName;
            return this;
        }

        public Builder utcOffsetMinutes(Integer utcOffsetMinutes) {
            this.utcOffsetMinutes = utcOffsetMinutes;
            return this;
        }

        public Builder timezoneProvenance(TimezoneProvenance timezoneProvenance) {
            this.timezoneProvenance = timezoneProvenance;
            return this;
        }

        public Builder sourceQuality(int sourceQuality) {
            this.sourceQuality = sourceQuality;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public CanonicalActivity build() {
            return new CanonicalActivity(this);
        }
    }
}
