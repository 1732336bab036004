package com.activity.resolution.core.run;

import java.util.Objects;

/**
 * Options shared by every batch run: dry-run, force, downgrade permission,
 * row limit, worker count and row selection.
 */
public class RunOptions {

    private static final int DEFAULT_WORKERS = 1;

    private final boolean dryRun;
    private final boolean force;
    private final boolean allowDowngrade;
    private final int limit;
    private final int workers;
    private final OnlyFilter only;

    private RunOptions(Builder builder) {
        this.dryRun = builder.dryRun;
        this.force = builder.force;
        this.allowDowngrade = builder.allowDowngrade;
        this.limit = builder.limit;
        this.workers = builder.workers;
        this.only = builder.only;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public boolean isForce() {
        return force;
    }

    public boolean isAllowDowngrade() {
        return allowDowngrade;
    }

    /**
     * Maximum number of units to process, 0 for no limit.
     */
    public int getLimit() {
        return limit;
    }

    public boolean isLimited() {
        return limit > 0;
    }

    public int getWorkers() {
        return workers;
    }

    public OnlyFilter getOnly() {
        return only;
    }

    public static RunOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean dryRun = false;
        private boolean force = false;
        private boolean allowDowngrade = false;
        private int limit = 0;
        private int workers = DEFAULT_WORKERS;
        private OnlyFilter only = OnlyFilter.none();

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder force(boolean force) {
            this.force = force;
            return this;
        }

        public Builder allowDowngrade(boolean allowDowngrade) {
            this.allowDowngrade = allowDowngrade;
            return this;
        }

        public Builder limit(int limit) {
            if (limit < 0) {
                throw new IllegalArgumentException("limit must not be negative");
            }
            this.limit = limit;
            return this;
        }

        public Builder workers(int workers) {
            if (workers <= 0) {
                throw new IllegalArgumentException("workers must be positive");
            }
            this.workers = workers;
            return this;
        }

        public Builder only(OnlyFilter only) {
            this.only = Objects.requireNonNull(only, "only filter is required");
            return this;
        }

        public RunOptions build() {
            return new RunOptions(this);
        }
    }
}
