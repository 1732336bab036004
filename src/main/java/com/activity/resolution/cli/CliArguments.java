package com.activity.resolution.cli;

import com.activity.resolution.core.run.OnlyFilter;
import com.activity.resolution.core.run.RunOptions;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Parsed command line: {@code <command> [--db path] [--dry-run] [--force] [--allow-downgrade]
 * [--limit N] [--only key=value[,key=value]] [--csv path] [--pairs path] [--home-tz zone]
 * [--workers N] [--min-overlap S] [--tolerance S]}.
 */
public final class CliArguments {

    private final Command command;
    private final Path database;
    private final RunOptions runOptions;
    private final Path csv;
    private final Path pairs;
    private final String homeZone;
    private final Long minOverlapSeconds;
    private final Long toleranceSeconds;

    private CliArguments(Command command, Path database, RunOptions runOptions, Path csv, Path pairs,
                         String homeZone, Long minOverlapSeconds, Long toleranceSeconds) {
        this.command = command;
        this.database = database;
        this.runOptions = runOptions;
        this.csv = csv;
        this.pairs = pairs;
        this.homeZone = homeZone;
        this.minOverlapSeconds = minOverlapSeconds;
        this.toleranceSeconds = toleranceSeconds;
    }

    /**
     * @param defaultWorkers worker count used when {@code --workers} is absent
     * @throws UsageException on an unknown command or flag, a missing or malformed value
     */
    public static CliArguments parse(String[] args, int defaultWorkers) {
        if (args.length == 0) {
            throw new UsageException("missing command");
        }
        Command command = Command.fromName(args[0])
                .orElseThrow(() -> new UsageException("unknown command: " + args[0]));

        Path database = null;
        Path csv = null;
        Path pairs = null;
        String homeZone = null;
        Long minOverlap = null;
        Long tolerance = null;
        RunOptions.Builder run = RunOptions.builder().workers(defaultWorkers);

        for (int i = 1; i < args.length; i++) {
            String flag = args[i];
            try {
                switch (flag) {
                    case "--dry-run" -> run.dryRun(true);
                    case "--force" -> run.force(true);
                    case "--allow-downgrade" -> run.allowDowngrade(true);
                    case "--db" -> database = Path.of(value(args, ++i, flag));
                    case "--csv" -> csv = Path.of(value(args, ++i, flag));
                    case "--pairs" -> pairs = Path.of(value(args, ++i, flag));
                    case "--home-tz" -> homeZone = value(args, ++i, flag);
                    case "--limit" -> run.limit(intValue(args, ++i, flag));
                    case "--workers" -> run.workers(intValue(args, ++i, flag));
                    case "--min-overlap" -> minOverlap = (long) intValue(args, ++i, flag);
                    case "--tolerance" -> tolerance = (long) intValue(args, ++i, flag);
                    case "--only" -> run.only(OnlyFilter.parse(value(args, ++i, flag)));
                    default -> throw new UsageException("unknown option: " + flag);
                }
            } catch (IllegalArgumentException e) {
                throw new UsageException("invalid " + flag + ": " + e.getMessage(), e);
            }
        }

        if (command == Command.MERGE && pairs == null) {
            throw new UsageException("merge requires --pairs <csv>");
        }
        RunOptions runOptions;
        try {
            runOptions = run.build();
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage(), e);
        }
        return new CliArguments(command, database, runOptions, csv, pairs, homeZone, minOverlap, tolerance);
    }

    private static String value(String[] args, int index, String flag) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new UsageException(flag + " requires a value");
        }
        return args[index];
    }

    private static int intValue(String[] args, int index, String flag) {
        String raw = value(args, index, flag);
        try {
            int parsed = Integer.parseInt(raw);
            if (parsed < 0) {
                throw new UsageException(flag + " must not be negative: " + raw);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new UsageException(flag + " expects a number, got: " + raw, e);
        }
    }

    public Command getCommand() {
        return command;
    }

    public Optional<Path> getDatabase() {
        return Optional.ofNullable(database);
    }

    public RunOptions getRunOptions() {
        return runOptions;
    }

    public Optional<Path> getCsv() {
        return Optional.ofNullable(csv);
    }

    public Optional<Path> getPairs() {
        return Optional.ofNullable(pairs);
    }

    public Optional<String> getHomeZone() {
        return Optional.ofNullable(homeZone);
    }

    public Optional<Long> getMinOverlapSeconds() {
        return Optional.ofNullable(minOverlapSeconds);
    }

    public Optional<Long> getToleranceSeconds() {
        return Optional.ofNullable(toleranceSeconds);
    }
}
