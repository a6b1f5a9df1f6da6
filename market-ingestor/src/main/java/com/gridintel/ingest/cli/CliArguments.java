package com.gridintel.ingest.cli;

import com.gridintel.ingest.model.TimeRange;
import lombok.Builder;
import lombok.Value;
import org.springframework.boot.ApplicationArguments;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line options of a one-shot run.
 *
 * <pre>
 *   --dataset=ceps-imbalance|all   required; its presence selects CLI mode
 *   --start=2025-11-01             range backfill (civil days, inclusive)
 *   --end=2025-11-07               defaults to yesterday in the dataset zone
 *   --mode=ingest|aggregate|audit  default ingest
 *   --dry-run                      fetch and parse, write nothing
 *   --debug                        verbose logging
 * </pre>
 *
 * Without {@code --start} an ingest run is in auto mode. Options holding a dot are
 * Spring property overrides and are passed through untouched.
 */
@Value
@Builder
public class CliArguments {

    public static final String ALL = "all";

    private static final Set<String> VALUE_OPTIONS = Set.of("dataset", "start", "end", "mode");
    private static final Set<String> FLAG_OPTIONS = Set.of("dry-run", "debug");

    public enum Mode {
        INGEST, AGGREGATE, AUDIT
    }

    String dataset;
    LocalDate start;
    LocalDate end;
    Mode mode;
    boolean dryRun;
    boolean debug;

    public boolean isAllDatasets() {
        return ALL.equalsIgnoreCase(dataset);
    }

    /** Range to ingest, or null for auto mode. */
    public TimeRange ingestRange(LocalDate today) {
        if (start == null) return null;
        return TimeRange.ofDays(start, lastDay(today));
    }

    /** First day for aggregate/audit; yesterday when no --start was given. */
    public LocalDate firstDay(LocalDate today) {
        return start != null ? start : lastDay(today);
    }

    public LocalDate lastDay(LocalDate today) {
        LocalDate last = end != null ? end : today.minusDays(1);
        if (start != null && last.isBefore(start)) {
            throw new IllegalArgumentException("--end " + last + " is before --start " + start);
        }
        return last;
    }

    /**
     * @throws IllegalArgumentException for missing, unknown or malformed options
     */
    public static CliArguments parse(ApplicationArguments args) {
        for (String option : args.getOptionNames()) {
            if (!option.contains(".") && !VALUE_OPTIONS.contains(option) && !FLAG_OPTIONS.contains(option)) {
                throw new IllegalArgumentException("Unknown option --" + option);
            }
        }

        String dataset = single(args, "dataset");
        if (dataset == null || dataset.isBlank()) {
            throw new IllegalArgumentException("--dataset=<id>|all is required");
        }

        LocalDate start = date(args, "start");
        LocalDate end = date(args, "end");
        if (end != null && start == null) {
            throw new IllegalArgumentException("--end requires --start");
        }
        if (start != null && end != null && end.isBefore(start)) {
            throw new IllegalArgumentException("--end " + end + " is before --start " + start);
        }

        String mode = single(args, "mode");
        Mode parsedMode;
        try {
            parsedMode = mode == null ? Mode.INGEST : Mode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("--mode must be ingest, aggregate or audit, got '" + mode + "'");
        }

        return CliArguments.builder()
                .dataset(dataset.trim())
                .start(start)
                .end(end)
                .mode(parsedMode)
                .dryRun(args.containsOption("dry-run"))
                .debug(args.containsOption("debug"))
                .build();
    }

    /** True when the raw process arguments ask for a one-shot run. */
    public static boolean isCliInvocation(String[] args) {
        for (String arg : args) {
            if (arg.equals("--dataset") || arg.startsWith("--dataset=")) return true;
        }
        return false;
    }

    /**
     * Rewrites {@code --start 2025-11-01} into {@code --start=2025-11-01} so Spring's
     * option parser sees a value rather than a flag and a stray argument.
     */
    public static String[] normalize(String[] args) {
        List<String> out = new ArrayList<>(args.length);
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--") && VALUE_OPTIONS.contains(arg.substring(2))
                    && i + 1 < args.length && !args[i + 1].startsWith("--")) {
                out.add(arg + "=" + args[++i]);
            } else {
                out.add(arg);
            }
        }
        return out.toArray(new String[0]);
    }

    private static String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) return null;
        if (values.size() > 1) {
            throw new IllegalArgumentException("--" + name + " given more than once");
        }
        return values.get(0);
    }

    private static LocalDate date(ApplicationArguments args, String name) {
        String value = single(args, name);
        if (value == null) return null;
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("--" + name + " must be an ISO date (yyyy-MM-dd), got '" + value + "'");
        }
    }
}
