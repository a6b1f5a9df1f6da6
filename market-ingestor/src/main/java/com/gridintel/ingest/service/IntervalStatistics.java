package com.gridintel.ingest.service;

import java.time.Duration;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;

/**
 * Pure helpers for interval roll-ups.
 */
public final class IntervalStatistics {

    private static final DateTimeFormatter LABEL_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private IntervalStatistics() {
    }

    public static Double mean(List<Double> values) {
        if (values.isEmpty()) return null;
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    /**
     * 50th percentile with linear interpolation between the two middle order
     * statistics, the same as SQL {@code PERCENTILE_CONT(0.5)}.
     */
    public static Double median(List<Double> values) {
        if (values.isEmpty()) return null;
        double[] sorted = values.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);

        double position = (sorted.length - 1) * 0.5;
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        return sorted[lower] + (position - lower) * (sorted[upper] - sorted[lower]);
    }

    /** "00:00-00:15" ... "23:45-00:00". */
    public static String label(LocalTime start, Duration interval) {
        return LABEL_FORMAT.format(start) + "-" + LABEL_FORMAT.format(start.plus(interval));
    }
}
