package com.gridintel.ingest.service;

import com.gridintel.ingest.model.BackfillResolution;
import com.gridintel.ingest.model.Dataset;
import com.gridintel.ingest.model.RawRecord;
import com.gridintel.ingest.model.TimeRange;
import com.gridintel.ingest.support.H2Store;
import com.gridintel.ingest.support.TestDatasets;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BackfillResolverTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 11, 9, 0, 0);

    private H2Store h2;
    private BackfillResolver resolver;
    private final Dataset dataset = TestDatasets.minuteDataset();

    @BeforeEach
    void setUp() {
        Clock clock = TestDatasets.pragueClockAt(NOW);
        h2 = new H2Store(clock);
        resolver = new BackfillResolver(h2.store, clock);
    }

    @AfterEach
    void tearDown() {
        h2.close();
    }

    @Test
    @DisplayName("Empty store resolves from the epoch floor up to now minus lag")
    void emptyStoreStartsAtFloor() {
        BackfillResolution resolution = resolver.resolve(dataset);

        assertThat(resolution.nothingToDo()).isFalse();
        assertThat(resolution.cursor()).isNull();
        assertThat(resolution.range()).isEqualTo(TimeRange.of(
                LocalDateTime.of(2025, 11, 1, 0, 0),
                LocalDateTime.of(2025, 11, 8, 0, 0)));
    }

    @Test
    @DisplayName("After records through 2025-11-07T23:59 the next range is [11-08, 11-08): nothing to do")
    void caughtUpIsNoOp() {
        List<RawRecord> week = new ArrayList<>();
        for (LocalDate day = LocalDate.of(2025, 11, 1); day.isBefore(LocalDate.of(2025, 11, 8)); day = day.plusDays(1)) {
            week.addAll(TestDatasets.minuteDay(day));
        }
        h2.store.upsert(dataset, week);

        BackfillResolution resolution = resolver.resolve(dataset);

        assertThat(resolution.nothingToDo()).isTrue();
        assertThat(resolution.cursor()).isEqualTo(LocalDateTime.of(2025, 11, 7, 23, 59));
        assertThat(resolution.range()).isEqualTo(TimeRange.of(
                LocalDateTime.of(2025, 11, 8, 0, 0),
                LocalDateTime.of(2025, 11, 8, 0, 0)));
        assertThat(resolution.range().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("The resolved start moves strictly forward once records are written")
    void cursorIsMonotonic() {
        TimeRange before = resolver.resolve(dataset).range();

        h2.store.upsert(dataset, TestDatasets.minuteDay(LocalDate.of(2025, 11, 1)));
        TimeRange after = resolver.resolve(dataset).range();

        assertThat(after.start()).isAfter(before.start());
        assertThat(after.start()).isEqualTo(LocalDateTime.of(2025, 11, 2, 0, 0));
        assertThat(after.end()).isEqualTo(before.end());
    }

    @Test
    @DisplayName("The cursor spans partitions: the newest month wins")
    void cursorAcrossMonths() {
        h2.store.upsert(dataset, List.of(
                RawRecord.of(LocalDateTime.of(2025, 10, 31, 23, 0), "CZ", TestDatasets.FIELD, 1.0),
                RawRecord.of(LocalDateTime.of(2025, 11, 3, 12, 30), "CZ", TestDatasets.FIELD, 2.0)));

        BackfillResolution resolution = resolver.resolve(dataset);

        assertThat(resolution.cursor()).isEqualTo(LocalDateTime.of(2025, 11, 3, 12, 30));
        assertThat(resolution.range().start()).isEqualTo(LocalDateTime.of(2025, 11, 3, 12, 31));
    }

    @Test
    @DisplayName("Records of another grouping key don't move this dataset's cursor")
    void otherGroupingKeyIgnored() {
        h2.store.upsert(dataset, List.of(
                RawRecord.of(LocalDateTime.of(2025, 11, 5, 0, 0), "SK", TestDatasets.FIELD, 1.0)));

        assertThat(resolver.resolve(dataset).cursor()).isNull();
    }

    @Test
    @DisplayName("The horizon is floored to the dataset resolution")
    void horizonFloored() {
        assertThat(BackfillResolver.floorToResolution(LocalDateTime.of(2025, 11, 8, 13, 47, 31), Duration.ofMinutes(15)))
                .isEqualTo(LocalDateTime.of(2025, 11, 8, 13, 45));
        assertThat(BackfillResolver.floorToResolution(LocalDateTime.of(2025, 11, 8, 13, 47, 31), Duration.ofMinutes(1)))
                .isEqualTo(LocalDateTime.of(2025, 11, 8, 13, 47));
    }
}
