package com.gridintel.ingest.store;

import com.gridintel.ingest.config.IngestorProperties;
import com.gridintel.ingest.exception.PartitionRoutingException;
import com.gridintel.ingest.exception.StoreConstraintViolationException;
import com.gridintel.ingest.model.AggregateRecord;
import com.gridintel.ingest.model.Dataset;
import com.gridintel.ingest.model.RawRecord;
import com.gridintel.ingest.model.TimeRange;
import com.gridintel.ingest.support.H2Store;
import com.gridintel.ingest.support.TestDatasets;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PartitionedStoreTest {

    private static final LocalDate DAY = LocalDate.of(2025, 11, 3);
    private static final String NOV = "test_imbalance_raw_cz_202511";

    private H2Store h2;
    private PartitionedStore store;
    private final Dataset dataset = TestDatasets.minuteDataset();

    @BeforeEach
    void setUp() {
        h2 = new H2Store(TestDatasets.pragueClockAt(LocalDateTime.of(2025, 11, 9, 0, 0)));
        store = h2.store;
    }

    @AfterEach
    void tearDown() {
        h2.close();
    }

    private static RawRecord record(LocalDateTime ts, Double value) {
        return RawRecord.of(ts, "CZ", TestDatasets.FIELD, value);
    }

    @Nested
    @DisplayName("Raw upsert")
    class RawUpsert {

        @Test
        @DisplayName("First write inserts, the same write again updates in place")
        void insertThenUpdate() {
            List<RawRecord> day = TestDatasets.minuteDay(DAY);

            UpsertResult first = store.upsert(dataset, day);
            UpsertResult second = store.upsert(dataset, day);

            assertThat(first.inserted()).isEqualTo(1440);
            assertThat(first.updated()).isZero();
            assertThat(second.inserted()).isZero();
            assertThat(second.updated()).isEqualTo(1440);
            assertThat(h2.count(NOV)).isEqualTo(1440);
        }

        @Test
        @DisplayName("An existing natural key gets every value field overwritten")
        void overwritesValues() {
            LocalDateTime ts = DAY.atTime(10, 0);
            store.upsert(dataset, List.of(record(ts, 1.0)));

            store.upsert(dataset, List.of(record(ts, 42.5)));

            List<RawRecord> stored = store.readRaw(dataset, TimeRange.ofDays(DAY, DAY));
            assertThat(stored).hasSize(1);
            assertThat(stored.get(0).value(TestDatasets.FIELD)).isEqualTo(42.5);
        }

        @Test
        @DisplayName("NULL values are stored and read back as null")
        void nullValues() {
            store.upsert(dataset, List.of(record(DAY.atTime(1, 0), null)));

            RawRecord stored = store.readRaw(dataset, TimeRange.ofDays(DAY, DAY)).get(0);
            assertThat(stored.getValues()).containsKey(TestDatasets.FIELD);
            assertThat(stored.value(TestDatasets.FIELD)).isNull();
        }

        @Test
        @DisplayName("Duplicate natural keys in one batch collapse to the last occurrence")
        void duplicatesInBatch() {
            LocalDateTime ts = DAY.atTime(5, 0);

            UpsertResult result = store.upsert(dataset, List.of(record(ts, 1.0), record(ts, 2.0)));

            assertThat(result.written()).isEqualTo(1);
            assertThat(store.readRaw(dataset, TimeRange.ofDays(DAY, DAY)).get(0).value(TestDatasets.FIELD))
                    .isEqualTo(2.0);
        }

        @Test
        @DisplayName("An empty batch writes nothing and creates no partition")
        void emptyBatch() {
            assertThat(store.upsert(dataset, List.of())).isEqualTo(UpsertResult.EMPTY);
            assertThat(store.registeredPartitions(dataset, PartitionKey.Kind.RAW, false)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Partitions")
    class Partitions {

        @Test
        @DisplayName("Missing partitions are created on first write and registered once")
        void createdOnFirstWrite() {
            store.upsert(dataset, List.of(
                    record(LocalDateTime.of(2025, 10, 31, 23, 59), 1.0),
                    record(LocalDateTime.of(2025, 11, 1, 0, 0), 2.0)));
            store.upsert(dataset, List.of(record(LocalDateTime.of(2025, 11, 1, 0, 1), 3.0)));

            assertThat(store.registeredPartitions(dataset, PartitionKey.Kind.RAW, false))
                    .containsExactly("test_imbalance_raw_cz_202510", NOV);
            assertThat(h2.count("ingest_partitions")).isEqualTo(2);
            assertThat(h2.count("test_imbalance_raw_cz_202510")).isEqualTo(1);
            assertThat(h2.count(NOV)).isEqualTo(2);
        }

        @Test
        @DisplayName("A second store instance over the same database reuses existing partitions")
        void createIfAbsentAcrossInstances() {
            store.upsert(dataset, List.of(record(DAY.atTime(0, 0), 1.0)));

            PartitionedStore other = new PartitionedStore(h2.jdbc,
                    new DataSourceTransactionManager(h2.database),
                    h2.router, h2.schema, TestDatasets.pragueClockAt(LocalDateTime.of(2025, 11, 9, 0, 0)),
                    new IngestorProperties());
            other.upsert(dataset, List.of(record(DAY.atTime(0, 1), 2.0)));

            assertThat(h2.count("ingest_partitions")).isEqualTo(1);
            assertThat(h2.count(NOV)).isEqualTo(2);
        }

        @Test
        @DisplayName("Reads span partitions and ignore months that were never written")
        void readAcrossPartitions() {
            store.upsert(dataset, List.of(
                    record(LocalDateTime.of(2025, 10, 31, 23, 59), 1.0),
                    record(LocalDateTime.of(2025, 11, 1, 0, 0), 2.0)));

            List<RawRecord> read = store.readRaw(dataset, TimeRange.of(
                    LocalDateTime.of(2025, 9, 1, 0, 0), LocalDateTime.of(2026, 1, 1, 0, 0)));

            assertThat(read).extracting(RawRecord::getTimestamp).containsExactly(
                    LocalDateTime.of(2025, 10, 31, 23, 59), LocalDateTime.of(2025, 11, 1, 0, 0));
        }
    }

    @Nested
    @DisplayName("Failure modes")
    class FailureModes {

        @Test
        @DisplayName("A grouping key outside the domain fails the batch before anything is written")
        void routingErrorWritesNothing() {
            List<RawRecord> batch = List.of(
                    record(DAY.atTime(0, 0), 1.0),
                    RawRecord.of(DAY.atTime(0, 1), "DE", TestDatasets.FIELD, 2.0));

            assertThatThrownBy(() -> store.upsert(dataset, batch))
                    .isInstanceOf(PartitionRoutingException.class);
            assertThat(store.registeredPartitions(dataset, PartitionKey.Kind.RAW, false)).isEmpty();
        }

        @Test
        @DisplayName("A failing partition rolls back the rows already written to other partitions")
        void batchIsAtomic() {
            // December's partition exists with a stricter shape than the store would create
            h2.jdbc.execute("CREATE TABLE test_imbalance_raw_cz_202512 (ts TIMESTAMP NOT NULL, "
                    + "grouping_key VARCHAR(16) NOT NULL, load_mw DOUBLE PRECISION NOT NULL, "
                    + "ingested_at TIMESTAMP NOT NULL, PRIMARY KEY (ts, grouping_key))");

            List<RawRecord> batch = new ArrayList<>();
            batch.add(record(LocalDateTime.of(2025, 11, 30, 23, 59), 1.0));
            batch.add(record(LocalDateTime.of(2025, 12, 1, 0, 0), null));

            assertThatThrownBy(() -> store.upsert(dataset, batch))
                    .isInstanceOf(StoreConstraintViolationException.class);
            assertThat(h2.count(NOV)).isZero();
            assertThat(h2.count("test_imbalance_raw_cz_202512")).isZero();
            assertThat(store.maxTimestamp(dataset)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Cursor queries")
    class Cursor {

        @Test
        @DisplayName("Min and max timestamps come from the oldest and newest populated partitions")
        void minAndMax() {
            assertThat(store.maxTimestamp(dataset)).isEmpty();
            assertThat(store.minTimestamp(dataset)).isEmpty();

            store.upsert(dataset, List.of(
                    record(LocalDateTime.of(2025, 10, 2, 8, 0), 1.0),
                    record(LocalDateTime.of(2025, 11, 4, 9, 15), 2.0)));

            assertThat(store.minTimestamp(dataset)).contains(LocalDateTime.of(2025, 10, 2, 8, 0));
            assertThat(store.maxTimestamp(dataset)).contains(LocalDateTime.of(2025, 11, 4, 9, 15));
        }
    }

    @Nested
    @DisplayName("Aggregate upsert")
    class AggregateUpsert {

        private AggregateRecord aggregate(String label, int hour, int minute, double mean) {
            return AggregateRecord.builder()
                    .tradeDate(DAY)
                    .intervalLabel(label)
                    .intervalStart(DAY.atTime(hour, minute))
                    .groupingKey("CZ")
                    .sampleCount(15)
                    .mean(mean)
                    .median(mean)
                    .lastObserved(null)
                    .build();
        }

        @Test
        @DisplayName("Aggregates are keyed by trade date and interval label and overwritten on re-run")
        void upsertAggregates() {
            UpsertResult first = store.upsertAggregates(dataset, List.of(
                    aggregate("00:00-00:15", 0, 0, 1.0),
                    aggregate("23:45-00:00", 23, 45, 2.0)));
            UpsertResult second = store.upsertAggregates(dataset, List.of(aggregate("00:00-00:15", 0, 0, 9.0)));

            assertThat(first.inserted()).isEqualTo(2);
            assertThat(second.updated()).isEqualTo(1);

            List<AggregateRecord> stored = store.readAggregates(dataset, DAY, DAY);
            Map<String, AggregateRecord> byLabel = new LinkedHashMap<>();
            stored.forEach(a -> byLabel.put(a.getIntervalLabel(), a));

            assertThat(byLabel.keySet()).containsExactly("00:00-00:15", "23:45-00:00");
            assertThat(byLabel.get("00:00-00:15").getMean()).isEqualTo(9.0);
            assertThat(byLabel.get("23:45-00:00").getLastObserved()).isNull();
            assertThat(h2.count("test_imbalance_agg_cz_202511")).isEqualTo(2);
        }
    }
}
