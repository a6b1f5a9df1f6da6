package com.gridintel.ingest.store;

import com.gridintel.ingest.exception.PartitionRoutingException;
import com.gridintel.ingest.model.Dataset;
import com.gridintel.ingest.model.PartitionGranularity;
import com.gridintel.ingest.model.RawRecord;
import com.gridintel.ingest.model.TimeRange;
import com.gridintel.ingest.support.TestDatasets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PartitionRouterTest {

    private final PartitionRouter router = new PartitionRouter();
    private final Dataset dataset = TestDatasets.minuteDataset();

    @Nested
    @DisplayName("Routing")
    class Routing {

        @Test
        @DisplayName("Monthly partitions are named after base table, kind, grouping key and month")
        void monthlyName() {
            RawRecord record = RawRecord.of(LocalDateTime.of(2025, 11, 7, 23, 59), "CZ", "load_mw", 1.0);

            assertThat(router.routeRaw(dataset, record).tableName()).isEqualTo("test_imbalance_raw_cz_202511");
            assertThat(router.route(dataset, PartitionKey.Kind.AGGREGATE, "CZ", LocalDate.of(2025, 11, 7)).tableName())
                    .isEqualTo("test_imbalance_agg_cz_202511");
        }

        @Test
        @DisplayName("Yearly and unpartitioned granularities")
        void otherGranularities() {
            Dataset yearly = TestDatasets.minuteDatasetBuilder().partitionGranularity(PartitionGranularity.YEAR).build();
            Dataset flat = TestDatasets.minuteDatasetBuilder().partitionGranularity(PartitionGranularity.NONE).build();
            LocalDate date = LocalDate.of(2025, 11, 7);

            assertThat(router.route(yearly, PartitionKey.Kind.RAW, "CZ", date).tableName())
                    .isEqualTo("test_imbalance_raw_cz_2025");
            assertThat(router.route(flat, PartitionKey.Kind.RAW, "CZ", date).tableName())
                    .isEqualTo("test_imbalance_raw_cz");
        }

        @Test
        @DisplayName("Same record, same partition: routing is a pure function")
        void deterministic() {
            RawRecord record = RawRecord.of(LocalDateTime.of(2025, 1, 31, 12, 0), "SK", "load_mw", 1.0);

            assertThat(router.routeRaw(dataset, record)).isEqualTo(router.routeRaw(dataset, record));
        }

        @Test
        @DisplayName("A grouping key outside the declared domain is a routing error")
        void outsideDomain() {
            RawRecord record = RawRecord.of(LocalDateTime.of(2025, 11, 7, 0, 0), "DE", "load_mw", 1.0);

            assertThatThrownBy(() -> router.routeRaw(dataset, record))
                    .isInstanceOf(PartitionRoutingException.class)
                    .hasMessageContaining("DE");
        }

        @Test
        @DisplayName("routeAll groups by partition and rejects the whole batch on one bad key")
        void routeAll() {
            List<RawRecord> batch = List.of(
                    RawRecord.of(LocalDateTime.of(2025, 10, 31, 23, 59), "CZ", "load_mw", 1.0),
                    RawRecord.of(LocalDateTime.of(2025, 11, 1, 0, 0), "CZ", "load_mw", 2.0),
                    RawRecord.of(LocalDateTime.of(2025, 11, 1, 0, 1), "SK", "load_mw", 3.0));

            Map<PartitionKey, List<RawRecord>> routed = router.routeAll(dataset, batch);

            assertThat(routed.keySet().stream().map(PartitionKey::tableName).collect(Collectors.toList()))
                    .containsExactly("test_imbalance_raw_cz_202510", "test_imbalance_raw_cz_202511",
                            "test_imbalance_raw_sk_202511");

            List<RawRecord> withBadKey = List.of(batch.get(0),
                    RawRecord.of(LocalDateTime.of(2025, 11, 1, 0, 2), null, "load_mw", 4.0));
            assertThatThrownBy(() -> router.routeAll(dataset, withBadKey))
                    .isInstanceOf(PartitionRoutingException.class);
        }
    }

    @Nested
    @DisplayName("Partitions covering a range")
    class Covering {

        @Test
        @DisplayName("An exclusive end at midnight on the 1st does not reach into the next month")
        void exclusiveEnd() {
            TimeRange october = TimeRange.of(LocalDateTime.of(2025, 10, 15, 0, 0), LocalDateTime.of(2025, 11, 1, 0, 0));

            assertThat(router.partitionsCovering(dataset, PartitionKey.Kind.RAW, october))
                    .extracting(PartitionKey::tableName)
                    .containsExactly("test_imbalance_raw_cz_202510");
        }

        @Test
        @DisplayName("A range over a year boundary lists each month oldest first")
        void acrossYears() {
            assertThat(router.partitionsCovering(dataset, PartitionKey.Kind.AGGREGATE,
                    LocalDate.of(2025, 11, 20), LocalDate.of(2026, 1, 2)))
                    .extracting(PartitionKey::tableName)
                    .containsExactly("test_imbalance_agg_cz_202511", "test_imbalance_agg_cz_202512",
                            "test_imbalance_agg_cz_202601");
        }

        @Test
        @DisplayName("An empty range covers nothing")
        void emptyRange() {
            LocalDateTime t = LocalDateTime.of(2025, 11, 1, 0, 0);

            assertThat(router.partitionsCovering(dataset, PartitionKey.Kind.RAW, TimeRange.of(t, t))).isEmpty();
        }
    }
}
