package com.gridintel.ingest.service;

import com.gridintel.ingest.model.TimeRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkPlannerTest {

    private final ChunkPlanner planner = new ChunkPlanner();

    private static final LocalDateTime START = LocalDateTime.of(2025, 11, 1, 0, 0);

    @Nested
    @DisplayName("Coverage")
    class Coverage {

        @ParameterizedTest(name = "max span {0} minutes")
        @ValueSource(longs = {1, 7, 60, 1440, 10080, 12345, 100000})
        @DisplayName("Chunks tile the range exactly: no gaps, no overlaps, none too long")
        void chunksTileTheRange(long spanMinutes) {
            TimeRange range = TimeRange.of(START, START.plusDays(17).plusMinutes(13));
            Duration span = Duration.ofMinutes(spanMinutes);

            List<TimeRange> chunks = planner.plan(range, span).collect(Collectors.toList());

            assertThat(chunks).isNotEmpty();
            assertThat(chunks.get(0).start()).isEqualTo(range.start());
            assertThat(chunks.get(chunks.size() - 1).end()).isEqualTo(range.end());
            for (int i = 0; i < chunks.size(); i++) {
                TimeRange chunk = chunks.get(i);
                assertThat(chunk.isEmpty()).isFalse();
                assertThat(chunk.length()).isLessThanOrEqualTo(span);
                if (i > 0) {
                    assertThat(chunk.start()).isEqualTo(chunks.get(i - 1).end());
                }
            }
            assertThat(chunks).hasSize((int) planner.chunkCount(range, span));
        }

        @Test
        @DisplayName("Three weeks at a seven-day span give three full chunks, oldest first")
        void weeklyChunks() {
            TimeRange range = TimeRange.of(START, START.plusDays(21));

            List<TimeRange> chunks = planner.plan(range, Duration.ofDays(7)).collect(Collectors.toList());

            assertThat(chunks).containsExactly(
                    TimeRange.of(START, START.plusDays(7)),
                    TimeRange.of(START.plusDays(7), START.plusDays(14)),
                    TimeRange.of(START.plusDays(14), START.plusDays(21)));
        }

        @Test
        @DisplayName("The last chunk is shortened to the range end")
        void lastChunkShortened() {
            TimeRange range = TimeRange.of(START, START.plusDays(8));

            List<TimeRange> chunks = planner.plan(range, Duration.ofDays(7)).collect(Collectors.toList());

            assertThat(chunks).hasSize(2);
            assertThat(chunks.get(1).length()).isEqualTo(Duration.ofDays(1));
        }

        @Test
        @DisplayName("A span longer than the range yields the range itself")
        void hugeSpan() {
            TimeRange range = TimeRange.of(START, START.plusHours(3));

            assertThat(planner.plan(range, Duration.ofDays(365 * 1000L)))
                    .containsExactly(range);
        }
    }

    @Nested
    @DisplayName("Edge cases")
    class EdgeCases {

        @Test
        @DisplayName("Empty and inverted ranges plan no chunks")
        void emptyRange() {
            assertThat(planner.plan(TimeRange.of(START, START), Duration.ofDays(1))).isEmpty();
            assertThat(planner.plan(TimeRange.of(START, START.minusDays(1)), Duration.ofDays(1))).isEmpty();
            assertThat(planner.chunkCount(TimeRange.of(START, START), Duration.ofDays(1))).isZero();
        }

        @Test
        @DisplayName("Non-positive spans are rejected")
        void nonPositiveSpan() {
            TimeRange range = TimeRange.of(START, START.plusDays(1));

            assertThatThrownBy(() -> planner.plan(range, Duration.ZERO))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> planner.plan(range, Duration.ofMinutes(-5)))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Planning is lazy: a century at one-minute chunks can be started without materialising it")
        void lazyPlan() {
            TimeRange century = TimeRange.of(START, START.plusYears(100));

            List<TimeRange> firstThree = planner.plan(century, Duration.ofMinutes(1))
                    .limit(3)
                    .collect(Collectors.toList());

            assertThat(firstThree).containsExactly(
                    TimeRange.of(START, START.plusMinutes(1)),
                    TimeRange.of(START.plusMinutes(1), START.plusMinutes(2)),
                    TimeRange.of(START.plusMinutes(2), START.plusMinutes(3)));
        }
    }
}
