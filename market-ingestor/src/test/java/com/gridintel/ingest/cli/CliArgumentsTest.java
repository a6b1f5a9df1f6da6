package com.gridintel.ingest.cli;

import com.gridintel.ingest.model.TimeRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CliArgumentsTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 11, 9);

    private static CliArguments parse(String... args) {
        return CliArguments.parse(new DefaultApplicationArguments(CliArguments.normalize(args)));
    }

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        @DisplayName("Dataset alone means auto-mode ingest")
        void autoMode() {
            CliArguments cli = parse("--dataset=ceps-imbalance");

            assertThat(cli.getDataset()).isEqualTo("ceps-imbalance");
            assertThat(cli.getMode()).isEqualTo(CliArguments.Mode.INGEST);
            assertThat(cli.isDryRun()).isFalse();
            assertThat(cli.isAllDatasets()).isFalse();
            assertThat(cli.ingestRange(TODAY)).isNull();
        }

        @Test
        @DisplayName("Space-separated values are accepted as well as --opt=value")
        void spaceSeparated() {
            CliArguments cli = parse("--dataset", "all", "--start", "2025-11-01", "--end=2025-11-03",
                    "--mode", "AUDIT", "--dry-run", "--debug");

            assertThat(cli.isAllDatasets()).isTrue();
            assertThat(cli.getStart()).isEqualTo(LocalDate.of(2025, 11, 1));
            assertThat(cli.getEnd()).isEqualTo(LocalDate.of(2025, 11, 3));
            assertThat(cli.getMode()).isEqualTo(CliArguments.Mode.AUDIT);
            assertThat(cli.isDryRun()).isTrue();
            assertThat(cli.isDebug()).isTrue();
        }

        @Test
        @DisplayName("Property overrides pass through")
        void propertyOverrides() {
            CliArguments cli = parse("--dataset=x", "--ingestor.pipeline.fetch-timeout=30s");

            assertThat(cli.getDataset()).isEqualTo("x");
        }

        @Test
        @DisplayName("Invalid invocations are rejected with a message")
        void invalid() {
            assertThatThrownBy(() -> parse("--start=2025-11-01"))
                    .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("--dataset");
            assertThatThrownBy(() -> parse("--dataset=x", "--end=2025-11-01"))
                    .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("--end requires --start");
            assertThatThrownBy(() -> parse("--dataset=x", "--start=2025-11-05", "--end=2025-11-01"))
                    .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("before");
            assertThatThrownBy(() -> parse("--dataset=x", "--start=01.11.2025"))
                    .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("ISO date");
            assertThatThrownBy(() -> parse("--dataset=x", "--mode=delete"))
                    .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("--mode");
            assertThatThrownBy(() -> parse("--dataset=x", "--force"))
                    .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("--force");
            assertThatThrownBy(() -> parse("--dataset=x", "--dataset=y"))
                    .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("more than once");
        }
    }

    @Nested
    @DisplayName("Ranges")
    class Ranges {

        @Test
        @DisplayName("--start without --end runs through yesterday, end inclusive")
        void openEnded() {
            CliArguments cli = parse("--dataset=x", "--start=2025-11-01");

            assertThat(cli.ingestRange(TODAY)).isEqualTo(TimeRange.ofDays(
                    LocalDate.of(2025, 11, 1), LocalDate.of(2025, 11, 8)));
        }

        @Test
        @DisplayName("Aggregate and audit default to yesterday only")
        void defaultDays() {
            CliArguments cli = parse("--dataset=x", "--mode=audit");

            assertThat(cli.firstDay(TODAY)).isEqualTo(LocalDate.of(2025, 11, 8));
            assertThat(cli.lastDay(TODAY)).isEqualTo(LocalDate.of(2025, 11, 8));
        }

        @Test
        @DisplayName("A start after yesterday without an end is rejected when the range is computed")
        void startInFuture() {
            CliArguments cli = parse("--dataset=x", "--start=2025-11-20");

            assertThatThrownBy(() -> cli.ingestRange(TODAY)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("Only --dataset switches to a one-shot run")
    void cliInvocation() {
        assertThat(CliArguments.isCliInvocation(new String[]{"--dataset=all"})).isTrue();
        assertThat(CliArguments.isCliInvocation(new String[]{"--dataset", "all"})).isTrue();
        assertThat(CliArguments.isCliInvocation(new String[]{"--server.port=9000"})).isFalse();
        assertThat(CliArguments.isCliInvocation(new String[0])).isFalse();
    }

    @Test
    @DisplayName("Normalising leaves flags and overrides alone")
    void normalize() {
        assertThat(CliArguments.normalize(new String[]{"--dataset", "x", "--dry-run", "--start", "2025-11-01", "--debug"}))
                .containsExactly("--dataset=x", "--dry-run", "--start=2025-11-01", "--debug");
    }
}
