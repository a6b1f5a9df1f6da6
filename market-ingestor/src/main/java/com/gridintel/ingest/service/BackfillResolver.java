package com.gridintel.ingest.service;

import com.gridintel.ingest.model.BackfillResolution;
import com.gridintel.ingest.model.Dataset;
import com.gridintel.ingest.model.TimeRange;
import com.gridintel.ingest.store.PartitionedStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Works out what auto mode should fetch next.
 *
 * There is no cursor file: the boundary is always re-derived from the store's own
 * maximum timestamp for the dataset. The upper bound is "now minus lag" in the
 * dataset's civil zone, floored to the dataset resolution, because upstreams keep
 * revising the most recent data for a while after first publishing it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BackfillResolver {

    private final PartitionedStore store;
    private final Clock clock;

    public BackfillResolution resolve(Dataset dataset) {
        LocalDateTime horizon = floorToResolution(
                LocalDateTime.now(clock.withZone(dataset.getZone())).minus(dataset.getLag()),
                dataset.getResolution());

        Optional<LocalDateTime> cursor = store.maxTimestamp(dataset);
        LocalDateTime from = cursor
                .map(last -> last.plus(dataset.getResolution()))
                .orElse(dataset.getEpochFloor());

        if (!from.isBefore(horizon)) {
            log.debug("{} is up to date: next={} horizon={}", dataset.getId(), from, horizon);
            return BackfillResolution.upToDate(from, cursor.orElse(null));
        }

        TimeRange missing = TimeRange.of(from, horizon);
        log.info("{}: cursor={}, missing range {}", dataset.getId(), cursor.map(Object::toString).orElse("(empty store)"), missing);
        return BackfillResolution.pending(missing, cursor.orElse(null));
    }

    static LocalDateTime floorToResolution(LocalDateTime timestamp, Duration resolution) {
        LocalDateTime dayStart = timestamp.toLocalDate().atStartOfDay();
        long step = resolution.toSeconds();
        long elapsed = Duration.between(dayStart, timestamp).toSeconds();
        return dayStart.plusSeconds(elapsed - elapsed % step);
    }
}
