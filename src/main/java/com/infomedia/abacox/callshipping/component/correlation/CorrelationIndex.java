package com.infomedia.abacox.callshipping.component.correlation;

import com.infomedia.abacox.callshipping.component.engine.EngineConfigService;
import com.infomedia.abacox.callshipping.component.feed.FeedCursor;
import com.infomedia.abacox.callshipping.component.normalizer.CelEventType;
import com.infomedia.abacox.callshipping.component.normalizer.CelRecord;
import com.infomedia.abacox.callshipping.component.normalizer.NormalizedRecord;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Groups normalized records by linked id. Each group is mutated only while holding its monitor,
 * so records of one call are applied by a single writer while different calls proceed in parallel.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class CorrelationIndex {

    // Minimum quiet time before a fully hung-up group is closed without LINKEDID_END
    static final Duration HANGUP_GRACE = Duration.ofSeconds(5);

    private final EngineConfigService engineConfig;
    private final Clock clock;

    private final Map<String, CorrelatedGroup> groups = new ConcurrentHashMap<>();

    @Getter
    public static class SweepResult {
        private final List<CorrelatedGroup> newlyClosed = new ArrayList<>();
        private final List<CorrelatedGroup> open = new ArrayList<>();
        /** Groups closed earlier whose final shipment has not been handed to delivery yet. */
        private final List<CorrelatedGroup> unsettled = new ArrayList<>();
    }

    public GroupHandle ingest(NormalizedRecord record) {
        String linkedId = record.getLinkedId();
        while (true) {
            Instant now = clock.instant();
            boolean[] created = new boolean[1];
            CorrelatedGroup group = groups.computeIfAbsent(linkedId, id -> {
                created[0] = true;
                return new CorrelatedGroup(id, now);
            });
            synchronized (group) {
                if (group.isEvicted()) {
                    // Lost a race with eviction, retry against a fresh group
                    continue;
                }
                boolean wasClosed = group.isClosed();
                boolean added = group.insert(record, now);
                if (added && !wasClosed) {
                    evaluateClosureOnIngest(group, record, now);
                }
                if (added && wasClosed) {
                    log.debug("Late {} record for closed call {}", record.getType(), linkedId);
                }
                return new GroupHandle(linkedId, group, added, created[0], added && wasClosed,
                        group.isClosed(), group.getCloseReason());
            }
        }
    }

    private void evaluateClosureOnIngest(CorrelatedGroup group, NormalizedRecord record, Instant now) {
        if (record instanceof CelRecord cel && cel.getEventType() == CelEventType.LINKEDID_END) {
            group.close(CloseReason.LINKEDID_END, now);
            log.debug("Call {} closed by LINKEDID_END", group.getLinkedId());
            return;
        }
        if (!engineConfig.isCelCompletionRequired() && group.allCdrsDisposed()) {
            group.close(CloseReason.CDR_TERMINAL, now);
            log.debug("Call {} closed by terminal CDR disposition", group.getLinkedId());
        }
    }

    /**
     * Closes groups that went quiet and lists the groups still open.
     */
    public SweepResult sweep() {
        Instant now = clock.instant();
        Duration quiescence = engineConfig.getQuiescenceInterval();
        Duration hangupGrace = quiescence.compareTo(HANGUP_GRACE) < 0 ? quiescence : HANGUP_GRACE;
        SweepResult result = new SweepResult();
        for (CorrelatedGroup group : groups.values()) {
            synchronized (group) {
                if (group.isEvicted()) {
                    continue;
                }
                if (group.isClosed()) {
                    if (!group.isSettled()) {
                        result.unsettled.add(group);
                    }
                    continue;
                }
                Duration idle = Duration.between(group.getLastActivityAt(), now);
                if (group.allChannelsHungUp() && idle.compareTo(hangupGrace) >= 0) {
                    group.close(CloseReason.ALL_CHANNELS_HUNG_UP, now);
                    result.newlyClosed.add(group);
                } else if (idle.compareTo(quiescence) >= 0) {
                    group.close(CloseReason.QUIESCENT, now);
                    result.newlyClosed.add(group);
                } else {
                    result.open.add(group);
                }
            }
        }
        if (!result.newlyClosed.isEmpty()) {
            log.debug("Sweep closed {} groups, {} remain open", result.newlyClosed.size(), result.open.size());
        }
        return result;
    }

    /**
     * Removes settled closed groups once the late-arrival window has elapsed.
     *
     * @param retained groups still needed elsewhere, e.g. with a shipment waiting for delivery
     * @return number of evicted groups
     */
    public int evictExpired(Predicate<CorrelatedGroup> retained) {
        Instant cutoff = clock.instant().minus(engineConfig.getClosedGroupRetention());
        int evicted = 0;
        for (CorrelatedGroup group : groups.values()) {
            synchronized (group) {
                if (group.isClosed() && group.isSettled() && !group.getClosedAt().isAfter(cutoff)
                        && !group.getLastActivityAt().isAfter(cutoff) && !retained.test(group)) {
                    group.markEvicted();
                    groups.remove(group.getLinkedId(), group);
                    evicted++;
                }
            }
        }
        if (evicted > 0) {
            log.debug("Evicted {} settled call groups", evicted);
        }
        return evicted;
    }

    public Optional<CorrelatedGroup> get(String linkedId) {
        return Optional.ofNullable(groups.get(linkedId));
    }

    public boolean contains(String linkedId) {
        return linkedId != null && groups.containsKey(linkedId);
    }

    public int size() {
        return groups.size();
    }

    public long openGroupCount() {
        return groups.values().stream().filter(g -> !g.isClosed()).count();
    }

    /**
     * Earliest cursor per feed over the groups whose final shipment is not yet handed off, plus the
     * retained ones. Feeds resume from here after a restart so no undelivered call is skipped.
     */
    public Map<String, FeedCursor> unsettledLowWaterMarks(Predicate<CorrelatedGroup> retained) {
        Map<String, FeedCursor> marks = new HashMap<>();
        for (CorrelatedGroup group : groups.values()) {
            synchronized (group) {
                if (group.isEvicted() || (group.isSettled() && !retained.test(group))) {
                    continue;
                }
                group.getFirstCursors().forEach((feed, cursor) -> marks.merge(feed, cursor, FeedCursor::min));
            }
        }
        return marks;
    }
}
