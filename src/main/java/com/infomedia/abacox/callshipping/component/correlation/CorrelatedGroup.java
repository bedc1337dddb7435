package com.infomedia.abacox.callshipping.component.correlation;

import com.infomedia.abacox.callshipping.component.aggregation.CallAggregate;
import com.infomedia.abacox.callshipping.component.feed.FeedCursor;
import com.infomedia.abacox.callshipping.component.normalizer.CdrRecord;
import com.infomedia.abacox.callshipping.component.normalizer.CelEventType;
import com.infomedia.abacox.callshipping.component.normalizer.CelRecord;
import com.infomedia.abacox.callshipping.component.normalizer.NormalizedRecord;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * All CDR and CEL records sharing one linked id. CDR legs are kept in sequence order and CEL
 * events in event-time order; {@link #orderedRecords()} interleaves both by event time.
 * Records are only ever inserted, never removed. Callers hold the group monitor while mutating.
 */
@Getter
public class CorrelatedGroup {

    static final Comparator<Instant> TIME_ORDER = Comparator.nullsLast(Comparator.naturalOrder());
    static final Comparator<Long> SEQUENCE_ORDER = Comparator.nullsLast(Comparator.naturalOrder());

    static final Comparator<CdrRecord> CDR_ORDER = Comparator
            .comparing(CdrRecord::getSequence, SEQUENCE_ORDER)
            .thenComparing(CdrRecord::getStartTime, TIME_ORDER);

    static final Comparator<CelRecord> CEL_ORDER = Comparator
            .comparing(CelRecord::getEventTime, TIME_ORDER)
            .thenComparing(CelRecord::getSequence, SEQUENCE_ORDER);

    private final String linkedId;
    private final Instant createdAt;
    private final List<CdrRecord> cdrs = new ArrayList<>();
    private final List<CelRecord> cels = new ArrayList<>();
    @Getter(AccessLevel.NONE)
    private final Set<String> identities = new HashSet<>();
    // Earliest cursor per feed, used to compute the resume checkpoint
    private final Map<String, FeedCursor> firstCursors = new HashMap<>();

    private Instant lastActivityAt;
    private int revision;
    private CloseReason closeReason;
    private Instant closedAt;
    private boolean evicted;

    @Setter
    private CallAggregate aggregate;

    /** The final shipment of this group has been handed to delivery. */
    @Setter
    private boolean settled;

    /**
     * Re-created after its call had already shipped complete, e.g. late records after eviction or a
     * replay after restart. Its records may be a subset of the call, so it never triggers a corrective re-ship.
     */
    @Setter
    private boolean reopened;

    public CorrelatedGroup(String linkedId, Instant createdAt) {
        this.linkedId = linkedId;
        this.createdAt = createdAt;
        this.lastActivityAt = createdAt;
    }

    /**
     * Inserts the record at its ordered position.
     *
     * @return false if an identical record is already part of the group
     */
    boolean insert(NormalizedRecord record, Instant arrivedAt) {
        if (!identities.add(identityOf(record))) {
            return false;
        }
        if (record instanceof CdrRecord cdr) {
            cdrs.add(upperBound(cdrs, cdr, CDR_ORDER), cdr);
        } else if (record instanceof CelRecord cel) {
            cels.add(upperBound(cels, cel, CEL_ORDER), cel);
        }
        if (record.getCursor() != null && record.getFeedName() != null) {
            firstCursors.merge(record.getFeedName(), record.getCursor(), FeedCursor::min);
        }
        lastActivityAt = arrivedAt;
        revision++;
        return true;
    }

    void close(CloseReason reason, Instant at) {
        if (closeReason == null) {
            closeReason = reason;
            closedAt = at;
        }
    }

    void markEvicted() {
        evicted = true;
    }

    public boolean isClosed() {
        return closeReason != null;
    }

    public List<CdrRecord> getCdrs() {
        return Collections.unmodifiableList(cdrs);
    }

    public List<CelRecord> getCels() {
        return Collections.unmodifiableList(cels);
    }

    public Map<String, FeedCursor> getFirstCursors() {
        return Collections.unmodifiableMap(firstCursors);
    }

    public int size() {
        return cdrs.size() + cels.size();
    }

    /**
     * CDR legs (in sequence order) merged with CEL events (in time order) by event time.
     * On equal times the CDR leg comes first.
     */
    public List<NormalizedRecord> orderedRecords() {
        List<NormalizedRecord> merged = new ArrayList<>(size());
        int i = 0;
        int j = 0;
        while (i < cdrs.size() || j < cels.size()) {
            if (j >= cels.size()) {
                merged.add(cdrs.get(i++));
            } else if (i >= cdrs.size()) {
                merged.add(cels.get(j++));
            } else if (TIME_ORDER.compare(cdrs.get(i).getStartTime(), cels.get(j).getEventTime()) <= 0) {
                merged.add(cdrs.get(i++));
            } else {
                merged.add(cels.get(j++));
            }
        }
        return merged;
    }

    /**
     * True when at least one channel started and every started channel has a HANGUP.
     */
    public boolean allChannelsHungUp() {
        Set<String> started = new HashSet<>();
        Set<String> hungUp = new HashSet<>();
        for (CelRecord cel : cels) {
            if (cel.getEventType() == CelEventType.CHAN_START) {
                started.add(cel.getChanName());
            } else if (cel.getEventType() == CelEventType.HANGUP) {
                hungUp.add(cel.getChanName());
            }
        }
        return !started.isEmpty() && hungUp.containsAll(started);
    }

    /**
     * True when there is at least one CDR leg and every leg carries a final disposition.
     */
    public boolean allCdrsDisposed() {
        if (cdrs.isEmpty()) {
            return false;
        }
        for (CdrRecord cdr : cdrs) {
            if (cdr.getDisposition() == null || !cdr.getDisposition().isTerminal()) {
                return false;
            }
        }
        return true;
    }

    public Instant getEarliestEventTime() {
        Instant earliest = null;
        for (CdrRecord cdr : cdrs) {
            earliest = earlier(earliest, cdr.getStartTime());
        }
        for (CelRecord cel : cels) {
            earliest = earlier(earliest, cel.getEventTime());
        }
        return earliest;
    }

    private static Instant earlier(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return b.isBefore(a) ? b : a;
    }

    private static <T> int upperBound(List<T> list, T item, Comparator<? super T> order) {
        int low = 0;
        int high = list.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (order.compare(list.get(mid), item) <= 0) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    private static String identityOf(NormalizedRecord record) {
        if (record instanceof CdrRecord cdr) {
            return "CDR|" + cdr.getUniqueId() + "|" + cdr.getSequence() + "|" + cdr.getStartTime() + "|"
                    + cdr.getChannel() + "|" + cdr.getDstChannel() + "|" + cdr.getDst() + "|" + cdr.getDisposition();
        }
        CelRecord cel = (CelRecord) record;
        if (cel.getSequence() != null) {
            return "CEL|#" + cel.getSequence();
        }
        return "CEL|" + cel.getUniqueId() + "|" + cel.getEventName() + "|" + cel.getEventTime() + "|" + cel.getChanName();
    }
}
