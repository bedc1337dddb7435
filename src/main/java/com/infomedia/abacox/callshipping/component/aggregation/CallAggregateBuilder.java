package com.infomedia.abacox.callshipping.component.aggregation;

import com.infomedia.abacox.callshipping.component.classification.CallDirection;
import com.infomedia.abacox.callshipping.component.classification.CallDirectionService;
import com.infomedia.abacox.callshipping.component.classification.CallEndpoints;
import com.infomedia.abacox.callshipping.component.classification.CallFeatureDetector;
import com.infomedia.abacox.callshipping.component.classification.CallFeatures;
import com.infomedia.abacox.callshipping.component.classification.NumberAnalyzer;
import com.infomedia.abacox.callshipping.component.classification.NumberExtractionService;
import com.infomedia.abacox.callshipping.component.classification.tenant.TenantMatch;
import com.infomedia.abacox.callshipping.component.classification.tenant.TenantResolutionService;
import com.infomedia.abacox.callshipping.component.correlation.CorrelatedGroup;
import com.infomedia.abacox.callshipping.component.engine.EngineConfigService;
import com.infomedia.abacox.callshipping.component.normalizer.CdrRecord;
import com.infomedia.abacox.callshipping.component.normalizer.CelEventType;
import com.infomedia.abacox.callshipping.component.normalizer.CelRecord;
import com.infomedia.abacox.callshipping.component.normalizer.Disposition;
import com.infomedia.abacox.callshipping.component.normalizer.NormalizedRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the {@link CallAggregate} of a correlated group from its records and the classifiers.
 * The aggregate is rebuilt from the whole group on every change.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class CallAggregateBuilder {

    private static final Set<CelEventType> THREAD_EVENTS = EnumSet.of(
            CelEventType.CHAN_START, CelEventType.ANSWER, CelEventType.BRIDGE_ENTER, CelEventType.BRIDGE_EXIT,
            CelEventType.BLINDTRANSFER, CelEventType.ATTENDEDTRANSFER, CelEventType.HANGUP,
            CelEventType.LINKEDID_END, CelEventType.PARK_START, CelEventType.PARK_END);

    private static final Set<String> THREAD_APPS = Set.of(
            "queue", "voicemail", "voicemailmain", "confbridge", "meetme", "background", "read", "ivr");

    private final CallDirectionService directionService;
    private final CallFeatureDetector featureDetector;
    private final NumberExtractionService numberExtractionService;
    private final TenantResolutionService tenantResolutionService;
    private final NumberAnalyzer numberAnalyzer;
    private final EngineConfigService engineConfig;

    /**
     * A group is worth shipping once it has a CDR, or for CEL-only feeds a channel start
     * followed by another lifecycle event.
     */
    public boolean hasMinimumData(CorrelatedGroup group) {
        if (!group.getCdrs().isEmpty()) {
            return true;
        }
        CelRecord start = null;
        for (CelRecord cel : group.getCels()) {
            if (start == null) {
                if (cel.getEventType() == CelEventType.CHAN_START) {
                    start = cel;
                }
            } else if (cel.getEventType() != CelEventType.OTHER) {
                return true;
            }
        }
        return false;
    }

    public CallAggregate build(CorrelatedGroup group, CallAggregate previous) {
        CallDirection direction = directionService.classify(group, previous == null ? null : previous.getDirection());
        CallEndpoints endpoints = numberExtractionService.extract(group, direction);
        CallFeatures features = featureDetector.detect(group);
        TenantMatch tenant = tenantResolutionService.resolve(group, endpoints);

        List<CdrRecord> cdrs = group.getCdrs();
        List<CelRecord> cels = group.getCels();

        Instant startedAt = group.getEarliestEventTime();
        Instant answeredAt = answeredAt(cdrs, cels);
        Instant endedAt = endedAt(cdrs, cels);
        long duration = durationSeconds(cdrs, cels, startedAt, endedAt);
        long billsec = billsec(cdrs, answeredAt, endedAt);
        long threshold = engineConfig.getLongCallUpdateIntervalSeconds();

        String srcExtensionName = extensionName(cels, endpoints.getSrcExtension());
        String dstExtensionName = extensionName(cels, endpoints.getDstExtension());
        String callerName = callerName(cdrs, cels, endpoints);
        String srcName = direction == CallDirection.INBOUND ? CallerIdUtil.cleanCallerName(callerName) : emptyToNull(callerName);
        String dstName = direction == CallDirection.INTERNAL ? dstExtensionName : null;

        CallAggregate.CallAggregateBuilder builder = CallAggregate.builder()
                .linkedId(group.getLinkedId())
                .direction(direction)
                .srcNumber(endpoints.getSrcNumber())
                .srcExtension(endpoints.getSrcExtension())
                .srcName(srcName)
                .srcExtensionName(srcExtensionName)
                .dstNumber(endpoints.getDstNumber())
                .dstExtension(endpoints.getDstExtension())
                .dstName(dstName)
                .dstExtensionName(dstExtensionName)
                .tenant(tenant.tenant())
                .tenantSource(tenant.strategy())
                .callThreads(buildThreads(group))
                .startedAt(startedAt)
                .answeredAt(answeredAt)
                .endedAt(endedAt)
                .disposition(disposition(cdrs, cels, group.isClosed()))
                .durationSeconds(duration)
                .billsec(billsec)
                .longCall(threshold > 0 && duration > threshold)
                .complete(group.isClosed())
                .transferred(features.isTransferred())
                .queueCall(features.isQueueCall())
                .voicemail(features.isVoicemail())
                .ivr(features.isIvr())
                .parked(features.isParked())
                .conference(features.isConference())
                .anonymousCaller(features.isAnonymousCaller())
                .connectorVersion(engineConfig.getConnectorVersion())
                .customerId(engineConfig.getCustomerId())
                .hostname(engineConfig.getHostname());

        if (engineConfig.isIncludeRawData()) {
            builder.rawCdrs(new ArrayList<>(cdrs)).rawCels(new ArrayList<>(cels));
        }
        return builder.build();
    }

    List<ThreadEntry> buildThreads(CorrelatedGroup group) {
        List<ThreadEntry> threads = new ArrayList<>();
        for (NormalizedRecord record : group.orderedRecords()) {
            if (record instanceof CdrRecord cdr) {
                threads.add(ThreadEntry.builder()
                        .time(cdr.getStartTime())
                        .event("CDR")
                        .uniqueId(cdr.getUniqueId())
                        .channel(cdr.getChannel())
                        .dstChannel(cdr.getDstChannel())
                        .src(cdr.getSrc())
                        .dst(cdr.getDst())
                        .duration(cdr.getDuration())
                        .billsec(cdr.getBillSec())
                        .disposition(cdr.getDisposition() == null ? null : cdr.getDisposition().getPbxValue())
                        .lastApp(cdr.getLastApp())
                        .context(cdr.getDcontext())
                        .build());
            } else if (record instanceof CelRecord cel && isThreadEvent(cel)) {
                ThreadEntry.ThreadEntryBuilder entry = ThreadEntry.builder()
                        .time(cel.getEventTime())
                        .event(cel.getEventName())
                        .uniqueId(cel.getUniqueId())
                        .channel(cel.getChanName())
                        .exten(cel.getExten())
                        .context(cel.getContext());
                if (cel.getEventType() == CelEventType.BRIDGE_ENTER || cel.getEventType() == CelEventType.BRIDGE_EXIT) {
                    entry.peer(cel.getPeer());
                }
                if (cel.getEventType().isTransfer()) {
                    entry.transferee(cel.getExtra());
                }
                if (cel.getEventType() == CelEventType.APP_START) {
                    entry.app(cel.getAppName()).appData(cel.getAppData());
                }
                threads.add(entry.build());
            }
        }
        return threads;
    }

    private static boolean isThreadEvent(CelRecord cel) {
        if (THREAD_EVENTS.contains(cel.getEventType())) {
            return true;
        }
        return cel.getEventType() == CelEventType.APP_START
                && cel.getAppName() != null
                && THREAD_APPS.contains(cel.getAppName().toLowerCase(Locale.ROOT));
    }

    private static Instant answeredAt(List<CdrRecord> cdrs, List<CelRecord> cels) {
        Instant answered = null;
        for (CdrRecord cdr : cdrs) {
            if (cdr.getAnswerTime() != null && (answered == null || cdr.getAnswerTime().isBefore(answered))) {
                answered = cdr.getAnswerTime();
            }
        }
        if (answered != null) {
            return answered;
        }
        for (CelRecord cel : cels) {
            if (cel.getEventType() == CelEventType.ANSWER) {
                return cel.getEventTime();
            }
        }
        return null;
    }

    private static Instant endedAt(List<CdrRecord> cdrs, List<CelRecord> cels) {
        Instant ended = null;
        for (CdrRecord cdr : cdrs) {
            if (cdr.getEndTime() != null && (ended == null || cdr.getEndTime().isAfter(ended))) {
                ended = cdr.getEndTime();
            }
        }
        for (CelRecord cel : cels) {
            CelEventType type = cel.getEventType();
            boolean ending = type == CelEventType.HANGUP || type == CelEventType.CHAN_END || type == CelEventType.LINKEDID_END;
            if (ending && cel.getEventTime() != null && (ended == null || cel.getEventTime().isAfter(ended))) {
                ended = cel.getEventTime();
            }
        }
        return ended;
    }

    private static long durationSeconds(List<CdrRecord> cdrs, List<CelRecord> cels, Instant startedAt, Instant endedAt) {
        long duration = 0;
        for (CdrRecord cdr : cdrs) {
            duration = Math.max(duration, cdr.getDuration());
        }
        if (duration > 0 || startedAt == null) {
            return duration;
        }
        Instant last = endedAt;
        if (last == null) {
            for (CelRecord cel : cels) {
                if (cel.getEventTime() != null && (last == null || cel.getEventTime().isAfter(last))) {
                    last = cel.getEventTime();
                }
            }
        }
        return last == null ? 0 : Math.max(0, Duration.between(startedAt, last).getSeconds());
    }

    private static long billsec(List<CdrRecord> cdrs, Instant answeredAt, Instant endedAt) {
        long billsec = 0;
        for (CdrRecord cdr : cdrs) {
            billsec = Math.max(billsec, cdr.getBillSec());
        }
        if (billsec == 0 && cdrs.isEmpty() && answeredAt != null && endedAt != null) {
            billsec = Math.max(0, Duration.between(answeredAt, endedAt).getSeconds());
        }
        return billsec;
    }

    private static Disposition disposition(List<CdrRecord> cdrs, List<CelRecord> cels, boolean closed) {
        for (CdrRecord cdr : cdrs) {
            if (cdr.getDisposition() == Disposition.ANSWERED) {
                return Disposition.ANSWERED;
            }
        }
        for (CdrRecord cdr : cdrs) {
            if (cdr.getDisposition() != null && cdr.getDisposition() != Disposition.UNKNOWN) {
                return cdr.getDisposition();
            }
        }
        for (CelRecord cel : cels) {
            if (cel.getEventType() == CelEventType.ANSWER) {
                return Disposition.ANSWERED;
            }
        }
        return closed ? Disposition.NO_ANSWER : null;
    }

    private String callerName(List<CdrRecord> cdrs, List<CelRecord> cels, CallEndpoints endpoints) {
        for (CelRecord cel : cels) {
            if (cel.getEventType() != CelEventType.CHAN_START || cel.getCidName() == null || cel.getCidName().isBlank()) {
                continue;
            }
            String cidNum = cel.getCidNum();
            if (cidNum == null || cidNum.isEmpty()) {
                continue;
            }
            if (Objects.equals(cidNum, endpoints.getSrcExtension())
                    || (endpoints.getSrcNumber() != null && endpoints.getSrcNumber().equals(numberAnalyzer.normalizeNumber(cidNum)))) {
                return cel.getCidName();
            }
        }
        for (CdrRecord cdr : cdrs) {
            if (cdr.getCallerIdName() != null && !cdr.getCallerIdName().isBlank()) {
                return cdr.getCallerIdName();
            }
        }
        return null;
    }

    // Name a device presents for itself: its channel and caller number are the extension
    private String extensionName(List<CelRecord> cels, String extension) {
        if (extension == null) {
            return null;
        }
        for (CelRecord cel : cels) {
            if (cel.getEventType() == CelEventType.CHAN_START
                    && extension.equals(numberAnalyzer.extensionFromChannel(cel.getChanName()))
                    && extension.equals(cel.getCidNum())
                    && cel.getCidName() != null && !cel.getCidName().isBlank()) {
                return cel.getCidName().trim();
            }
        }
        return null;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
