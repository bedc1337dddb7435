package com.infomedia.abacox.callshipping.component.normalizer;

import com.infomedia.abacox.callshipping.component.feed.RawRecord;
import com.infomedia.abacox.callshipping.component.metrics.EngineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts raw feed rows into {@link CdrRecord} and {@link CelRecord}.
 * Malformed fields degrade to empty or zero values; only records without any
 * usable call identity are discarded.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class RecordNormalizer {

    // "Caller Name" <1234>
    private static final Pattern CLID_PATTERN = Pattern.compile("^\\s*\"?([^\"<]*)\"?\\s*<([^>]*)>\\s*$");

    private final EngineMetrics metrics;

    public NormalizationResult normalize(RawRecord raw) {
        if (raw == null || raw.getType() == null) {
            metrics.recordDiscarded();
            return NormalizationResult.discard("Record without type");
        }
        String uniqueId = text(raw, "uniqueid");
        String linkedId = text(raw, "linkedid");
        if (linkedId.isEmpty()) {
            if (uniqueId.isEmpty()) {
                metrics.recordDiscarded();
                log.debug("Discarding {} record from {} without linkedid and uniqueid", raw.getType(), raw.getFeedName());
                return NormalizationResult.discard("No usable linkedid or uniqueid");
            }
            // A call with a single channel is its own group
            linkedId = uniqueId;
        }
        return raw.getType() == RecordType.CDR
                ? NormalizationResult.of(normalizeCdr(raw, linkedId, uniqueId))
                : NormalizationResult.of(normalizeCel(raw, linkedId, uniqueId));
    }

    private CdrRecord normalizeCdr(RawRecord raw, String linkedId, String uniqueId) {
        long duration = parseNonNegativeLong(raw, "duration");
        long billSec = parseNonNegativeLong(raw, "billsec");

        Instant start = DateTimeUtil.parseInstant(raw.get("start"));
        if (start == null) {
            start = DateTimeUtil.parseInstant(raw.get("calldate"));
        }
        if (start == null) {
            start = DateTimeUtil.instantFromUniqueId(uniqueId);
        }
        Instant answer = DateTimeUtil.parseInstant(raw.get("answer"));
        Instant end = DateTimeUtil.parseInstant(raw.get("end"));
        if (end == null && start != null) {
            end = start.plus(Duration.ofSeconds(duration));
        }
        if (answer == null && start != null && billSec > 0) {
            answer = start.plus(Duration.ofSeconds(Math.max(0, duration - billSec)));
        }

        String clid = text(raw, "clid");
        String callerIdName = "";
        String src = PhoneNumberUtil.cleanPhoneField(raw.get("src")).getCleanedNumber();
        Matcher clidMatcher = CLID_PATTERN.matcher(clid);
        if (clidMatcher.matches()) {
            callerIdName = clidMatcher.group(1).trim();
            if (src.isEmpty()) {
                src = PhoneNumberUtil.cleanPhoneField(clidMatcher.group(2)).getCleanedNumber();
            }
        } else if (!clid.isEmpty() && !PhoneNumberUtil.cleanPhoneField(clid).isNumeric()) {
            callerIdName = clid;
        }

        return CdrRecord.builder()
                .uniqueId(uniqueId)
                .linkedId(linkedId)
                .sequence(sequence(raw, "sequence", uniqueId))
                .startTime(start)
                .answerTime(answer)
                .endTime(end)
                .src(src)
                .dst(PhoneNumberUtil.cleanPhoneField(raw.get("dst")).getCleanedNumber())
                .callerIdName(callerIdName)
                .context(text(raw, "context"))
                .dcontext(text(raw, "dcontext"))
                .channel(text(raw, "channel"))
                .dstChannel(text(raw, "dstchannel"))
                .lastApp(text(raw, "lastapp"))
                .lastData(text(raw, "lastdata"))
                .duration(duration)
                .billSec(billSec)
                .disposition(Disposition.parse(raw.get("disposition")))
                .accountCode(text(raw, "accountcode"))
                .userField(text(raw, "userfield"))
                .peerAccount(text(raw, "peeraccount"))
                .feedName(raw.getFeedName())
                .cursor(raw.getCursor())
                .build();
    }

    private CelRecord normalizeCel(RawRecord raw, String linkedId, String uniqueId) {
        String eventName = text(raw, "eventtype");
        Instant eventTime = DateTimeUtil.parseInstant(raw.get("eventtime"));
        if (eventTime == null) {
            eventTime = DateTimeUtil.instantFromUniqueId(uniqueId);
        }
        String extra = text(raw, "extra");
        if (extra.isEmpty()) {
            extra = text(raw, "eventextra");
        }
        return CelRecord.builder()
                .eventType(CelEventType.parse(eventName))
                .eventName(eventName)
                .eventTime(eventTime)
                .linkedId(linkedId)
                .uniqueId(uniqueId)
                .sequence(sequence(raw, "id", null))
                .cidName(text(raw, "cid_name"))
                .cidNum(PhoneNumberUtil.cleanPhoneField(raw.get("cid_num")).getCleanedNumber())
                .cidAni(PhoneNumberUtil.cleanPhoneField(raw.get("cid_ani")).getCleanedNumber())
                .cidRdnis(PhoneNumberUtil.cleanPhoneField(raw.get("cid_rdnis")).getCleanedNumber())
                .cidDnid(PhoneNumberUtil.cleanPhoneField(raw.get("cid_dnid")).getCleanedNumber())
                .exten(PhoneNumberUtil.cleanPhoneField(raw.get("exten")).getCleanedNumber())
                .context(text(raw, "context"))
                .chanName(text(raw, "channame"))
                .appName(text(raw, "appname"))
                .appData(text(raw, "appdata"))
                .accountCode(text(raw, "accountcode"))
                .peer(text(raw, "peer"))
                .userDefType(text(raw, "userdeftype"))
                .extra(extra)
                .feedName(raw.getFeedName())
                .cursor(raw.getCursor())
                .build();
    }

    private static String text(RawRecord raw, String field) {
        String value = raw.get(field);
        return value == null ? "" : value.trim();
    }

    private static long parseNonNegativeLong(RawRecord raw, String field) {
        String value = text(raw, field);
        if (value.isEmpty()) {
            return 0L;
        }
        try {
            return Math.max(0L, (long) Double.parseDouble(value));
        } catch (NumberFormatException e) {
            log.debug("Malformed numeric field {}='{}', using 0", field, value);
            return 0L;
        }
    }

    private static Long sequence(RawRecord raw, String field, String uniqueId) {
        String value = text(raw, field);
        if (!value.isEmpty()) {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                log.debug("Malformed sequence field {}='{}'", field, value);
            }
        }
        return uniqueId == null ? null : DateTimeUtil.sequenceFromUniqueId(uniqueId);
    }
}
