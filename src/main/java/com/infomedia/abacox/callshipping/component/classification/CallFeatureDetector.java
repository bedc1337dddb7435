package com.infomedia.abacox.callshipping.component.classification;

import com.infomedia.abacox.callshipping.component.correlation.CorrelatedGroup;
import com.infomedia.abacox.callshipping.component.engine.EngineConfigService;
import com.infomedia.abacox.callshipping.component.normalizer.CdrRecord;
import com.infomedia.abacox.callshipping.component.normalizer.CelEventType;
import com.infomedia.abacox.callshipping.component.normalizer.CelRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Detects transfers, queues, voicemail, IVR, parking and conferences from the applications
 * and dialplan contexts a call went through.
 */
@Component
@RequiredArgsConstructor
public class CallFeatureDetector {

    private static final Set<String> TRANSFER_APPS = Set.of("transfer", "blindxfer", "atxfer");
    private static final Set<String> VOICEMAIL_APPS = Set.of("voicemail", "voicemailmain", "vm");
    private static final Set<String> PARKING_APPS = Set.of("park", "parkedcall", "parkandannounce");
    private static final Set<String> CONFERENCE_APPS = Set.of("confbridge", "meetme");
    private static final Set<String> IVR_APPS = Set.of("background", "ivr", "read");

    private final EngineConfigService engineConfig;
    private final PatternMatcher patternMatcher;
    private final NumberAnalyzer numberAnalyzer;

    static boolean isTransferApp(String lastAppLower) {
        return TRANSFER_APPS.contains(lastAppLower) || lastAppLower.contains("attended");
    }

    public CallFeatures detect(CorrelatedGroup group) {
        boolean transferred = false;
        boolean queue = false;
        boolean voicemail = false;
        boolean ivr = false;
        boolean parked = false;
        boolean conference = false;
        boolean anonymous = false;

        List<String> queuePatterns = engineConfig.getQueuePatterns();
        List<String> voicemailPatterns = engineConfig.getVoicemailPatterns();
        List<String> ivrPatterns = engineConfig.getIvrPatterns();
        List<String> parkingPatterns = engineConfig.getParkingPatterns();
        List<String> conferencePatterns = engineConfig.getConferencePatterns();

        for (CdrRecord cdr : group.getCdrs()) {
            String app = lower(cdr.getLastApp());
            String lastData = lower(cdr.getLastData());
            transferred |= isTransferApp(app) || lower(cdr.getChannel()).contains("masq")
                    || lastData.contains("transfer") || lastData.contains("xfer");
            queue |= app.equals("queue") || matchesContexts(cdr.getContext(), cdr.getDcontext(), queuePatterns);
            voicemail |= VOICEMAIL_APPS.contains(app) || matchesContexts(cdr.getContext(), cdr.getDcontext(), voicemailPatterns);
            ivr |= IVR_APPS.contains(app) || matchesContexts(cdr.getContext(), cdr.getDcontext(), ivrPatterns);
            parked |= PARKING_APPS.contains(app) || matchesContexts(cdr.getContext(), cdr.getDcontext(), parkingPatterns);
            conference |= CONFERENCE_APPS.contains(app) || matchesContexts(cdr.getContext(), cdr.getDcontext(), conferencePatterns);
        }
        if (!group.getCdrs().isEmpty()) {
            anonymous = numberAnalyzer.isAnonymous(group.getCdrs().get(0).getSrc())
                    || numberAnalyzer.isAnonymous(group.getCdrs().get(0).getCallerIdName());
        }

        for (CelRecord cel : group.getCels()) {
            CelEventType type = cel.getEventType();
            transferred |= type.isTransfer();
            parked |= type == CelEventType.PARK_START;
            if (type == CelEventType.APP_START) {
                String app = lower(cel.getAppName());
                queue |= app.equals("queue");
                voicemail |= VOICEMAIL_APPS.contains(app);
                ivr |= IVR_APPS.contains(app);
                conference |= CONFERENCE_APPS.contains(app);
            }
            if (type == CelEventType.CHAN_START) {
                anonymous |= numberAnalyzer.isAnonymous(cel.getCidNum()) || numberAnalyzer.isAnonymous(cel.getCidName());
            }
            queue |= patternMatcher.matchesAny(cel.getContext(), queuePatterns);
            voicemail |= patternMatcher.matchesAny(cel.getContext(), voicemailPatterns);
            ivr |= patternMatcher.matchesAny(cel.getContext(), ivrPatterns);
            conference |= patternMatcher.matchesAny(cel.getContext(), conferencePatterns);
        }

        return CallFeatures.builder()
                .transferred(transferred)
                .queueCall(queue)
                .voicemail(voicemail)
                .ivr(ivr)
                .parked(parked)
                .conference(conference)
                .anonymousCaller(anonymous)
                .build();
    }

    private boolean matchesContexts(String context, String dcontext, List<String> patterns) {
        return patternMatcher.matchesAny(context, patterns) || patternMatcher.matchesAny(dcontext, patterns);
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
