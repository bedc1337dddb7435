package com.infomedia.abacox.callshipping.component.classification;

import com.infomedia.abacox.callshipping.component.EngineFixtures;
import com.infomedia.abacox.callshipping.component.correlation.CorrelatedGroup;
import com.infomedia.abacox.callshipping.component.correlation.CorrelationIndex;
import com.infomedia.abacox.callshipping.component.normalizer.CelEventType;
import com.infomedia.abacox.callshipping.component.normalizer.NormalizedRecord;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.infomedia.abacox.callshipping.component.EngineFixtures.T0;
import static org.junit.jupiter.api.Assertions.*;

class CallFeatureDetectorTest {

    private static final String LINKED_ID = "1714564800.1";

    private final EngineFixtures.Classifiers classifiers = new EngineFixtures.Classifiers(Map.of());
    private final CorrelationIndex index = new CorrelationIndex(classifiers.config, new EngineFixtures.MutableClock(T0));

    private CorrelatedGroup group(NormalizedRecord... records) {
        CorrelatedGroup group = null;
        for (NormalizedRecord record : records) {
            group = index.ingest(record).getGroup();
        }
        return group;
    }

    @Test
    void testPlainCallHasNoFeatures() {
        CallFeatures features = classifiers.featureDetector.detect(group(
                EngineFixtures.cdr(LINKED_ID).src("338").dst("201").dcontext("ext-local").lastApp("Dial").build()));

        assertFalse(features.isTransferred());
        assertFalse(features.isQueueCall());
        assertFalse(features.isVoicemail());
        assertFalse(features.isAnonymousCaller());
    }

    @Test
    void testQueueAndVoicemailFromContextsAndApps() {
        CallFeatures features = classifiers.featureDetector.detect(group(
                EngineFixtures.cdr(LINKED_ID).src("6475550100").dst("400").dcontext("ext-queues").lastApp("Queue").build(),
                EngineFixtures.cdr(LINKED_ID).uniqueId("1714564800.2").sequence(2L).src("6475550100").dst("338")
                        .dcontext("macro-vm").lastApp("VoiceMail").build()));

        assertTrue(features.isQueueCall());
        assertTrue(features.isVoicemail());
        assertFalse(features.isConference());
    }

    @Test
    void testCelEventsMarkTransferParkAndConference() {
        CallFeatures features = classifiers.featureDetector.detect(group(
                EngineFixtures.cel(LINKED_ID, CelEventType.BLINDTRANSFER, T0.plusSeconds(10)).sequence(1L).build(),
                EngineFixtures.cel(LINKED_ID, CelEventType.PARK_START, T0.plusSeconds(20)).sequence(2L).build(),
                EngineFixtures.cel(LINKED_ID, CelEventType.APP_START, T0.plusSeconds(30)).sequence(3L)
                        .appName("ConfBridge").build()));

        assertTrue(features.isTransferred());
        assertTrue(features.isParked());
        assertTrue(features.isConference());
    }

    @Test
    void testAnonymousCaller() {
        CallFeatures features = classifiers.featureDetector.detect(group(
                EngineFixtures.cdr(LINKED_ID).src("anonymous").dst("338").build()));

        assertTrue(features.isAnonymousCaller());
    }
}
