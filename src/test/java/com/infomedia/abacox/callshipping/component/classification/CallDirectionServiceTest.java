package com.infomedia.abacox.callshipping.component.classification;

import com.infomedia.abacox.callshipping.component.EngineFixtures;
import com.infomedia.abacox.callshipping.component.configmanager.ConfigKey;
import com.infomedia.abacox.callshipping.component.correlation.CorrelatedGroup;
import com.infomedia.abacox.callshipping.component.correlation.CorrelationIndex;
import com.infomedia.abacox.callshipping.component.normalizer.CelEventType;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Map;

import static com.infomedia.abacox.callshipping.component.EngineFixtures.T0;
import static org.junit.jupiter.api.Assertions.*;

class CallDirectionServiceTest {

    private final EngineFixtures.Classifiers classifiers =
            new EngineFixtures.Classifiers(Map.of(ConfigKey.KNOWN_TRUNKS, "rogers-trunk"));
    private final CallDirectionService service = classifiers.directionService;

    private static CallDirectionService.Leg leg(String channel, String dstChannel, String context, String dcontext,
                                                String src, String dst) {
        return new CallDirectionService.Leg(channel, dstChannel, context, dcontext, src, dst);
    }

    @Test
    void testInternalContextToTrunkIsOutbound() {
        CallDirection direction = service.classifyLeg(leg("SIP/338-acme-00000001", "SIP/sbc-ca2-00001",
                "from-internal", "from-internal", "338", "16475550100"));

        assertEquals(CallDirection.OUTBOUND, direction);
    }

    @Test
    void testInternalContextBetweenDevicesIsInternal() {
        CallDirection direction = service.classifyLeg(leg("SIP/338-acme-00000001", "SIP/201-acme-00000002",
                "from-internal", "ext-local", "338", "201"));

        assertEquals(CallDirection.INTERNAL, direction);
    }

    @Test
    void testTrunkWithExternalContextIsInbound() {
        CallDirection direction = service.classifyLeg(leg("SIP/sbc-ca2-00000a1f", "SIP/338-acme-00000002",
                "from-trunk", "from-did-direct", "16475550100", "338"));

        assertEquals(CallDirection.INBOUND, direction);
    }

    @Test
    void testKnownTrunkPeerIsTrunk() {
        assertTrue(service.isTrunkChannel("SIP/rogers-trunk-0000001a"));
        assertTrue(service.isTrunkChannel("SIP/sbc-ca2-00001"));
        assertFalse(service.isTrunkChannel("SIP/338-acme-0000001a"));
        assertFalse(service.isInternalChannel("SIP/rogers-trunk-0000001a"));
    }

    @Test
    void testLocalChannelIsInternal() {
        CallDirection direction = service.classifyLeg(leg("Local/338@from-queue-00000001;2", "",
                "from-queue", "unrecognized", "", ""));

        assertEquals(CallDirection.INTERNAL, direction);
    }

    @Test
    void testNumberShapesAsLastResort() {
        assertEquals(CallDirection.INBOUND, service.classifyByNumbers("6475550100", "338"));
        assertEquals(CallDirection.OUTBOUND, service.classifyByNumbers("338", "6475550100"));
        assertEquals(CallDirection.INTERNAL, service.classifyByNumbers("338", "201"));
        assertEquals(CallDirection.UNKNOWN, service.classifyByNumbers("", "s"));
    }

    @Test
    void testEstablishedDirectionIsKept() {
        CorrelationIndex index = new CorrelationIndex(classifiers.config, Clock.fixed(T0, ZoneOffset.UTC));
        index.ingest(EngineFixtures.cdr("1714564800.1")
                .channel("SIP/sbc-ca2-00000a1f").context("from-trunk").dcontext("from-did-direct")
                .src("16475550100").dst("338").build());
        CorrelatedGroup group = index.get("1714564800.1").orElseThrow();

        assertEquals(CallDirection.INBOUND, service.classify(group, null));
        assertEquals(CallDirection.OUTBOUND, service.classify(group, CallDirection.OUTBOUND));
        assertEquals(CallDirection.INBOUND, service.classify(group, CallDirection.UNKNOWN));
    }

    @Test
    void testCelOnlyGroupUsesChannelStart() {
        CorrelationIndex index = new CorrelationIndex(classifiers.config, Clock.fixed(T0, ZoneOffset.UTC));
        index.ingest(EngineFixtures.cel("1714564800.2", CelEventType.CHAN_START, T0)
                .chanName("SIP/sbc-ca2-00000b01").context("from-pstn").cidNum("16475550100").exten("338").build());
        CorrelatedGroup group = index.get("1714564800.2").orElseThrow();

        assertEquals(CallDirection.INBOUND, service.classify(group, null));
    }
}
