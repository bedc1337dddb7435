package com.infomedia.abacox.callshipping.component.classification;

import com.infomedia.abacox.callshipping.component.EngineFixtures;
import com.infomedia.abacox.callshipping.component.correlation.CorrelatedGroup;
import com.infomedia.abacox.callshipping.component.correlation.CorrelationIndex;
import com.infomedia.abacox.callshipping.component.normalizer.CelEventType;
import com.infomedia.abacox.callshipping.component.normalizer.NormalizedRecord;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Map;

import static com.infomedia.abacox.callshipping.component.EngineFixtures.T0;
import static com.infomedia.abacox.callshipping.component.EngineFixtures.cdr;
import static com.infomedia.abacox.callshipping.component.EngineFixtures.cel;
import static org.junit.jupiter.api.Assertions.*;

class NumberExtractionServiceTest {

    private static final String LINKED_ID = "1714564800.30";

    private final EngineFixtures.Classifiers classifiers = new EngineFixtures.Classifiers(Map.of());
    private final NumberExtractionService service = classifiers.numberExtractionService;

    private CorrelatedGroup group(NormalizedRecord... records) {
        CorrelationIndex index = new CorrelationIndex(classifiers.config, Clock.fixed(T0, ZoneOffset.UTC));
        for (NormalizedRecord record : records) {
            index.ingest(record);
        }
        return index.get(LINKED_ID).orElseThrow();
    }

    @Test
    void testSpecialDestinationTakesDidFromDirectContext() {
        CorrelatedGroup group = group(cdr(LINKED_ID)
                .src("4165550100").dst("s").dcontext("from-did-direct,6478752300").build());

        CallEndpoints endpoints = service.extract(group, CallDirection.INBOUND);

        assertEquals("16478752300", endpoints.getDstNumber());
        assertEquals("14165550100", endpoints.getSrcNumber());
    }

    @Test
    void testSpecialDestinationTakesDidFromChannelStart() {
        CorrelatedGroup group = group(
                cel(LINKED_ID, CelEventType.CHAN_START, T0).chanName("SIP/sbc-ca2-00000001")
                        .exten("s").cidDnid("6478752300").build(),
                cdr(LINKED_ID).src("4165550100").dst("s").dcontext("from-trunk").build());

        assertEquals("16478752300", service.extract(group, CallDirection.INBOUND).getDstNumber());
    }

    @Test
    void testInboundCallerRecoveredFromCelWhenSrcEmpty() {
        CorrelatedGroup group = group(
                cel(LINKED_ID, CelEventType.CHAN_START, T0).chanName("SIP/sbc-ca2-00000001")
                        .cidNum("4165550100").exten("6478752300").build(),
                cdr(LINKED_ID).src("").dst("338").dcontext("from-trunk").dstChannel("SIP/338-acme-00000002").build());

        CallEndpoints endpoints = service.extract(group, CallDirection.INBOUND);

        assertEquals("14165550100", endpoints.getSrcNumber());
        assertEquals("338", endpoints.getDstExtension());
        assertEquals("16478752300", endpoints.getDstNumber());
    }

    @Test
    void testOutboundCallerExtensionRecoveredFromCel() {
        CorrelatedGroup group = group(
                cel(LINKED_ID, CelEventType.CHAN_START, T0).cidNum("338").exten("4165550100").build(),
                cdr(LINKED_ID).src("").dst("4165550100").dcontext("from-internal").build());

        CallEndpoints endpoints = service.extract(group, CallDirection.OUTBOUND);

        assertEquals("338", endpoints.getSrcExtension());
        assertNull(endpoints.getSrcNumber());
        assertEquals("14165550100", endpoints.getDstNumber());
    }

    @Test
    void testCelOnlyInboundUsesDnidForSpecialExten() {
        CorrelatedGroup group = group(cel(LINKED_ID, CelEventType.CHAN_START, T0)
                .chanName("SIP/sbc-ca2-00000001").cidNum("4165550100").exten("s").cidDnid("6478752300").build());

        CallEndpoints endpoints = service.extract(group, CallDirection.INBOUND);

        assertEquals("14165550100", endpoints.getSrcNumber());
        assertEquals("16478752300", endpoints.getDstNumber());
        assertNull(endpoints.getSrcExtension());
    }

    @Test
    void testCelOnlyInboundToExtensionKeepsDid() {
        CorrelatedGroup group = group(cel(LINKED_ID, CelEventType.CHAN_START, T0)
                .chanName("SIP/sbc-ca2-00000001").cidNum("4165550100").exten("338").cidDnid("6478752300").build());

        CallEndpoints endpoints = service.extract(group, CallDirection.INBOUND);

        assertEquals("338", endpoints.getDstExtension());
        assertEquals("16478752300", endpoints.getDstNumber());
    }

    @Test
    void testCelOnlyOutboundFromExtension() {
        CorrelatedGroup group = group(cel(LINKED_ID, CelEventType.CHAN_START, T0)
                .chanName("SIP/338-acme-00000001").cidNum("338").exten("4165550100").build());

        CallEndpoints endpoints = service.extract(group, CallDirection.OUTBOUND);

        assertEquals("338", endpoints.getSrcExtension());
        assertEquals("14165550100", endpoints.getDstNumber());
    }

    @Test
    void testCelOnlyWithoutChannelStartIsEmpty() {
        CorrelatedGroup group = group(cel(LINKED_ID, CelEventType.ANSWER, T0).cidNum("4165550100").build());

        CallEndpoints endpoints = service.extract(group, CallDirection.INBOUND);

        assertNull(endpoints.getSrcNumber());
        assertNull(endpoints.getDstNumber());
    }
}
