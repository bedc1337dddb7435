package com.infomedia.abacox.callshipping.component.feed;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AmiMessageParserTest {

    @Test
    void testParseCelEvent() {
        Map<String, String> message = AmiMessageParser.parse(List.of(
                "Event: CEL",
                "Privilege: call,all",
                "EventName: CHAN_START",
                "EventTime: 2024-05-01 12:00:00.123456",
                "Channel: SIP/338-00000001",
                "AppData: Dial(SIP/sbc-ca2/16475550100,60)",
                "UniqueID: 1714564800.1",
                "LinkedID: 1714564800.1",
                "garbage without separator"));

        assertTrue(AmiMessageParser.isCelEvent(message));
        assertFalse(AmiMessageParser.isSuccessResponse(message));
        assertEquals("1714564800.1", message.get("linkedid"));
        assertEquals("Dial(SIP/sbc-ca2/16475550100,60)", message.get("AppData"));
    }

    @Test
    void testFirstHeaderWins() {
        Map<String, String> message = AmiMessageParser.parse(List.of("Response: Success", "response: Error"));

        assertTrue(AmiMessageParser.isSuccessResponse(message));
    }

    @Test
    void testCelFieldsUseColumnNames() {
        Map<String, String> message = AmiMessageParser.parse(List.of(
                "Event: CEL",
                "EventName: LINKEDID_END",
                "CallerIDnum: 6475550100",
                "Channel: SIP/sbc-ca2-00000002",
                "LinkedID: 1714564800.1"));

        Map<String, String> fields = AmiMessageParser.toCelFields(message);

        assertEquals("LINKEDID_END", fields.get("eventtype"));
        assertEquals("6475550100", fields.get("cid_num"));
        assertEquals("SIP/sbc-ca2-00000002", fields.get("channame"));
        assertEquals("1714564800.1", fields.get("linkedid"));
        assertEquals("", fields.get("extra"));
        assertEquals(CelCsvFeedAdapter.COLUMNS.size(), fields.size());
    }

    @Test
    void testLoginAction() {
        assertEquals("Action: Login\r\nUsername: shipper\r\nSecret: s3cret\r\nEvents: cel\r\n\r\n",
                AmiMessageParser.loginAction("shipper", "s3cret"));
    }
}
