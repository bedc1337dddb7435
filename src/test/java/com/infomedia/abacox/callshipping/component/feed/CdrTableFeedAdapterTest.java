package com.infomedia.abacox.callshipping.component.feed;

import com.infomedia.abacox.callshipping.component.EngineFixtures;
import com.infomedia.abacox.callshipping.component.configmanager.ConfigKey;
import com.infomedia.abacox.callshipping.component.engine.EngineConfigService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CdrTableFeedAdapterTest {

    private String url;
    private Connection keepAlive;
    private CdrTableFeedAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        url = "jdbc:h2:mem:pbx-" + UUID.randomUUID();
        keepAlive = DriverManager.getConnection(url, "sa", "");
        try (Statement statement = keepAlive.createStatement()) {
            statement.execute("CREATE TABLE cdr (calldate TIMESTAMP, uniqueid VARCHAR(32), linkedid VARCHAR(32),"
                    + " src VARCHAR(80), dst VARCHAR(80), disposition VARCHAR(45), duration INT, billsec INT)");
            statement.execute("INSERT INTO cdr VALUES ('2024-05-01 12:00:00', '1714564800.2', '1714564800.1',"
                    + " '338', '16475550100', 'ANSWERED', 95, 90)");
            statement.execute("INSERT INTO cdr VALUES ('2024-05-01 12:00:00', '1714564800.1', '1714564800.1',"
                    + " '6475550100', '338', 'ANSWERED', 95, 90)");
            statement.execute("INSERT INTO cdr VALUES ('2024-05-01 12:00:05', '1714564805.3', '1714564805.3',"
                    + " '339', '340', NULL, 4, 0)");
        }
        EngineConfigService config = EngineFixtures.config(Map.of(
                ConfigKey.CDR_SOURCE_URL, url,
                ConfigKey.CDR_SOURCE_USERNAME, "sa"));
        adapter = new CdrTableFeedAdapter(new SourceDbConnector(config), config);
    }

    @AfterEach
    void tearDown() throws Exception {
        keepAlive.close();
    }

    private static List<String> uniqueIds(FeedBatch batch) {
        List<String> ids = new ArrayList<>();
        batch.records().forEach(r -> ids.add(r.get("uniqueid")));
        return ids;
    }

    @Test
    void testReadsRowsInCalldateUniqueIdOrder() throws Exception {
        FeedBatch batch = adapter.fetchSince(FeedCursor.start(), 100);

        assertEquals(List.of("1714564800.1", "1714564800.2", "1714564805.3"), uniqueIds(batch));
        assertEquals(FeedCursor.start(), batch.records().get(0).getCursor());
        assertEquals(CdrTableFeedAdapter.NAME, batch.records().get(0).getFeedName());
        assertEquals("", batch.records().get(2).get("disposition"));
        assertEquals("1714564805.3", batch.nextCursor().getKey());

        assertTrue(adapter.fetchSince(batch.nextCursor(), 100).isEmpty());
    }

    @Test
    void testRecordCursorReplaysThatRecord() throws Exception {
        FeedBatch batch = adapter.fetchSince(FeedCursor.start(), 100);

        FeedBatch replay = adapter.fetchSince(batch.records().get(1).getCursor(), 100);

        assertEquals(List.of("1714564800.2", "1714564805.3"), uniqueIds(replay));
    }

    @Test
    void testPagingNeverSkipsRows() throws Exception {
        List<String> seen = new ArrayList<>();
        FeedCursor cursor = FeedCursor.start();
        for (int i = 0; i < 10; i++) {
            FeedBatch batch = adapter.fetchSince(cursor, 2);
            if (batch.isEmpty()) {
                break;
            }
            seen.addAll(uniqueIds(batch));
            cursor = batch.nextCursor();
        }

        assertEquals(List.of("1714564800.1", "1714564800.2", "1714564805.3"), seen);
    }

    @Test
    void testMaxTimestampAndLinkedIdLookup() throws Exception {
        assertEquals(Timestamp.valueOf("2024-05-01 12:00:05").toInstant(), adapter.maxTimestamp().orElseThrow());
        assertTrue(adapter.linkedIdExists("1714564800.1"));
        assertFalse(adapter.linkedIdExists("1714564899.9"));
    }

    @Test
    void testMissingTableIsFeedException() {
        EngineConfigService config = EngineFixtures.config(Map.of(
                ConfigKey.CDR_SOURCE_URL, url,
                ConfigKey.CDR_SOURCE_USERNAME, "sa",
                ConfigKey.DB_TABLE_CDR, "missing_table"));
        CdrTableFeedAdapter missing = new CdrTableFeedAdapter(new SourceDbConnector(config), config);

        assertThrows(FeedException.class, () -> missing.fetchSince(FeedCursor.start(), 10));
    }
}
