package com.infomedia.abacox.callshipping.component.feed;

import com.infomedia.abacox.callshipping.component.engine.EngineConfigService;
import com.infomedia.abacox.callshipping.component.normalizer.RecordType;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Map;

/**
 * CDR table feed. Rows are read in {@code (calldate, uniqueid)} order.
 */
@Component
public class CdrTableFeedAdapter extends AbstractTableFeedAdapter {

    public static final String NAME = "cdr";

    private final EngineConfigService engineConfig;

    public CdrTableFeedAdapter(SourceDbConnector connector, EngineConfigService engineConfig) {
        super(connector);
        this.engineConfig = engineConfig;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RecordType recordType() {
        return RecordType.CDR;
    }

    @Override
    protected String table() {
        return engineConfig.getCdrTable();
    }

    @Override
    protected String timestampColumn() {
        return "calldate";
    }

    @Override
    protected PreparedStatement prepareFetch(Connection connection, FeedCursor cursor, int limit) throws SQLException {
        String table = SourceDbConnector.checkTableName(table());
        PreparedStatement ps;
        if (cursor.getTimestamp() == null) {
            ps = connector.prepare(connection,
                    "SELECT * FROM " + table + " ORDER BY calldate, uniqueid LIMIT ?");
            ps.setInt(1, limit);
        } else if (cursor.getKey() == null) {
            ps = connector.prepare(connection,
                    "SELECT * FROM " + table + " WHERE calldate > ? ORDER BY calldate, uniqueid LIMIT ?");
            ps.setTimestamp(1, timestampOf(cursor.getTimestamp()));
            ps.setInt(2, limit);
        } else {
            ps = connector.prepare(connection,
                    "SELECT * FROM " + table + " WHERE calldate > ? OR (calldate = ? AND uniqueid > ?)"
                            + " ORDER BY calldate, uniqueid LIMIT ?");
            ps.setTimestamp(1, timestampOf(cursor.getTimestamp()));
            ps.setTimestamp(2, timestampOf(cursor.getTimestamp()));
            ps.setString(3, cursor.getKey());
            ps.setInt(4, limit);
        }
        return ps;
    }

    @Override
    protected FeedCursor cursorOf(ResultSet rs, Map<String, String> row) {
        return FeedCursor.of(instantOf(rs, "calldate"), 0L, row.get("uniqueid"));
    }
}
