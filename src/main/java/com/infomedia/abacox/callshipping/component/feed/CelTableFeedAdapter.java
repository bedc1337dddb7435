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
 * CEL table feed. Rows are read in {@code id} order; a fresh start without an id begins after a timestamp.
 */
@Component
public class CelTableFeedAdapter extends AbstractTableFeedAdapter implements CelFeedAdapter {

    public static final String NAME = "cel-db";

    private final EngineConfigService engineConfig;

    public CelTableFeedAdapter(SourceDbConnector connector, EngineConfigService engineConfig) {
        super(connector);
        this.engineConfig = engineConfig;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RecordType recordType() {
        return RecordType.CEL;
    }

    @Override
    public CelMode celMode() {
        return CelMode.DB;
    }

    @Override
    protected String table() {
        return engineConfig.getCelTable();
    }

    @Override
    protected String timestampColumn() {
        return "eventtime";
    }

    @Override
    protected PreparedStatement prepareFetch(Connection connection, FeedCursor cursor, int limit) throws SQLException {
        String table = SourceDbConnector.checkTableName(table());
        PreparedStatement ps;
        if (cursor.getPosition() > 0) {
            ps = connector.prepare(connection, "SELECT * FROM " + table + " WHERE id > ? ORDER BY id LIMIT ?");
            ps.setLong(1, cursor.getPosition());
            ps.setInt(2, limit);
        } else if (cursor.getTimestamp() != null) {
            ps = connector.prepare(connection, "SELECT * FROM " + table + " WHERE eventtime > ? ORDER BY id LIMIT ?");
            ps.setTimestamp(1, timestampOf(cursor.getTimestamp()));
            ps.setInt(2, limit);
        } else {
            ps = connector.prepare(connection, "SELECT * FROM " + table + " ORDER BY id LIMIT ?");
            ps.setInt(1, limit);
        }
        return ps;
    }

    @Override
    protected boolean hasUniqueCursor() {
        return true;
    }

    @Override
    protected FeedCursor cursorOf(ResultSet rs, Map<String, String> row) throws SQLException {
        return FeedCursor.of(instantOf(rs, "eventtime"), rs.getLong("id"), null);
    }
}
