package com.infomedia.abacox.callshipping.component.feed;

import lombok.extern.log4j.Log4j2;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Polls a PBX table through {@link SourceDbConnector}. Each record carries the cursor of the row before
 * it, so fetching from a record's cursor returns that record again.
 */
@Log4j2
public abstract class AbstractTableFeedAdapter implements FeedAdapter {

    protected final SourceDbConnector connector;

    protected AbstractTableFeedAdapter(SourceDbConnector connector) {
        this.connector = connector;
    }

    protected abstract String table();

    protected abstract String timestampColumn();

    /**
     * Binds the query returning the rows after {@code cursor}, in cursor order.
     */
    protected abstract PreparedStatement prepareFetch(Connection connection, FeedCursor cursor, int limit) throws SQLException;

    protected abstract FeedCursor cursorOf(ResultSet rs, Map<String, String> row) throws SQLException;

    /**
     * Whether every row has its own cursor value. When not, rows sharing a cursor may span pages.
     */
    protected boolean hasUniqueCursor() {
        return false;
    }

    @Override
    public FeedBatch fetchSince(FeedCursor cursor, int limit) throws FeedException {
        List<RawRecord> records = new ArrayList<>();
        List<FeedCursor> rowCursors = new ArrayList<>();
        FeedCursor previous = cursor;
        try (Connection connection = connector.open();
             PreparedStatement ps = prepareFetch(connection, cursor, limit);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                Map<String, String> row = SourceDbConnector.readRow(rs);
                FeedCursor rowCursor = cursorOf(rs, row);
                records.add(RawRecord.builder()
                        .type(recordType())
                        .feedName(name())
                        .fields(row)
                        .cursor(previous)
                        .build());
                rowCursors.add(rowCursor);
                previous = rowCursor;
            }
        } catch (SQLException e) {
            throw new FeedException("Failed to read " + table() + " since " + cursor + ": " + e.getMessage(), e);
        }
        if (records.isEmpty()) {
            return FeedBatch.empty(cursor);
        }
        int keep = records.size();
        if (records.size() >= limit && !hasUniqueCursor()) {
            keep = completeKeyCount(rowCursors);
        }
        if (keep < records.size()) {
            log.trace("Holding back {} rows sharing the last cursor key of {}", records.size() - keep, table());
        }
        return new FeedBatch(List.copyOf(records.subList(0, keep)), rowCursors.get(keep - 1));
    }

    /**
     * Rows sharing the cursor of the last row may continue in the next page. They are held back unless
     * they fill the whole page.
     */
    static int completeKeyCount(List<FeedCursor> rowCursors) {
        FeedCursor last = rowCursors.get(rowCursors.size() - 1);
        int keep = rowCursors.size();
        while (keep > 0 && rowCursors.get(keep - 1).equals(last)) {
            keep--;
        }
        return keep == 0 ? rowCursors.size() : keep;
    }

    @Override
    public Optional<Instant> maxTimestamp() throws FeedException {
        String sql = "SELECT MAX(" + timestampColumn() + ") AS max_ts FROM " + SourceDbConnector.checkTableName(table());
        try (Connection connection = connector.open();
             PreparedStatement ps = connector.prepare(connection, sql);
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? Optional.ofNullable(instantOf(rs, "max_ts")) : Optional.empty();
        } catch (SQLException e) {
            throw new FeedException("Failed to read the latest " + timestampColumn() + " of " + table(), e);
        }
    }

    @Override
    public boolean linkedIdExists(String linkedId) throws FeedException {
        String sql = "SELECT 1 FROM " + SourceDbConnector.checkTableName(table()) + " WHERE linkedid = ? LIMIT 1";
        try (Connection connection = connector.open();
             PreparedStatement ps = connector.prepare(connection, sql)) {
            ps.setString(1, linkedId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new FeedException("Failed to look up linkedid " + linkedId + " in " + table(), e);
        }
    }

    protected static Instant instantOf(ResultSet rs, String column) {
        try {
            Timestamp ts = rs.getTimestamp(column);
            return ts == null ? null : ts.toInstant();
        } catch (SQLException e) {
            // Zero dates and similar garbage
            log.debug("Unreadable {} value: {}", column, e.getMessage());
            return null;
        }
    }

    protected static Timestamp timestampOf(Instant instant) {
        return Timestamp.from(instant);
    }

    @Override
    public String toString() {
        return name() + "(" + table() + ")";
    }
}
