package com.infomedia.abacox.callshipping.component.feed;

import com.infomedia.abacox.callshipping.component.engine.EngineConfigService;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Plain JDBC access to the PBX database holding the CDR and CEL tables.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class SourceDbConnector {

    private static final Pattern TABLE_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_$.]*$");

    private final EngineConfigService engineConfig;

    private volatile String loadedDriver;

    public SourceDbConfig getConfig() {
        return SourceDbConfig.builder()
                .url(engineConfig.getCdrSourceUrl())
                .username(engineConfig.getCdrSourceUsername())
                .password(engineConfig.getCdrSourcePassword())
                .build();
    }

    public Connection open() throws SQLException {
        SourceDbConfig config = getConfig();
        String driver = config.getDriverClassName();
        if (driver != null && !driver.equals(loadedDriver)) {
            log.debug("Loading JDBC driver: {}", driver);
            try {
                Class.forName(driver);
                loadedDriver = driver;
            } catch (ClassNotFoundException e) {
                throw new SQLException("JDBC Driver not found: " + driver, e);
            }
        }
        DriverManager.setLoginTimeout(config.getQueryTimeoutSeconds());
        return DriverManager.getConnection(config.getUrl(), config.getUsername(), config.getPassword());
    }

    public PreparedStatement prepare(Connection connection, String sql) throws SQLException {
        PreparedStatement ps = connection.prepareStatement(sql, ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY);
        ps.setQueryTimeout(getConfig().getQueryTimeoutSeconds());
        return ps;
    }

    /**
     * Reads the current row as text keyed by lower-case column label. SQL nulls become empty strings.
     */
    public static Map<String, String> readRow(ResultSet rs) throws SQLException {
        ResultSetMetaData metaData = rs.getMetaData();
        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 1; i <= metaData.getColumnCount(); i++) {
            String value = rs.getString(i);
            row.put(metaData.getColumnLabel(i).toLowerCase(Locale.ROOT), value == null ? "" : value);
        }
        return row;
    }

    /**
     * Guards table names taken from configuration before they are placed into SQL text.
     */
    public static String checkTableName(String table) {
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + table);
        }
        return table;
    }
}
