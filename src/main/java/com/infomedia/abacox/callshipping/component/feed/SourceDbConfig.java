package com.infomedia.abacox.callshipping.component.feed;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Locale;

/**
 * Connection settings of the PBX database. The driver follows the URL scheme.
 */
@Getter
@Builder
@ToString(exclude = "password")
public class SourceDbConfig {

    private final String url; // e.g. jdbc:mysql://localhost:3306/asteriskcdrdb
    private final String username;
    private final String password;
    @Builder.Default
    private final int queryTimeoutSeconds = 30;

    /**
     * @return the driver to register, or null to leave the choice to {@link java.sql.DriverManager}
     */
    public String getDriverClassName() {
        String scheme = url == null ? "" : url.toLowerCase(Locale.ROOT);
        if (scheme.startsWith("jdbc:mysql:")) {
            return "com.mysql.cj.jdbc.Driver";
        }
        if (scheme.startsWith("jdbc:h2:")) {
            return "org.h2.Driver";
        }
        return null;
    }
}
