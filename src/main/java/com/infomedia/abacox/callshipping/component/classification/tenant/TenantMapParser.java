package com.infomedia.abacox.callshipping.component.classification.tenant;

import lombok.extern.log4j.Log4j2;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Log4j2
public class TenantMapParser {

    private TenantMapParser() {
    }

    /**
     * Parses {@code key:tenant} entries. Malformed entries are skipped.
     */
    public static Map<String, String> parse(List<String> entries) {
        Map<String, String> map = new LinkedHashMap<>();
        for (String entry : entries) {
            int separator = entry.indexOf(':');
            if (separator <= 0 || separator == entry.length() - 1) {
                log.warn("Ignoring malformed tenant map entry '{}'", entry);
                continue;
            }
            String key = entry.substring(0, separator).trim();
            String tenant = entry.substring(separator + 1).trim().toLowerCase(Locale.ROOT);
            if (!key.isEmpty() && !tenant.isEmpty()) {
                map.put(key, tenant);
            }
        }
        return map;
    }
}
