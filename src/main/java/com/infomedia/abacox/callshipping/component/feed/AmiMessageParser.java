package com.infomedia.abacox.callshipping.component.feed;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Parses Asterisk Manager Interface messages ({@code Key: Value} lines ended by a blank line)
 * and maps CEL events onto the CEL column names.
 */
public final class AmiMessageParser {

    private static final Map<String, String> CEL_FIELD_MAPPING = new LinkedHashMap<>();

    static {
        CEL_FIELD_MAPPING.put("EventName", "eventtype");
        CEL_FIELD_MAPPING.put("EventTime", "eventtime");
        CEL_FIELD_MAPPING.put("CallerIDname", "cid_name");
        CEL_FIELD_MAPPING.put("CallerIDnum", "cid_num");
        CEL_FIELD_MAPPING.put("CallerIDani", "cid_ani");
        CEL_FIELD_MAPPING.put("CallerIDrdnis", "cid_rdnis");
        CEL_FIELD_MAPPING.put("CallerIDdnid", "cid_dnid");
        CEL_FIELD_MAPPING.put("Exten", "exten");
        CEL_FIELD_MAPPING.put("Context", "context");
        CEL_FIELD_MAPPING.put("Channel", "channame");
        CEL_FIELD_MAPPING.put("Application", "appname");
        CEL_FIELD_MAPPING.put("AppData", "appdata");
        CEL_FIELD_MAPPING.put("AMAFlags", "amaflags");
        CEL_FIELD_MAPPING.put("AccountCode", "accountcode");
        CEL_FIELD_MAPPING.put("UniqueID", "uniqueid");
        CEL_FIELD_MAPPING.put("LinkedID", "linkedid");
        CEL_FIELD_MAPPING.put("Peer", "peer");
        CEL_FIELD_MAPPING.put("UserDefType", "userdeftype");
        CEL_FIELD_MAPPING.put("Extra", "extra");
    }

    private AmiMessageParser() {
    }

    /**
     * Parses the lines of one message. Header names are matched case-insensitively since their
     * casing differs between Asterisk versions. Lines without a colon are ignored.
     */
    public static Map<String, String> parse(List<String> lines) {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (String line : lines) {
            int colon = line.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            String key = line.substring(0, colon).trim();
            String value = line.substring(colon + 1).trim();
            headers.putIfAbsent(key, value);
        }
        return headers;
    }

    public static boolean isCelEvent(Map<String, String> message) {
        return "CEL".equalsIgnoreCase(message.get("Event"));
    }

    public static boolean isSuccessResponse(Map<String, String> message) {
        return "Success".equalsIgnoreCase(message.get("Response"));
    }

    public static Map<String, String> toCelFields(Map<String, String> message) {
        Map<String, String> fields = new LinkedHashMap<>();
        CEL_FIELD_MAPPING.forEach((header, column) -> {
            String value = message.get(header);
            fields.put(column, value == null ? "" : value);
        });
        return fields;
    }

    public static String loginAction(String username, String secret) {
        return "Action: Login\r\n"
                + "Username: " + username + "\r\n"
                + "Secret: " + secret + "\r\n"
                + "Events: cel\r\n"
                + "\r\n";
    }
}
