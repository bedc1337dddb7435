package com.infomedia.abacox.callshipping.component.aggregation;

import java.util.regex.Pattern;

public class CallerIdUtil {

    static final int LONG_NAME_LENGTH = 30;

    private static final Pattern NUMBER_ONLY = Pattern.compile("^\\+?[\\d\\s\\-().]+$");

    private CallerIdUtil() {
    }

    /**
     * Removes a tenant routing prefix from an inbound caller id name. Names such as
     * {@code 338-CFLAW-Jane Doe} or long dash-delimited names keep only their last segment.
     * A name that is only a phone number is cleared.
     *
     * @return the cleaned name, or null when nothing usable remains
     */
    public static String cleanCallerName(String name) {
        if (name == null) {
            return null;
        }
        String trimmed = name.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        int firstDash = trimmed.indexOf('-');
        if (firstDash > 0) {
            String firstSegment = trimmed.substring(0, firstDash).trim();
            if (isAllDigits(firstSegment) || trimmed.length() > LONG_NAME_LENGTH) {
                trimmed = trimmed.substring(trimmed.lastIndexOf('-') + 1).trim();
            }
        }
        if (trimmed.isEmpty() || NUMBER_ONLY.matcher(trimmed).matches()) {
            return null;
        }
        return trimmed;
    }

    private static boolean isAllDigits(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
