package com.infomedia.abacox.callshipping.component.normalizer;

import lombok.extern.log4j.Log4j2;

import java.util.regex.Pattern;

@Log4j2
public class PhoneNumberUtil {

    // Digits with the usual dialing punctuation, optionally starting with + or a * feature code
    private static final Pattern NUMBER_SHAPED = Pattern.compile("^\\+?[\\d\\s().\\-*#]+$");
    private static final Pattern NON_DIAL_CHARS = Pattern.compile("[^0-9*#]");

    private PhoneNumberUtil() {
    }

    /**
     * Strips formatting characters from a phone-like field. A leading '+' is kept.
     * Values that are not number-shaped ({@code s}, {@code anonymous}, a SIP URI) are returned
     * trimmed and flagged as non-numeric rather than rejected.
     */
    public static CleanPhoneNumberResult cleanPhoneField(String value) {
        if (value == null) {
            return new CleanPhoneNumberResult("", false);
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return new CleanPhoneNumberResult("", false);
        }
        if (!NUMBER_SHAPED.matcher(trimmed).matches()) {
            log.trace("Value '{}' is not number-shaped, keeping as text", trimmed);
            return new CleanPhoneNumberResult(trimmed, false);
        }
        String cleaned = NON_DIAL_CHARS.matcher(trimmed).replaceAll("");
        if (trimmed.startsWith("+")) {
            cleaned = "+" + cleaned;
        }
        boolean hasDigit = cleaned.chars().anyMatch(Character::isDigit);
        return new CleanPhoneNumberResult(cleaned, hasDigit);
    }

    public static String digitsOnly(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c >= '0' && c <= '9') {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    public static boolean isAllDigits(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
