package com.infomedia.abacox.callshipping.component.classification;

import com.infomedia.abacox.callshipping.component.engine.EngineConfigService;
import com.infomedia.abacox.callshipping.component.normalizer.PhoneNumberUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Shape checks for the numeric fields of a call: extension, external number, E.164,
 * anonymous and special destinations.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class NumberAnalyzer {

    public static final int MIN_EXTERNAL_NUMBER_DIGITS = 10;

    private static final Pattern E164 = Pattern.compile("^\\+\\d{10,15}$");
    private static final Pattern FEATURE_CODE = Pattern.compile("^\\*\\d{1,6}$");
    private static final Set<String> ANONYMOUS_VALUES = Set.of("anonymous", "private", "restricted", "unavailable", "unknown");
    private static final Set<String> SPECIAL_DESTINATIONS = Set.of("s", "i", "t", "h");
    private static final List<String> DIAL_PREFIXES = List.of("*67", "*82");

    private final EngineConfigService engineConfig;

    public boolean isExtension(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        String cleaned = PhoneNumberUtil.cleanPhoneField(value).getCleanedNumber();
        if (FEATURE_CODE.matcher(cleaned).matches()) {
            return true;
        }
        if (!PhoneNumberUtil.isAllDigits(cleaned)) {
            return false;
        }
        return cleaned.length() >= engineConfig.getMinExtensionLength()
                && cleaned.length() <= engineConfig.getMaxExtensionLength();
    }

    public boolean isInternational(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        String cleaned = PhoneNumberUtil.cleanPhoneField(value).getCleanedNumber();
        if (E164.matcher(cleaned).matches()) {
            return true;
        }
        for (String prefix : engineConfig.getInternationalPrefixes()) {
            if ("+".equals(prefix)) {
                continue;
            }
            if (cleaned.startsWith(prefix) && PhoneNumberUtil.isAllDigits(cleaned)
                    && cleaned.length() - prefix.length() >= 7) {
                return true;
            }
        }
        return false;
    }

    /**
     * An external party number: at least ten digits once dial prefixes are removed, or international.
     */
    public boolean isPhoneNumber(String value) {
        return normalizeNumber(value) != null || isInternational(value);
    }

    public boolean isAnonymous(String value) {
        return value != null && ANONYMOUS_VALUES.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    public boolean isSpecialDestination(String value) {
        return value != null && SPECIAL_DESTINATIONS.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Normalizes an external number: removes the {@code *67}/{@code *82} and outside-line {@code 9}
     * prefixes and formatting, and adds the NANP country code to ten-digit numbers.
     *
     * @return the digits, or null when the value is not number-shaped or too short
     */
    public String normalizeNumber(String value) {
        if (value == null || value.isBlank() || isSpecialDestination(value) || isAnonymous(value)) {
            return null;
        }
        String current = value.trim();
        for (String prefix : DIAL_PREFIXES) {
            if (current.startsWith(prefix)) {
                current = current.substring(prefix.length());
            }
        }
        if (!PhoneNumberUtil.cleanPhoneField(current).isNumeric()) {
            return null;
        }
        String digits = PhoneNumberUtil.digitsOnly(current);
        if (digits.startsWith("9") && digits.length() >= MIN_EXTERNAL_NUMBER_DIGITS + 1 && !current.startsWith("+")) {
            String withoutOutsideLine = digits.substring(1);
            if (withoutOutsideLine.length() == 10 || withoutOutsideLine.startsWith("1")) {
                digits = withoutOutsideLine;
            }
        }
        if (digits.length() == 10) {
            digits = "1" + digits;
        }
        return digits.length() >= MIN_EXTERNAL_NUMBER_DIGITS ? digits : null;
    }

    /**
     * Extension embedded in a device channel name, e.g. {@code SIP/338-acme-0000001a} gives {@code 338}.
     */
    public String extensionFromChannel(String channel) {
        if (channel == null) {
            return null;
        }
        int slash = channel.indexOf('/');
        if (slash < 0 || slash == channel.length() - 1) {
            return null;
        }
        String technology = channel.substring(0, slash).toLowerCase(Locale.ROOT);
        if (!technology.equals("sip") && !technology.equals("pjsip") && !technology.equals("iax2")) {
            return null;
        }
        String info = channel.substring(slash + 1);
        int dash = info.indexOf('-');
        String candidate = dash >= 0 ? info.substring(0, dash) : info;
        if (PhoneNumberUtil.isAllDigits(candidate) && candidate.length() <= Math.max(6, engineConfig.getMaxExtensionLength())) {
            return candidate;
        }
        return null;
    }
}
