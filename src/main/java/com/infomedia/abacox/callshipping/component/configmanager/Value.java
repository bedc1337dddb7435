package com.infomedia.abacox.callshipping.component.configmanager;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Effective value of one setting, as resolved from an override, the environment or the default.
 * Conversions fail with {@link IllegalArgumentException} naming the group and key.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class Value {

    private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "on", "1");

    private final String group;
    private final String key;
    private final String value;

    public String asString() {
        return value;
    }

    public int asInt() {
        return (int) parse("an integer", Integer.MIN_VALUE, Integer.MAX_VALUE);
    }

    public long asLong() {
        return parse("a long", Long.MIN_VALUE, Long.MAX_VALUE);
    }

    /**
     * {@code true}, {@code yes}, {@code on} and {@code 1} in any case. Anything else, blank included, is false.
     */
    public boolean asBoolean() {
        return value != null && TRUE_WORDS.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Comma separated entries, trimmed, blanks dropped.
     */
    public List<String> asStringList() {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(entry -> !entry.isEmpty())
                .toList();
    }

    private long parse(String expected, long min, long max) {
        long parsed;
        try {
            parsed = Long.parseLong(value == null ? "" : value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(describe(expected), e);
        }
        if (parsed < min || parsed > max) {
            throw new IllegalArgumentException(describe(expected));
        }
        return parsed;
    }

    private String describe(String expected) {
        return String.format("Setting %s.%s is '%s', expected %s", group, key, value, expected);
    }
}
