package com.infomedia.abacox.callshipping.component.classification;

import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Case-insensitive matching of PBX names (contexts, channels, applications) against configured
 * patterns. A pattern containing '*' is a glob anchored at the start, anything else is an exact match.
 * Compiled globs are cached.
 */
@Component
@Log4j2
public class PatternMatcher {

    private final Map<String, Pattern> compiled = new ConcurrentHashMap<>();

    public boolean matches(String value, String pattern) {
        if (value == null || value.isEmpty() || pattern == null || pattern.isEmpty()) {
            return false;
        }
        String lowerValue = value.toLowerCase(Locale.ROOT);
        String lowerPattern = pattern.toLowerCase(Locale.ROOT).trim();
        if (lowerPattern.indexOf('*') < 0) {
            return lowerValue.equals(lowerPattern);
        }
        return compiled.computeIfAbsent(lowerPattern, PatternMatcher::compileGlob).matcher(lowerValue).matches();
    }

    public boolean matchesAny(String value, List<String> patterns) {
        if (value == null || value.isEmpty() || patterns == null) {
            return false;
        }
        for (String pattern : patterns) {
            if (matches(value, pattern)) {
                return true;
            }
        }
        return false;
    }

    public int cacheSize() {
        return compiled.size();
    }

    private static Pattern compileGlob(String glob) {
        StringBuilder regex = new StringBuilder("^");
        String[] parts = glob.split("\\*", -1);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                regex.append(".*");
            }
            if (!parts[i].isEmpty()) {
                regex.append(Pattern.quote(parts[i]));
            }
        }
        regex.append("$");
        log.trace("Compiled pattern '{}' to {}", glob, regex);
        return Pattern.compile(regex.toString());
    }
}
