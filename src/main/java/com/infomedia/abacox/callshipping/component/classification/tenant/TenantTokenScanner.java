package com.infomedia.abacox.callshipping.component.classification.tenant;

import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Scans a delimited PBX field for a tenant token. Deny-listed trunk names are removed from the
 * field before it is split, then the remaining tokens are scanned right to left and the first
 * valid one is taken.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class TenantTokenScanner {

    private static final Pattern DELIMITERS = Pattern.compile("[-_/@,]");

    private final TenantValidator validator;

    public Optional<String> scan(String field) {
        if (field == null || field.isBlank()) {
            return Optional.empty();
        }
        List<String> tokens = tokenize(field);
        for (int i = tokens.size() - 1; i >= 0; i--) {
            String tenant = validator.validate(tokens.get(i));
            if (tenant != null) {
                return Optional.of(tenant);
            }
        }
        return Optional.empty();
    }

    /**
     * Tokens of the field with deny-listed phrases already removed, left to right.
     */
    List<String> tokenize(String field) {
        String remaining = field.toLowerCase(Locale.ROOT);
        for (String phrase : validator.getDeniedPhrases()) {
            remaining = removePhrase(remaining, phrase);
        }
        List<String> tokens = new ArrayList<>();
        for (String token : DELIMITERS.split(remaining)) {
            if (!token.isEmpty() && !validator.isDenied(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    // Removes whole-token occurrences only: "acme" must not be cut out of "acmecorp"
    private static String removePhrase(String value, String phrase) {
        StringBuilder out = new StringBuilder(value.length());
        int from = 0;
        int index;
        while ((index = value.indexOf(phrase, from)) >= 0) {
            int end = index + phrase.length();
            boolean startsToken = index == 0 || DELIMITERS.matcher(String.valueOf(value.charAt(index - 1))).matches();
            boolean endsToken = end == value.length() || DELIMITERS.matcher(String.valueOf(value.charAt(end))).matches();
            out.append(value, from, index);
            if (startsToken && endsToken) {
                out.append('/');
            } else {
                out.append(phrase);
            }
            from = end;
        }
        out.append(value.substring(from));
        return out.toString();
    }
}
