package com.infomedia.abacox.callshipping.component.classification.tenant;

import com.infomedia.abacox.callshipping.component.engine.EngineConfigService;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether a token can be a tenant name. Rejects tokens outside 2..20 characters,
 * numeric and hexadecimal identifiers, configured trunk names and dialplan vocabulary.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class TenantValidator {

    public static final int MIN_LENGTH = 2;
    public static final int MAX_LENGTH = 20;

    private static final Pattern TENANT_SHAPE = Pattern.compile("^[a-z][a-z0-9]*$");
    private static final Pattern HEX = Pattern.compile("^[0-9a-f]+$");

    static final Set<String> INFRASTRUCTURE_WORDS = Set.of(
            "sip", "pjsip", "iax", "iax2", "dahdi", "local", "from", "to", "did", "direct", "trunk", "peer",
            "sbc", "ca1", "ca2", "us1", "us2", "closed", "open", "internal", "external", "inside", "outside",
            "ext", "queues", "queue", "ivr", "macro", "dial", "dialout", "outgoing", "incoming", "inbound",
            "outbound", "default", "gw", "gateway", "pstn", "server", "redir", "restricted", "allhours",
            "extensions", "app", "vm", "park", "xfer", "noxfer", "ringing", "group", "followme", "exten",
            "anonymous", "unknown", "none", "null");

    private final EngineConfigService engineConfig;

    /**
     * Normalized token if acceptable as a tenant, otherwise null.
     */
    public String validate(String candidate) {
        if (candidate == null) {
            return null;
        }
        String token = candidate.trim().toLowerCase(Locale.ROOT);
        if (token.length() < MIN_LENGTH || token.length() > MAX_LENGTH) {
            return null;
        }
        if (!TENANT_SHAPE.matcher(token).matches()) {
            return null;
        }
        // Channel unique ids: hex with at least one digit
        if (HEX.matcher(token).matches() && token.chars().anyMatch(Character::isDigit)) {
            return null;
        }
        if (isDenied(token)) {
            log.trace("Rejected deny-listed tenant candidate '{}'", token);
            return null;
        }
        return token;
    }

    public boolean isDenied(String token) {
        String lower = token.toLowerCase(Locale.ROOT);
        if (INFRASTRUCTURE_WORDS.contains(lower)) {
            return true;
        }
        for (String trunk : engineConfig.getKnownTrunks()) {
            if (trunk.equalsIgnoreCase(lower)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Configured trunk names, longest first, so multi-token names are removed before their parts.
     */
    public List<String> getDeniedPhrases() {
        List<String> phrases = new ArrayList<>();
        for (String trunk : engineConfig.getKnownTrunks()) {
            if (!trunk.isBlank()) {
                phrases.add(trunk.trim().toLowerCase(Locale.ROOT));
            }
        }
        phrases.sort(Comparator.comparingInt(String::length).reversed());
        return phrases;
    }
}
