package com.infomedia.abacox.callshipping.component.classification;

import com.infomedia.abacox.callshipping.component.correlation.CorrelatedGroup;
import com.infomedia.abacox.callshipping.component.engine.EngineConfigService;
import com.infomedia.abacox.callshipping.component.normalizer.CdrRecord;
import com.infomedia.abacox.callshipping.component.normalizer.CelEventType;
import com.infomedia.abacox.callshipping.component.normalizer.CelRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Decides the direction of a call from its CDR legs, falling back to the CEL channel start
 * for CEL-only groups. Rules are evaluated in priority order and the first match wins:
 * internal destination context, trunk channel, local channel, then number shapes.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class CallDirectionService {

    private final EngineConfigService engineConfig;
    private final PatternMatcher patternMatcher;
    private final NumberAnalyzer numberAnalyzer;

    /**
     * The fields of one leg the rules look at.
     */
    public record Leg(String channel, String dstChannel, String context, String dcontext, String src, String dst) {

        static Leg of(CdrRecord cdr) {
            return new Leg(cdr.getChannel(), cdr.getDstChannel(), cdr.getContext(), cdr.getDcontext(), cdr.getSrc(), cdr.getDst());
        }

        static Leg of(CelRecord cel) {
            return new Leg(cel.getChanName(), "", cel.getContext(), cel.getContext(), cel.getCidNum(), cel.getExten());
        }
    }

    /**
     * Direction of the group. A direction already established for the call is kept; only an
     * UNKNOWN one is evaluated again.
     */
    public CallDirection classify(CorrelatedGroup group, CallDirection established) {
        if (established != null && established != CallDirection.UNKNOWN) {
            return established;
        }
        List<CdrRecord> cdrs = group.getCdrs();
        // Parking, transfer and anonymous legs only decide when no regular leg does
        for (CdrRecord cdr : cdrs) {
            if (isAuxiliaryLeg(cdr)) {
                continue;
            }
            CallDirection direction = classifyLeg(Leg.of(cdr));
            if (direction != CallDirection.UNKNOWN) {
                return direction;
            }
        }
        for (CdrRecord cdr : cdrs) {
            if (isAuxiliaryLeg(cdr)) {
                CallDirection direction = classifyLeg(Leg.of(cdr));
                if (direction != CallDirection.UNKNOWN) {
                    return direction;
                }
            }
        }
        for (CelRecord cel : group.getCels()) {
            if (cel.getEventType() == CelEventType.CHAN_START) {
                CallDirection direction = classifyLeg(Leg.of(cel));
                if (direction != CallDirection.UNKNOWN) {
                    return direction;
                }
            }
        }
        log.debug("Direction of call {} could not be determined", group.getLinkedId());
        return CallDirection.UNKNOWN;
    }

    public CallDirection classifyLeg(Leg leg) {
        String channel = nullToEmpty(leg.channel());
        String dstChannel = nullToEmpty(leg.dstChannel());
        String dcontext = nullToEmpty(leg.dcontext());
        String context = leg.context() == null || leg.context().isEmpty() ? dcontext : leg.context();

        // 1. Internal destination context wins over any channel naming
        if (patternMatcher.matchesAny(dcontext, engineConfig.getInternalContexts())) {
            boolean internalParties = isInternalChannel(channel) && isInternalDestination(dstChannel, leg.dst());
            log.trace("Rule 1 matched dcontext={} channel={} internalParties={}", dcontext, channel, internalParties);
            return internalParties ? CallDirection.INTERNAL : CallDirection.OUTBOUND;
        }

        // 2. Trunk channel
        if (isTrunkChannel(channel)) {
            boolean external = patternMatcher.matchesAny(context, engineConfig.getExternalContexts())
                    || patternMatcher.matchesAny(dcontext, engineConfig.getExternalContexts());
            log.trace("Rule 2 matched channel={} externalContext={}", channel, external);
            return external ? CallDirection.INBOUND : CallDirection.OUTBOUND;
        }

        // 3. Local channel
        if (channel.toLowerCase(Locale.ROOT).startsWith("local/")) {
            return CallDirection.INTERNAL;
        }

        // 4. Fallbacks: route contexts, device to trunk, then number shapes
        if (patternMatcher.matchesAny(dcontext, engineConfig.getOutboundContexts())) {
            return CallDirection.OUTBOUND;
        }
        if (patternMatcher.matchesAny(dcontext, engineConfig.getExternalContexts())) {
            return CallDirection.INBOUND;
        }
        if (isInternalChannel(channel) && isTrunkChannel(dstChannel)) {
            return CallDirection.OUTBOUND;
        }
        return classifyByNumbers(leg.src(), leg.dst());
    }

    CallDirection classifyByNumbers(String src, String dst) {
        boolean srcExtension = numberAnalyzer.isExtension(src);
        boolean dstExtension = numberAnalyzer.isExtension(dst);
        boolean srcExternal = !srcExtension && numberAnalyzer.isPhoneNumber(src);
        boolean dstExternal = !dstExtension && numberAnalyzer.isPhoneNumber(dst);

        if (srcExternal && dstExtension) {
            return CallDirection.INBOUND;
        }
        if (srcExtension && dstExternal) {
            return CallDirection.OUTBOUND;
        }
        if (srcExtension && dstExtension) {
            return CallDirection.INTERNAL;
        }
        return CallDirection.UNKNOWN;
    }

    public boolean isTrunkChannel(String channel) {
        if (channel == null || channel.isEmpty()) {
            return false;
        }
        if (patternMatcher.matchesAny(channel, engineConfig.getTrunkChannelPatterns())) {
            return true;
        }
        // SIP/<peer>-<id>: a configured trunk peer name
        List<String> knownTrunks = engineConfig.getKnownTrunks();
        if (knownTrunks.isEmpty()) {
            return false;
        }
        int slash = channel.indexOf('/');
        if (slash < 0) {
            return false;
        }
        String peer = channel.substring(slash + 1);
        int lastDash = peer.lastIndexOf('-');
        if (lastDash > 0) {
            peer = peer.substring(0, lastDash);
        }
        for (String trunk : knownTrunks) {
            if (trunk.equalsIgnoreCase(peer)) {
                return true;
            }
        }
        return false;
    }

    public boolean isInternalChannel(String channel) {
        if (channel == null || channel.isEmpty() || isTrunkChannel(channel)) {
            return false;
        }
        return channel.toLowerCase(Locale.ROOT).startsWith("local/") || numberAnalyzer.extensionFromChannel(channel) != null;
    }

    private boolean isInternalDestination(String dstChannel, String dst) {
        if (dstChannel != null && !dstChannel.isEmpty()) {
            return isInternalChannel(dstChannel);
        }
        return numberAnalyzer.isExtension(dst);
    }

    private boolean isAuxiliaryLeg(CdrRecord cdr) {
        String lastApp = nullToEmpty(cdr.getLastApp()).toLowerCase(Locale.ROOT);
        return lastApp.startsWith("park") || CallFeatureDetector.isTransferApp(lastApp)
                || nullToEmpty(cdr.getChannel()).toLowerCase(Locale.ROOT).contains("masq")
                || numberAnalyzer.isAnonymous(cdr.getSrc());
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
