package com.infomedia.abacox.callshipping.component.classification;

import com.infomedia.abacox.callshipping.component.correlation.CorrelatedGroup;
import com.infomedia.abacox.callshipping.component.normalizer.CdrRecord;
import com.infomedia.abacox.callshipping.component.normalizer.CelEventType;
import com.infomedia.abacox.callshipping.component.normalizer.CelRecord;
import com.infomedia.abacox.callshipping.component.normalizer.Disposition;
import com.infomedia.abacox.callshipping.component.normalizer.PhoneNumberUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Extracts caller and callee numbers and extensions of a call. The answered leg is preferred
 * for ring groups. For inbound calls the dialed DID is recovered from the destination context
 * or the CEL channel start when the CDR destination is an extension or a special destination.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class NumberExtractionService {

    private final NumberAnalyzer numberAnalyzer;

    public CallEndpoints extract(CorrelatedGroup group, CallDirection direction) {
        List<CdrRecord> cdrs = group.getCdrs();
        if (cdrs.isEmpty()) {
            return extractFromCels(group.getCels(), direction);
        }
        CdrRecord working = cdrs.get(0);
        for (CdrRecord cdr : cdrs) {
            if (cdr.getDisposition() == Disposition.ANSWERED) {
                working = cdr;
                break;
            }
        }

        CallEndpoints endpoints = new CallEndpoints();
        endpoints.setSrcExtension(numberAnalyzer.extensionFromChannel(working.getChannel()));
        endpoints.setDstExtension(numberAnalyzer.extensionFromChannel(working.getDstChannel()));

        String src = working.getSrc();
        String dst = working.getDst();
        String srcDigits = PhoneNumberUtil.digitsOnly(src);
        String dstDigits = PhoneNumberUtil.digitsOnly(dst);

        switch (direction) {
            case INBOUND -> {
                if (srcDigits.length() >= NumberAnalyzer.MIN_EXTERNAL_NUMBER_DIGITS) {
                    endpoints.setSrcNumber(numberAnalyzer.normalizeNumber(src));
                } else if (!srcDigits.isEmpty() && endpoints.getSrcExtension() == null) {
                    endpoints.setSrcExtension(srcDigits);
                }
                String did = extractDidFromContext(working.getDcontext());
                if (did == null) {
                    did = extractDidFromContext(working.getContext());
                }
                if (did != null) {
                    endpoints.setDstNumber(did);
                } else if (numberAnalyzer.isSpecialDestination(dst)) {
                    endpoints.setDstNumber(didFromChannelStart(group.getCels()));
                } else if (dstDigits.length() >= NumberAnalyzer.MIN_EXTERNAL_NUMBER_DIGITS) {
                    endpoints.setDstNumber(numberAnalyzer.normalizeNumber(dst));
                } else if (!dstDigits.isEmpty()) {
                    if (endpoints.getDstExtension() == null) {
                        endpoints.setDstExtension(dstDigits);
                    }
                    endpoints.setDstNumber(didFromChannelStart(group.getCels()));
                }
            }
            case OUTBOUND -> {
                if (srcDigits.length() >= NumberAnalyzer.MIN_EXTERNAL_NUMBER_DIGITS) {
                    endpoints.setSrcNumber(numberAnalyzer.normalizeNumber(src));
                } else if (!srcDigits.isEmpty() && endpoints.getSrcExtension() == null) {
                    endpoints.setSrcExtension(srcDigits);
                }
                if (dstDigits.length() >= NumberAnalyzer.MIN_EXTERNAL_NUMBER_DIGITS || numberAnalyzer.isInternational(dst)) {
                    endpoints.setDstNumber(numberAnalyzer.normalizeNumber(dst));
                }
            }
            case INTERNAL -> {
                if (endpoints.getSrcExtension() == null && numberAnalyzer.isExtension(src)) {
                    endpoints.setSrcExtension(src);
                }
                if (endpoints.getDstExtension() == null && dst != null
                        && (dst.startsWith("*") || numberAnalyzer.isExtension(dst))) {
                    endpoints.setDstExtension(dst);
                }
            }
            default -> {
                if (numberAnalyzer.isExtension(src)) {
                    endpoints.setSrcExtension(src);
                } else {
                    endpoints.setSrcNumber(numberAnalyzer.normalizeNumber(src));
                }
                if (numberAnalyzer.isExtension(dst)) {
                    endpoints.setDstExtension(dst);
                } else {
                    endpoints.setDstNumber(numberAnalyzer.normalizeNumber(dst));
                }
            }
        }

        if (srcDigits.isEmpty()) {
            recoverCaller(endpoints, group.getCels(), direction);
        }
        return endpoints;
    }

    /**
     * DID embedded in a dialplan context, e.g. {@code 338-6478752300-338-CFLAW-gconnect}
     * or {@code from-did-direct,6478752300}.
     */
    public String extractDidFromContext(String context) {
        if (context == null || context.isEmpty()) {
            return null;
        }
        for (String part : context.split("-")) {
            if (PhoneNumberUtil.isAllDigits(part) && part.length() >= 10 && part.length() <= 11) {
                return numberAnalyzer.normalizeNumber(part);
            }
        }
        if (context.indexOf(',') >= 0) {
            for (String part : context.split(",")) {
                String trimmed = part.trim();
                if (PhoneNumberUtil.isAllDigits(trimmed) && trimmed.length() >= 10) {
                    return numberAnalyzer.normalizeNumber(trimmed);
                }
            }
        }
        return null;
    }

    private CallEndpoints extractFromCels(List<CelRecord> cels, CallDirection direction) {
        CallEndpoints endpoints = new CallEndpoints();
        CelRecord start = null;
        for (CelRecord cel : cels) {
            if (cel.getEventType() == CelEventType.CHAN_START) {
                start = cel;
                break;
            }
        }
        if (start == null) {
            return endpoints;
        }
        String caller = start.getCidNum();
        if (numberAnalyzer.isExtension(caller) && direction != CallDirection.INBOUND) {
            endpoints.setSrcExtension(caller);
        } else {
            endpoints.setSrcNumber(numberAnalyzer.normalizeNumber(caller));
        }
        if (endpoints.getSrcExtension() == null && direction != CallDirection.INBOUND) {
            endpoints.setSrcExtension(numberAnalyzer.extensionFromChannel(start.getChanName()));
        }
        String dialed = start.getExten();
        if (numberAnalyzer.isSpecialDestination(dialed) || dialed == null || dialed.isEmpty()) {
            dialed = start.getCidDnid();
        }
        if (numberAnalyzer.isExtension(dialed)) {
            endpoints.setDstExtension(dialed);
            if (direction == CallDirection.INBOUND) {
                endpoints.setDstNumber(didFromChannelStart(cels));
            }
        } else {
            endpoints.setDstNumber(numberAnalyzer.normalizeNumber(dialed));
        }
        return endpoints;
    }

    private String didFromChannelStart(List<CelRecord> cels) {
        for (CelRecord cel : cels) {
            if (cel.getEventType() != CelEventType.CHAN_START) {
                continue;
            }
            for (String candidate : new String[]{cel.getExten(), cel.getCidDnid()}) {
                if (PhoneNumberUtil.isAllDigits(candidate) && candidate.length() >= NumberAnalyzer.MIN_EXTERNAL_NUMBER_DIGITS) {
                    return numberAnalyzer.normalizeNumber(candidate);
                }
            }
        }
        return null;
    }

    private void recoverCaller(CallEndpoints endpoints, List<CelRecord> cels, CallDirection direction) {
        for (CelRecord cel : cels) {
            String cidNum = cel.getCidNum();
            if (cidNum == null || cidNum.isEmpty()) {
                continue;
            }
            if (direction == CallDirection.INBOUND || !numberAnalyzer.isExtension(cidNum)) {
                String number = numberAnalyzer.normalizeNumber(cidNum);
                if (number != null) {
                    endpoints.setSrcNumber(number);
                    log.trace("Caller number {} recovered from CEL for call {}", number, cel.getLinkedId());
                    return;
                }
            } else if (endpoints.getSrcExtension() == null) {
                endpoints.setSrcExtension(cidNum);
                return;
            }
        }
    }
}
