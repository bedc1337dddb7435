package com.infomedia.abacox.callshipping.component.normalizer;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of normalizing one raw record: a CDR, a CEL, or a discard with its reason.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class NormalizationResult {

    public enum Kind {
        CDR,
        CEL,
        DISCARD
    }

    private final Kind kind;
    private final NormalizedRecord record;
    private final String discardReason;

    public static NormalizationResult of(CdrRecord record) {
        return new NormalizationResult(Kind.CDR, record, null);
    }

    public static NormalizationResult of(CelRecord record) {
        return new NormalizationResult(Kind.CEL, record, null);
    }

    public static NormalizationResult discard(String reason) {
        return new NormalizationResult(Kind.DISCARD, null, reason);
    }

    public boolean isDiscarded() {
        return kind == Kind.DISCARD;
    }
}
