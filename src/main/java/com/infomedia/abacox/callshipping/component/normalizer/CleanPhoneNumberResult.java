package com.infomedia.abacox.callshipping.component.normalizer;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class CleanPhoneNumberResult {
    /** Digits (with leading + or * kept) when numeric, otherwise the trimmed original text. */
    private final String cleanedNumber;
    private final boolean numeric;
}
