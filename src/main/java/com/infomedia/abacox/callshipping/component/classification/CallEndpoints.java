package com.infomedia.abacox.callshipping.component.classification;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Numbers and extensions of both parties. Numbers are normalized digits, extensions are as dialed.
 */
@Data
@NoArgsConstructor
public class CallEndpoints {
    private String srcNumber;
    private String dstNumber;
    private String srcExtension;
    private String dstExtension;
}
