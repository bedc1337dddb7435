package com.infomedia.abacox.callshipping.component.normalizer;

public enum RecordType {
    CDR,
    CEL
}
