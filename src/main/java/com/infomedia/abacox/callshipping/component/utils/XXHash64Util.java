package com.infomedia.abacox.callshipping.component.utils;

import net.jpountz.xxhash.XXHash64;
import net.jpountz.xxhash.XXHashFactory;

/**
 * 64-bit XXHash rendered as 16 lowercase hex digits, used as a change-detection fingerprint.
 * Not suitable where collisions must be resisted.
 */
public final class XXHash64Util {

    // JNI when the native library loads, pure Java otherwise. Instances are stateless.
    private static final XXHash64 HASH = XXHashFactory.fastestInstance().hash64();

    private XXHash64Util() {
    }

    public static String toHex(byte[] data) {
        return String.format("%016x", HASH.hash(data, 0, data.length, 0L));
    }
}
