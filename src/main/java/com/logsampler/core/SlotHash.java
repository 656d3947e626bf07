package com.logsampler.core;

import java.nio.charset.StandardCharsets;

/**
 * Non-cryptographic string hash used to place message keys into counter slots.
 *
 * <p>The key's UTF-8 bytes are folded into a 64-bit state which is then
 * permuted with XSH RR (randomly rotated xorshift), the output function of the
 * PCG family of generators. The result is deterministic across runs and JVMs.
 *
 * <p>The fold shifts each byte in from the right, so only the last eight bytes
 * of a key reach the digest, and keys of three bytes or fewer all digest to 0.
 * Collisions between such keys are expected.
 */
public final class SlotHash {

    private SlotHash() {
    }

    /**
     * Digest of a key, an unsigned 32-bit value carried in an int
     */
    public static int hash(String key) {
        return permute(fold(key.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Slot index of a key in a table of the given width
     */
    public static int slot(String key, int width) {
        return Integer.remainderUnsigned(hash(key), width);
    }

    /**
     * Collapse a byte string into a 64-bit ring, rotating by one byte per input byte
     */
    static long fold(byte[] bytes) {
        long n = 0L;
        for (byte b : bytes) {
            n = ((n & 0xffL) >>> 56) | (n << 8);
            n ^= b & 0xffL;
        }
        return n;
    }

    /**
     * XSH RR: xorshift high bits, then rotate right by the top five bits
     */
    static int permute(long n) {
        int xorshifted = (int) (((n >>> 18) ^ n) >>> 27);
        int rot = (int) (n >>> 59);
        return Integer.rotateRight(xorshifted, rot);
    }
}
