package com.queryscope.platform.id;

import java.net.InetAddress;
import java.security.SecureRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Snowflake-style unique ID generator.
 *
 * Generates 128-bit IDs formatted as 32-character lower-case hex strings.
 *
 * ID Structure (128 bits):
 * - 48 bits: milliseconds since 2024-01-01 UTC
 * - 16 bits: node ID (hostname hash + random seed)
 * - 64 bits: process-wide sequence counter
 *
 * The sequence never resets, so ids are unique within a process even when the
 * clock stands still or goes backwards. Lock-free.
 */
public final class IdGenerator {

    private static final long EPOCH = 1704067200000L; // 2024-01-01 00:00:00 UTC

    private static final IdGenerator INSTANCE = new IdGenerator();

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final int nodeId;
    private final AtomicLong sequence = new AtomicLong(0);

    private IdGenerator() {
        this.nodeId = generateNodeId();
    }

    public static IdGenerator getInstance() {
        return INSTANCE;
    }

    /**
     * Generate a unique operation ID as a 32-character hex string.
     */
    public String generateOperationId() {
        long timestamp = System.currentTimeMillis();
        long seq = sequence.getAndIncrement();

        long high = ((timestamp - EPOCH) << 16) | (nodeId & 0xFFFF);

        char[] chars = new char[32];
        encodeHex(high, chars, 0, 16);
        encodeHex(seq, chars, 16, 32);
        return new String(chars);
    }

    private static void encodeHex(long value, char[] chars, int start, int end) {
        for (int i = end - 1; i >= start; i--) {
            chars[i] = HEX[(int) (value & 0xF)];
            value >>>= 4;
        }
    }

    private static int generateNodeId() {
        try {
            String hostname = InetAddress.getLocalHost().getHostName();
            int hostnameHash = hostname.hashCode() & 0xFF;
            int randomBits = new SecureRandom().nextInt() & 0xFF;
            return (hostnameHash << 8) | randomBits;
        } catch (Exception e) {
            return new SecureRandom().nextInt() & 0xFFFF;
        }
    }
}
