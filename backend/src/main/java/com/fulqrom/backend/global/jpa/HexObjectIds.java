package com.fulqrom.backend.global.jpa;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * 24-character hexadecimal identifiers: 4 bytes epoch seconds, 5 random bytes, 3 bytes counter.
 * Keeps ids issued by this service interchangeable with the ids already held by clients.
 */
public final class HexObjectIds {

    private static final Pattern FORMAT = Pattern.compile("^[0-9a-fA-F]{24}$");
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final byte[] PROCESS_UNIQUE = new byte[5];
    private static final AtomicInteger COUNTER = new AtomicInteger(RANDOM.nextInt());

    static {
        RANDOM.nextBytes(PROCESS_UNIQUE);
    }

    private HexObjectIds() {
    }

    public static String next() {
        return next(Instant.now());
    }

    static String next(Instant timestamp) {
        byte[] bytes = new byte[12];
        int seconds = (int) timestamp.getEpochSecond();
        bytes[0] = (byte) (seconds >>> 24);
        bytes[1] = (byte) (seconds >>> 16);
        bytes[2] = (byte) (seconds >>> 8);
        bytes[3] = (byte) seconds;
        System.arraycopy(PROCESS_UNIQUE, 0, bytes, 4, PROCESS_UNIQUE.length);
        int count = COUNTER.getAndIncrement() & 0x00ffffff;
        bytes[9] = (byte) (count >>> 16);
        bytes[10] = (byte) (count >>> 8);
        bytes[11] = (byte) count;
        return HexFormat.of().formatHex(bytes);
    }

    public static boolean isValid(String candidate) {
        return candidate != null && FORMAT.matcher(candidate).matches();
    }

    /**
     * Lower-cases a valid id; callers check {@link #isValid(String)} first.
     */
    public static String normalize(String id) {
        return id.toLowerCase(Locale.ROOT);
    }
}
