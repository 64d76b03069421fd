package com.raditha.twx.obfuscation;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Derives short, stable aliases for class names. The alias depends only on
 * the seed and the class name, so the same input always maps to the same
 * alias across runs and machines.
 * <p>
 * 64-bit FNV-1a over the eight big-endian seed bytes and the UTF-8 bytes of
 * the name, finished with the SplitMix64 mixer and written in base 62.
 * Collisions are not detected.
 */
public class ObfuscationMapper {

    public static final long DEFAULT_SEED = 0x1337BEEFCAFEBABEL;
    public static final String DEFAULT_PREFIX = "tw";

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    // Letters first: a class selector may not start with a digit.
    private static final char[] ALPHABET =
            "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789".toCharArray();

    private static final Pattern PREFIX = Pattern.compile("[A-Za-z_][A-Za-z0-9_-]*");

    private final long seed;
    private final String prefix;

    public ObfuscationMapper() {
        this(DEFAULT_SEED, DEFAULT_PREFIX);
    }

    public ObfuscationMapper(long seed, String prefix) {
        if (!isValidPrefix(prefix)) {
            throw new IllegalArgumentException("prefix must be a valid CSS identifier start: " + prefix);
        }
        this.seed = seed;
        this.prefix = prefix;
    }

    public static boolean isValidPrefix(String prefix) {
        return prefix != null && PREFIX.matcher(prefix).matches();
    }

    public String alias(String className) {
        return prefix + base62(mix(fnv1a(className)));
    }

    /**
     * Aliases for all names, in iteration order of the input.
     */
    public Map<String, String> mapAll(Collection<String> classNames) {
        Map<String, String> mapping = new LinkedHashMap<>();
        for (String name : classNames) {
            mapping.put(name, alias(name));
        }
        return mapping;
    }

    public long getSeed() {
        return seed;
    }

    public String getPrefix() {
        return prefix;
    }

    private long fnv1a(String className) {
        long hash = FNV_OFFSET_BASIS;
        for (int shift = 56; shift >= 0; shift -= 8) {
            hash ^= (seed >>> shift) & 0xff;
            hash *= FNV_PRIME;
        }
        for (byte b : className.getBytes(StandardCharsets.UTF_8)) {
            hash ^= b & 0xff;
            hash *= FNV_PRIME;
        }
        return hash;
    }

    private static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
        z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
        return z ^ (z >>> 31);
    }

    private static String base62(long value) {
        if (value == 0) {
            return String.valueOf(ALPHABET[0]);
        }
        StringBuilder sb = new StringBuilder();
        long v = value;
        while (v != 0) {
            int digit = (int) Long.remainderUnsigned(v, 62);
            sb.append(ALPHABET[digit]);
            v = Long.divideUnsigned(v, 62);
        }
        return sb.reverse().toString();
    }
}
