package com.raditha.twx.parser;

/**
 * Maps UTF-8 byte offsets reported by tree-sitter back to UTF-16 indexes into
 * the Java source string.
 */
final class ByteOffsets {

    private final int[] charIndex;

    ByteOffsets(String text) {
        int bytes = 0;
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            bytes += encodedLength(codePoint);
            i += Character.charCount(codePoint);
        }
        charIndex = new int[bytes + 1];
        int b = 0;
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            int length = encodedLength(codePoint);
            for (int k = 0; k < length; k++) {
                charIndex[b + k] = i;
            }
            b += length;
            i += Character.charCount(codePoint);
        }
        charIndex[bytes] = text.length();
    }

    int toChar(int byteOffset) {
        if (byteOffset < 0) {
            return 0;
        }
        return byteOffset < charIndex.length ? charIndex[byteOffset] : charIndex[charIndex.length - 1];
    }

    /**
     * Unpaired surrogates are written as a single replacement byte.
     */
    private static int encodedLength(int codePoint) {
        if (codePoint < 0x80 || (codePoint <= 0xFFFF && Character.isSurrogate((char) codePoint))) {
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        return codePoint < 0x10000 ? 3 : 4;
    }
}
