package com.dochunker.core.chunk;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/** 패시지 id = sha1_hex(url + "\n" + text) 앞 16자리. 같은 입력 → 같은 id. */
public final class PassageIds {
    private static final char[] HEX = "0123456789abcdef".toCharArray();
    static final int LENGTH = 16;

    private PassageIds() {}

    public static String of(String url, String text) {
        byte[] digest = sha1((url == null ? "" : url) + "\n" + (text == null ? "" : text));
        char[] out = new char[LENGTH];
        for (int i = 0; i < LENGTH / 2; i++) {
            out[i * 2] = HEX[(digest[i] >> 4) & 0x0f];
            out[i * 2 + 1] = HEX[digest[i] & 0x0f];
        }
        return new String(out);
    }

    private static byte[] sha1(String s) {
        try {
            return MessageDigest.getInstance("SHA-1").digest(s.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            // 모든 JRE는 SHA-1을 제공해야 한다
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
