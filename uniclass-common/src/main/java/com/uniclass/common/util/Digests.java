package com.uniclass.common.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 单向摘要工具类。
 */
public final class Digests {

    private Digests() {
    }

    /**
     * SHA-256 十六进制摘要（64 个小写字符）。
     */
    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            // 所有 JDK 都必须提供 SHA-256
            throw new IllegalStateException("SHA-256 不可用", e);
        }
    }

    /**
     * 日志脱敏：只保留前 8 个字符。
     */
    public static String mask(String secret) {
        if (secret == null || secret.length() <= 8) return "***";
        return secret.substring(0, 8) + "***";
    }
}
