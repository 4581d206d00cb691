package com.uniclass.gateway.auth;

/**
 * API Key 格式：uc_{环境}_{随机串}，例如 uc_live_a1b2c3...
 */
public final class KeyFormat {

    public static final String LIVE_PREFIX = "uc_live_";

    public static final String TEST_PREFIX = "uc_test_";

    /** 随机部分的字节数 */
    static final int RANDOM_BYTES = 32;

    /** 展示用前缀长度（含环境前缀） */
    static final int DISPLAY_PREFIX_LENGTH = 12;

    private KeyFormat() {
    }

    public static String prefixFor(boolean live) {
        return live ? LIVE_PREFIX : TEST_PREFIX;
    }

    public static boolean isRecognized(String rawKey) {
        return rawKey.startsWith(LIVE_PREFIX) || rawKey.startsWith(TEST_PREFIX);
    }

    public static String displayPrefix(String rawKey) {
        return rawKey.substring(0, Math.min(DISPLAY_PREFIX_LENGTH, rawKey.length()));
    }
}
