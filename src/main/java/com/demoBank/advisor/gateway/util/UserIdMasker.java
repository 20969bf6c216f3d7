package com.demoBank.advisor.gateway.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Masks user ids for logs. The masked form keeps a short hash tag so lines of one user can be correlated.
 */
public class UserIdMasker {

    private static final int TAG_LENGTH = 6;

    private UserIdMasker() {}

    /**
     * @param userId user id as received in the {@code X-User-ID} header
     * @return e.g. {@code us***01#3fa2c1}; ids of 6 characters or fewer keep only their first character
     */
    public static String mask(String userId) {
        if (userId == null || userId.isBlank()) {
            return "<none>";
        }
        String id = userId.trim();
        String visible = id.length() <= 6
                ? id.charAt(0) + "***"
                : id.substring(0, 2) + "***" + id.substring(id.length() - 2);
        return visible + "#" + tag(id);
    }

    private static String tag(String id) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(id.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, TAG_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
