package io.graphlite.core.diff;

import com.fasterxml.jackson.databind.JsonNode;
import io.graphlite.core.Json;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Stable SHA-256 over the canonical JSON form of a tree.
 * <p>
 * Field order does not matter; a null tree and an empty object hash the same.
 */
public final class ContentHasher {

    private ContentHasher() {}

    public static String contentHash(JsonNode tree) {
        JsonNode normalized = (tree == null || tree.isNull() || tree.isMissingNode()) ? Json.emptyObject() : tree;
        return sha256Hex(Json.canonicalBytes(normalized));
    }

    static String sha256Hex(byte[] bytes) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
