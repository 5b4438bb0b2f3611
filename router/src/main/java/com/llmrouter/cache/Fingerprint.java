package com.llmrouter.cache;

import com.llmrouter.model.MediaType;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class Fingerprint {

    private Fingerprint() {
    }

    /**
     * Deterministic key for one unit of analysis work. Runs of whitespace in the content are
     * collapsed so reformatted copies of the same post share a key. Each part is length-prefixed,
     * so separator characters inside content or template cannot shift part boundaries.
     */
    public static String of(String content, MediaType mediaType, String promptTemplate) {
        StringBuilder sb = new StringBuilder();
        appendPart(sb, normalize(content));
        appendPart(sb, mediaType.getValue());
        appendPart(sb, promptTemplate != null ? promptTemplate : "");

        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(sb.toString().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 32);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static void appendPart(StringBuilder sb, String part) {
        sb.append(part.length()).append(':').append(part);
    }

    static String normalize(String content) {
        if (content == null) {
            return "";
        }
        return content.trim().replaceAll("\\s+", " ");
    }
}
