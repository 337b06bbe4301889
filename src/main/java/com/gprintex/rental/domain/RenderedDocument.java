package com.gprintex.rental.domain;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Fixed binary artifact produced from the generated markup, with its SHA-256 digest.
 */
public record RenderedDocument(byte[] content, String digest) {

    public RenderedDocument {
        if (content == null || content.length == 0) {
            throw new IllegalArgumentException("content must not be empty");
        }
        content = content.clone();
    }

    public static RenderedDocument of(byte[] content) {
        return new RenderedDocument(content, sha256(content));
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    public int size() {
        return content.length;
    }

    static String sha256(byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RenderedDocument other && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "RenderedDocument[size=" + content.length + ", digest=" + digest + "]";
    }
}
