package com.twbconvert.pbip;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;
import java.util.UUID;

/**
 * Deterministic identifiers for every emitted object. Each identifier is a hash over (kind, scope, name), so the
 * same workbook always yields the same lineage tags, relationship names, page names and visual names.
 */
public final class StableIdentifiers {
    private static final char[] HEX = "0123456789abcdef".toCharArray();
    private static final int REPORT_NAME_LENGTH = 20;

    private StableIdentifiers() {}

    /** Name-based (version 3) UUID, the form TMDL uses for lineage tags and relationship names. */
    public static String uuid(String kind, String scope, String name) {
        return UUID.nameUUIDFromBytes(key(kind, scope, name)).toString();
    }

    /** First 20 hex digits of the SHA-1 of (kind, scope, name), the form PBIR uses for page and visual names. */
    public static String reportName(String kind, String scope, String name) {
        byte[] digest = sha1(key(kind, scope, name));
        StringBuilder builder = new StringBuilder(REPORT_NAME_LENGTH);
        for (int i = 0; builder.length() < REPORT_NAME_LENGTH; i++) {
            builder.append(HEX[(digest[i] >> 4) & 0xF]).append(HEX[digest[i] & 0xF]);
        }
        return builder.toString();
    }

    public static String tableTag(String table) {
        return uuid("table", "", table);
    }

    public static String columnTag(String table, String column) {
        return uuid("column", table, column);
    }

    public static String measureTag(String table, String measure) {
        return uuid("measure", table, measure);
    }

    public static String relationshipName(String fromTable, String fromColumn, String toTable, String toColumn) {
        return uuid("relationship", fromTable + "." + fromColumn, toTable + "." + toColumn);
    }

    public static String pageName(String source) {
        return reportName("page", "", source);
    }

    public static String visualName(String pageName, String source) {
        return reportName("visual", pageName, source);
    }

    private static byte[] key(String kind, String scope, String name) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(name, "name");
        return (kind + '\0' + scope + '\0' + name).getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] sha1(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-1").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 is not available", e);
        }
    }
}
