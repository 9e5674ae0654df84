package com.example.auditledger.models;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Canonical hashing for the audit chain.
 *
 * <p>The digest input is the seven chained fields joined with {@code '|'} in this order:
 * {@code previous_hash | created_at | actor_user_id | action | resource_type | resource_id | workspace_id}.
 * {@code created_at} is rendered in UTC with millisecond precision
 * ({@code yyyy-MM-dd'T'HH:mm:ss.SSS'Z'}) and absent optional fields are the empty string.
 * The UTF-8 bytes are hashed with SHA-256 and rendered as 64 lowercase hex characters.
 * Changing any of this breaks verification of every record already stored.
 *
 * <p>{@code details}, {@code ip_address} and {@code user_agent} are not part of the digest.
 */
public final class ChainHash {

    /** Predecessor of the first record of a chain scope that has never been archived. */
    public static final String GENESIS = "0".repeat(64);

    private static final char[] HEX = "0123456789abcdef".toCharArray();
    private static final String SEPARATOR = "|";
    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private ChainHash() {
    }

    public static String compute(String previousHash,
                                 Instant createdAt,
                                 String actorUserId,
                                 String action,
                                 String resourceType,
                                 String resourceId,
                                 String workspaceId) {
        String canon = canonicalInput(previousHash, createdAt, actorUserId, action,
                resourceType, resourceId, workspaceId);
        return sha256Hex(canon.getBytes(StandardCharsets.UTF_8));
    }

    public static String compute(AuditRecord record) {
        return compute(
                record.getPreviousHash(),
                record.getCreatedAt(),
                record.getActorUserId(),
                record.getAction(),
                record.getResourceType(),
                record.getResourceId(),
                record.getWorkspaceId()
        );
    }

    public static String canonicalInput(String previousHash,
                                        Instant createdAt,
                                        String actorUserId,
                                        String action,
                                        String resourceType,
                                        String resourceId,
                                        String workspaceId) {
        return String.join(SEPARATOR,
                nn(previousHash),
                createdAt == null ? "" : formatTimestamp(createdAt),
                nn(actorUserId),
                nn(action),
                nn(resourceType),
                nn(resourceId),
                nn(workspaceId)
        );
    }

    public static String formatTimestamp(Instant instant) {
        return TIMESTAMP.format(instant);
    }

    /**
     * Drops sub-millisecond precision so the stored {@code created_at} is exactly what was hashed.
     */
    public static Instant truncate(Instant instant) {
        return instant.truncatedTo(ChronoUnit.MILLIS);
    }

    /**
     * Lowercase hex SHA-256 of raw bytes; also used for archive export checksums.
     */
    public static String sha256Hex(byte[] input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return bytesToHex(md.digest(input));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }

    private static String nn(String s) { return s == null ? "" : s; }

    private static String bytesToHex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0, j = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            out[j++] = HEX[v >>> 4];
            out[j++] = HEX[v & 0x0F];
        }
        return new String(out);
    }
}
