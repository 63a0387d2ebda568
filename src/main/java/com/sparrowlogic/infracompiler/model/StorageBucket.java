package com.sparrowlogic.infracompiler.model;

import java.util.Map;

/**
 * An {@code aws_s3_bucket}. Every component is optional; {@code acl} falls back to
 * {@link CannedAcl#PRIVATE}. Unnamed buckets are labelled {@value #FALLBACK_NAME}, even when a
 * prefix is set. Setting both {@code name} and {@code prefix} is passed through untouched and left
 * for Terraform to reject.
 */
public record StorageBucket(
    String name,
    CannedAcl acl,
    String prefix,
    Boolean forceDestroy,
    Boolean objectLockEnabled,
    Map<String, String> tags
) implements Resource {

    public static final String TYPE = "aws_s3_bucket";
    public static final String FALLBACK_NAME = "bucket";

    public static StorageBucket empty() {
        return new StorageBucket(null, null, null, null, null, null);
    }

    public static StorageBucket named(String name) {
        return new StorageBucket(name, null, null, null, null, null);
    }

    public CannedAcl effectiveAcl() {
        return acl != null ? acl : CannedAcl.PRIVATE;
    }

    @Override
    public String resourceType() {
        return TYPE;
    }

    @Override
    public String label() {
        return name != null ? name : FALLBACK_NAME;
    }

    @Override
    public <T> T accept(ResourceVisitor<T> visitor) {
        return visitor.visitStorageBucket(this);
    }
}
