package com.sparrowlogic.infracompiler.model;

import java.util.List;
import java.util.Objects;

/**
 * An {@code aws_s3_bucket_acl}. Terraform expects one of {@code acl} or
 * {@code accessControlPolicy}; neither is enforced here.
 */
public record StorageBucketAcl(
    String bucket,
    CannedAcl acl,
    AccessControlPolicy accessControlPolicy,
    String expectedBucketOwner
) implements Resource {

    public static final String TYPE = "aws_s3_bucket_acl";

    public StorageBucketAcl {
        Objects.requireNonNull(bucket, "bucket");
    }

    @Override
    public String resourceType() {
        return TYPE;
    }

    @Override
    public String label() {
        return bucket;
    }

    @Override
    public <T> T accept(ResourceVisitor<T> visitor) {
        return visitor.visitStorageBucketAcl(this);
    }

    public record AccessControlPolicy(Owner owner, List<Grant> grants) {
        public AccessControlPolicy {
            Objects.requireNonNull(owner, "owner");
            grants = List.copyOf(grants);
        }
    }

    public record Owner(String id, String displayName) {
        public Owner {
            Objects.requireNonNull(id, "id");
        }
    }

    public record Grant(Grantee grantee, Permission permission) {
        public Grant {
            Objects.requireNonNull(grantee, "grantee");
            Objects.requireNonNull(permission, "permission");
        }
    }

    /** {@code id}, {@code uri} and {@code emailAddress} are set according to {@code type}. */
    public record Grantee(GranteeType type, String id, String uri, String emailAddress) {
        public Grantee {
            Objects.requireNonNull(type, "type");
        }

        public static Grantee canonicalUser(String id) {
            return new Grantee(GranteeType.CANONICAL_USER, id, null, null);
        }

        public static Grantee group(String uri) {
            return new Grantee(GranteeType.GROUP, null, uri, null);
        }
    }
}
