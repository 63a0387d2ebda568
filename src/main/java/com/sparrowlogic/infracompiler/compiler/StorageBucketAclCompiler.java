package com.sparrowlogic.infracompiler.compiler;

import com.sparrowlogic.infracompiler.ir.Block;
import com.sparrowlogic.infracompiler.model.StorageBucketAcl;
import com.sparrowlogic.infracompiler.model.StorageBucketAcl.AccessControlPolicy;
import com.sparrowlogic.infracompiler.model.StorageBucketAcl.Grant;

public final class StorageBucketAclCompiler extends AbstractResourceCompiler<StorageBucketAcl> {

    @Override
    public Block compile(StorageBucketAcl bucketAcl) {
        var block = start(bucketAcl)
            .attribute("bucket", bucketAcl.bucket());

        if (bucketAcl.acl() != null) {
            block.attribute("acl", bucketAcl.acl().value());
        }
        if (bucketAcl.accessControlPolicy() != null) {
            block.block(accessControlPolicy(bucketAcl.accessControlPolicy()));
        }
        optional(block, "expected_bucket_owner", bucketAcl.expectedBucketOwner());

        return block.build();
    }

    private Block accessControlPolicy(AccessControlPolicy policy) {
        var block = Block.builder("access_control_policy");
        policy.grants().forEach(entry -> block.block(grant(entry)));

        var owner = Block.builder("owner")
            .attribute("id", policy.owner().id());
        optional(owner, "display_name", policy.owner().displayName());
        block.block(owner.build());

        return block.build();
    }

    private Block grant(Grant grant) {
        var grantee = Block.builder("grantee")
            .attribute("type", grant.grantee().type().value());
        optional(grantee, "id", grant.grantee().id());
        optional(grantee, "uri", grant.grantee().uri());
        optional(grantee, "email_address", grant.grantee().emailAddress());

        return Block.builder("grant")
            .block(grantee.build())
            .attribute("permission", grant.permission().value())
            .build();
    }
}
