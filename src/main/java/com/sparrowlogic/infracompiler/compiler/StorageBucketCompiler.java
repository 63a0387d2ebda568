package com.sparrowlogic.infracompiler.compiler;

import com.sparrowlogic.infracompiler.ir.Block;
import com.sparrowlogic.infracompiler.model.StorageBucket;

public final class StorageBucketCompiler extends AbstractResourceCompiler<StorageBucket> {

    @Override
    public Block compile(StorageBucket bucket) {
        var block = start(bucket);

        optional(block, "bucket", bucket.name());
        // always emitted, unlike every other optional field
        block.attribute("acl", bucket.effectiveAcl().value());
        optional(block, "bucket_prefix", bucket.prefix());
        optional(block, "force_destroy", bucket.forceDestroy());
        optional(block, "object_lock_enabled", bucket.objectLockEnabled());
        tags(block, bucket.tags());

        return block.build();
    }
}
