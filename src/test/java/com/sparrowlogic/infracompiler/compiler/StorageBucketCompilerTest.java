package com.sparrowlogic.infracompiler.compiler;

import com.sparrowlogic.infracompiler.ir.Expression;
import com.sparrowlogic.infracompiler.model.CannedAcl;
import com.sparrowlogic.infracompiler.model.Permission;
import com.sparrowlogic.infracompiler.model.StorageBucket;
import com.sparrowlogic.infracompiler.model.StorageBucketAcl;
import com.sparrowlogic.infracompiler.model.StorageBucketAcl.AccessControlPolicy;
import com.sparrowlogic.infracompiler.model.StorageBucketAcl.Grant;
import com.sparrowlogic.infracompiler.model.StorageBucketAcl.Grantee;
import com.sparrowlogic.infracompiler.model.StorageBucketAcl.Owner;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StorageBucketCompilerTest {

    private final StorageBucketCompiler compiler = new StorageBucketCompiler();
    private final StorageBucketAclCompiler aclCompiler = new StorageBucketAclCompiler();

    @Test
    void shouldEmitOnlyDefaultAclForBareBucket() {
        var block = compiler.compile(StorageBucket.empty());

        assertEquals(Map.of("acl", Expression.string("private")), block.attributes());
        assertEquals(List.of("aws_s3_bucket", "bucket"), block.labels());
    }

    @Test
    void shouldUseGivenAcl() {
        var block = compiler.compile(new StorageBucket("assets", CannedAcl.PUBLIC_READ, null, null, null, null));

        assertEquals(Expression.string("public-read"), block.attribute("acl"));
        assertEquals(Expression.string("assets"), block.attribute("bucket"));
        assertEquals(List.of("aws_s3_bucket", "assets"), block.labels());
    }

    @Test
    void shouldEmitNameAndPrefixTogether() {
        var block = compiler.compile(new StorageBucket("logs", null, "logs-", true, false, Map.of("Team", "ops")));

        assertEquals(List.of("bucket", "acl", "bucket_prefix", "force_destroy", "object_lock_enabled", "tags"),
            List.copyOf(block.attributes().keySet()));
    }

    @Test
    void shouldUseFallbackLabelWhenUnnamed() {
        var block = compiler.compile(new StorageBucket(null, null, "tmp-", null, null, null));

        assertEquals(List.of("aws_s3_bucket", "bucket"), block.labels());
        assertEquals(Expression.string("tmp-"), block.attribute("bucket_prefix"));
        assertNull(block.attribute("bucket"));
    }

    @Test
    void shouldCompileCannedBucketAcl() {
        var block = aclCompiler.compile(new StorageBucketAcl("assets", CannedAcl.PRIVATE, null, "123456789012"));

        assertEquals(List.of("aws_s3_bucket_acl", "assets"), block.labels());
        assertEquals(List.of("bucket", "acl", "expected_bucket_owner"), List.copyOf(block.attributes().keySet()));
        assertTrue(block.blocks().isEmpty());
    }

    @Test
    void shouldCompileAccessControlPolicyAsNestedBlocks() {
        var policy = new AccessControlPolicy(new Owner("owner-id", null), List.of(
            new Grant(Grantee.canonicalUser("owner-id"), Permission.FULL_CONTROL),
            new Grant(Grantee.group("http://acs.amazonaws.com/groups/s3/LogDelivery"), Permission.WRITE)));

        var block = aclCompiler.compile(new StorageBucketAcl("assets", null, policy, null));

        assertEquals(List.of("bucket"), List.copyOf(block.attributes().keySet()));
        var acp = block.blocks("access_control_policy").get(0);
        var grants = acp.blocks("grant");
        assertEquals(2, grants.size());
        assertEquals(Expression.string("FULL_CONTROL"), grants.get(0).attribute("permission"));
        var grantee = grants.get(1).blocks("grantee").get(0);
        assertEquals(Expression.string("Group"), grantee.attribute("type"));
        assertEquals(Expression.string("http://acs.amazonaws.com/groups/s3/LogDelivery"), grantee.attribute("uri"));
        assertNull(grantee.attribute("id"));
        assertEquals(Map.of("id", Expression.string("owner-id")), acp.blocks("owner").get(0).attributes());
    }
}
