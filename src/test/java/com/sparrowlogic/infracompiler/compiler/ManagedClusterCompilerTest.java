package com.sparrowlogic.infracompiler.compiler;

import com.sparrowlogic.infracompiler.cidr.CidrBlock;
import com.sparrowlogic.infracompiler.ir.Expression;
import com.sparrowlogic.infracompiler.ir.Expression.ArrayValue;
import com.sparrowlogic.infracompiler.ir.Expression.RawReference;
import com.sparrowlogic.infracompiler.model.IamRole;
import com.sparrowlogic.infracompiler.model.ManagedCluster;
import com.sparrowlogic.infracompiler.model.ManagedCluster.EncryptionConfig;
import com.sparrowlogic.infracompiler.model.Network;
import com.sparrowlogic.infracompiler.model.Subnet;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ManagedClusterCompilerTest {

    private static final String TRUST_POLICY = "{\"Version\":\"2012-10-17\"}";

    private final ManagedClusterCompiler compiler = new ManagedClusterCompiler();
    private final Network network = Network.of("main", CidrBlock.parse("10.0.0.0/16"));
    private final Subnet a = Subnet.of("private_a", network, CidrBlock.parse("10.0.1.0/24"));
    private final Subnet b = Subnet.of("private_b", network, CidrBlock.parse("10.0.2.0/24"));
    private final IamRole role = IamRole.of("eks_cluster", TRUST_POLICY);

    @Test
    void shouldCompileMinimalCluster() {
        var block = compiler.compile(ManagedCluster.of("prod", network, List.of(a, b), role));

        assertEquals(List.of("aws_eks_cluster", "prod"), block.labels());
        assertEquals(List.of("name", "role_arn"), List.copyOf(block.attributes().keySet()));
        assertEquals("aws_iam_role.eks_cluster.arn", ((RawReference) block.attribute("role_arn")).token());

        var vpcConfig = block.blocks("vpc_config").get(0);
        var subnetIds = (ArrayValue) vpcConfig.attribute("subnet_ids");
        assertEquals(List.of("aws_subnet.private_a.id", "aws_subnet.private_b.id"),
            subnetIds.elements().stream().map(e -> ((RawReference) e).token()).toList());
        assertTrue(block.blocks("encryption_config").isEmpty());
    }

    @Test
    void shouldCompileFullCluster() {
        var cluster = new ManagedCluster("prod", network, List.of(a), role, "1.30", List.of("api", "audit"),
            true, false, EncryptionConfig.secrets("arn:aws:kms:us-east-1:123:key/abc"), Map.of("Env", "prod"));

        var block = compiler.compile(cluster);

        assertEquals(List.of("name", "role_arn", "version", "enabled_cluster_log_types", "tags"),
            List.copyOf(block.attributes().keySet()));
        assertEquals(List.of("vpc_config", "encryption_config"), block.blocks().stream().map(nested -> nested.blockType()).toList());
        var vpcConfig = block.blocks("vpc_config").get(0);
        assertEquals(Expression.bool(true), vpcConfig.attribute("endpoint_private_access"));
        assertEquals(Expression.bool(false), vpcConfig.attribute("endpoint_public_access"));
        var encryption = block.blocks("encryption_config").get(0);
        assertEquals(Expression.strings(List.of("secrets")), encryption.attribute("resources"));
        assertEquals(Expression.string("arn:aws:kms:us-east-1:123:key/abc"),
            encryption.blocks("provider").get(0).attribute("key_arn"));
    }

    @Test
    void shouldRequireAtLeastOneSubnet() {
        assertThrows(IllegalArgumentException.class, () -> ManagedCluster.of("prod", network, List.of(), role));
    }

    @Test
    void shouldCompileIamRole() {
        var block = new IamRoleCompiler().compile(new IamRole("eks_cluster", TRUST_POLICY, "EKS control plane", null, null));

        assertEquals(List.of("aws_iam_role", "eks_cluster"), block.labels());
        assertEquals(List.of("name", "assume_role_policy", "description"), List.copyOf(block.attributes().keySet()));
        assertEquals(Expression.string(TRUST_POLICY), block.attribute("assume_role_policy"));
    }
}
