package com.sparrowlogic.infracompiler.compiler;

import com.sparrowlogic.infracompiler.ir.Block;
import com.sparrowlogic.infracompiler.ir.Expression;
import com.sparrowlogic.infracompiler.model.ManagedCluster;

public final class ManagedClusterCompiler extends AbstractResourceCompiler<ManagedCluster> {

    @Override
    public Block compile(ManagedCluster cluster) {
        var block = start(cluster)
            .attribute("name", cluster.name())
            .attribute("role_arn", reference(cluster.role(), ARN))
            .block(vpcConfig(cluster));

        optional(block, "version", cluster.version());
        optional(block, "enabled_cluster_log_types", cluster.enabledClusterLogTypes());

        var encryption = cluster.encryptionConfig();
        if (encryption != null) {
            var encryptionBlock = Block.builder("encryption_config")
                .block(Block.builder("provider")
                    .attribute("key_arn", encryption.kmsKeyArn())
                    .build());
            optional(encryptionBlock, "resources", encryption.resources());
            block.block(encryptionBlock.build());
        }

        tags(block, cluster.tags());
        return block.build();
    }

    private Block vpcConfig(ManagedCluster cluster) {
        var subnetIds = cluster.subnets().stream()
            .map(subnet -> reference(subnet, ID))
            .toList();
        var vpcConfig = Block.builder("vpc_config")
            .attribute("subnet_ids", Expression.array(subnetIds));
        optional(vpcConfig, "endpoint_private_access", cluster.endpointPrivateAccess());
        optional(vpcConfig, "endpoint_public_access", cluster.endpointPublicAccess());
        return vpcConfig.build();
    }
}
