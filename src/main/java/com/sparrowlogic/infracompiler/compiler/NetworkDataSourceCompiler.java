package com.sparrowlogic.infracompiler.compiler;

import com.sparrowlogic.infracompiler.ir.Block;
import com.sparrowlogic.infracompiler.model.NetworkDataSource;

public final class NetworkDataSourceCompiler extends AbstractResourceCompiler<NetworkDataSource> {

    @Override
    public Block compile(NetworkDataSource dataSource) {
        var block = start(dataSource);

        optional(block, "id", dataSource.id());
        optional(block, "cidr_block", dataSource.cidrBlock());
        optional(block, "owner_id", dataSource.ownerId());
        optional(block, "enable_dns_hostnames", dataSource.enableDnsHostnames());
        optional(block, "enable_dns_support", dataSource.enableDnsSupport());
        tags(block, dataSource.tags());
        filters(block, dataSource.filters());

        return block.build();
    }
}
