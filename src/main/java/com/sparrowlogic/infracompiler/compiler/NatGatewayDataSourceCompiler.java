package com.sparrowlogic.infracompiler.compiler;

import com.sparrowlogic.infracompiler.ir.Block;
import com.sparrowlogic.infracompiler.model.NatGatewayDataSource;

public final class NatGatewayDataSourceCompiler extends AbstractResourceCompiler<NatGatewayDataSource> {

    @Override
    public Block compile(NatGatewayDataSource dataSource) {
        var block = start(dataSource);

        optional(block, "id", dataSource.id());
        optional(block, "vpc_id", dataSource.vpcId());
        optional(block, "subnet_id", dataSource.subnetId());
        optional(block, "state", dataSource.state());
        tags(block, dataSource.tags());
        filters(block, dataSource.filters());

        return block.build();
    }
}
