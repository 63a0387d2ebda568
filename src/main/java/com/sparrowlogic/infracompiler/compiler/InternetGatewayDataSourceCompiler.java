package com.sparrowlogic.infracompiler.compiler;

import com.sparrowlogic.infracompiler.ir.Block;
import com.sparrowlogic.infracompiler.model.InternetGatewayDataSource;

public final class InternetGatewayDataSourceCompiler extends AbstractResourceCompiler<InternetGatewayDataSource> {

    @Override
    public Block compile(InternetGatewayDataSource dataSource) {
        var block = start(dataSource);
        optional(block, "internet_gateway_id", dataSource.internetGatewayId());
        tags(block, dataSource.tags());
        filters(block, dataSource.filters());
        return block.build();
    }
}
