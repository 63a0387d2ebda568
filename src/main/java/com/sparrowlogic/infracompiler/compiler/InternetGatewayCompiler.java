package com.sparrowlogic.infracompiler.compiler;

import com.sparrowlogic.infracompiler.ir.Block;
import com.sparrowlogic.infracompiler.model.InternetGateway;

public final class InternetGatewayCompiler extends AbstractResourceCompiler<InternetGateway> {

    @Override
    public Block compile(InternetGateway gateway) {
        var block = start(gateway)
            .attribute("vpc_id", reference(gateway.network(), ID));
        tags(block, gateway.tags());
        return block.build();
    }
}
