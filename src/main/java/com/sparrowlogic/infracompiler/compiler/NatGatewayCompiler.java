package com.sparrowlogic.infracompiler.compiler;

import com.sparrowlogic.infracompiler.ir.Block;
import com.sparrowlogic.infracompiler.model.NatGateway;

public final class NatGatewayCompiler extends AbstractResourceCompiler<NatGateway> {

    @Override
    public Block compile(NatGateway nat) {
        var block = start(nat)
            .attribute("subnet_id", reference(nat.subnet(), ID))
            .attribute("allocation_id", reference(nat.elasticIp(), ID));

        optional(block, "connectivity_type", nat.connectivityType());
        optional(block, "state", nat.state());
        tags(block, nat.tags());

        return block.build();
    }
}
