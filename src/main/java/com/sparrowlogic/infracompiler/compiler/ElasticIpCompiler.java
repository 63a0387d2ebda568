package com.sparrowlogic.infracompiler.compiler;

import com.sparrowlogic.infracompiler.ir.Block;
import com.sparrowlogic.infracompiler.model.ElasticIp;

public final class ElasticIpCompiler extends AbstractResourceCompiler<ElasticIp> {

    @Override
    public Block compile(ElasticIp eip) {
        var block = start(eip);

        optional(block, "domain", eip.domain());
        optional(block, "instance", eip.instance());
        optional(block, "network_interface", eip.networkInterface());
        optional(block, "public_ipv4_pool", eip.publicIpv4Pool());
        optional(block, "customer_owned_ipv4_pool", eip.customerOwnedIpv4Pool());
        optional(block, "associate_with_private_ip", eip.associateWithPrivateIp());
        optional(block, "address", eip.address());
        tags(block, eip.tags());

        return block.build();
    }
}
