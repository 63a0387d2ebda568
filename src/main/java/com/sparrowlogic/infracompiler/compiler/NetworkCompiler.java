package com.sparrowlogic.infracompiler.compiler;

import com.sparrowlogic.infracompiler.ir.Block;
import com.sparrowlogic.infracompiler.model.Network;

public final class NetworkCompiler extends AbstractResourceCompiler<Network> {

    @Override
    public Block compile(Network network) {
        var block = start(network)
            .attribute("cidr_block", network.cidrBlock().toString());

        optional(block, "instance_tenancy", network.instanceTenancy());
        optional(block, "enable_dns_hostnames", network.enableDnsHostnames());
        optional(block, "enable_dns_support", network.enableDnsSupport());
        optional(block, "enable_classiclink", network.enableClassiclink());
        optional(block, "enable_classiclink_dns_support", network.enableClassiclinkDnsSupport());
        optional(block, "assign_generated_ipv6_cidr_block", network.assignGeneratedIpv6CidrBlock());
        tags(block, network.tags());

        return block.build();
    }
}
