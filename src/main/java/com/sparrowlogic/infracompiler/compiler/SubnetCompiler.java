package com.sparrowlogic.infracompiler.compiler;

import com.sparrowlogic.infracompiler.ir.Block;
import com.sparrowlogic.infracompiler.model.Subnet;

public final class SubnetCompiler extends AbstractResourceCompiler<Subnet> {

    @Override
    public Block compile(Subnet subnet) {
        var block = start(subnet)
            .attribute("vpc_id", reference(subnet.network(), ID))
            .attribute("cidr_block", subnet.cidrBlock().toString());

        if (subnet.availabilityZone() != null) {
            block.attribute("availability_zone", subnet.availabilityZone().code());
        }
        optional(block, "assign_ipv6_address_on_creation", subnet.assignIpv6AddressOnCreation());
        optional(block, "ipv6_cidr_block", subnet.ipv6CidrBlock());
        optional(block, "map_public_ip_on_launch", subnet.mapPublicIpOnLaunch());
        tags(block, subnet.tags());

        return block.build();
    }
}
