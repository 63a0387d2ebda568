package com.sparrowlogic.infracompiler.model;

import com.sparrowlogic.infracompiler.cidr.CidrBlock;

import java.util.Map;
import java.util.Objects;

public record Subnet(
    String name,
    Network network,
    CidrBlock cidrBlock,
    AvailabilityZone availabilityZone,
    Boolean assignIpv6AddressOnCreation,
    String ipv6CidrBlock,
    Boolean mapPublicIpOnLaunch,
    Map<String, String> tags
) implements Resource {

    public static final String TYPE = "aws_subnet";

    public Subnet {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(network, "network");
        Objects.requireNonNull(cidrBlock, "cidrBlock");
    }

    public static Subnet of(String name, Network network, CidrBlock cidrBlock) {
        return new Subnet(name, network, cidrBlock, null, null, null, null, null);
    }

    @Override
    public String resourceType() {
        return TYPE;
    }

    @Override
    public String label() {
        return name;
    }

    @Override
    public <T> T accept(ResourceVisitor<T> visitor) {
        return visitor.visitSubnet(this);
    }
}
