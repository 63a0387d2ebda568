package com.sparrowlogic.infracompiler.model;

import com.sparrowlogic.infracompiler.cidr.CidrBlock;

import java.util.Map;
import java.util.Objects;

/**
 * An {@code aws_vpc}. Nullable components are optional and omitted from output when null.
 */
public record Network(
    String name,
    CidrBlock cidrBlock,
    String instanceTenancy,
    Boolean enableDnsHostnames,
    Boolean enableDnsSupport,
    Boolean enableClassiclink,
    Boolean enableClassiclinkDnsSupport,
    Boolean assignGeneratedIpv6CidrBlock,
    Map<String, String> tags
) implements Resource {

    public static final String TYPE = "aws_vpc";

    public Network {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(cidrBlock, "cidrBlock");
    }

    public static Network of(String name, CidrBlock cidrBlock) {
        return new Network(name, cidrBlock, null, null, null, null, null, null, null);
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
        return visitor.visitNetwork(this);
    }
}
