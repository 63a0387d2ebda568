package com.sparrowlogic.infracompiler.model;

import java.util.Map;
import java.util.Objects;

/**
 * An {@code aws_nat_gateway}. It has no name of its own; the block is labelled by the
 * optional id, falling back to {@code "nat"}.
 */
public record NatGateway(
    String id,
    Network network,
    Subnet subnet,
    ElasticIp elasticIp,
    String connectivityType,
    String state,
    Map<String, String> tags
) implements Resource {

    public static final String TYPE = "aws_nat_gateway";
    public static final String FALLBACK_NAME = "nat";

    public NatGateway {
        Objects.requireNonNull(network, "network");
        Objects.requireNonNull(subnet, "subnet");
        Objects.requireNonNull(elasticIp, "elasticIp");
    }

    @Override
    public String resourceType() {
        return TYPE;
    }

    @Override
    public String label() {
        return id != null ? id : FALLBACK_NAME;
    }

    @Override
    public <T> T accept(ResourceVisitor<T> visitor) {
        return visitor.visitNatGateway(this);
    }
}
