package com.sparrowlogic.infracompiler.model;

import java.util.List;
import java.util.Map;

public record NatGatewayDataSource(
    String id,
    String vpcId,
    String subnetId,
    String state,
    Map<String, String> tags,
    List<Filter> filters
) implements Resource {

    @Override
    public String blockType() {
        return DATA;
    }

    @Override
    public String resourceType() {
        return NatGateway.TYPE;
    }

    @Override
    public String label() {
        return id != null ? id : NatGateway.FALLBACK_NAME;
    }

    @Override
    public <T> T accept(ResourceVisitor<T> visitor) {
        return visitor.visitNatGatewayDataSource(this);
    }
}
