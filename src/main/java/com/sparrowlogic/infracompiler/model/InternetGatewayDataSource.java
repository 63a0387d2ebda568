package com.sparrowlogic.infracompiler.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public record InternetGatewayDataSource(
    String name,
    String internetGatewayId,
    Map<String, String> tags,
    List<Filter> filters
) implements Resource {

    public InternetGatewayDataSource {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public String blockType() {
        return DATA;
    }

    @Override
    public String resourceType() {
        return InternetGateway.TYPE;
    }

    @Override
    public String label() {
        return name;
    }

    @Override
    public <T> T accept(ResourceVisitor<T> visitor) {
        return visitor.visitInternetGatewayDataSource(this);
    }
}
