package com.sparrowlogic.infracompiler.model;

import java.util.Map;
import java.util.Objects;

public record InternetGateway(String name, Network network, Map<String, String> tags) implements Resource {

    public static final String TYPE = "aws_internet_gateway";

    public InternetGateway {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(network, "network");
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
        return visitor.visitInternetGateway(this);
    }
}
