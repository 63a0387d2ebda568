package com.sparrowlogic.infracompiler.model;

import java.util.Map;
import java.util.Objects;

public record ElasticIp(
    String name,
    String domain,
    String instance,
    String networkInterface,
    String publicIpv4Pool,
    String customerOwnedIpv4Pool,
    String associateWithPrivateIp,
    String address,
    Map<String, String> tags
) implements Resource {

    public static final String TYPE = "aws_eip";

    public ElasticIp {
        Objects.requireNonNull(name, "name");
    }

    public static ElasticIp inVpc(String name) {
        return new ElasticIp(name, "vpc", null, null, null, null, null, null, null);
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
        return visitor.visitElasticIp(this);
    }
}
