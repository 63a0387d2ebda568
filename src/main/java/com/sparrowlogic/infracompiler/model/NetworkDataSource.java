package com.sparrowlogic.infracompiler.model;

import java.util.List;
import java.util.Map;

/**
 * Lookup of an existing VPC. Labelled by {@code id} when given, otherwise {@code "vpc"}.
 */
public record NetworkDataSource(
    String id,
    String cidrBlock,
    String ownerId,
    Boolean enableDnsHostnames,
    Boolean enableDnsSupport,
    Map<String, String> tags,
    List<Filter> filters
) implements Resource {

    public static final String FALLBACK_NAME = "vpc";

    @Override
    public String blockType() {
        return DATA;
    }

    @Override
    public String resourceType() {
        return Network.TYPE;
    }

    @Override
    public String label() {
        return id != null ? id : FALLBACK_NAME;
    }

    @Override
    public <T> T accept(ResourceVisitor<T> visitor) {
        return visitor.visitNetworkDataSource(this);
    }
}
