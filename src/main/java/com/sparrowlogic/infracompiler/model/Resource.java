package com.sparrowlogic.infracompiler.model;

/**
 * A typed AWS resource or data source that compiles to exactly one top-level block.
 */
public sealed interface Resource
        permits Network, NetworkDataSource, Subnet, InternetGateway, InternetGatewayDataSource,
                ElasticIp, NatGateway, NatGatewayDataSource, IamRole, ManagedCluster,
                StorageBucket, StorageBucketAcl {

    String RESOURCE = "resource";
    String DATA = "data";

    /** {@code resource} or {@code data}. */
    default String blockType() {
        return RESOURCE;
    }

    /** Terraform type label, e.g. {@code aws_vpc}. */
    String resourceType();

    /** Second block label: the user-assigned name, or the kind's fallback literal. */
    String label();

    <T> T accept(ResourceVisitor<T> visitor);
}
