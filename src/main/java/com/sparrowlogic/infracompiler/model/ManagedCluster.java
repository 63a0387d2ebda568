package com.sparrowlogic.infracompiler.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An {@code aws_eks_cluster} placed in one or more subnets of {@code network}.
 */
public record ManagedCluster(
    String name,
    Network network,
    List<Subnet> subnets,
    IamRole role,
    String version,
    List<String> enabledClusterLogTypes,
    Boolean endpointPrivateAccess,
    Boolean endpointPublicAccess,
    EncryptionConfig encryptionConfig,
    Map<String, String> tags
) implements Resource {

    public static final String TYPE = "aws_eks_cluster";

    public ManagedCluster {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(network, "network");
        Objects.requireNonNull(role, "role");
        subnets = List.copyOf(subnets);
        if (subnets.isEmpty()) {
            throw new IllegalArgumentException("Cluster " + name + " needs at least one subnet");
        }
    }

    public static ManagedCluster of(String name, Network network, List<Subnet> subnets, IamRole role) {
        return new ManagedCluster(name, network, subnets, role, null, null, null, null, null, null);
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
        return visitor.visitManagedCluster(this);
    }

    /**
     * Envelope encryption of cluster resources with a KMS key. {@code resources} is optional.
     */
    public record EncryptionConfig(String kmsKeyArn, List<String> resources) {

        public EncryptionConfig {
            Objects.requireNonNull(kmsKeyArn, "kmsKeyArn");
        }

        public static EncryptionConfig secrets(String kmsKeyArn) {
            return new EncryptionConfig(kmsKeyArn, List.of("secrets"));
        }
    }
}
