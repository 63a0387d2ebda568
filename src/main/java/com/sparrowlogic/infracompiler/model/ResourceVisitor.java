package com.sparrowlogic.infracompiler.model;

public interface ResourceVisitor<T> {

    T visitNetwork(Network network);

    T visitNetworkDataSource(NetworkDataSource dataSource);

    T visitSubnet(Subnet subnet);

    T visitInternetGateway(InternetGateway gateway);

    T visitInternetGatewayDataSource(InternetGatewayDataSource dataSource);

    T visitElasticIp(ElasticIp elasticIp);

    T visitNatGateway(NatGateway gateway);

    T visitNatGatewayDataSource(NatGatewayDataSource dataSource);

    T visitIamRole(IamRole role);

    T visitManagedCluster(ManagedCluster cluster);

    T visitStorageBucket(StorageBucket bucket);

    T visitStorageBucketAcl(StorageBucketAcl bucketAcl);
}
