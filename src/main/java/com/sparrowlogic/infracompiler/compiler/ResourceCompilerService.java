package com.sparrowlogic.infracompiler.compiler;

import com.sparrowlogic.infracompiler.ir.Block;
import com.sparrowlogic.infracompiler.ir.Program;
import com.sparrowlogic.infracompiler.model.AwsProvider;
import com.sparrowlogic.infracompiler.model.ElasticIp;
import com.sparrowlogic.infracompiler.model.IamRole;
import com.sparrowlogic.infracompiler.model.InternetGateway;
import com.sparrowlogic.infracompiler.model.InternetGatewayDataSource;
import com.sparrowlogic.infracompiler.model.ManagedCluster;
import com.sparrowlogic.infracompiler.model.NatGateway;
import com.sparrowlogic.infracompiler.model.NatGatewayDataSource;
import com.sparrowlogic.infracompiler.model.Network;
import com.sparrowlogic.infracompiler.model.NetworkDataSource;
import com.sparrowlogic.infracompiler.model.Resource;
import com.sparrowlogic.infracompiler.model.ResourceVisitor;
import com.sparrowlogic.infracompiler.model.StorageBucket;
import com.sparrowlogic.infracompiler.model.StorageBucketAcl;
import com.sparrowlogic.infracompiler.model.Subnet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Routes each resource kind to its compiler and assembles whole programs.
 */
@Service
public class ResourceCompilerService implements ResourceVisitor<Block> {

    private static final Logger logger = LoggerFactory.getLogger(ResourceCompilerService.class);

    private final ProviderCompiler providerCompiler = new ProviderCompiler();
    private final NetworkCompiler networkCompiler = new NetworkCompiler();
    private final NetworkDataSourceCompiler networkDataSourceCompiler = new NetworkDataSourceCompiler();
    private final SubnetCompiler subnetCompiler = new SubnetCompiler();
    private final InternetGatewayCompiler internetGatewayCompiler = new InternetGatewayCompiler();
    private final InternetGatewayDataSourceCompiler internetGatewayDataSourceCompiler =
        new InternetGatewayDataSourceCompiler();
    private final ElasticIpCompiler elasticIpCompiler = new ElasticIpCompiler();
    private final NatGatewayCompiler natGatewayCompiler = new NatGatewayCompiler();
    private final NatGatewayDataSourceCompiler natGatewayDataSourceCompiler = new NatGatewayDataSourceCompiler();
    private final IamRoleCompiler iamRoleCompiler = new IamRoleCompiler();
    private final ManagedClusterCompiler managedClusterCompiler = new ManagedClusterCompiler();
    private final StorageBucketCompiler storageBucketCompiler = new StorageBucketCompiler();
    private final StorageBucketAclCompiler storageBucketAclCompiler = new StorageBucketAclCompiler();

    public Block compile(Resource resource) {
        var block = resource.accept(this);
        logger.debug("Compiled {} {}.{}", resource.blockType(), resource.resourceType(), resource.label());
        return block;
    }

    public Block compile(AwsProvider provider) {
        return providerCompiler.compile(provider);
    }

    public Program compileProgram(AwsProvider provider, List<? extends Resource> resources) {
        var blocks = new ArrayList<Block>(resources.size() + 1);
        if (provider != null) {
            blocks.add(compile(provider));
        }
        resources.forEach(resource -> blocks.add(compile(resource)));
        logger.info("Compiled program with {} blocks", blocks.size());
        return new Program(blocks);
    }

    @Override
    public Block visitNetwork(Network network) {
        return networkCompiler.compile(network);
    }

    @Override
    public Block visitNetworkDataSource(NetworkDataSource dataSource) {
        return networkDataSourceCompiler.compile(dataSource);
    }

    @Override
    public Block visitSubnet(Subnet subnet) {
        return subnetCompiler.compile(subnet);
    }

    @Override
    public Block visitInternetGateway(InternetGateway gateway) {
        return internetGatewayCompiler.compile(gateway);
    }

    @Override
    public Block visitInternetGatewayDataSource(InternetGatewayDataSource dataSource) {
        return internetGatewayDataSourceCompiler.compile(dataSource);
    }

    @Override
    public Block visitElasticIp(ElasticIp elasticIp) {
        return elasticIpCompiler.compile(elasticIp);
    }

    @Override
    public Block visitNatGateway(NatGateway gateway) {
        return natGatewayCompiler.compile(gateway);
    }

    @Override
    public Block visitNatGatewayDataSource(NatGatewayDataSource dataSource) {
        return natGatewayDataSourceCompiler.compile(dataSource);
    }

    @Override
    public Block visitIamRole(IamRole role) {
        return iamRoleCompiler.compile(role);
    }

    @Override
    public Block visitManagedCluster(ManagedCluster cluster) {
        return managedClusterCompiler.compile(cluster);
    }

    @Override
    public Block visitStorageBucket(StorageBucket bucket) {
        return storageBucketCompiler.compile(bucket);
    }

    @Override
    public Block visitStorageBucketAcl(StorageBucketAcl bucketAcl) {
        return storageBucketAclCompiler.compile(bucketAcl);
    }
}
