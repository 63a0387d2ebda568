package com.sparrowlogic.infracompiler.service;

import com.sparrowlogic.infracompiler.cidr.CidrBlock;
import com.sparrowlogic.infracompiler.model.AvailabilityZone;
import com.sparrowlogic.infracompiler.model.ElasticIp;
import com.sparrowlogic.infracompiler.model.InternetGateway;
import com.sparrowlogic.infracompiler.model.NatGateway;
import com.sparrowlogic.infracompiler.model.Network;
import com.sparrowlogic.infracompiler.model.Region;
import com.sparrowlogic.infracompiler.model.Resource;
import com.sparrowlogic.infracompiler.model.Subnet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.AttributeBooleanValue;
import software.amazon.awssdk.services.ec2.model.DescribeAddressesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeInternetGatewaysRequest;
import software.amazon.awssdk.services.ec2.model.DescribeNatGatewaysRequest;
import software.amazon.awssdk.services.ec2.model.DescribeSubnetsRequest;
import software.amazon.awssdk.services.ec2.model.DescribeVpcAttributeRequest;
import software.amazon.awssdk.services.ec2.model.DescribeVpcAttributeResponse;
import software.amazon.awssdk.services.ec2.model.DescribeVpcsRequest;
import software.amazon.awssdk.services.ec2.model.NatGatewayState;
import software.amazon.awssdk.services.ec2.model.Tag;
import software.amazon.awssdk.services.ec2.model.VpcAttributeName;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Reads an existing VPC and the networking around it into typed resources. Read-only: nothing
 * is created or changed in the account.
 */
@Service
public class AwsInfrastructureService {

    private static final Logger logger = LoggerFactory.getLogger(AwsInfrastructureService.class);

    private static final Set<NatGatewayState> INACTIVE_NAT_STATES =
        EnumSet.of(NatGatewayState.DELETING, NatGatewayState.DELETED, NatGatewayState.FAILED);

    private final Ec2ClientFactory clientFactory;

    public AwsInfrastructureService(Ec2ClientFactory clientFactory) {
        this.clientFactory = clientFactory;
    }

    /**
     * Returns the VPC, its subnets, attached internet gateways, the elastic IPs used by its NAT
     * gateways and the NAT gateways themselves, in that order.
     */
    public List<Resource> importNetwork(String profile, Region region, String vpcId) {
        try (var ec2Client = clientFactory.create(profile, region)) {
            return importNetwork(ec2Client, vpcId);
        }
    }

    private List<Resource> importNetwork(Ec2Client ec2Client, String vpcId) {
        var names = new TerraformNames();
        var vpcFilter = software.amazon.awssdk.services.ec2.model.Filter.builder()
            .name("vpc-id").values(vpcId).build();

        var vpc = ec2Client.describeVpcs(DescribeVpcsRequest.builder().vpcIds(vpcId).build())
            .vpcs().stream()
            .findFirst()
            .orElseThrow(() -> new VpcNotFoundException(vpcId));

        var network = new Network(
            names.assign(Network.TYPE, vpc.tags(), vpc.vpcId()),
            CidrBlock.parse(vpc.cidrBlock()),
            vpc.instanceTenancyAsString(),
            vpcAttribute(ec2Client, vpcId, VpcAttributeName.ENABLE_DNS_HOSTNAMES,
                DescribeVpcAttributeResponse::enableDnsHostnames),
            vpcAttribute(ec2Client, vpcId, VpcAttributeName.ENABLE_DNS_SUPPORT,
                DescribeVpcAttributeResponse::enableDnsSupport),
            null,
            null,
            null,
            tags(vpc.tags())
        );

        var resources = new ArrayList<Resource>();
        resources.add(network);

        var subnetsById = new HashMap<String, Subnet>();
        ec2Client.describeSubnets(DescribeSubnetsRequest.builder().filters(vpcFilter).build())
            .subnets()
            .forEach(s -> {
                var ipv6 = s.ipv6CidrBlockAssociationSet().stream()
                    .map(association -> association.ipv6CidrBlock())
                    .findFirst()
                    .orElse(null);
                var subnet = new Subnet(
                    names.assign(Subnet.TYPE, s.tags(), s.subnetId()),
                    network,
                    CidrBlock.parse(s.cidrBlock()),
                    availabilityZone(s.availabilityZone(), s.subnetId()),
                    s.assignIpv6AddressOnCreation(),
                    ipv6,
                    s.mapPublicIpOnLaunch(),
                    tags(s.tags())
                );
                subnetsById.put(s.subnetId(), subnet);
                resources.add(subnet);
            });

        var igwFilter = software.amazon.awssdk.services.ec2.model.Filter.builder()
            .name("attachment.vpc-id").values(vpcId).build();
        ec2Client.describeInternetGateways(DescribeInternetGatewaysRequest.builder().filters(igwFilter).build())
            .internetGateways()
            .forEach(igw -> resources.add(new InternetGateway(
                names.assign(InternetGateway.TYPE, igw.tags(), igw.internetGatewayId()),
                network,
                tags(igw.tags())
            )));

        var natGateways = ec2Client.describeNatGateways(DescribeNatGatewaysRequest.builder().filter(vpcFilter).build())
            .natGateways().stream()
            .filter(nat -> {
                if (INACTIVE_NAT_STATES.contains(nat.state())) {
                    logger.debug("Ignoring NAT gateway {} in state {}", nat.natGatewayId(), nat.stateAsString());
                    return false;
                }
                return true;
            })
            .toList();
        var allocationIds = natGateways.stream()
            .flatMap(nat -> nat.natGatewayAddresses().stream())
            .map(address -> address.allocationId())
            .filter(id -> id != null)
            .distinct()
            .toList();

        var elasticIpsByAllocation = new HashMap<String, ElasticIp>();
        if (!allocationIds.isEmpty()) {
            ec2Client.describeAddresses(DescribeAddressesRequest.builder().allocationIds(allocationIds).build())
                .addresses()
                .forEach(address -> {
                    var eip = new ElasticIp(
                        names.assign(ElasticIp.TYPE, address.tags(), address.allocationId()),
                        address.domainAsString(),
                        null,
                        null,
                        null,
                        null,
                        null,
                        null,
                        tags(address.tags())
                    );
                    elasticIpsByAllocation.put(address.allocationId(), eip);
                    resources.add(eip);
                });
        }

        natGateways.forEach(nat -> {
            var subnet = subnetsById.get(nat.subnetId());
            var elasticIp = nat.natGatewayAddresses().stream()
                .map(address -> elasticIpsByAllocation.get(address.allocationId()))
                .filter(eip -> eip != null)
                .findFirst()
                .orElse(null);
            if (subnet == null || elasticIp == null) {
                logger.warn("Skipping NAT gateway {}: subnet {} or its elastic IP is not part of VPC {}",
                    nat.natGatewayId(), nat.subnetId(), vpcId);
                return;
            }
            resources.add(new NatGateway(
                names.assign(NatGateway.TYPE, nat.tags(), nat.natGatewayId()),
                network,
                subnet,
                elasticIp,
                nat.connectivityTypeAsString(),
                null,
                tags(nat.tags())
            ));
        });

        logger.info("Imported {} resources from VPC {}", resources.size(), vpcId);
        return resources;
    }

    private Boolean vpcAttribute(Ec2Client ec2Client, String vpcId, VpcAttributeName attribute,
                                 Function<DescribeVpcAttributeResponse, AttributeBooleanValue> extractor) {
        var response = ec2Client.describeVpcAttribute(DescribeVpcAttributeRequest.builder()
            .vpcId(vpcId)
            .attribute(attribute)
            .build());
        if (response == null || extractor.apply(response) == null) {
            return null;
        }
        return extractor.apply(response).value();
    }

    private AvailabilityZone availabilityZone(String code, String subnetId) {
        if (code == null) {
            return null;
        }
        var zone = AvailabilityZone.fromCode(code);
        if (zone.isEmpty()) {
            logger.warn("Availability zone {} of subnet {} is not supported; leaving it unset", code, subnetId);
        }
        return zone.orElse(null);
    }

    // AWS does not distinguish "no tags" from an empty tag set
    private static Map<String, String> tags(List<Tag> tags) {
        if (tags == null || tags.isEmpty()) {
            return null;
        }
        var map = new LinkedHashMap<String, String>();
        tags.forEach(tag -> map.put(tag.key(), tag.value()));
        return map;
    }

    /**
     * Derives Terraform identifiers from Name tags, falling back to the AWS id, unique per type.
     */
    static final class TerraformNames {

        private final Map<String, Set<String>> used = new HashMap<>();

        String assign(String resourceType, List<Tag> tags, String awsId) {
            var nameTag = tags == null ? null : tags.stream()
                .filter(tag -> "Name".equals(tag.key()))
                .map(Tag::value)
                .filter(value -> value != null && !value.isBlank())
                .findFirst()
                .orElse(null);
            var base = sanitize(nameTag != null ? nameTag : awsId);

            var taken = used.computeIfAbsent(resourceType, type -> new HashSet<>());
            var candidate = base;
            for (int suffix = 2; !taken.add(candidate); suffix++) {
                candidate = base + "_" + suffix;
            }
            return candidate;
        }

        static String sanitize(String value) {
            var cleaned = value.trim().toLowerCase().replaceAll("[^a-z0-9_-]", "_");
            if (cleaned.isEmpty() || !Character.isLetter(cleaned.charAt(0)) && cleaned.charAt(0) != '_') {
                cleaned = "r_" + cleaned;
            }
            return cleaned;
        }
    }
}
