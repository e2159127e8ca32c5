package com.acme.pci.probe;

import java.util.List;

public final class CapabilityCatalog {
    private CapabilityCatalog() {}

    public static final List<ApiCall> REQUIREMENT_1 = List.of(
            ApiCall.of("ec2", "describe-vpcs", "VPC Configuration"),
            ApiCall.of("ec2", "describe-security-groups", "Security Group Rules"),
            ApiCall.of("ec2", "describe-network-acls", "Network ACLs"),
            ApiCall.of("ec2", "describe-subnets", "Subnet Configuration"),
            ApiCall.of("ec2", "describe-route-tables", "Route Tables"),
            ApiCall.of("ec2", "describe-vpc-endpoints", "VPC Endpoints"),
            ApiCall.of("ec2", "describe-vpc-peering-connections", "VPC Peering"),
            ApiCall.of("ec2", "describe-nat-gateways", "NAT Gateways"),
            ApiCall.of("ec2", "describe-internet-gateways", "Internet Gateways"),
            ApiCall.of("ec2", "describe-flow-logs", "VPC Flow Logs"),
            ApiCall.of("wafv2", "list-web-acls", "WAF Configuration", "--scope", "REGIONAL"),
            ApiCall.of("ec2", "describe-transit-gateways", "Transit Gateways")
    );

    public static final List<ApiCall> REQUIREMENT_10 = List.of(
            ApiCall.of("cloudtrail", "describe-trails", "CloudTrail Trails"),
            ApiCall.of("cloudtrail", "lookup-events", "CloudTrail Audit", "--max-items", "1"),
            ApiCall.of("logs", "describe-log-groups", "CloudWatch Logs", "--max-items", "1"),
            ApiCall.of("cloudwatch", "describe-alarms", "CloudWatch Alarms", "--max-items", "1"),
            ApiCall.of("ec2", "describe-flow-logs", "VPC Flow Logs"),
            ApiCall.of("s3api", "list-buckets", "S3 Buckets"),
            ApiCall.of("configservice", "describe-configuration-recorders", "AWS Config Recorders"),
            ApiCall.of("guardduty", "list-detectors", "GuardDuty Detectors"),
            ApiCall.of("securityhub", "describe-hub", "Security Hub")
    );

    public static List<ApiCall> forRequirement(String requirement) {
        return switch (requirement) {
            case "1" -> REQUIREMENT_1;
            case "10" -> REQUIREMENT_10;
            default -> throw new IllegalArgumentException("No capability list for requirement " + requirement);
        };
    }
}
