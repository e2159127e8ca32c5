package com.acme.pci.checks;

import com.acme.pci.checks.AwsEvidence.Exposure;
import com.acme.pci.checks.AwsEvidence.LogGroup;
import com.acme.pci.checks.AwsEvidence.Trail;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AwsEvidenceTest {

    @Test
    void vpcs_areExtracted() {
        Evidence<List<AwsEvidence.Vpc>> ev = AwsEvidence.VPCS.extract(
                "{\"Vpcs\":[{\"VpcId\":\"vpc-1\",\"IsDefault\":true},{\"VpcId\":\"vpc-2\"}]}");
        assertTrue(ev.isComplete());
        assertEquals(List.of(new AwsEvidence.Vpc("vpc-1", true), new AwsEvidence.Vpc("vpc-2", false)), ev.fact());
    }

    @Test
    void unusablePayloads_areIncomplete() {
        assertFalse(AwsEvidence.VPCS.extract("").isComplete());
        assertFalse(AwsEvidence.VPCS.extract("{oops").isComplete());
        Evidence<List<AwsEvidence.Vpc>> missing = AwsEvidence.VPCS.extract("{\"Subnets\":[]}");
        assertFalse(missing.isComplete());
        assertTrue(missing.reason().contains("Vpcs"));
    }

    @Test
    void trails_readFlags() {
        List<Trail> trails = AwsEvidence.TRAILS.extract("{\"trailList\":[{\"Name\":\"org\",\"IsMultiRegionTrail\":true,"
                + "\"LogFileValidationEnabled\":false}]}").fact();
        assertEquals(List.of(new Trail("org", true, false)), trails);
    }

    @Test
    void logGroups_withoutRetentionNeverExpire() {
        List<LogGroup> groups = AwsEvidence.LOG_GROUPS.extract("{\"logGroups\":[{\"logGroupName\":\"/app\",\"retentionInDays\":30},"
                + "{\"logGroupName\":\"/audit\"}]}").fact();
        assertEquals(30, groups.get(0).retentionDays());
        assertNull(groups.get(1).retentionDays());
    }

    @Test
    void flowLogs_onlyActiveResourcesCount() {
        Set<String> ids = AwsEvidence.ACTIVE_FLOW_LOG_RESOURCES.extract("{\"FlowLogs\":["
                + "{\"ResourceId\":\"vpc-1\",\"FlowLogStatus\":\"ACTIVE\"},"
                + "{\"ResourceId\":\"vpc-2\",\"FlowLogStatus\":\"INACTIVE\"}]}").fact();
        assertEquals(Set.of("vpc-1"), ids);
    }

    @Test
    void adminPortExposures_matchOpenSshRdpAndAllTraffic() {
        String payload = "{\"SecurityGroups\":["
                + "{\"GroupId\":\"sg-1\",\"GroupName\":\"bastion\",\"VpcId\":\"vpc-1\",\"IpPermissions\":["
                + "  {\"IpProtocol\":\"tcp\",\"FromPort\":22,\"ToPort\":22,\"IpRanges\":[{\"CidrIp\":\"0.0.0.0/0\"}]},"
                + "  {\"IpProtocol\":\"tcp\",\"FromPort\":443,\"ToPort\":443,\"IpRanges\":[{\"CidrIp\":\"0.0.0.0/0\"}]}]},"
                + "{\"GroupId\":\"sg-2\",\"GroupName\":\"wide\",\"VpcId\":\"vpc-1\",\"IpPermissions\":["
                + "  {\"IpProtocol\":\"tcp\",\"FromPort\":0,\"ToPort\":65535,\"Ipv6Ranges\":[{\"CidrIpv6\":\"::/0\"}]}]},"
                + "{\"GroupId\":\"sg-3\",\"GroupName\":\"all\",\"VpcId\":\"vpc-2\",\"IpPermissions\":["
                + "  {\"IpProtocol\":\"-1\",\"IpRanges\":[{\"CidrIp\":\"0.0.0.0/0\"}]}]},"
                + "{\"GroupId\":\"sg-4\",\"GroupName\":\"internal\",\"VpcId\":\"vpc-2\",\"IpPermissions\":["
                + "  {\"IpProtocol\":\"tcp\",\"FromPort\":22,\"ToPort\":22,\"IpRanges\":[{\"CidrIp\":\"10.0.0.0/8\"}]}]}"
                + "]}";

        List<Exposure> exposures = AwsEvidence.ADMIN_PORT_EXPOSURES.extract(payload).fact();

        assertEquals(List.of(
                new Exposure("sg-1", "bastion", "vpc-1", "22", "0.0.0.0/0"),
                new Exposure("sg-2", "wide", "vpc-1", "22,3389", "::/0"),
                new Exposure("sg-3", "all", "vpc-2", "all", "0.0.0.0/0")), exposures);
    }
}
