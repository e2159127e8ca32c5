package com.acme.pci.checks;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

public final class AwsEvidence {
    private AwsEvidence() {}

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final List<Integer> ADMIN_PORTS = List.of(22, 3389);
    static final String ANY_IPV4 = "0.0.0.0/0";
    static final String ANY_IPV6 = "::/0";

    public record Vpc(String id, boolean isDefault) {}
    public record Trail(String name, boolean multiRegion, boolean logFileValidation) {}
    public record LogGroup(String name, Integer retentionDays) {}
    public record Exposure(String groupId, String groupName, String vpcId, String ports, String source) {}

    public static final EvidenceExtractor<List<Vpc>> VPCS = payload -> list(payload, "Vpcs",
            n -> new Vpc(n.path("VpcId").asText(), n.path("IsDefault").asBoolean(false)));

    public static final EvidenceExtractor<List<Trail>> TRAILS = payload -> list(payload, "trailList",
            n -> new Trail(n.path("Name").asText(), n.path("IsMultiRegionTrail").asBoolean(false),
                    n.path("LogFileValidationEnabled").asBoolean(false)));

    /** Missing retentionInDays means the group never expires. */
    public static final EvidenceExtractor<List<LogGroup>> LOG_GROUPS = payload -> list(payload, "logGroups",
            n -> new LogGroup(n.path("logGroupName").asText(),
                    n.hasNonNull("retentionInDays") ? n.get("retentionInDays").asInt() : null));

    /** Resource ids (VPC, subnet or ENI) that have at least one active flow log. */
    public static final EvidenceExtractor<Set<String>> ACTIVE_FLOW_LOG_RESOURCES = payload -> {
        Evidence<List<String>> ev = list(payload, "FlowLogs",
                n -> "ACTIVE".equalsIgnoreCase(n.path("FlowLogStatus").asText()) ? n.path("ResourceId").asText() : null);
        if (!ev.isComplete()) return Evidence.incomplete(ev.reason());
        Set<String> ids = new LinkedHashSet<>();
        for (String id : ev.fact()) if (id != null && !id.isBlank()) ids.add(id);
        return Evidence.of(ids);
    };

    /** Inbound rules that open SSH/RDP, or every port, to the whole internet. */
    public static final EvidenceExtractor<List<Exposure>> ADMIN_PORT_EXPOSURES = payload -> {
        Evidence<List<JsonNode>> groups = list(payload, "SecurityGroups", n -> n);
        if (!groups.isComplete()) return Evidence.incomplete(groups.reason());
        List<Exposure> out = new ArrayList<>();
        for (JsonNode g : groups.fact()) {
            for (JsonNode perm : g.path("IpPermissions")) {
                String source = openSource(perm);
                if (source == null) continue;
                String ports = exposedAdminPorts(perm);
                if (ports != null) {
                    out.add(new Exposure(g.path("GroupId").asText(), g.path("GroupName").asText(),
                            g.path("VpcId").asText(), ports, source));
                }
            }
        }
        return Evidence.of(out);
    };

    static String openSource(JsonNode perm) {
        for (JsonNode r : perm.path("IpRanges")) if (ANY_IPV4.equals(r.path("CidrIp").asText())) return ANY_IPV4;
        for (JsonNode r : perm.path("Ipv6Ranges")) if (ANY_IPV6.equals(r.path("CidrIpv6").asText())) return ANY_IPV6;
        return null;
    }

    static String exposedAdminPorts(JsonNode perm) {
        String protocol = perm.path("IpProtocol").asText();
        if ("-1".equals(protocol)) return "all";
        if (!"tcp".equalsIgnoreCase(protocol) && !"6".equals(protocol)) return null;
        int from = perm.path("FromPort").asInt(-1);
        int to = perm.path("ToPort").asInt(-1);
        List<String> hit = new ArrayList<>();
        for (int port : ADMIN_PORTS) {
            if (from <= port && port <= to) hit.add(String.valueOf(port));
        }
        return hit.isEmpty() ? null : String.join(",", hit);
    }

    static <T> Evidence<List<T>> list(String payload, String field, Function<JsonNode, T> mapper) {
        if (payload == null || payload.isBlank()) return Evidence.incomplete("Empty response");
        JsonNode root;
        try {
            root = MAPPER.readTree(payload);
        } catch (Exception e) {
            return Evidence.incomplete("Response could not be parsed: " + e.getMessage());
        }
        JsonNode arr = root == null ? null : root.get(field);
        if (arr == null || !arr.isArray()) return Evidence.incomplete("Response has no '" + field + "' list");
        List<T> out = new ArrayList<>();
        for (JsonNode n : arr) out.add(mapper.apply(n));
        return Evidence.of(out);
    }
}
