package com.acme.pci.probe;

import com.acme.pci.model.ProbeResult;
import com.acme.pci.model.ReportMetadata;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public record CallerIdentity(String account, String arn) {
    private static final Logger log = LoggerFactory.getLogger(CallerIdentity.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final ApiCall GET_CALLER_IDENTITY = ApiCall.of("sts", "get-caller-identity", "Caller identity");

    public static CallerIdentity unknown() {
        return new CallerIdentity(ReportMetadata.UNKNOWN_IDENTITY, ReportMetadata.UNKNOWN_IDENTITY);
    }

    public static CallerIdentity lookup(Probe probe) {
        ProbeResult r = probe.run(GET_CALLER_IDENTITY);
        if (!r.ok() || r.isEmpty()) {
            log.warn("Caller identity unavailable: {}", r.error());
            return unknown();
        }
        try {
            JsonNode n = MAPPER.readTree(r.payload());
            String account = n.path("Account").asText("");
            String arn = n.path("Arn").asText("");
            return new CallerIdentity(account.isBlank() ? ReportMetadata.UNKNOWN_IDENTITY : account,
                    arn.isBlank() ? ReportMetadata.UNKNOWN_IDENTITY : arn);
        } catch (Exception e) {
            log.warn("Caller identity response could not be parsed: {}", e.getMessage());
            return unknown();
        }
    }
}
