package com.acme.pci.probe;

import com.acme.pci.model.ProbeResult;

import java.util.List;

public final class ProbeOutputs {
    private ProbeOutputs() {}

    static final List<String> DENIAL_MARKERS = List.of(
            "AccessDenied",
            "UnauthorizedOperation",
            "UnauthorizedAccess",
            "operation: You are not authorized",
            "is not authorized to perform"
    );

    public static boolean isDenial(String output) {
        if (output == null) return false;
        for (String marker : DENIAL_MARKERS) {
            if (output.contains(marker)) return true;
        }
        return false;
    }

    /**
     * A zero exit is a completed call whatever its body says; denial markers are only looked
     * for in the error text of a failed call.
     */
    public static ProbeResult categorize(int exitCode, String stdout, String stderr) {
        if (exitCode == 0) {
            String payload = stdout == null ? "" : stdout.trim();
            return payload.isEmpty() ? ProbeResult.empty() : ProbeResult.success(payload);
        }
        String error = stderr == null || stderr.isBlank() ? (stdout == null ? "" : stdout.trim()) : stderr.trim();
        if (isDenial(error)) return ProbeResult.denied(error);
        return ProbeResult.error(error.isEmpty() ? "exit code " + exitCode : error);
    }
}
