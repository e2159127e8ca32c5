package com.acme.pci.probe;

import com.acme.pci.model.ProbeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

public final class AwsCliProbe implements Probe {
    private static final Logger log = LoggerFactory.getLogger(AwsCliProbe.class);

    private final String cli;
    private final String region;
    private final int timeoutSeconds;

    public AwsCliProbe(String cli, String region, int timeoutSeconds) {
        this.cli = cli;
        this.region = region;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public ProbeResult run(ApiCall call) {
        List<String> cmd = new ArrayList<>();
        cmd.add(cli);
        cmd.add(call.service());
        cmd.add(call.command());
        cmd.addAll(call.args());
        if (region != null && !region.isBlank()) {
            cmd.add("--region");
            cmd.add(region);
        }
        cmd.add("--output");
        cmd.add("json");
        return exec(cmd);
    }

    /** Region from the local CLI profile, or null when none is configured. */
    public String configuredRegion() {
        ProbeResult r = exec(List.of(cli, "configure", "get", "region"));
        if (!r.ok() || r.isEmpty()) return null;
        return r.payload().trim();
    }

    ProbeResult exec(List<String> cmd) {
        log.debug("Running {}", cmd);
        Process process;
        try {
            process = new ProcessBuilder(cmd).start();
        } catch (IOException e) {
            log.warn("Cannot start '{}': {}", cli, e.getMessage());
            return ProbeResult.error("Cannot start " + cli + ": " + e.getMessage());
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()));
        try {
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return ProbeResult.error(String.join(" ", cmd) + " timed out after " + timeoutSeconds + "s");
            }
            String out = stdout.get(timeoutSeconds, TimeUnit.SECONDS);
            String err = stderr.get(timeoutSeconds, TimeUnit.SECONDS);
            if (process.exitValue() == 0 && !err.isBlank()) log.debug("{} wrote to stderr: {}", cmd.get(1), err.trim());
            return ProbeOutputs.categorize(process.exitValue(), out, err);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return ProbeResult.error("Interrupted while running " + String.join(" ", cmd));
        } catch (Exception e) {
            process.destroyForcibly();
            return ProbeResult.error("Failed to read output of " + String.join(" ", cmd) + ": " + e.getMessage());
        }
    }

    private static String readAll(InputStream in) {
        try (in) { return new String(in.readAllBytes(), StandardCharsets.UTF_8); }
        catch (IOException e) { throw new UncheckedIOException(e); }
    }
}
