package com.acme.pci;

import com.acme.pci.engine.PermissionGate;

import java.nio.file.Path;
import java.util.Map;

public final class AssessmentConfig {

    static final String ENV_OUTPUT_DIR = "PCI_OUTPUT_DIR";
    static final String ENV_THRESHOLD = "PCI_PERMISSION_THRESHOLD";
    static final String ENV_AWS_CLI = "PCI_AWS_CLI";
    static final String ENV_PROBE_TIMEOUT = "PCI_PROBE_TIMEOUT_SECONDS";
    static final String ENV_DEFAULT_REGION = "PCI_DEFAULT_REGION";

    static final String DEFAULT_OUTPUT_DIR = "./reports";
    static final String DEFAULT_AWS_CLI = "aws";
    static final int DEFAULT_PROBE_TIMEOUT_SECONDS = 60;
    static final String DEFAULT_REGION = "us-east-1";

    private final Path outputDir;
    private final int threshold;
    private final String awsCli;
    private final int probeTimeoutSeconds;
    private final String defaultRegion;

    private AssessmentConfig(Builder b) {
        this.outputDir = b.outputDir;
        this.threshold = b.threshold;
        this.awsCli = b.awsCli;
        this.probeTimeoutSeconds = b.probeTimeoutSeconds;
        this.defaultRegion = b.defaultRegion;
    }

    public Path getOutputDir() { return outputDir; }
    public int getThreshold() { return threshold; }
    public String getAwsCli() { return awsCli; }
    public int getProbeTimeoutSeconds() { return probeTimeoutSeconds; }
    public String getDefaultRegion() { return defaultRegion; }

    public static AssessmentConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static AssessmentConfig fromEnvironment(Map<String, String> env) {
        return builder()
                .outputDir(Path.of(getEnv(env, ENV_OUTPUT_DIR, DEFAULT_OUTPUT_DIR)))
                .threshold(parseInt(env, ENV_THRESHOLD, PermissionGate.DEFAULT_THRESHOLD))
                .awsCli(getEnv(env, ENV_AWS_CLI, DEFAULT_AWS_CLI))
                .probeTimeoutSeconds(parseInt(env, ENV_PROBE_TIMEOUT, DEFAULT_PROBE_TIMEOUT_SECONDS))
                .defaultRegion(getEnv(env, ENV_DEFAULT_REGION, DEFAULT_REGION))
                .build();
    }

    public Builder toBuilder() {
        return builder()
                .outputDir(outputDir)
                .threshold(threshold)
                .awsCli(awsCli)
                .probeTimeoutSeconds(probeTimeoutSeconds)
                .defaultRegion(defaultRegion);
    }

    public static Builder builder() { return new Builder(); }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return v != null && !v.isBlank() ? v.trim() : defaultValue;
    }

    private static int parseInt(Map<String, String> env, String key, int defaultValue) {
        String v = env.get(key);
        if (v == null || v.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + v + "'", e);
        }
    }

    public static final class Builder {
        private Path outputDir = Path.of(DEFAULT_OUTPUT_DIR);
        private int threshold = PermissionGate.DEFAULT_THRESHOLD;
        private String awsCli = DEFAULT_AWS_CLI;
        private int probeTimeoutSeconds = DEFAULT_PROBE_TIMEOUT_SECONDS;
        private String defaultRegion = DEFAULT_REGION;

        public Builder outputDir(Path outputDir) { this.outputDir = outputDir; return this; }
        public Builder threshold(int threshold) { this.threshold = threshold; return this; }
        public Builder awsCli(String awsCli) { this.awsCli = awsCli; return this; }
        public Builder probeTimeoutSeconds(int s) { this.probeTimeoutSeconds = s; return this; }
        public Builder defaultRegion(String region) { this.defaultRegion = region; return this; }

        public AssessmentConfig build() {
            if (threshold < 0 || threshold > 100) throw new IllegalArgumentException("Permission threshold must be within 0..100, got " + threshold);
            if (probeTimeoutSeconds <= 0) throw new IllegalArgumentException("Probe timeout must be positive, got " + probeTimeoutSeconds);
            return new AssessmentConfig(this);
        }
    }
}
