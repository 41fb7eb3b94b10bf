package com.ryuqq.provisioner.adapter.aws.stack;

import com.ryuqq.provisioner.core.readiness.ReadinessConfig;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Settings of one deployment (immutable record).
 *
 * <p>Loaded once at start-up and passed explicitly to the stack definition. Providers never
 * read the environment themselves.</p>
 *
 * <p><strong>Environment variables:</strong></p>
 * <pre>
 * AWS_DEFAULT_REGION  region               (us-east-1)
 * EMAIL_NOTIFY        low-stock e-mail     (none)
 * ROLE_NAME           function role        (LabRole)
 * STATE_FILE          State Store path     (aws_resources.json)
 * FUNCTIONS_DIR       function sources     (lambdas)
 * WEB_INDEX           site template        (web/index.html)
 * SEED_DIR            CSV seed folder      (data)
 * SEED_DATA           upload seed data     (true)
 * </pre>
 *
 * @param region AWS region id
 * @param email address subscribed to the low-stock topic (nullable)
 * @param roleName execution role of the functions
 * @param stateFile State Store file
 * @param functionsDir folder holding one sub-folder per function
 * @param webIndex static site template
 * @param seedDir folder of CSV files uploaded after provisioning
 * @param seedData whether to upload seed data at all
 * @param readiness bound of propagation polls
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record DeploymentConfig(
    String region,
    String email,
    String roleName,
    Path stateFile,
    Path functionsDir,
    Path webIndex,
    Path seedDir,
    boolean seedData,
    ReadinessConfig readiness
) {

    public static final String DEFAULT_REGION = "us-east-1";
    public static final String DEFAULT_ROLE_NAME = "LabRole";
    public static final Path DEFAULT_STATE_FILE = Path.of("aws_resources.json");

    public DeploymentConfig {
        if (region == null || region.isBlank()) {
            throw new IllegalArgumentException("region cannot be null or blank");
        }
        if (roleName == null || roleName.isBlank()) {
            throw new IllegalArgumentException("roleName cannot be null or blank");
        }
        if (stateFile == null) {
            throw new IllegalArgumentException("stateFile cannot be null");
        }
        if (functionsDir == null) {
            throw new IllegalArgumentException("functionsDir cannot be null");
        }
        if (webIndex == null) {
            throw new IllegalArgumentException("webIndex cannot be null");
        }
        if (seedDir == null) {
            throw new IllegalArgumentException("seedDir cannot be null");
        }
        if (readiness == null) {
            throw new IllegalArgumentException("readiness cannot be null");
        }
        if (email != null && email.isBlank()) {
            email = null;
        }
    }

    /**
     * Default settings.
     */
    public DeploymentConfig() {
        this(DEFAULT_REGION, null, DEFAULT_ROLE_NAME, DEFAULT_STATE_FILE, Path.of("lambdas"),
            Path.of("web", "index.html"), Path.of("data"), true, new ReadinessConfig());
    }

    /**
     * Defaults overridden by whichever variables are set.
     *
     * @param environment variables, typically {@link System#getenv()}
     * @return config
     * @throws IllegalArgumentException if SEED_DATA is not a boolean
     */
    public static DeploymentConfig fromEnvironment(Map<String, String> environment) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        DeploymentConfig defaults = new DeploymentConfig();
        return new DeploymentConfig(
            value(environment, "AWS_DEFAULT_REGION", defaults.region()),
            value(environment, "EMAIL_NOTIFY", defaults.email()),
            value(environment, "ROLE_NAME", defaults.roleName()),
            path(environment, "STATE_FILE", defaults.stateFile()),
            path(environment, "FUNCTIONS_DIR", defaults.functionsDir()),
            path(environment, "WEB_INDEX", defaults.webIndex()),
            path(environment, "SEED_DIR", defaults.seedDir()),
            flag(environment, "SEED_DATA", defaults.seedData()),
            defaults.readiness());
    }

    public DeploymentConfig withRegion(String region) {
        return new DeploymentConfig(region, email, roleName, stateFile, functionsDir, webIndex, seedDir, seedData, readiness);
    }

    public DeploymentConfig withEmail(String email) {
        return new DeploymentConfig(region, email, roleName, stateFile, functionsDir, webIndex, seedDir, seedData, readiness);
    }

    public DeploymentConfig withRoleName(String roleName) {
        return new DeploymentConfig(region, email, roleName, stateFile, functionsDir, webIndex, seedDir, seedData, readiness);
    }

    public DeploymentConfig withStateFile(Path stateFile) {
        return new DeploymentConfig(region, email, roleName, stateFile, functionsDir, webIndex, seedDir, seedData, readiness);
    }

    public DeploymentConfig withFunctionsDir(Path functionsDir) {
        return new DeploymentConfig(region, email, roleName, stateFile, functionsDir, webIndex, seedDir, seedData, readiness);
    }

    public DeploymentConfig withWebIndex(Path webIndex) {
        return new DeploymentConfig(region, email, roleName, stateFile, functionsDir, webIndex, seedDir, seedData, readiness);
    }

    public DeploymentConfig withSeedDir(Path seedDir) {
        return new DeploymentConfig(region, email, roleName, stateFile, functionsDir, webIndex, seedDir, seedData, readiness);
    }

    public DeploymentConfig withSeedData(boolean seedData) {
        return new DeploymentConfig(region, email, roleName, stateFile, functionsDir, webIndex, seedDir, seedData, readiness);
    }

    public DeploymentConfig withReadiness(ReadinessConfig readiness) {
        return new DeploymentConfig(region, email, roleName, stateFile, functionsDir, webIndex, seedDir, seedData, readiness);
    }

    private static String value(Map<String, String> environment, String name, String fallback) {
        String value = environment.get(name);
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static Path path(Map<String, String> environment, String name, Path fallback) {
        String value = environment.get(name);
        return value == null || value.isBlank() ? fallback : Path.of(value.trim());
    }

    private static boolean flag(Map<String, String> environment, String name, boolean fallback) {
        String value = environment.get(name);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("true") || normalized.equals("1") || normalized.equals("yes")) {
            return true;
        }
        if (normalized.equals("false") || normalized.equals("0") || normalized.equals("no")) {
            return false;
        }
        throw new IllegalArgumentException(name + " must be true or false: " + value);
    }
}
