package com.ryuqq.provisioner.cli;

import com.ryuqq.provisioner.adapter.aws.stack.DeploymentConfig;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.Map;

/**
 * Options shared by every subcommand; they override the environment.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class ConfigOptions {

    @Option(names = {"-s", "--state-file"}, paramLabel = "<path>",
        description = "State file (default: $STATE_FILE or aws_resources.json)")
    Path stateFile;

    @Option(names = {"-r", "--region"}, paramLabel = "<region>",
        description = "AWS region (default: $AWS_DEFAULT_REGION or us-east-1)")
    String region;

    /**
     * @throws IllegalArgumentException if a variable or option holds an invalid value
     */
    DeploymentConfig resolve(Map<String, String> environment) {
        DeploymentConfig config = DeploymentConfig.fromEnvironment(environment);
        if (stateFile != null) {
            config = config.withStateFile(stateFile);
        }
        if (region != null) {
            config = config.withRegion(region);
        }
        return config;
    }
}
