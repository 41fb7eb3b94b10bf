package com.ryuqq.provisioner.cli;

import com.ryuqq.provisioner.adapter.aws.stack.DeploymentConfig;
import com.ryuqq.provisioner.application.orchestrator.ApplyReport;
import com.ryuqq.provisioner.application.teardown.TeardownReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line entry point.
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * provisioner apply   [--state-file &lt;path&gt;] [--region &lt;region&gt;]
 * provisioner destroy [--state-file &lt;path&gt;] [--region &lt;region&gt;]
 * </pre>
 *
 * <p><strong>Exit codes:</strong> 0 success, 1 failed run, 2 usage or configuration error.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
@Command(name = "provisioner",
    mixinStandardHelpOptions = true,
    version = "provisioner 1.0.0",
    description = "Provisions and tears down the inventory stack",
    subcommands = {ProvisionerCli.ApplyCommand.class, ProvisionerCli.DestroyCommand.class})
public class ProvisionerCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ProvisionerCli.class);

    @Spec
    CommandSpec spec;

    private final Map<String, String> environment;
    private final DeploymentFactory factory;

    public ProvisionerCli() {
        this(System.getenv(), new AwsDeploymentFactory());
    }

    ProvisionerCli(Map<String, String> environment, DeploymentFactory factory) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        this.environment = environment;
        this.factory = factory;
    }

    public static void main(String[] args) {
        int exitCode = commandLine(new ProvisionerCli()).execute(args);
        System.exit(exitCode);
    }

    static CommandLine commandLine(ProvisionerCli cli) {
        return new CommandLine(cli)
            .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                log.error("Run aborted: {}", ex.getMessage(), ex);
                cmd.getErr().println("Error: " + ex.getMessage());
                return CommandLine.ExitCode.SOFTWARE;
            });
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return CommandLine.ExitCode.USAGE;
    }

    Deployment open(ConfigOptions options, CommandLine commandLine) {
        DeploymentConfig config;
        try {
            config = options.resolve(environment);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(commandLine, "Invalid configuration: " + e.getMessage(), e);
        }
        return factory.open(config);
    }

    // ===== Subcommands =====

    @Command(name = "apply", mixinStandardHelpOptions = true,
        description = "Create or resume the deployment recorded in the state file")
    static class ApplyCommand implements Callable<Integer> {

        @ParentCommand
        private ProvisionerCli parent;

        @Spec
        CommandSpec spec;

        @Mixin
        ConfigOptions options;

        @Override
        public Integer call() {
            try (Deployment deployment = parent.open(options, spec.commandLine())) {
                ApplyReport report = deployment.orchestrator().apply();
                log.info("Apply finished: {}", report);
                new ReportPrinter(spec.commandLine().getOut()).apply(report);
                return report.isSuccess() ? CommandLine.ExitCode.OK : CommandLine.ExitCode.SOFTWARE;
            }
        }
    }

    @Command(name = "destroy", mixinStandardHelpOptions = true,
        description = "Delete every resource recorded in the state file")
    static class DestroyCommand implements Callable<Integer> {

        @ParentCommand
        private ProvisionerCli parent;

        @Spec
        CommandSpec spec;

        @Mixin
        ConfigOptions options;

        @Override
        public Integer call() {
            try (Deployment deployment = parent.open(options, spec.commandLine())) {
                TeardownReport report = deployment.teardown().destroy();
                log.info("Destroy finished: {}", report);
                new ReportPrinter(spec.commandLine().getOut()).destroy(report);
                return report.isSuccess() ? CommandLine.ExitCode.OK : CommandLine.ExitCode.SOFTWARE;
            }
        }
    }
}
