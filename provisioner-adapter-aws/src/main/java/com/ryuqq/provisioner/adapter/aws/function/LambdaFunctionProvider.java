package com.ryuqq.provisioner.adapter.aws.function;

import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.model.ResourceKey;
import com.ryuqq.provisioner.core.model.ResourceKind;
import com.ryuqq.provisioner.core.spi.ResourceDetails;
import com.ryuqq.provisioner.core.spi.ResourceProvider;
import com.ryuqq.provisioner.core.spi.ResourceRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.lambda.model.CreateFunctionRequest;
import software.amazon.awssdk.services.lambda.model.DeleteFunctionRequest;
import software.amazon.awssdk.services.lambda.model.Environment;
import software.amazon.awssdk.services.lambda.model.FunctionCode;
import software.amazon.awssdk.services.lambda.model.FunctionConfiguration;
import software.amazon.awssdk.services.lambda.model.GetFunctionRequest;
import software.amazon.awssdk.services.lambda.model.ResourceConflictException;
import software.amazon.awssdk.services.lambda.model.ResourceNotFoundException;
import software.amazon.awssdk.services.lambda.model.Runtime;
import software.amazon.awssdk.services.lambda.model.UpdateFunctionCodeRequest;
import software.amazon.awssdk.services.lambda.model.UpdateFunctionConfigurationRequest;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Compute function deployed from a single Python source file.
 *
 * <p><strong>Create-or-update:</strong></p>
 * <ol>
 *   <li>create (python3.11, {@value #HANDLER}, 30 s, 256 MB, publish)</li>
 *   <li>on conflict: update the code, wait until the update finished, then update role and
 *       environment</li>
 *   <li>wait until the function is ready to be wired</li>
 * </ol>
 *
 * <p>Identifier is the unqualified function ARN, which stays the same across updates.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class LambdaFunctionProvider implements ResourceProvider {

    private static final Logger log = LoggerFactory.getLogger(LambdaFunctionProvider.class);

    static final String HANDLER = "lambda_function.lambda_handler";
    static final int TIMEOUT_SECONDS = 30;
    static final int MEMORY_MB = 256;

    private final LambdaClient lambda;
    private final FunctionDefinition definition;

    public LambdaFunctionProvider(LambdaClient lambda, FunctionDefinition definition) {
        if (lambda == null) {
            throw new IllegalArgumentException("lambda cannot be null");
        }
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        this.lambda = lambda;
        this.definition = definition;
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.FUNCTION;
    }

    @Override
    public boolean exists(String name) {
        return findFunction(name).isPresent();
    }

    @Override
    public String create(ResourceRequest request) {
        String function = request.name();
        String role = request.requireRole();
        byte[] archive = FunctionArchive.zip(definition.source());
        Environment environment = Environment.builder().variables(environmentFor(request)).build();

        String arn;
        try {
            arn = lambda.createFunction(CreateFunctionRequest.builder()
                .functionName(function)
                .runtime(Runtime.PYTHON3_11)
                .role(role)
                .handler(HANDLER)
                .code(FunctionCode.builder().zipFile(SdkBytes.fromByteArray(archive)).build())
                .timeout(TIMEOUT_SECONDS)
                .memorySize(MEMORY_MB)
                .environment(environment)
                .publish(true)
                .build()).functionArn();
            log.info("[Lambda] Function created: {}", function);
            lambda.waiter().waitUntilFunctionActiveV2(getFunction(function));
        } catch (ResourceConflictException e) {
            log.info("[Lambda] Function {} already exists, updating code...", function);
            lambda.updateFunctionCode(UpdateFunctionCodeRequest.builder()
                .functionName(function)
                .zipFile(SdkBytes.fromByteArray(archive))
                .publish(true)
                .build());
            lambda.waiter().waitUntilFunctionUpdatedV2(getFunction(function));

            log.info("[Lambda] Updating configuration of {}...", function);
            arn = lambda.updateFunctionConfiguration(UpdateFunctionConfigurationRequest.builder()
                .functionName(function)
                .role(role)
                .environment(environment)
                .build()).functionArn();
            lambda.waiter().waitUntilFunctionUpdatedV2(getFunction(function));
        }
        return unqualified(arn);
    }

    @Override
    public Optional<ResourceDetails> describe(String identifier) {
        return findFunction(identifier).map(configuration -> {
            Map<String, String> attributes = new LinkedHashMap<>();
            if (configuration.state() != null) {
                attributes.put(ResourceDetails.STATUS, configuration.stateAsString());
            }
            return new ResourceDetails(unqualified(configuration.functionArn()), attributes);
        });
    }

    @Override
    public void delete(ResourceHandle handle) {
        try {
            lambda.deleteFunction(DeleteFunctionRequest.builder().functionName(handle.name()).build());
            log.info("[Lambda] Function deleted: {}", handle.name());
        } catch (ResourceNotFoundException e) {
            log.info("[Lambda] Function {} no longer exists", handle.name());
        }
    }

    Map<String, String> environmentFor(ResourceRequest request) {
        Map<String, String> variables = new LinkedHashMap<>(definition.environment());
        for (Map.Entry<String, ResourceKey> binding : definition.bindings().entrySet()) {
            variables.put(binding.getKey(), request.dependency(binding.getValue()).identifier());
        }
        return variables;
    }

    /**
     * Drops a version or alias qualifier: {@code arn:aws:lambda:r:a:function:name[:qualifier]}.
     */
    static String unqualified(String arn) {
        String[] parts = arn.split(":");
        if (parts.length <= 7) {
            return arn;
        }
        return String.join(":", Arrays.copyOf(parts, 7));
    }

    private Optional<FunctionConfiguration> findFunction(String nameOrArn) {
        try {
            return Optional.of(lambda.getFunction(getFunction(nameOrArn)).configuration());
        } catch (ResourceNotFoundException e) {
            return Optional.empty();
        }
    }

    private static GetFunctionRequest getFunction(String nameOrArn) {
        return GetFunctionRequest.builder().functionName(nameOrArn).build();
    }
}
