package com.ryuqq.provisioner.adapter.aws.function;

import com.ryuqq.provisioner.core.model.ResourceKey;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What to deploy for one function.
 *
 * @param source source file zipped as the handler module
 * @param environment static environment variables
 * @param bindings environment variables filled with a dependency's identifier
 *                 (e.g. {@code TOPIC_ARN} bound to the topic)
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record FunctionDefinition(
    Path source,
    Map<String, String> environment,
    Map<String, ResourceKey> bindings
) {

    public FunctionDefinition {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        environment = environment == null ? Map.of() : Map.copyOf(environment);
        bindings = bindings == null ? Map.of() : Map.copyOf(bindings);
    }

    public static FunctionDefinition of(Path source) {
        return new FunctionDefinition(source, Map.of(), Map.of());
    }

    public FunctionDefinition withEnvironment(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(environment);
        copy.put(name, value);
        return new FunctionDefinition(source, copy, bindings);
    }

    public FunctionDefinition withBinding(String name, ResourceKey dependency) {
        Map<String, ResourceKey> copy = new LinkedHashMap<>(bindings);
        copy.put(name, dependency);
        return new FunctionDefinition(source, environment, copy);
    }
}
