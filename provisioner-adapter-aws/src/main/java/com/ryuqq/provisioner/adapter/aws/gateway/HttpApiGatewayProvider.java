package com.ryuqq.provisioner.adapter.aws.gateway;

import com.ryuqq.provisioner.adapter.aws.function.LambdaPermissions;
import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.model.ResourceKey;
import com.ryuqq.provisioner.core.model.ResourceKind;
import com.ryuqq.provisioner.core.spi.ResourceDetails;
import com.ryuqq.provisioner.core.spi.ResourceProvider;
import com.ryuqq.provisioner.core.spi.ResourceRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.apigatewayv2.ApiGatewayV2Client;
import software.amazon.awssdk.services.apigatewayv2.model.Api;
import software.amazon.awssdk.services.apigatewayv2.model.ConflictException;
import software.amazon.awssdk.services.apigatewayv2.model.Cors;
import software.amazon.awssdk.services.apigatewayv2.model.CreateApiRequest;
import software.amazon.awssdk.services.apigatewayv2.model.CreateIntegrationRequest;
import software.amazon.awssdk.services.apigatewayv2.model.CreateRouteRequest;
import software.amazon.awssdk.services.apigatewayv2.model.CreateStageRequest;
import software.amazon.awssdk.services.apigatewayv2.model.DeleteApiRequest;
import software.amazon.awssdk.services.apigatewayv2.model.GetApiRequest;
import software.amazon.awssdk.services.apigatewayv2.model.GetApisRequest;
import software.amazon.awssdk.services.apigatewayv2.model.GetApisResponse;
import software.amazon.awssdk.services.apigatewayv2.model.GetIntegrationsRequest;
import software.amazon.awssdk.services.apigatewayv2.model.GetRoutesRequest;
import software.amazon.awssdk.services.apigatewayv2.model.Integration;
import software.amazon.awssdk.services.apigatewayv2.model.IntegrationType;
import software.amazon.awssdk.services.apigatewayv2.model.NotFoundException;
import software.amazon.awssdk.services.apigatewayv2.model.ProtocolType;
import software.amazon.awssdk.services.apigatewayv2.model.Route;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * HTTP API in front of the API function.
 *
 * <p><strong>Convergence steps</strong> (each skipped when already in place):</p>
 * <ol>
 *   <li>API looked up by name, created with CORS when absent</li>
 *   <li>invoke permission {@code ApiGatewayInvoke-{apiId}} on the function</li>
 *   <li>{@code AWS_PROXY} integration (payload 2.0) for the function</li>
 *   <li>routes {@code GET /items} and {@code GET /items/{store}}</li>
 *   <li>{@code $default} stage with auto-deploy</li>
 * </ol>
 *
 * <p>Identifier is the API id. {@link #describe(String)} exposes the invoke URL under
 * {@link ResourceDetails#ENDPOINT}.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class HttpApiGatewayProvider implements ResourceProvider {

    private static final Logger log = LoggerFactory.getLogger(HttpApiGatewayProvider.class);

    static final List<String> ROUTE_KEYS = List.of("GET /items", "GET /items/{store}");
    static final String STAGE_NAME = "$default";
    static final String PAYLOAD_FORMAT_VERSION = "2.0";

    private final ApiGatewayV2Client apiGateway;
    private final LambdaPermissions permissions;
    private final Region region;
    private final ResourceKey functionKey;

    /**
     * @param apiGateway API Gateway v2 client
     * @param permissions function permission helper
     * @param region deployment region
     * @param functionKey dependency holding the API function
     */
    public HttpApiGatewayProvider(ApiGatewayV2Client apiGateway, LambdaPermissions permissions,
                                  Region region, ResourceKey functionKey) {
        if (apiGateway == null) {
            throw new IllegalArgumentException("apiGateway cannot be null");
        }
        if (permissions == null) {
            throw new IllegalArgumentException("permissions cannot be null");
        }
        if (region == null) {
            throw new IllegalArgumentException("region cannot be null");
        }
        if (functionKey == null) {
            throw new IllegalArgumentException("functionKey cannot be null");
        }
        this.apiGateway = apiGateway;
        this.permissions = permissions;
        this.region = region;
        this.functionKey = functionKey;
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.GATEWAY;
    }

    @Override
    public boolean exists(String name) {
        return findApiId(name).isPresent();
    }

    @Override
    public String create(ResourceRequest request) {
        String functionArn = request.dependency(functionKey).identifier();
        String apiId = findApiId(request.name()).orElseGet(() -> createApi(request.name()));

        permissions.grantInvoke(functionArn, "ApiGatewayInvoke-" + apiId, "apigateway.amazonaws.com",
            executeApiArn(functionArn, apiId));
        String integrationId = ensureIntegration(apiId, functionArn);
        ensureRoutes(apiId, integrationId);
        ensureStage(apiId);

        log.info("[API GW] {} ready at {}", request.name(), endpoint(apiId));
        return apiId;
    }

    @Override
    public Optional<ResourceDetails> describe(String identifier) {
        try {
            apiGateway.getApi(GetApiRequest.builder().apiId(identifier).build());
            return Optional.of(new ResourceDetails(identifier, Map.of(ResourceDetails.ENDPOINT, endpoint(identifier))));
        } catch (NotFoundException e) {
            return Optional.empty();
        }
    }

    @Override
    public void delete(ResourceHandle handle) {
        try {
            apiGateway.deleteApi(DeleteApiRequest.builder().apiId(handle.identifier()).build());
            log.info("[API GW] API deleted: {} ({})", handle.name(), handle.identifier());
        } catch (NotFoundException e) {
            log.info("[API GW] API {} no longer exists", handle.identifier());
        }
    }

    /**
     * @return {@code https://{apiId}.execute-api.{region}.amazonaws.com}
     */
    public String endpoint(String apiId) {
        return "https://" + apiId + ".execute-api." + region.id() + ".amazonaws.com";
    }

    private Optional<String> findApiId(String name) {
        String nextToken = null;
        do {
            GetApisResponse page = apiGateway.getApis(GetApisRequest.builder().nextToken(nextToken).build());
            Optional<String> found = page.items().stream()
                .filter(api -> name.equals(api.name()))
                .map(Api::apiId)
                .findFirst();
            if (found.isPresent()) {
                return found;
            }
            nextToken = page.nextToken();
        } while (nextToken != null);
        return Optional.empty();
    }

    private String createApi(String name) {
        String apiId = apiGateway.createApi(CreateApiRequest.builder()
            .name(name)
            .protocolType(ProtocolType.HTTP)
            .corsConfiguration(Cors.builder()
                .allowOrigins("*")
                .allowMethods("GET", "OPTIONS")
                .allowHeaders("Content-Type")
                .build())
            .build()).apiId();
        log.info("[API GW] API created: {} (ID: {})", name, apiId);
        return apiId;
    }

    private String ensureIntegration(String apiId, String functionArn) {
        Optional<String> existing = apiGateway.getIntegrations(GetIntegrationsRequest.builder().apiId(apiId).build())
            .items().stream()
            .filter(integration -> integration.integrationType() == IntegrationType.AWS_PROXY)
            .filter(integration -> functionArn.equals(integration.integrationUri()))
            .map(Integration::integrationId)
            .findFirst();
        if (existing.isPresent()) {
            return existing.get();
        }
        String integrationId = apiGateway.createIntegration(CreateIntegrationRequest.builder()
            .apiId(apiId)
            .integrationType(IntegrationType.AWS_PROXY)
            .integrationUri(functionArn)
            .payloadFormatVersion(PAYLOAD_FORMAT_VERSION)
            .build()).integrationId();
        log.info("[API GW] Integration {} created for {}", integrationId, functionArn);
        return integrationId;
    }

    private void ensureRoutes(String apiId, String integrationId) {
        Set<String> present = apiGateway.getRoutes(GetRoutesRequest.builder().apiId(apiId).build())
            .items().stream()
            .map(Route::routeKey)
            .collect(Collectors.toSet());
        for (String routeKey : ROUTE_KEYS) {
            if (present.contains(routeKey)) {
                continue;
            }
            try {
                apiGateway.createRoute(CreateRouteRequest.builder()
                    .apiId(apiId)
                    .routeKey(routeKey)
                    .target("integrations/" + integrationId)
                    .build());
                log.info("[API GW] Route created: {}", routeKey);
            } catch (ConflictException e) {
                log.debug("[API GW] Route {} already exists", routeKey);
            }
        }
    }

    private void ensureStage(String apiId) {
        try {
            apiGateway.createStage(CreateStageRequest.builder()
                .apiId(apiId)
                .stageName(STAGE_NAME)
                .autoDeploy(true)
                .build());
            log.info("[API GW] Stage {} created", STAGE_NAME);
        } catch (ConflictException e) {
            log.debug("[API GW] Stage {} already exists", STAGE_NAME);
        }
    }

    /**
     * Source ARN of the invoke permission. Partition and account come from the function ARN.
     */
    private String executeApiArn(String functionArn, String apiId) {
        String[] parts = functionArn.split(":");
        return "arn:" + parts[1] + ":execute-api:" + region.id() + ":" + parts[4] + ":" + apiId + "/*/*";
    }
}
