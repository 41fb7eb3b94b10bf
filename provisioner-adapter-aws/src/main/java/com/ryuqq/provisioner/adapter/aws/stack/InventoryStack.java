package com.ryuqq.provisioner.adapter.aws.stack;

import com.ryuqq.provisioner.adapter.aws.function.FunctionDefinition;
import com.ryuqq.provisioner.adapter.aws.function.LambdaFunctionProvider;
import com.ryuqq.provisioner.adapter.aws.function.LambdaPermissions;
import com.ryuqq.provisioner.adapter.aws.gateway.HttpApiGatewayProvider;
import com.ryuqq.provisioner.adapter.aws.storage.S3BucketProvider;
import com.ryuqq.provisioner.adapter.aws.storage.SeedDataProvider;
import com.ryuqq.provisioner.adapter.aws.storage.StaticSiteProvider;
import com.ryuqq.provisioner.adapter.aws.table.DynamoDbTableProvider;
import com.ryuqq.provisioner.adapter.aws.topic.SnsTopicProvider;
import com.ryuqq.provisioner.adapter.aws.trigger.BucketNotificationTriggerProvider;
import com.ryuqq.provisioner.adapter.aws.trigger.StreamMappingTriggerProvider;
import com.ryuqq.provisioner.core.model.ResourceKey;
import com.ryuqq.provisioner.core.model.ResourceKind;
import com.ryuqq.provisioner.core.model.ResourceNames;
import com.ryuqq.provisioner.core.readiness.ReadinessWaiter;
import com.ryuqq.provisioner.core.spec.DeploymentPlan;
import com.ryuqq.provisioner.core.spec.NameRule;
import com.ryuqq.provisioner.core.spec.OutputRule;
import com.ryuqq.provisioner.core.spec.ReconcilePolicy;
import com.ryuqq.provisioner.core.spec.ResourceSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.regions.Region;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Declaration of the inventory stack.
 *
 * <p><strong>Topology</strong> (arrows point at dependencies):</p>
 * <pre>
 * STORAGE:uploads   STORAGE:web   TABLE:inventory   TOPIC:low-stock
 * FUNCTION:loader   FUNCTION:api  FUNCTION:notify → TOPIC:low-stock
 * GATEWAY:inventory-api      → FUNCTION:api
 * TRIGGER:uploads-to-loader  → STORAGE:uploads, FUNCTION:loader
 * TRIGGER:stream-to-notify   → FUNCTION:notify, TABLE:inventory
 * STORAGE:web-site           → STORAGE:web, GATEWAY:inventory-api      (optional)
 * STORAGE:seed-data          → STORAGE:uploads, TRIGGER:uploads-to-loader (optional)
 * </pre>
 *
 * <p>The apply plan leaves out the optional steps whose local assets are missing. The
 * teardown plan always declares every resource so that anything recorded can be deleted.</p>
 *
 * <p>Buckets, the table and the topic are reused once confirmed. Functions, the gateway and the
 * triggers converge on every apply: they bind to dependency identifiers and function permissions,
 * which a name lookup cannot confirm.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class InventoryStack {

    private static final Logger log = LoggerFactory.getLogger(InventoryStack.class);

    public static final ResourceKey UPLOADS = ResourceKey.of(ResourceKind.STORAGE, "uploads");
    public static final ResourceKey WEB = ResourceKey.of(ResourceKind.STORAGE, "web");
    public static final ResourceKey TABLE = ResourceKey.of(ResourceKind.TABLE, "inventory");
    public static final ResourceKey LOADER = ResourceKey.of(ResourceKind.FUNCTION, "loader");
    public static final ResourceKey API = ResourceKey.of(ResourceKind.FUNCTION, "api");
    public static final ResourceKey GATEWAY = ResourceKey.of(ResourceKind.GATEWAY, "inventory-api");
    public static final ResourceKey UPLOADS_TRIGGER = ResourceKey.of(ResourceKind.TRIGGER, "uploads-to-loader");
    public static final ResourceKey TOPIC = ResourceKey.of(ResourceKind.TOPIC, "low-stock");
    public static final ResourceKey NOTIFY = ResourceKey.of(ResourceKind.FUNCTION, "notify");
    public static final ResourceKey STREAM_TRIGGER = ResourceKey.of(ResourceKind.TRIGGER, "stream-to-notify");
    public static final ResourceKey WEB_SITE = ResourceKey.of(ResourceKind.STORAGE, "web-site");
    public static final ResourceKey SEED_DATA = ResourceKey.of(ResourceKind.STORAGE, "seed-data");

    public static final String TABLE_NAME = "Inventory";
    public static final String LOADER_FUNCTION = "LoadInventoryFunction";
    public static final String API_FUNCTION = "GetInventoryApiFunction";
    public static final String NOTIFY_FUNCTION = "NotifyLowStockFunction";
    public static final String API_NAME = "InventoryAPI";

    private static final String SOURCE_FILE = "lambda_function.py";

    private final DeploymentConfig config;
    private final AwsClients clients;

    public InventoryStack(DeploymentConfig config, AwsClients clients) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clients == null) {
            throw new IllegalArgumentException("clients cannot be null");
        }
        this.config = config;
        this.clients = clients;
    }

    /**
     * Plan for {@code apply}: optional steps only when their assets exist.
     */
    public DeploymentPlan applyPlan() {
        boolean withSite = Files.isRegularFile(config.webIndex());
        if (!withSite) {
            log.warn("Web index {} not found, skipping the static site", config.webIndex());
        }
        boolean withSeed = config.seedData() && Files.isDirectory(config.seedDir());
        if (config.seedData() && !withSeed) {
            log.warn("Seed folder {} not found, skipping the data upload", config.seedDir());
        }
        return DeploymentPlan.of(specs(withSite, withSeed));
    }

    /**
     * Plan for {@code destroy}: every resource the stack can create.
     */
    public DeploymentPlan teardownPlan() {
        return DeploymentPlan.of(specs(true, true));
    }

    private List<ResourceSpec> specs(boolean withSite, boolean withSeed) {
        Region region = clients.region();
        LambdaPermissions permissions = new LambdaPermissions(clients.lambda());
        S3BucketProvider buckets = new S3BucketProvider(clients.s3(), region);
        DynamoDbTableProvider tables = new DynamoDbTableProvider(clients.dynamoDb());
        HttpApiGatewayProvider gateways = new HttpApiGatewayProvider(clients.apiGateway(), permissions, region, API);

        List<ResourceSpec> specs = new ArrayList<>();
        specs.add(ResourceSpec.of(UPLOADS, NameRule.suffixed(ResourceNames.UPLOADS_BUCKET_PREFIX), buckets)
            .withOutput("uploads-bucket", OutputRule.name()));
        specs.add(ResourceSpec.of(WEB, NameRule.suffixed(ResourceNames.WEB_BUCKET_PREFIX), buckets)
            .withOutput("web-bucket", OutputRule.name()));
        specs.add(ResourceSpec.of(TABLE, NameRule.fixed(TABLE_NAME), tables)
            .withOutput("table-arn", OutputRule.identifier()));

        specs.add(function(LOADER, LOADER_FUNCTION, FunctionDefinition.of(source("load_inventory"))
            .withEnvironment("TABLE_NAME", TABLE_NAME)));
        specs.add(function(API, API_FUNCTION, FunctionDefinition.of(source("get_inventory_api"))
            .withEnvironment("TABLE_NAME", TABLE_NAME)));

        specs.add(ResourceSpec.of(GATEWAY, NameRule.fixed(API_NAME), gateways)
            .withDependsOn(API)
            .withPolicy(ReconcilePolicy.CONVERGE)
            .withOutput("api-endpoint", handle -> gateways.endpoint(handle.identifier())));
        specs.add(ResourceSpec.of(UPLOADS_TRIGGER, NameRule.suffixed(ResourceNames.UPLOADS_BUCKET_PREFIX),
                new BucketNotificationTriggerProvider(clients.s3(), permissions,
                    new ReadinessWaiter(config.readiness()), UPLOADS, LOADER))
            .withDependsOn(UPLOADS, LOADER)
            .withPolicy(ReconcilePolicy.CONVERGE));

        specs.add(ResourceSpec.of(TOPIC, NameRule.suffixed(ResourceNames.TOPIC_PREFIX),
                new SnsTopicProvider(clients.sns(), config.email()))
            .withOutput("topic-arn", OutputRule.identifier()));
        specs.add(function(NOTIFY, NOTIFY_FUNCTION, FunctionDefinition.of(source("notify_low_stock"))
            .withBinding("TOPIC_ARN", TOPIC))
            .withDependsOn(TOPIC));
        specs.add(ResourceSpec.of(STREAM_TRIGGER, NameRule.fixed(NOTIFY_FUNCTION),
                new StreamMappingTriggerProvider(clients.lambda(), TABLE, tables, NOTIFY))
            .withDependsOn(NOTIFY, TABLE)
            .withPolicy(ReconcilePolicy.CONVERGE));

        if (withSite) {
            specs.add(ResourceSpec.of(WEB_SITE, NameRule.suffixed(ResourceNames.WEB_BUCKET_PREFIX),
                    new StaticSiteProvider(clients.s3(), region, config.webIndex(), GATEWAY, gateways))
                .withDependsOn(WEB, GATEWAY)
                .withPolicy(ReconcilePolicy.CONVERGE)
                .withOutput("web-url", OutputRule.identifier()));
        }
        if (withSeed) {
            specs.add(ResourceSpec.of(SEED_DATA, NameRule.suffixed(ResourceNames.UPLOADS_BUCKET_PREFIX),
                    new SeedDataProvider(clients.s3(), config.seedDir()))
                .withDependsOn(UPLOADS, UPLOADS_TRIGGER)
                .withPolicy(ReconcilePolicy.CONVERGE));
        }
        return specs;
    }

    private ResourceSpec function(ResourceKey key, String name, FunctionDefinition definition) {
        return ResourceSpec.of(key, NameRule.fixed(name), new LambdaFunctionProvider(clients.lambda(), definition))
            .withRequiresRole(true)
            .withPolicy(ReconcilePolicy.CONVERGE);
    }

    private Path source(String folder) {
        return config.functionsDir().resolve(folder).resolve(SOURCE_FILE);
    }
}
