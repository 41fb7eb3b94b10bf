package com.ryuqq.provisioner.adapter.aws.table;

import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.model.ResourceKind;
import com.ryuqq.provisioner.core.spi.ResourceDetails;
import com.ryuqq.provisioner.core.spi.ResourceProvider;
import com.ryuqq.provisioner.core.spi.ResourceRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.ResourceInUseException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;
import software.amazon.awssdk.services.dynamodb.model.StreamSpecification;
import software.amazon.awssdk.services.dynamodb.model.StreamViewType;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Inventory table: {@code store} (HASH) + {@code item} (RANGE), on-demand billing, with a
 * {@code NEW_AND_OLD_IMAGES} change stream.
 *
 * <p>The stream is requested at creation only. An existing table is accepted as is.</p>
 *
 * <p>Identifier is the table ARN. {@link #describe(String)} exposes the latest stream ARN
 * under {@link ResourceDetails#STREAM_ARN}.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class DynamoDbTableProvider implements ResourceProvider {

    private static final Logger log = LoggerFactory.getLogger(DynamoDbTableProvider.class);

    static final String PARTITION_KEY = "store";
    static final String SORT_KEY = "item";

    private final DynamoDbClient dynamoDb;

    public DynamoDbTableProvider(DynamoDbClient dynamoDb) {
        if (dynamoDb == null) {
            throw new IllegalArgumentException("dynamoDb cannot be null");
        }
        this.dynamoDb = dynamoDb;
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.TABLE;
    }

    @Override
    public boolean exists(String name) {
        return findTable(name).isPresent();
    }

    @Override
    public String create(ResourceRequest request) {
        String table = request.name();
        try {
            dynamoDb.createTable(CreateTableRequest.builder()
                .tableName(table)
                .keySchema(
                    KeySchemaElement.builder().attributeName(PARTITION_KEY).keyType(KeyType.HASH).build(),
                    KeySchemaElement.builder().attributeName(SORT_KEY).keyType(KeyType.RANGE).build())
                .attributeDefinitions(
                    AttributeDefinition.builder().attributeName(PARTITION_KEY).attributeType(ScalarAttributeType.S).build(),
                    AttributeDefinition.builder().attributeName(SORT_KEY).attributeType(ScalarAttributeType.S).build())
                .billingMode(BillingMode.PAY_PER_REQUEST)
                .streamSpecification(StreamSpecification.builder()
                    .streamEnabled(true)
                    .streamViewType(StreamViewType.NEW_AND_OLD_IMAGES)
                    .build())
                .build());
            log.info("[DDB] Creating table {}...", table);
        } catch (ResourceInUseException e) {
            log.info("[DDB] Table already exists: {}", table);
        }

        dynamoDb.waiter().waitUntilTableExists(DescribeTableRequest.builder().tableName(table).build());
        return describeTable(table).tableArn();
    }

    @Override
    public Optional<ResourceDetails> describe(String identifier) {
        return findTable(tableName(identifier)).map(description -> {
            Map<String, String> attributes = new HashMap<>();
            if (description.latestStreamArn() != null) {
                attributes.put(ResourceDetails.STREAM_ARN, description.latestStreamArn());
            }
            if (description.tableStatus() != null) {
                attributes.put(ResourceDetails.STATUS, description.tableStatusAsString());
            }
            return new ResourceDetails(description.tableArn(), attributes);
        });
    }

    @Override
    public void delete(ResourceHandle handle) {
        String table = handle.name();
        try {
            dynamoDb.deleteTable(DeleteTableRequest.builder().tableName(table).build());
            log.info("[DDB] Deleting table {}...", table);
        } catch (ResourceNotFoundException e) {
            log.info("[DDB] Table {} no longer exists", table);
            return;
        }
        dynamoDb.waiter().waitUntilTableNotExists(DescribeTableRequest.builder().tableName(table).build());
        log.info("[DDB] Table deleted: {}", table);
    }

    /**
     * Table name from {@code arn:aws:dynamodb:region:account:table/Name}; plain names pass through.
     */
    static String tableName(String identifier) {
        int separator = identifier.indexOf(":table/");
        return separator < 0 ? identifier : identifier.substring(separator + ":table/".length());
    }

    private Optional<TableDescription> findTable(String table) {
        try {
            return Optional.of(describeTable(table));
        } catch (ResourceNotFoundException e) {
            return Optional.empty();
        }
    }

    private TableDescription describeTable(String table) {
        return dynamoDb.describeTable(DescribeTableRequest.builder().tableName(table).build()).table();
    }
}
