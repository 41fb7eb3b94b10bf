package com.ryuqq.provisioner.adapter.aws.table;

import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.model.ResourceKey;
import com.ryuqq.provisioner.core.model.ResourceKind;
import com.ryuqq.provisioner.core.model.RunSuffix;
import com.ryuqq.provisioner.core.spi.ResourceDetails;
import com.ryuqq.provisioner.core.spi.ResourceRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.ResourceInUseException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.StreamViewType;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;
import software.amazon.awssdk.services.dynamodb.waiters.DynamoDbWaiter;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * DynamoDbTableProvider tests.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DynamoDbTableProviderTest {

    private static final String TABLE = "Inventory";
    private static final String TABLE_ARN = "arn:aws:dynamodb:us-east-1:123456789012:table/Inventory";
    private static final String STREAM_ARN = TABLE_ARN + "/stream/2024-01-01T00:00:00.000";

    @Mock
    private DynamoDbClient dynamoDb;

    @Mock
    private DynamoDbWaiter waiter;

    private DynamoDbTableProvider provider;

    @BeforeEach
    void setUp() {
        provider = new DynamoDbTableProvider(dynamoDb);
    }

    // ==================== create ====================

    @Test
    void create_NewTable_RequestsKeysBillingAndStream() {
        // given
        when(dynamoDb.waiter()).thenReturn(waiter);
        when(dynamoDb.describeTable(any(DescribeTableRequest.class))).thenReturn(described(TableStatus.ACTIVE));

        // when
        String arn = provider.create(ResourceRequest.of(TABLE, RunSuffix.of("20240101-abcd1234")));

        // then
        assertThat(arn).isEqualTo(TABLE_ARN);
        ArgumentCaptor<CreateTableRequest> captor = ArgumentCaptor.forClass(CreateTableRequest.class);
        verify(dynamoDb).createTable(captor.capture());
        CreateTableRequest request = captor.getValue();
        assertThat(request.tableName()).isEqualTo(TABLE);
        assertThat(request.keySchema()).hasSize(2);
        assertThat(request.keySchema().get(0).attributeName()).isEqualTo("store");
        assertThat(request.keySchema().get(0).keyType()).isEqualTo(KeyType.HASH);
        assertThat(request.keySchema().get(1).attributeName()).isEqualTo("item");
        assertThat(request.keySchema().get(1).keyType()).isEqualTo(KeyType.RANGE);
        assertThat(request.billingMode()).isEqualTo(BillingMode.PAY_PER_REQUEST);
        assertThat(request.streamSpecification().streamEnabled()).isTrue();
        assertThat(request.streamSpecification().streamViewType()).isEqualTo(StreamViewType.NEW_AND_OLD_IMAGES);
        verify(waiter).waitUntilTableExists(any(DescribeTableRequest.class));
    }

    @Test
    void create_TableInUse_WaitsAndReturnsExistingArn() {
        // given
        when(dynamoDb.createTable(any(CreateTableRequest.class)))
            .thenThrow(ResourceInUseException.builder().message("Table already exists").build());
        when(dynamoDb.waiter()).thenReturn(waiter);
        when(dynamoDb.describeTable(any(DescribeTableRequest.class))).thenReturn(described(TableStatus.ACTIVE));

        // when
        String arn = provider.create(ResourceRequest.of(TABLE, RunSuffix.of("20240101-abcd1234")));

        // then
        assertThat(arn).isEqualTo(TABLE_ARN);
        verify(waiter).waitUntilTableExists(any(DescribeTableRequest.class));
    }

    // ==================== describe / exists ====================

    @Test
    void describe_ExposesStreamArnAndStatus() {
        // given
        when(dynamoDb.describeTable(DescribeTableRequest.builder().tableName(TABLE).build()))
            .thenReturn(described(TableStatus.ACTIVE));

        // when
        Optional<ResourceDetails> details = provider.describe(TABLE_ARN);

        // then
        assertThat(details).isPresent();
        assertThat(details.get().attribute(ResourceDetails.STREAM_ARN)).contains(STREAM_ARN);
        assertThat(details.get().attribute(ResourceDetails.STATUS)).contains("ACTIVE");
    }

    @Test
    void exists_TableMissing_ReturnsFalse() {
        // given
        when(dynamoDb.describeTable(any(DescribeTableRequest.class)))
            .thenThrow(ResourceNotFoundException.builder().message("not found").build());

        // when & then
        assertThat(provider.exists(TABLE)).isFalse();
    }

    // ==================== delete ====================

    @Test
    void delete_WaitsUntilTableIsGone() {
        // given
        when(dynamoDb.waiter()).thenReturn(waiter);

        // when
        provider.delete(handle());

        // then
        verify(dynamoDb).deleteTable(DeleteTableRequest.builder().tableName(TABLE).build());
        verify(waiter).waitUntilTableNotExists(any(DescribeTableRequest.class));
    }

    @Test
    void delete_TableMissing_SucceedsWithoutWaiting() {
        // given
        when(dynamoDb.deleteTable(any(DeleteTableRequest.class)))
            .thenThrow(ResourceNotFoundException.builder().message("not found").build());

        // when
        provider.delete(handle());

        // then
        verify(dynamoDb, never()).waiter();
    }

    @Test
    void tableName_ParsesArnAndKeepsPlainNames() {
        assertThat(DynamoDbTableProvider.tableName(TABLE_ARN)).isEqualTo(TABLE);
        assertThat(DynamoDbTableProvider.tableName(TABLE)).isEqualTo(TABLE);
    }

    private static DescribeTableResponse described(TableStatus status) {
        return DescribeTableResponse.builder()
            .table(TableDescription.builder()
                .tableName(TABLE)
                .tableArn(TABLE_ARN)
                .tableStatus(status)
                .latestStreamArn(STREAM_ARN)
                .build())
            .build();
    }

    private static ResourceHandle handle() {
        return ResourceHandle.created(ResourceKey.of(ResourceKind.TABLE, "inventory"), TABLE, TABLE_ARN,
            Instant.parse("2024-01-01T12:00:00Z"));
    }
}
