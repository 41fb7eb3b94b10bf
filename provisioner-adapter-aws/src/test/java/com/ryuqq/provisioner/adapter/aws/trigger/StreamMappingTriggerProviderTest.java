package com.ryuqq.provisioner.adapter.aws.trigger;

import com.ryuqq.provisioner.core.exception.ProvisioningException;
import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.model.ResourceKey;
import com.ryuqq.provisioner.core.model.ResourceKind;
import com.ryuqq.provisioner.core.model.RunSuffix;
import com.ryuqq.provisioner.core.spi.ResourceDetails;
import com.ryuqq.provisioner.core.spi.ResourceProvider;
import com.ryuqq.provisioner.core.spi.ResourceRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.lambda.model.CreateEventSourceMappingRequest;
import software.amazon.awssdk.services.lambda.model.CreateEventSourceMappingResponse;
import software.amazon.awssdk.services.lambda.model.EventSourceMappingConfiguration;
import software.amazon.awssdk.services.lambda.model.EventSourcePosition;
import software.amazon.awssdk.services.lambda.model.ListEventSourceMappingsRequest;
import software.amazon.awssdk.services.lambda.model.ListEventSourceMappingsResponse;
import software.amazon.awssdk.services.lambda.model.ResourceConflictException;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

/**
 * StreamMappingTriggerProvider tests.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class StreamMappingTriggerProviderTest {

    private static final RunSuffix SUFFIX = RunSuffix.of("20240101-abcd1234");
    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");
    private static final ResourceKey TABLE_KEY = ResourceKey.of(ResourceKind.TABLE, "inventory");
    private static final ResourceKey FUNCTION_KEY = ResourceKey.of(ResourceKind.FUNCTION, "notify-low-stock");
    private static final String TABLE_ARN = "arn:aws:dynamodb:us-east-1:123456789012:table/Inventory";
    private static final String STREAM_ARN = TABLE_ARN + "/stream/2024-01-01T00:00:00.000";
    private static final String FUNCTION = "NotifyLowStockFunction";

    @Mock
    private LambdaClient lambda;

    @Mock
    private ResourceProvider tableProvider;

    private StreamMappingTriggerProvider provider;

    @BeforeEach
    void setUp() {
        provider = new StreamMappingTriggerProvider(lambda, TABLE_KEY, tableProvider, FUNCTION_KEY);
    }

    @Test
    void create_NoMapping_CreatesFromLatestWithBatchOfOne() {
        // given
        givenStream();
        when(lambda.listEventSourceMappings(any(ListEventSourceMappingsRequest.class)))
            .thenReturn(ListEventSourceMappingsResponse.builder().build());
        when(lambda.createEventSourceMapping(any(CreateEventSourceMappingRequest.class)))
            .thenReturn(CreateEventSourceMappingResponse.builder().uuid("uuid-1").build());

        // when
        String uuid = provider.create(request());

        // then
        assertThat(uuid).isEqualTo("uuid-1");
        ArgumentCaptor<CreateEventSourceMappingRequest> captor =
            ArgumentCaptor.forClass(CreateEventSourceMappingRequest.class);
        verify(lambda).createEventSourceMapping(captor.capture());
        assertThat(captor.getValue().eventSourceArn()).isEqualTo(STREAM_ARN);
        assertThat(captor.getValue().functionName()).isEqualTo(FUNCTION);
        assertThat(captor.getValue().startingPosition()).isEqualTo(EventSourcePosition.LATEST);
        assertThat(captor.getValue().batchSize()).isEqualTo(1);
        assertThat(captor.getValue().enabled()).isTrue();
    }

    @Test
    void create_MappingExists_ReusesIt() {
        // given
        givenStream();
        when(lambda.listEventSourceMappings(any(ListEventSourceMappingsRequest.class)))
            .thenReturn(mappings("uuid-existing"));

        // when
        String uuid = provider.create(request());

        // then
        assertThat(uuid).isEqualTo("uuid-existing");
        verify(lambda, never()).createEventSourceMapping(any(CreateEventSourceMappingRequest.class));
    }

    @Test
    void create_Conflict_ReturnsMappingCreatedConcurrently() {
        // given
        givenStream();
        when(lambda.listEventSourceMappings(any(ListEventSourceMappingsRequest.class)))
            .thenReturn(ListEventSourceMappingsResponse.builder().build())
            .thenReturn(mappings("uuid-raced"));
        when(lambda.createEventSourceMapping(any(CreateEventSourceMappingRequest.class)))
            .thenThrow(ResourceConflictException.builder().message("exists").build());

        // when & then
        assertThat(provider.create(request())).isEqualTo("uuid-raced");
    }

    @Test
    void create_TableRecreatedWithNewStream_MapsNewStream() {
        // given
        String recreatedTableArn = TABLE_ARN + "-recreated";
        String newStreamArn = TABLE_ARN + "/stream/2024-02-01T00:00:00.000";
        when(tableProvider.describe(recreatedTableArn))
            .thenReturn(Optional.of(new ResourceDetails(recreatedTableArn, Map.of(ResourceDetails.STREAM_ARN, newStreamArn))));
        // the mapping on the old stream still exists but is not listed for the new one
        when(lambda.listEventSourceMappings(argThat((ListEventSourceMappingsRequest listing) ->
                newStreamArn.equals(listing.eventSourceArn()))))
            .thenReturn(ListEventSourceMappingsResponse.builder().build());
        when(lambda.createEventSourceMapping(any(CreateEventSourceMappingRequest.class)))
            .thenReturn(CreateEventSourceMappingResponse.builder().uuid("uuid-new").build());

        // when
        String uuid = provider.create(request(recreatedTableArn));

        // then
        assertThat(uuid).isEqualTo("uuid-new");
        ArgumentCaptor<CreateEventSourceMappingRequest> captor =
            ArgumentCaptor.forClass(CreateEventSourceMappingRequest.class);
        verify(lambda).createEventSourceMapping(captor.capture());
        assertThat(captor.getValue().eventSourceArn()).isEqualTo(newStreamArn);
        verify(tableProvider, never()).describe(TABLE_ARN);
    }

    @Test
    void create_TableWithoutStream_ThrowsFatal() {
        // given
        when(tableProvider.describe(TABLE_ARN)).thenReturn(Optional.of(ResourceDetails.of(TABLE_ARN)));

        // when & then
        assertThatThrownBy(() -> provider.create(request()))
            .isInstanceOf(ProvisioningException.class)
            .hasMessageContaining("has no stream");
        verifyNoInteractions(lambda);
    }

    private void givenStream() {
        when(tableProvider.describe(TABLE_ARN))
            .thenReturn(Optional.of(new ResourceDetails(TABLE_ARN, Map.of(ResourceDetails.STREAM_ARN, STREAM_ARN))));
    }

    private static ListEventSourceMappingsResponse mappings(String uuid) {
        return ListEventSourceMappingsResponse.builder()
            .eventSourceMappings(EventSourceMappingConfiguration.builder().uuid(uuid).build())
            .build();
    }

    private static ResourceRequest request() {
        return request(TABLE_ARN);
    }

    private static ResourceRequest request(String tableArn) {
        ResourceHandle table = ResourceHandle.created(TABLE_KEY, "Inventory", tableArn, NOW);
        ResourceHandle function = ResourceHandle.created(FUNCTION_KEY, FUNCTION,
            "arn:aws:lambda:us-east-1:123456789012:function:" + FUNCTION, NOW);
        return new ResourceRequest("stream-to-notify", SUFFIX, Map.of(TABLE_KEY, table, FUNCTION_KEY, function), null);
    }
}
