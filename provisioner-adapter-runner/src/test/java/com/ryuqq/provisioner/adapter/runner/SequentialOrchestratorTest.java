package com.ryuqq.provisioner.adapter.runner;

import com.ryuqq.provisioner.adapter.inmemory.store.InMemoryStateStore;
import com.ryuqq.provisioner.application.orchestrator.ApplyReport;
import com.ryuqq.provisioner.core.exception.ErrorCategory;
import com.ryuqq.provisioner.core.exception.ProvisioningException;
import com.ryuqq.provisioner.core.exception.StateStoreException;
import com.ryuqq.provisioner.core.model.DeploymentRecord;
import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.model.ResourceKey;
import com.ryuqq.provisioner.core.model.ResourceKind;
import com.ryuqq.provisioner.core.model.RunSuffix;
import com.ryuqq.provisioner.core.outcome.Fail;
import com.ryuqq.provisioner.core.outcome.Ok;
import com.ryuqq.provisioner.core.spec.DeploymentPlan;
import com.ryuqq.provisioner.core.spi.AccountResolver;
import com.ryuqq.provisioner.core.spi.StateStore;
import com.ryuqq.provisioner.core.statemachine.ResourceStatus;
import com.ryuqq.provisioner.testkit.cloud.FakeCloud;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static com.ryuqq.provisioner.adapter.runner.FakeInventoryStack.API;
import static com.ryuqq.provisioner.adapter.runner.FakeInventoryStack.BUCKET_TRIGGER;
import static com.ryuqq.provisioner.adapter.runner.FakeInventoryStack.GATEWAY;
import static com.ryuqq.provisioner.adapter.runner.FakeInventoryStack.LOADER;
import static com.ryuqq.provisioner.adapter.runner.FakeInventoryStack.STREAM_TRIGGER;
import static com.ryuqq.provisioner.adapter.runner.FakeInventoryStack.TABLE;
import static com.ryuqq.provisioner.adapter.runner.FakeInventoryStack.UPLOADS;
import static com.ryuqq.provisioner.adapter.runner.FakeInventoryStack.WEB;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * SequentialOrchestrator tests.
 *
 * <ul>
 *   <li>fresh apply: one handle per planned resource, suffix persisted first</li>
 *   <li>second apply: no duplicates, same identifiers, same suffix</li>
 *   <li>interrupted apply: resumes from the record</li>
 *   <li>out-of-band deletion: resource recreated under a new identifier, dependent wiring rebound</li>
 *   <li>role lookup: lazy and once per run</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
class SequentialOrchestratorTest {

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    private static final RunSuffix SUFFIX = RunSuffix.of("20240101-abcd1234");
    private static final String ROLE_ARN = "arn:aws:iam::123456789012:role/LabRole";

    private FakeCloud cloud;
    private InMemoryStateStore store;
    private CountingResolver resolver;

    @BeforeEach
    void setUp() {
        cloud = new FakeCloud();
        store = new InMemoryStateStore();
        resolver = new CountingResolver();
    }

    private SequentialOrchestrator orchestrator(StateStore stateStore, FakeCloud target) {
        return new SequentialOrchestrator(stateStore, FakeInventoryStack.plan(target), resolver,
            new OrchestratorConfig(), CLOCK);
    }

    // ============================================================
    // 1. Fresh apply
    // ============================================================

    @Test
    void apply_EmptyStore_CreatesOneHandlePerSpec() {
        // when
        ApplyReport report = orchestrator(store, cloud).apply();

        // then
        assertThat(report.isSuccess()).isTrue();
        DeploymentRecord record = store.load().orElseThrow();
        assertThat(record.resources()).hasSize(10);
        assertThat(record.resources().values())
            .allSatisfy(handle -> assertThat(handle.status()).isEqualTo(ResourceStatus.CREATED));
        assertThat(report.getOutcomes()).hasSize(10)
            .allSatisfy(outcome -> assertThat(((Ok) outcome).message()).isEqualTo("created"));
        assertThat(cloud.totalCreates()).isEqualTo(10);
        assertThat(cloud.liveCount()).isEqualTo(10);
    }

    @Test
    void apply_EmptyStore_PersistsSuffixBeforeAnyProviderCall() {
        // when
        orchestrator(store, cloud).apply();

        // then
        DeploymentRecord first = store.history().get(0);
        assertThat(first.resources()).isEmpty();
        assertThat(first.runSuffix()).isEqualTo(store.load().orElseThrow().runSuffix());
        assertThat(first.runSuffix().getValue()).startsWith("20240101-");
    }

    @Test
    void apply_SavesAfterEveryStep() {
        // when
        orchestrator(store, cloud).apply();

        // then
        assertThat(store.saveCount()).isEqualTo(11);
        for (int i = 1; i < store.history().size(); i++) {
            assertThat(store.history().get(i).resources()).hasSize(i);
        }
    }

    @Test
    void apply_RecordsNamesAndOutputs() {
        // given
        store = new InMemoryStateStore(DeploymentRecord.start(SUFFIX));

        // when
        ApplyReport report = orchestrator(store, cloud).apply();

        // then
        DeploymentRecord record = report.getRecord();
        assertThat(record.handle(UPLOADS).orElseThrow().name()).isEqualTo("inventory-uploads-20240101-abcd1234");
        assertThat(record.handle(WEB).orElseThrow().name()).isEqualTo("inventory-web-20240101-abcd1234");
        assertThat(record.outputs())
            .containsEntry("uploads-bucket", "inventory-uploads-20240101-abcd1234")
            .containsEntry("table-arn", "TABLE/Inventory#1")
            .containsEntry("api-endpoint", "https://GATEWAY/InventoryAPI#1");
        assertThat(store.load().orElseThrow()).isEqualTo(record);
    }

    // ============================================================
    // 2. Idempotence
    // ============================================================

    @Test
    void apply_Twice_NoDuplicatesAndSameIdentifiers() {
        // given
        ApplyReport first = orchestrator(store, cloud).apply();

        // when
        ApplyReport second = orchestrator(store, cloud).apply();

        // then
        assertThat(second.isSuccess()).isTrue();
        assertThat(second.getRecord().runSuffix()).isEqualTo(first.getRecord().runSuffix());
        assertThat(identifiers(second.getRecord())).isEqualTo(identifiers(first.getRecord()));
        assertThat(cloud.liveCount()).isEqualTo(10);
        // functions, gateway and triggers converge: six create calls again
        assertThat(cloud.totalCreates()).isEqualTo(16);
        assertThat(second.getOutcomes())
            .extracting(outcome -> ((Ok) outcome).message())
            .containsOnly("verified", "converged");
        assertThat(second.getRecord().resources().values())
            .allSatisfy(handle -> assertThat(handle.status()).isEqualTo(ResourceStatus.VERIFIED));
    }

    @Test
    void apply_TableDeletedOutOfBand_RecreatesWithNewIdentifier() {
        // given
        orchestrator(store, cloud).apply();
        cloud.deleteOutOfBand(ResourceKind.TABLE, "Inventory");

        // when
        ApplyReport report = orchestrator(store, cloud).apply();

        // then
        assertThat(report.isSuccess()).isTrue();
        ResourceHandle table = report.getRecord().handle(TABLE).orElseThrow();
        assertThat(table.identifier()).isEqualTo("TABLE/Inventory#2");
        assertThat(table.status()).isEqualTo(ResourceStatus.CREATED);
        assertThat(report.getRecord().outputs()).containsEntry("table-arn", "TABLE/Inventory#2");
        assertThat(cloud.isLive(ResourceKind.TABLE, "Inventory")).isTrue();
    }

    @Test
    void apply_TableDeletedOutOfBand_RewiresStreamTriggerToNewTable() {
        // given
        DeploymentRecord first = orchestrator(store, cloud).apply().getRecord();
        cloud.deleteOutOfBand(ResourceKind.TABLE, "Inventory");

        // when
        ApplyReport report = orchestrator(store, cloud).apply();

        // then
        assertThat(report.isSuccess()).isTrue();
        ResourceHandle trigger = report.getRecord().handle(STREAM_TRIGGER).orElseThrow();
        assertThat(trigger.identifier())
            .isNotEqualTo(first.handle(STREAM_TRIGGER).orElseThrow().identifier())
            .isEqualTo("TRIGGER/stream-to-notify#2");
        assertThat(cloud.bindingOf(ResourceKind.TRIGGER, "stream-to-notify"))
            .contains("TABLE/Inventory#2")
            .doesNotContain("TABLE/Inventory#1");
        assertThat(report.getOutcomes())
            .filteredOn(outcome -> ((Ok) outcome).key().equals(STREAM_TRIGGER))
            .extracting(outcome -> ((Ok) outcome).message())
            .containsExactly("recreated");
        // wiring that does not touch the table keeps its identifier
        assertThat(report.getRecord().handle(BUCKET_TRIGGER).orElseThrow().identifier())
            .isEqualTo(first.handle(BUCKET_TRIGGER).orElseThrow().identifier());
    }

    @Test
    void apply_FunctionDeletedOutOfBand_RegrantsDependentWiring() {
        // given
        DeploymentRecord first = orchestrator(store, cloud).apply().getRecord();
        cloud.deleteOutOfBand(ResourceKind.FUNCTION, "LoadInventoryFunction");
        cloud.deleteOutOfBand(ResourceKind.FUNCTION, "GetInventoryApiFunction");

        // when
        ApplyReport report = orchestrator(store, cloud).apply();

        // then
        assertThat(report.isSuccess()).isTrue();
        assertThat(cloud.bindingOf(ResourceKind.TRIGGER, "uploads-to-loader-" + first.runSuffix().getValue()))
            .contains("FUNCTION/LoadInventoryFunction#2");
        assertThat(cloud.bindingOf(ResourceKind.GATEWAY, "InventoryAPI"))
            .containsExactly("FUNCTION/GetInventoryApiFunction#2");
        assertThat(report.getRecord().handle(GATEWAY).orElseThrow().identifier()).isEqualTo("GATEWAY/InventoryAPI#2");
        assertThat(report.getRecord().outputs()).containsEntry("api-endpoint", "https://GATEWAY/InventoryAPI#2");
    }

    // ============================================================
    // 3. Resumability
    // ============================================================

    @Test
    void apply_FailsMidway_StopsAndKeepsCompletedSteps() {
        // given
        cloud.failCreate("LoadInventoryFunction");

        // when
        ApplyReport report = orchestrator(store, cloud).apply();

        // then
        assertThat(report.isSuccess()).isFalse();
        Fail failure = report.failure().orElseThrow();
        assertThat(failure.key()).isEqualTo(LOADER);
        assertThat(failure.category()).isEqualTo(ErrorCategory.FATAL);
        assertThat(failure.cause()).isEqualTo("ProvisioningException");
        assertThat(store.load().orElseThrow().resources().keySet()).containsExactly(UPLOADS, WEB, TABLE);
        assertThat(cloud.createCount("GetInventoryApiFunction")).isZero();
        assertThat(report.getOutcomes()).last().isInstanceOf(Fail.class);
    }

    @Test
    void apply_ResumedAfterFailure_MatchesUninterruptedRun() {
        // given
        FakeCloud cleanCloud = new FakeCloud();
        InMemoryStateStore cleanStore = new InMemoryStateStore(DeploymentRecord.start(SUFFIX));
        DeploymentRecord uninterrupted = orchestrator(cleanStore, cleanCloud).apply().getRecord();

        store = new InMemoryStateStore(DeploymentRecord.start(SUFFIX));
        cloud.failCreate("NotifyLowStockFunction");
        ApplyReport failed = orchestrator(store, cloud).apply();
        cloud.heal();

        // when
        ApplyReport resumed = orchestrator(store, cloud).apply();

        // then
        assertThat(failed.isSuccess()).isFalse();
        assertThat(resumed.isSuccess()).isTrue();
        assertThat(resumed.getRecord().runSuffix()).isEqualTo(SUFFIX);
        assertThat(identifiers(resumed.getRecord())).isEqualTo(identifiers(uninterrupted));
        assertThat(resumed.getRecord().outputs()).isEqualTo(uninterrupted.outputs());
        assertThat(cloud.liveCount()).isEqualTo(cleanCloud.liveCount());
        assertThat(cloud.createCount("Inventory")).isEqualTo(1);
    }

    // ============================================================
    // 4. Role lookup
    // ============================================================

    @Test
    void apply_RoleResolvedOnceForAllFunctions() {
        // when
        orchestrator(store, cloud).apply();

        // then
        assertThat(resolver.calls).isEqualTo(1);
        assertThat(resolver.lastRoleName).isEqualTo("LabRole");
    }

    @Test
    void apply_ConfiguredRoleName_PassedToResolver() {
        // given
        SequentialOrchestrator orchestrator = new SequentialOrchestrator(store, FakeInventoryStack.plan(cloud),
            resolver, new OrchestratorConfig().withRoleName("InventoryRole"), CLOCK);

        // when
        orchestrator.apply();

        // then
        assertThat(resolver.lastRoleName).isEqualTo("InventoryRole");
    }

    @Test
    void apply_PlanWithoutRoleSpecs_NeverResolvesRole() {
        // given
        AccountResolver accounts = mock(AccountResolver.class);
        DeploymentPlan plan = DeploymentPlan.of(
            FakeInventoryStack.plan(cloud).spec(TABLE).orElseThrow());
        SequentialOrchestrator orchestrator =
            new SequentialOrchestrator(store, plan, accounts, new OrchestratorConfig(), CLOCK);

        // when
        ApplyReport report = orchestrator.apply();

        // then
        assertThat(report.isSuccess()).isTrue();
        verify(accounts, never()).roleArn(anyString());
    }

    @Test
    void apply_RoleLookupFails_AbortsAtFirstFunction() {
        // given
        AccountResolver accounts = mock(AccountResolver.class);
        when(accounts.roleArn("LabRole")).thenThrow(new ProvisioningException(ErrorCategory.FATAL, "AccessDenied"));
        SequentialOrchestrator orchestrator = new SequentialOrchestrator(store, FakeInventoryStack.plan(cloud),
            accounts, new OrchestratorConfig(), CLOCK);

        // when
        ApplyReport report = orchestrator.apply();

        // then
        assertThat(report.isSuccess()).isFalse();
        assertThat(report.failure().orElseThrow().key()).isEqualTo(LOADER);
        assertThat(report.failure().orElseThrow().message()).isEqualTo("AccessDenied");
        assertThat(cloud.createCount("LoadInventoryFunction")).isZero();
        verify(accounts, times(1)).roleArn("LabRole");
    }

    // ============================================================
    // 5. State Store failures
    // ============================================================

    @Test
    void apply_StateStoreFails_Propagates() {
        // given
        StateStore broken = mock(StateStore.class);
        when(broken.load()).thenReturn(Optional.of(DeploymentRecord.start(SUFFIX)));
        doThrow(new StateStoreException("disk full", null)).when(broken).save(any());

        // when & then
        assertThatThrownBy(() -> orchestrator(broken, cloud).apply())
            .isInstanceOf(StateStoreException.class)
            .hasMessage("disk full");
        assertThat(cloud.totalCreates()).isEqualTo(1);
    }

    @Test
    void apply_RecordMissingTrailingHandles_AdoptsExistingResources() {
        // given
        DeploymentRecord full = orchestrator(store, cloud).apply().getRecord();
        DeploymentRecord partial = DeploymentRecord.start(full.runSuffix());
        for (ResourceHandle handle : full.resources().values()) {
            if (handle.key().equals(API)) {
                break;
            }
            partial = partial.withHandle(handle);
        }
        InMemoryStateStore truncated = new InMemoryStateStore(partial);

        // when
        ApplyReport report = orchestrator(truncated, cloud).apply();

        // then
        assertThat(report.isSuccess()).isTrue();
        assertThat(identifiers(report.getRecord())).isEqualTo(identifiers(full));
        assertThat(report.getRecord().handle(GATEWAY).orElseThrow().status()).isEqualTo(ResourceStatus.CREATED);
        assertThat(cloud.liveCount()).isEqualTo(10);
    }

    private static Map<ResourceKey, String> identifiers(DeploymentRecord record) {
        Map<ResourceKey, String> identifiers = new LinkedHashMap<>();
        for (ResourceHandle handle : record.resources().values()) {
            identifiers.put(handle.key(), handle.identifier());
        }
        return identifiers;
    }

    private static final class CountingResolver implements AccountResolver {

        private int calls;
        private String lastRoleName;

        @Override
        public String roleArn(String roleName) {
            calls++;
            lastRoleName = roleName;
            return ROLE_ARN;
        }
    }
}
