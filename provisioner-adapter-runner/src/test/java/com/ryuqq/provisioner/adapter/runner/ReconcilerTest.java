package com.ryuqq.provisioner.adapter.runner;

import com.ryuqq.provisioner.core.exception.ErrorCategory;
import com.ryuqq.provisioner.core.exception.ProvisioningException;
import com.ryuqq.provisioner.core.model.DeploymentRecord;
import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.model.ResourceKey;
import com.ryuqq.provisioner.core.model.ResourceKind;
import com.ryuqq.provisioner.core.model.RunSuffix;
import com.ryuqq.provisioner.core.spec.NameRule;
import com.ryuqq.provisioner.core.spec.ReconcilePolicy;
import com.ryuqq.provisioner.core.spec.ResourceSpec;
import com.ryuqq.provisioner.core.statemachine.ResourceStatus;
import com.ryuqq.provisioner.testkit.cloud.FakeCloud;
import com.ryuqq.provisioner.testkit.cloud.FakeResourceProvider;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Reconciler tests.
 *
 * <ul>
 *   <li>no prior handle: create</li>
 *   <li>REUSE_IF_PRESENT: verify without create, recreate when gone</li>
 *   <li>CONVERGE: create-or-update every time, identifier stays stable</li>
 *   <li>missing dependency: fatal</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
class ReconcilerTest {

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");
    private static final RunSuffix SUFFIX = RunSuffix.of("20240101-abcd1234");
    private static final ResourceKey TABLE = ResourceKey.of(ResourceKind.TABLE, "inventory");
    private static final ResourceKey NOTIFY = ResourceKey.of(ResourceKind.FUNCTION, "notify");
    private static final ResourceKey TOPIC = ResourceKey.of(ResourceKind.TOPIC, "low-stock");

    private final FakeCloud cloud = new FakeCloud();
    private final Reconciler reconciler = new Reconciler(Clock.fixed(NOW, ZoneOffset.UTC));

    private final ResourceSpec table =
        ResourceSpec.of(TABLE, NameRule.fixed("Inventory"), cloud.provider(ResourceKind.TABLE));

    // ============================================================
    // 1. No prior handle
    // ============================================================

    @Test
    void reconcile_NoPriorHandle_CreatesResource() {
        // when
        ReconcileResult result = reconciler.reconcile(table, DeploymentRecord.start(SUFFIX), null);

        // then
        assertThat(result.action()).isEqualTo(ReconcileAction.CREATED);
        assertThat(result.handle().status()).isEqualTo(ResourceStatus.CREATED);
        assertThat(result.handle().name()).isEqualTo("Inventory");
        assertThat(result.handle().identifier()).isEqualTo("TABLE/Inventory#1");
        assertThat(result.handle().updatedAt()).isEqualTo(NOW);
        assertThat(cloud.createCount("Inventory")).isEqualTo(1);
    }

    // ============================================================
    // 2. REUSE_IF_PRESENT
    // ============================================================

    @Test
    void reconcile_RecordedAndPresent_VerifiesWithoutCreate() {
        // given
        DeploymentRecord record = DeploymentRecord.start(SUFFIX)
            .withHandle(reconciler.reconcile(table, DeploymentRecord.start(SUFFIX), null).handle());

        // when
        ReconcileResult result = reconciler.reconcile(table, record, null);

        // then
        assertThat(result.action()).isEqualTo(ReconcileAction.VERIFIED);
        assertThat(result.handle().status()).isEqualTo(ResourceStatus.VERIFIED);
        assertThat(result.handle().identifier()).isEqualTo("TABLE/Inventory#1");
        assertThat(cloud.createCount("Inventory")).isEqualTo(1);
    }

    @Test
    void reconcile_RecordedButDeletedOutOfBand_RecreatesWithNewIdentifier() {
        // given
        DeploymentRecord record = DeploymentRecord.start(SUFFIX)
            .withHandle(reconciler.reconcile(table, DeploymentRecord.start(SUFFIX), null).handle());
        cloud.deleteOutOfBand(ResourceKind.TABLE, "Inventory");

        // when
        ReconcileResult result = reconciler.reconcile(table, record, null);

        // then
        assertThat(result.action()).isEqualTo(ReconcileAction.RECREATED);
        assertThat(result.handle().status()).isEqualTo(ResourceStatus.CREATED);
        assertThat(result.handle().identifier()).isEqualTo("TABLE/Inventory#2");
    }

    @Test
    void reconcile_PriorHandleDeleted_CreatesFreshHandle() {
        // given
        ResourceHandle deleted = ResourceHandle.created(TABLE, "Inventory", "TABLE/Inventory#0", NOW).deleted(NOW);
        DeploymentRecord record = DeploymentRecord.start(SUFFIX).withHandle(deleted);

        // when
        ReconcileResult result = reconciler.reconcile(table, record, null);

        // then
        assertThat(result.action()).isEqualTo(ReconcileAction.CREATED);
        assertThat(result.handle().status()).isEqualTo(ResourceStatus.CREATED);
    }

    // ============================================================
    // 3. CONVERGE
    // ============================================================

    @Test
    void reconcile_ConvergeTwice_SameIdentifierAndCreateCalledEachTime() {
        // given
        FakeResourceProvider functions = cloud.provider(ResourceKind.FUNCTION);
        ResourceSpec notify = ResourceSpec.of(NOTIFY, NameRule.fixed("NotifyLowStockFunction"), functions)
            .withRequiresRole(true)
            .withPolicy(ReconcilePolicy.CONVERGE);
        ResourceHandle first = reconciler.reconcile(notify, DeploymentRecord.start(SUFFIX), "arn:role").handle();

        // when
        ReconcileResult second = reconciler.reconcile(notify, DeploymentRecord.start(SUFFIX).withHandle(first), "arn:role");

        // then
        assertThat(second.action()).isEqualTo(ReconcileAction.CONVERGED);
        assertThat(second.handle().identifier()).isEqualTo(first.identifier());
        assertThat(second.handle().status()).isEqualTo(ResourceStatus.VERIFIED);
        assertThat(cloud.createCount("NotifyLowStockFunction")).isEqualTo(2);
        assertThat(functions.requests()).allSatisfy(request ->
            assertThat(request.roleArn()).isEqualTo("arn:role"));
    }

    // ============================================================
    // 4. Dependencies and role
    // ============================================================

    @Test
    void reconcile_DependencyHandlesPassedToProvider() {
        // given
        FakeResourceProvider functions = cloud.provider(ResourceKind.FUNCTION);
        ResourceSpec topic = ResourceSpec.of(TOPIC, NameRule.suffixed("NoStock-"), cloud.provider(ResourceKind.TOPIC));
        ResourceSpec notify = ResourceSpec.of(NOTIFY, NameRule.fixed("NotifyLowStockFunction"), functions)
            .withDependsOn(TOPIC)
            .withRequiresRole(true);
        ResourceHandle topicHandle = reconciler.reconcile(topic, DeploymentRecord.start(SUFFIX), null).handle();

        // when
        reconciler.reconcile(notify, DeploymentRecord.start(SUFFIX).withHandle(topicHandle), "arn:role");

        // then
        assertThat(topicHandle.name()).isEqualTo("NoStock-20240101-abcd1234");
        assertThat(functions.requests()).singleElement()
            .satisfies(request -> assertThat(request.dependency(TOPIC)).isEqualTo(topicHandle));
    }

    @Test
    void reconcile_MissingDependency_ThrowsFatal() {
        // given
        ResourceSpec notify = ResourceSpec.of(NOTIFY, NameRule.fixed("NotifyLowStockFunction"),
            cloud.provider(ResourceKind.FUNCTION)).withDependsOn(TOPIC);

        // when & then
        assertThatThrownBy(() -> reconciler.reconcile(notify, DeploymentRecord.start(SUFFIX), null))
            .isInstanceOf(ProvisioningException.class)
            .hasMessageContaining("Missing dependency TOPIC:low-stock")
            .satisfies(e -> assertThat(((ProvisioningException) e).getCategory()).isEqualTo(ErrorCategory.FATAL));
        assertThat(cloud.totalCreates()).isZero();
    }

    @Test
    void reconcile_RoleRequiredButAbsent_ThrowsException() {
        // given
        ResourceSpec notify = ResourceSpec.of(NOTIFY, NameRule.fixed("NotifyLowStockFunction"),
            cloud.provider(ResourceKind.FUNCTION)).withRequiresRole(true);

        // when & then
        assertThatThrownBy(() -> reconciler.reconcile(notify, DeploymentRecord.start(SUFFIX), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("roleArn required");
    }
}
