package com.ryuqq.provisioner.adapter.runner;

/**
 * SequentialOrchestrator settings (immutable record).
 *
 * <p><strong>Settings:</strong></p>
 * <ul>
 *   <li>roleName: execution role resolved before the first spec that requires one (default LabRole)</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param roleName execution role name (not blank)
 */
public record OrchestratorConfig(String roleName) {

    public static final String DEFAULT_ROLE_NAME = "LabRole";

    /**
     * Default settings: roleName=LabRole.
     */
    public OrchestratorConfig() {
        this(DEFAULT_ROLE_NAME);
    }

    public OrchestratorConfig {
        if (roleName == null || roleName.isBlank()) {
            throw new IllegalArgumentException("roleName cannot be null or blank");
        }
    }

    public OrchestratorConfig withRoleName(String roleName) {
        return new OrchestratorConfig(roleName);
    }
}
