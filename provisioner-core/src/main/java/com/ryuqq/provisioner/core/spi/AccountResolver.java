package com.ryuqq.provisioner.core.spi;

/**
 * Resolves the execution role ARN in the caller's account.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AccountResolver {

    /**
     * @param roleName role name (e.g. {@code LabRole})
     * @return fully qualified role ARN
     */
    String roleArn(String roleName);
}
