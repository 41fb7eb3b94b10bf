/**
 * Compute functions: packaging, create-or-update and invoke permissions.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
package com.ryuqq.provisioner.adapter.aws.function;
