/**
 * Provisioning error taxonomy.
 *
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.core.exception.ErrorCategory} - ALREADY_EXISTS, NOT_FOUND, TRANSIENT, FATAL</li>
 *   <li>{@link com.ryuqq.provisioner.core.exception.ProvisioningException} - Unchecked base, carries a category</li>
 *   <li>{@link com.ryuqq.provisioner.core.exception.PropagationTimeoutException} - Readiness poll gave up</li>
 *   <li>{@link com.ryuqq.provisioner.core.exception.StateStoreException} - Deployment record unreadable or unwritable</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.core.exception;
