/**
 * Inventory stack definition: deployment settings, SDK clients and the resource plans.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
package com.ryuqq.provisioner.adapter.aws.stack;
