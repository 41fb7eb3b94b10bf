/**
 * Event triggers wiring the bucket and the table stream to their functions.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
package com.ryuqq.provisioner.adapter.aws.trigger;
