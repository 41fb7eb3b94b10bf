/**
 * HTTP API gateway provider.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
package com.ryuqq.provisioner.adapter.aws.gateway;
