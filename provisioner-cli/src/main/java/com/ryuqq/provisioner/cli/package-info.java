/**
 * picocli entry point: {@code apply} and {@code destroy} over the AWS inventory stack.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
package com.ryuqq.provisioner.cli;
