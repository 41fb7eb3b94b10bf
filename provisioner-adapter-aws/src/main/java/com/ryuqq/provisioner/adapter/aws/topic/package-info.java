/**
 * Notification topic provider.
 */
package com.ryuqq.provisioner.adapter.aws.topic;
