/**
 * Object-storage providers: buckets, the static web site and the seed data upload.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
package com.ryuqq.provisioner.adapter.aws.storage;
