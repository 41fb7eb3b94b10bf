/**
 * Key-value table provider.
 */
package com.ryuqq.provisioner.adapter.aws.table;
