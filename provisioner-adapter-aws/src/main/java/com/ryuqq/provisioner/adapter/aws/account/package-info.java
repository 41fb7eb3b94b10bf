/**
 * Account and role lookup.
 */
package com.ryuqq.provisioner.adapter.aws.account;
