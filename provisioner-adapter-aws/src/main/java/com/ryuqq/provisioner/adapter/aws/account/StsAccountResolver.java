package com.ryuqq.provisioner.adapter.aws.account;

import com.ryuqq.provisioner.core.spi.AccountResolver;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.GetCallerIdentityRequest;
import software.amazon.awssdk.services.sts.model.GetCallerIdentityResponse;

/**
 * Resolves a role name in the caller's account through STS.
 *
 * <p>Result: {@code arn:{partition}:iam::{account}:role/{roleName}}, with the partition taken
 * from the caller ARN.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class StsAccountResolver implements AccountResolver {

    private final StsClient sts;

    public StsAccountResolver(StsClient sts) {
        if (sts == null) {
            throw new IllegalArgumentException("sts cannot be null");
        }
        this.sts = sts;
    }

    @Override
    public String roleArn(String roleName) {
        if (roleName == null || roleName.isBlank()) {
            throw new IllegalArgumentException("roleName cannot be null or blank");
        }
        GetCallerIdentityResponse identity = sts.getCallerIdentity(GetCallerIdentityRequest.builder().build());
        String partition = identity.arn().split(":")[1];
        return "arn:" + partition + ":iam::" + identity.account() + ":role/" + roleName;
    }
}
