package com.ryuqq.provisioner.adapter.aws.function;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.lambda.model.AddPermissionRequest;
import software.amazon.awssdk.services.lambda.model.GetPolicyRequest;
import software.amazon.awssdk.services.lambda.model.RemovePermissionRequest;
import software.amazon.awssdk.services.lambda.model.ResourceConflictException;
import software.amazon.awssdk.services.lambda.model.ResourceNotFoundException;

/**
 * Resource-based invoke permissions on a function.
 *
 * <p>Statements are keyed by a stable statement id, so granting twice is a no-op and
 * revoking a missing statement is success.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class LambdaPermissions {

    private static final Logger log = LoggerFactory.getLogger(LambdaPermissions.class);

    private static final String INVOKE_ACTION = "lambda:InvokeFunction";

    private final LambdaClient lambda;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public LambdaPermissions(LambdaClient lambda) {
        if (lambda == null) {
            throw new IllegalArgumentException("lambda cannot be null");
        }
        this.lambda = lambda;
    }

    /**
     * Allows {@code principal} to invoke the function from {@code sourceArn}.
     *
     * @return true if a new statement was added, false if it already existed
     */
    public boolean grantInvoke(String function, String statementId, String principal, String sourceArn) {
        try {
            lambda.addPermission(AddPermissionRequest.builder()
                .functionName(function)
                .statementId(statementId)
                .action(INVOKE_ACTION)
                .principal(principal)
                .sourceArn(sourceArn)
                .build());
            log.info("[Lambda] Permission {} granted to {}", statementId, principal);
            return true;
        } catch (ResourceConflictException e) {
            log.debug("[Lambda] Permission {} already present", statementId);
            return false;
        }
    }

    /**
     * Removes the statement; a missing function or statement is success.
     */
    public void revoke(String function, String statementId) {
        try {
            lambda.removePermission(RemovePermissionRequest.builder()
                .functionName(function)
                .statementId(statementId)
                .build());
            log.info("[Lambda] Permission {} removed from {}", statementId, function);
        } catch (ResourceNotFoundException e) {
            log.debug("[Lambda] Permission {} already gone", statementId);
        }
    }

    /**
     * @return true once the function policy lists the statement
     */
    public boolean isVisible(String function, String statementId) {
        String policy;
        try {
            policy = lambda.getPolicy(GetPolicyRequest.builder().functionName(function).build()).policy();
        } catch (ResourceNotFoundException e) {
            return false;
        }
        if (policy == null) {
            return false;
        }
        try {
            for (JsonNode statement : objectMapper.readTree(policy).path("Statement")) {
                if (statementId.equals(statement.path("Sid").asText())) {
                    return true;
                }
            }
            return false;
        } catch (JsonProcessingException e) {
            log.warn("[Lambda] Unreadable policy on {}: {}", function, e.getMessage());
            return false;
        }
    }
}
