package com.ryuqq.provisioner.adapter.aws.trigger;

import com.ryuqq.provisioner.adapter.aws.function.LambdaPermissions;
import com.ryuqq.provisioner.adapter.aws.storage.S3BucketProvider;
import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.model.ResourceKey;
import com.ryuqq.provisioner.core.model.ResourceKind;
import com.ryuqq.provisioner.core.readiness.ReadinessWaiter;
import com.ryuqq.provisioner.core.spi.ResourceDetails;
import com.ryuqq.provisioner.core.spi.ResourceProvider;
import com.ryuqq.provisioner.core.spi.ResourceRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Event;
import software.amazon.awssdk.services.s3.model.FilterRule;
import software.amazon.awssdk.services.s3.model.FilterRuleName;
import software.amazon.awssdk.services.s3.model.GetBucketNotificationConfigurationRequest;
import software.amazon.awssdk.services.s3.model.LambdaFunctionConfiguration;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NotificationConfiguration;
import software.amazon.awssdk.services.s3.model.NotificationConfigurationFilter;
import software.amazon.awssdk.services.s3.model.PutBucketNotificationConfigurationRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3KeyFilter;

import java.util.Optional;

/**
 * Bucket → function trigger: CSV objects created in the uploads bucket invoke the loader.
 *
 * <p><strong>Steps:</strong></p>
 * <ol>
 *   <li>grant {@code S3Invoke-{bucket}} on the function (already granted is fine)</li>
 *   <li>poll the function policy until the statement is visible</li>
 *   <li>put the bucket notification ({@code s3:ObjectCreated:*}, suffix {@value #CSV_SUFFIX})</li>
 * </ol>
 *
 * <p>Identifier is {@code {bucketArn}->{functionArn}}.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class BucketNotificationTriggerProvider implements ResourceProvider {

    private static final Logger log = LoggerFactory.getLogger(BucketNotificationTriggerProvider.class);

    static final String CSV_SUFFIX = ".csv";
    static final String SEPARATOR = "->";

    private final S3Client s3;
    private final LambdaPermissions permissions;
    private final ReadinessWaiter readiness;
    private final ResourceKey bucketKey;
    private final ResourceKey functionKey;

    /**
     * @param s3 S3 client
     * @param permissions function permission helper
     * @param readiness bounded poll for permission propagation
     * @param bucketKey dependency holding the bucket
     * @param functionKey dependency holding the function
     */
    public BucketNotificationTriggerProvider(S3Client s3, LambdaPermissions permissions, ReadinessWaiter readiness,
                                             ResourceKey bucketKey, ResourceKey functionKey) {
        if (s3 == null) {
            throw new IllegalArgumentException("s3 cannot be null");
        }
        if (permissions == null) {
            throw new IllegalArgumentException("permissions cannot be null");
        }
        if (readiness == null) {
            throw new IllegalArgumentException("readiness cannot be null");
        }
        if (bucketKey == null) {
            throw new IllegalArgumentException("bucketKey cannot be null");
        }
        if (functionKey == null) {
            throw new IllegalArgumentException("functionKey cannot be null");
        }
        this.s3 = s3;
        this.permissions = permissions;
        this.readiness = readiness;
        this.bucketKey = bucketKey;
        this.functionKey = functionKey;
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.TRIGGER;
    }

    /**
     * Confirms the notification only. The invoke permission is not checked, so the stack
     * converges this trigger on every apply.
     *
     * @param name bucket name
     * @return true if the bucket has a function notification configured
     */
    @Override
    public boolean exists(String name) {
        try {
            return s3.getBucketNotificationConfiguration(GetBucketNotificationConfigurationRequest.builder()
                    .bucket(name)
                    .build())
                .hasLambdaFunctionConfigurations();
        } catch (NoSuchBucketException e) {
            return false;
        }
    }

    @Override
    public String create(ResourceRequest request) {
        String bucket = request.dependency(bucketKey).name();
        ResourceHandle function = request.dependency(functionKey);
        String statementId = statementId(bucket);

        permissions.grantInvoke(function.identifier(), statementId, "s3.amazonaws.com", S3BucketProvider.arn(bucket));
        readiness.await("invoke permission " + statementId,
            () -> permissions.isVisible(function.identifier(), statementId));

        s3.putBucketNotificationConfiguration(PutBucketNotificationConfigurationRequest.builder()
            .bucket(bucket)
            .notificationConfiguration(NotificationConfiguration.builder()
                .lambdaFunctionConfigurations(LambdaFunctionConfiguration.builder()
                    .lambdaFunctionArn(function.identifier())
                    .events(Event.S3_OBJECT_CREATED)
                    .filter(NotificationConfigurationFilter.builder()
                        .key(S3KeyFilter.builder()
                            .filterRules(FilterRule.builder().name(FilterRuleName.SUFFIX).value(CSV_SUFFIX).build())
                            .build())
                        .build())
                    .build())
                .build())
            .build());
        log.info("[S3] Trigger configured: {} -> {}", bucket, function.name());
        return S3BucketProvider.arn(bucket) + SEPARATOR + function.identifier();
    }

    @Override
    public Optional<ResourceDetails> describe(String identifier) {
        return exists(bucketOf(identifier)) ? Optional.of(ResourceDetails.of(identifier)) : Optional.empty();
    }

    @Override
    public boolean recognizes(String identifier) {
        return identifier.contains(SEPARATOR);
    }

    /**
     * Clears the bucket notifications and revokes the invoke permission.
     */
    @Override
    public void delete(ResourceHandle handle) {
        String bucket = bucketOf(handle.identifier());
        String functionArn = functionOf(handle.identifier());
        try {
            s3.putBucketNotificationConfiguration(PutBucketNotificationConfigurationRequest.builder()
                .bucket(bucket)
                .notificationConfiguration(NotificationConfiguration.builder().build())
                .build());
            log.info("[S3] Notifications cleared on {}", bucket);
        } catch (NoSuchBucketException e) {
            log.info("[S3] Bucket {} no longer exists", bucket);
        } catch (S3Exception e) {
            if (e.statusCode() != 404) {
                throw e;
            }
            log.info("[S3] Bucket {} no longer exists", bucket);
        }
        permissions.revoke(functionArn, statementId(bucket));
    }

    static String statementId(String bucket) {
        return "S3Invoke-" + bucket;
    }

    static String bucketOf(String identifier) {
        int separator = identifier.indexOf(SEPARATOR);
        String bucketArn = separator < 0 ? identifier : identifier.substring(0, separator);
        return S3BucketProvider.bucketName(bucketArn);
    }

    static String functionOf(String identifier) {
        int separator = identifier.indexOf(SEPARATOR);
        if (separator < 0) {
            throw new IllegalArgumentException("Not a bucket trigger identifier: " + identifier);
        }
        return identifier.substring(separator + SEPARATOR.length());
    }
}
