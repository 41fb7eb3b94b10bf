package com.ryuqq.provisioner.adapter.aws.storage;

import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.model.ResourceKind;
import com.ryuqq.provisioner.core.spi.ResourceDetails;
import com.ryuqq.provisioner.core.spi.ResourceProvider;
import com.ryuqq.provisioner.core.spi.ResourceRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.BucketAlreadyOwnedByYouException;
import software.amazon.awssdk.services.s3.model.CreateBucketConfiguration;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.DeleteBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.util.Optional;

/**
 * Object-storage bucket.
 *
 * <p><strong>Idempotence:</strong></p>
 * <ul>
 *   <li>create: skipped when {@code headBucket} succeeds; {@code BucketAlreadyOwnedByYou} is success</li>
 *   <li>delete: empties the bucket first; {@code NoSuchBucket} is success</li>
 * </ul>
 *
 * <p>Identifier is the bucket ARN, which is a pure function of the name.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class S3BucketProvider implements ResourceProvider {

    private static final Logger log = LoggerFactory.getLogger(S3BucketProvider.class);

    private static final int NOT_FOUND = 404;

    private final S3Client s3;
    private final Region region;
    private final BucketEmptier emptier;

    public S3BucketProvider(S3Client s3, Region region) {
        this(s3, region, new BucketEmptier(s3));
    }

    S3BucketProvider(S3Client s3, Region region, BucketEmptier emptier) {
        if (s3 == null) {
            throw new IllegalArgumentException("s3 cannot be null");
        }
        if (region == null) {
            throw new IllegalArgumentException("region cannot be null");
        }
        if (emptier == null) {
            throw new IllegalArgumentException("emptier cannot be null");
        }
        this.s3 = s3;
        this.region = region;
        this.emptier = emptier;
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.STORAGE;
    }

    @Override
    public boolean exists(String name) {
        try {
            s3.headBucket(HeadBucketRequest.builder().bucket(name).build());
            return true;
        } catch (NoSuchBucketException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == NOT_FOUND) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public String create(ResourceRequest request) {
        String bucket = request.name();
        if (exists(bucket)) {
            log.info("[S3] Bucket already exists: {}", bucket);
            return arn(bucket);
        }
        CreateBucketRequest.Builder builder = CreateBucketRequest.builder().bucket(bucket);
        if (!Region.US_EAST_1.equals(region)) {
            builder.createBucketConfiguration(CreateBucketConfiguration.builder()
                .locationConstraint(region.id())
                .build());
        }
        try {
            s3.createBucket(builder.build());
            log.info("[S3] Bucket created: {} ({})", bucket, region.id());
        } catch (BucketAlreadyOwnedByYouException e) {
            log.info("[S3] Bucket already owned: {}", bucket);
        }
        return arn(bucket);
    }

    @Override
    public Optional<ResourceDetails> describe(String identifier) {
        String bucket = bucketName(identifier);
        return exists(bucket) ? Optional.of(ResourceDetails.of(identifier)) : Optional.empty();
    }

    /**
     * @return true for a bucket ARN
     */
    @Override
    public boolean recognizes(String identifier) {
        return identifier.contains(":s3:::");
    }

    @Override
    public void delete(ResourceHandle handle) {
        String bucket = handle.name();
        try {
            emptier.empty(bucket);
            s3.deleteBucket(DeleteBucketRequest.builder().bucket(bucket).build());
            log.info("[S3] Bucket deleted: {}", bucket);
        } catch (NoSuchBucketException e) {
            log.info("[S3] Bucket {} no longer exists", bucket);
        } catch (S3Exception e) {
            if (e.statusCode() != NOT_FOUND) {
                throw e;
            }
            log.info("[S3] Bucket {} no longer exists", bucket);
        }
    }

    /**
     * @param bucket bucket name
     * @return {@code arn:aws:s3:::bucket}
     */
    public static String arn(String bucket) {
        return "arn:aws:s3:::" + bucket;
    }

    /**
     * Inverse of {@link #arn(String)}; plain names pass through.
     */
    public static String bucketName(String identifier) {
        int separator = identifier.lastIndexOf(':');
        return separator < 0 ? identifier : identifier.substring(separator + 1);
    }
}
