package com.ryuqq.provisioner.adapter.aws.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Delete;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.ListObjectVersionsRequest;
import software.amazon.awssdk.services.s3.model.ListObjectVersionsResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes every object from a bucket so that it can be deleted.
 *
 * <p>Object versions and delete markers go first, then whatever the unversioned listing still
 * returns. Deletions are sent in batches of at most {@value #MAX_BATCH} keys.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class BucketEmptier {

    private static final Logger log = LoggerFactory.getLogger(BucketEmptier.class);

    /**
     * DeleteObjects accepts at most 1000 keys per request.
     */
    static final int MAX_BATCH = 1000;

    private final S3Client s3;

    public BucketEmptier(S3Client s3) {
        if (s3 == null) {
            throw new IllegalArgumentException("s3 cannot be null");
        }
        this.s3 = s3;
    }

    /**
     * Empties the bucket.
     *
     * @param bucket bucket name
     * @return number of keys and versions deleted
     */
    public int empty(String bucket) {
        int deleted = deleteVersions(bucket) + deleteObjects(bucket);
        log.info("Emptied bucket {} ({} objects and versions)", bucket, deleted);
        return deleted;
    }

    private int deleteVersions(String bucket) {
        int deleted = 0;
        String keyMarker = null;
        String versionIdMarker = null;
        ListObjectVersionsResponse page;
        do {
            page = s3.listObjectVersions(ListObjectVersionsRequest.builder()
                .bucket(bucket)
                .keyMarker(keyMarker)
                .versionIdMarker(versionIdMarker)
                .build());
            List<ObjectIdentifier> identifiers = new ArrayList<>();
            page.versions().forEach(version -> identifiers.add(ObjectIdentifier.builder()
                .key(version.key())
                .versionId(version.versionId())
                .build()));
            page.deleteMarkers().forEach(marker -> identifiers.add(ObjectIdentifier.builder()
                .key(marker.key())
                .versionId(marker.versionId())
                .build()));
            deleted += deleteInBatches(bucket, identifiers);
            keyMarker = page.nextKeyMarker();
            versionIdMarker = page.nextVersionIdMarker();
        } while (Boolean.TRUE.equals(page.isTruncated()));
        return deleted;
    }

    private int deleteObjects(String bucket) {
        int deleted = 0;
        String continuationToken = null;
        ListObjectsV2Response page;
        do {
            page = s3.listObjectsV2(ListObjectsV2Request.builder()
                .bucket(bucket)
                .continuationToken(continuationToken)
                .build());
            List<ObjectIdentifier> identifiers = new ArrayList<>();
            page.contents().forEach(object -> identifiers.add(ObjectIdentifier.builder()
                .key(object.key())
                .build()));
            deleted += deleteInBatches(bucket, identifiers);
            continuationToken = page.nextContinuationToken();
        } while (Boolean.TRUE.equals(page.isTruncated()));
        return deleted;
    }

    private int deleteInBatches(String bucket, List<ObjectIdentifier> identifiers) {
        for (int from = 0; from < identifiers.size(); from += MAX_BATCH) {
            List<ObjectIdentifier> batch = identifiers.subList(from, Math.min(from + MAX_BATCH, identifiers.size()));
            s3.deleteObjects(DeleteObjectsRequest.builder()
                .bucket(bucket)
                .delete(Delete.builder().objects(batch).quiet(true).build())
                .build());
            log.debug("Deleted {} keys from {}", batch.size(), bucket);
        }
        return identifiers.size();
    }
}
