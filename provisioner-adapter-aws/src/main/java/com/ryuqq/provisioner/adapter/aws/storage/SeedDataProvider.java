package com.ryuqq.provisioner.adapter.aws.storage;

import com.ryuqq.provisioner.core.exception.ProvisioningException;
import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.model.ResourceKind;
import com.ryuqq.provisioner.core.spi.ResourceDetails;
import com.ryuqq.provisioner.core.spi.ResourceProvider;
import com.ryuqq.provisioner.core.spi.ResourceRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Uploads the initial CSV files into the uploads bucket, which fires the loader function.
 *
 * <p>A file that fails to upload is logged and skipped. Deletion is a no-op: the objects go
 * away with the bucket.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class SeedDataProvider implements ResourceProvider {

    private static final Logger log = LoggerFactory.getLogger(SeedDataProvider.class);

    private static final String CSV_SUFFIX = ".csv";

    private final S3Client s3;
    private final Path seedDirectory;

    public SeedDataProvider(S3Client s3, Path seedDirectory) {
        if (s3 == null) {
            throw new IllegalArgumentException("s3 cannot be null");
        }
        if (seedDirectory == null) {
            throw new IllegalArgumentException("seedDirectory cannot be null");
        }
        this.s3 = s3;
        this.seedDirectory = seedDirectory;
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.STORAGE;
    }

    @Override
    public boolean exists(String name) {
        try {
            return s3.listObjectsV2(ListObjectsV2Request.builder().bucket(name).maxKeys(1).build())
                .hasContents();
        } catch (NoSuchBucketException e) {
            return false;
        }
    }

    @Override
    public String create(ResourceRequest request) {
        String bucket = request.name();
        List<Path> files = csvFiles();
        if (files.isEmpty()) {
            log.info("[Data] No CSV files in {}", seedDirectory);
            return identifier(bucket);
        }

        int uploaded = 0;
        for (Path file : files) {
            String key = file.getFileName().toString();
            try {
                s3.putObject(PutObjectRequest.builder().bucket(bucket).key(key).build(), RequestBody.fromFile(file));
                uploaded++;
                log.info("[Data] Uploaded {} to {}", key, bucket);
            } catch (SdkException e) {
                log.error("[Data] Failed to upload {} to {}", key, bucket, e);
            }
        }
        log.info("[Data] {} of {} CSV files uploaded to {}", uploaded, files.size(), bucket);
        return identifier(bucket);
    }

    @Override
    public Optional<ResourceDetails> describe(String identifier) {
        return Optional.of(ResourceDetails.of(identifier));
    }

    @Override
    public boolean recognizes(String identifier) {
        return identifier.startsWith("s3://");
    }

    @Override
    public void delete(ResourceHandle handle) {
        log.info("[Data] Seed objects in {} are removed together with the bucket", handle.name());
    }

    List<Path> csvFiles() {
        if (!Files.isDirectory(seedDirectory)) {
            log.warn("[Data] Seed folder {} not found, skipping upload", seedDirectory);
            return List.of();
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(seedDirectory,
            path -> Files.isRegularFile(path)
                && path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(CSV_SUFFIX))) {
            stream.forEach(files::add);
        } catch (IOException e) {
            throw ProvisioningException.fatal("Cannot list seed folder " + seedDirectory, e);
        }
        files.sort(null);
        return files;
    }

    private static String identifier(String bucket) {
        return "s3://" + bucket + "/";
    }
}
