package com.ryuqq.provisioner.adapter.aws.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.provisioner.core.exception.ProvisioningException;
import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.model.ResourceKey;
import com.ryuqq.provisioner.core.model.ResourceKind;
import com.ryuqq.provisioner.core.spi.ResourceDetails;
import com.ryuqq.provisioner.core.spi.ResourceProvider;
import com.ryuqq.provisioner.core.spi.ResourceRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.IndexDocument;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PublicAccessBlockConfiguration;
import software.amazon.awssdk.services.s3.model.PutBucketPolicyRequest;
import software.amazon.awssdk.services.s3.model.PutBucketWebsiteRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutPublicAccessBlockRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.WebsiteConfiguration;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Publishes the static web site into the web bucket.
 *
 * <p>Every step is a put, so replaying the whole publication is safe:</p>
 * <ol>
 *   <li>disable the public access block</li>
 *   <li>apply a public-read bucket policy</li>
 *   <li>upload {@code index.html} with the API placeholder replaced by the gateway endpoint</li>
 *   <li>enable website hosting</li>
 * </ol>
 *
 * <p>Identifier is the website URL. Deletion is a no-op: the site goes away with its bucket.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class StaticSiteProvider implements ResourceProvider {

    private static final Logger log = LoggerFactory.getLogger(StaticSiteProvider.class);

    public static final String API_PLACEHOLDER = "REPLACE_ME_WITH_YOUR_INVOKE_URL";
    static final String INDEX_DOCUMENT = "index.html";
    static final String CONTENT_TYPE = "text/html; charset=utf-8";

    private final S3Client s3;
    private final Region region;
    private final Path indexTemplate;
    private final ResourceKey gatewayKey;
    private final ResourceProvider gatewayProvider;
    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * @param s3 S3 client
     * @param region deployment region, used for the website host name
     * @param indexTemplate local {@code index.html} template
     * @param gatewayKey dependency holding the HTTP API
     * @param gatewayProvider provider that exposes the gateway endpoint
     */
    public StaticSiteProvider(S3Client s3, Region region, Path indexTemplate,
                              ResourceKey gatewayKey, ResourceProvider gatewayProvider) {
        if (s3 == null) {
            throw new IllegalArgumentException("s3 cannot be null");
        }
        if (region == null) {
            throw new IllegalArgumentException("region cannot be null");
        }
        if (indexTemplate == null) {
            throw new IllegalArgumentException("indexTemplate cannot be null");
        }
        if (gatewayKey == null) {
            throw new IllegalArgumentException("gatewayKey cannot be null");
        }
        if (gatewayProvider == null) {
            throw new IllegalArgumentException("gatewayProvider cannot be null");
        }
        this.s3 = s3;
        this.region = region;
        this.indexTemplate = indexTemplate;
        this.gatewayKey = gatewayKey;
        this.gatewayProvider = gatewayProvider;
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.STORAGE;
    }

    @Override
    public boolean exists(String name) {
        try {
            s3.headObject(HeadObjectRequest.builder().bucket(name).key(INDEX_DOCUMENT).build());
            return true;
        } catch (NoSuchKeyException | NoSuchBucketException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public String create(ResourceRequest request) {
        String bucket = request.name();
        String apiEndpoint = endpointOf(request.dependency(gatewayKey));
        String page = readTemplate().replace(API_PLACEHOLDER, apiEndpoint);

        s3.putPublicAccessBlock(PutPublicAccessBlockRequest.builder()
            .bucket(bucket)
            .publicAccessBlockConfiguration(PublicAccessBlockConfiguration.builder()
                .blockPublicAcls(false)
                .ignorePublicAcls(false)
                .blockPublicPolicy(false)
                .restrictPublicBuckets(false)
                .build())
            .build());
        s3.putBucketPolicy(PutBucketPolicyRequest.builder()
            .bucket(bucket)
            .policy(publicReadPolicy(bucket))
            .build());
        s3.putObject(PutObjectRequest.builder()
                .bucket(bucket)
                .key(INDEX_DOCUMENT)
                .contentType(CONTENT_TYPE)
                .build(),
            RequestBody.fromString(page, StandardCharsets.UTF_8));
        s3.putBucketWebsite(PutBucketWebsiteRequest.builder()
            .bucket(bucket)
            .websiteConfiguration(WebsiteConfiguration.builder()
                .indexDocument(IndexDocument.builder().suffix(INDEX_DOCUMENT).build())
                .build())
            .build());

        String url = websiteUrl(bucket);
        log.info("[S3] Static site published: {} (API {})", url, apiEndpoint);
        return url;
    }

    @Override
    public Optional<ResourceDetails> describe(String identifier) {
        return Optional.of(new ResourceDetails(identifier, Map.of(ResourceDetails.ENDPOINT, identifier)));
    }

    @Override
    public boolean recognizes(String identifier) {
        return identifier.startsWith("http://");
    }

    @Override
    public void delete(ResourceHandle handle) {
        log.info("[S3] Static site {} is removed together with bucket {}", handle.identifier(), handle.name());
    }

    /**
     * Website endpoint in the dash form.
     *
     * <p>Regions launched later (eu-central-1, ap-south-1 and others) publish their endpoint in
     * the dot form {@code bucket.s3-website.region.amazonaws.com} instead, so the URL returned
     * for them does not resolve. The recorded identifier and the {@code web-url} output keep the
     * dash form.</p>
     *
     * @return {@code http://bucket.s3-website-region.amazonaws.com/}
     */
    public String websiteUrl(String bucket) {
        return "http://" + bucket + ".s3-website-" + region.id() + ".amazonaws.com/";
    }

    String publicReadPolicy(String bucket) {
        ObjectNode policy = objectMapper.createObjectNode();
        policy.put("Version", "2012-10-17");
        ObjectNode statement = policy.putArray("Statement").addObject();
        statement.put("Sid", "PublicReadObjects");
        statement.put("Effect", "Allow");
        statement.put("Principal", "*");
        statement.putArray("Action").add("s3:GetObject");
        statement.put("Resource", S3BucketProvider.arn(bucket) + "/*");
        try {
            return objectMapper.writeValueAsString(policy);
        } catch (JsonProcessingException e) {
            throw ProvisioningException.fatal("Cannot render bucket policy for " + bucket, e);
        }
    }

    private String endpointOf(ResourceHandle gateway) {
        return gatewayProvider.describe(gateway.identifier())
            .flatMap(details -> details.attribute(ResourceDetails.ENDPOINT))
            .orElseThrow(() -> ProvisioningException.fatal(
                "Gateway " + gateway.identifier() + " has no endpoint"));
    }

    private String readTemplate() {
        if (!Files.isRegularFile(indexTemplate)) {
            throw ProvisioningException.fatal("Web index template not found: " + indexTemplate);
        }
        try {
            return Files.readString(indexTemplate, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw ProvisioningException.fatal("Cannot read web index template " + indexTemplate, e);
        }
    }
}
