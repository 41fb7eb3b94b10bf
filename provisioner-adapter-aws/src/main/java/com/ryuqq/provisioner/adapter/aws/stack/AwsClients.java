package com.ryuqq.provisioner.adapter.aws.stack;

import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.apigatewayv2.ApiGatewayV2Client;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sts.StsClient;

/**
 * The SDK clients of one run, all bound to the deployment region.
 *
 * <p>Credentials come from the SDK's default provider chain.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class AwsClients implements AutoCloseable {

    private final Region region;
    private final S3Client s3;
    private final DynamoDbClient dynamoDb;
    private final LambdaClient lambda;
    private final ApiGatewayV2Client apiGateway;
    private final SnsClient sns;
    private final StsClient sts;

    public AwsClients(Region region, S3Client s3, DynamoDbClient dynamoDb, LambdaClient lambda,
                      ApiGatewayV2Client apiGateway, SnsClient sns, StsClient sts) {
        if (region == null) {
            throw new IllegalArgumentException("region cannot be null");
        }
        if (s3 == null || dynamoDb == null || lambda == null || apiGateway == null || sns == null || sts == null) {
            throw new IllegalArgumentException("clients cannot be null");
        }
        this.region = region;
        this.s3 = s3;
        this.dynamoDb = dynamoDb;
        this.lambda = lambda;
        this.apiGateway = apiGateway;
        this.sns = sns;
        this.sts = sts;
    }

    /**
     * Builds every client for the region. S3 may reach buckets in other regions.
     */
    public static AwsClients create(Region region) {
        return new AwsClients(region,
            S3Client.builder().region(region).crossRegionAccessEnabled(true).build(),
            DynamoDbClient.builder().region(region).build(),
            LambdaClient.builder().region(region).build(),
            ApiGatewayV2Client.builder().region(region).build(),
            SnsClient.builder().region(region).build(),
            StsClient.builder().region(region).build());
    }

    public Region region() {
        return region;
    }

    public S3Client s3() {
        return s3;
    }

    public DynamoDbClient dynamoDb() {
        return dynamoDb;
    }

    public LambdaClient lambda() {
        return lambda;
    }

    public ApiGatewayV2Client apiGateway() {
        return apiGateway;
    }

    public SnsClient sns() {
        return sns;
    }

    public StsClient sts() {
        return sts;
    }

    @Override
    public void close() {
        s3.close();
        dynamoDb.close();
        lambda.close();
        apiGateway.close();
        sns.close();
        sts.close();
    }
}
