package com.ryuqq.provisioner.adapter.aws.topic;

import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.model.ResourceKind;
import com.ryuqq.provisioner.core.spi.ResourceDetails;
import com.ryuqq.provisioner.core.spi.ResourceProvider;
import com.ryuqq.provisioner.core.spi.ResourceRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.CreateTopicRequest;
import software.amazon.awssdk.services.sns.model.DeleteTopicRequest;
import software.amazon.awssdk.services.sns.model.GetTopicAttributesRequest;
import software.amazon.awssdk.services.sns.model.ListSubscriptionsByTopicRequest;
import software.amazon.awssdk.services.sns.model.ListSubscriptionsByTopicResponse;
import software.amazon.awssdk.services.sns.model.ListTopicsRequest;
import software.amazon.awssdk.services.sns.model.ListTopicsResponse;
import software.amazon.awssdk.services.sns.model.NotFoundException;
import software.amazon.awssdk.services.sns.model.SubscribeRequest;

import java.util.Optional;

/**
 * Low-stock notification topic with an optional e-mail subscription.
 *
 * <p>{@code createTopic} is idempotent by name. The subscription is requested only when no
 * subscription (confirmed or pending) exists for the address, so re-runs do not send a new
 * confirmation mail.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class SnsTopicProvider implements ResourceProvider {

    private static final Logger log = LoggerFactory.getLogger(SnsTopicProvider.class);

    static final String EMAIL_PROTOCOL = "email";

    private final SnsClient sns;
    private final String email;

    /**
     * @param sns SNS client
     * @param email address to subscribe, null or blank for none
     */
    public SnsTopicProvider(SnsClient sns, String email) {
        if (sns == null) {
            throw new IllegalArgumentException("sns cannot be null");
        }
        this.sns = sns;
        this.email = email == null || email.isBlank() ? null : email.trim();
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.TOPIC;
    }

    @Override
    public boolean exists(String name) {
        String nextToken = null;
        do {
            ListTopicsResponse page = sns.listTopics(ListTopicsRequest.builder().nextToken(nextToken).build());
            boolean found = page.topics().stream()
                .anyMatch(topic -> topic.topicArn().endsWith(":" + name));
            if (found) {
                return true;
            }
            nextToken = page.nextToken();
        } while (nextToken != null);
        return false;
    }

    @Override
    public String create(ResourceRequest request) {
        String topicArn = sns.createTopic(CreateTopicRequest.builder().name(request.name()).build()).topicArn();
        log.info("[SNS] Topic: {}", topicArn);
        if (email != null) {
            subscribeOnce(topicArn);
        }
        return topicArn;
    }

    @Override
    public Optional<ResourceDetails> describe(String identifier) {
        try {
            sns.getTopicAttributes(GetTopicAttributesRequest.builder().topicArn(identifier).build());
            return Optional.of(ResourceDetails.of(identifier));
        } catch (NotFoundException e) {
            return Optional.empty();
        }
    }

    @Override
    public void delete(ResourceHandle handle) {
        try {
            sns.deleteTopic(DeleteTopicRequest.builder().topicArn(handle.identifier()).build());
            log.info("[SNS] Topic deleted: {}", handle.identifier());
        } catch (NotFoundException e) {
            log.info("[SNS] Topic {} no longer exists", handle.identifier());
        }
    }

    private void subscribeOnce(String topicArn) {
        if (isSubscribed(topicArn)) {
            log.info("[SNS] {} is already subscribed", email);
            return;
        }
        sns.subscribe(SubscribeRequest.builder()
            .topicArn(topicArn)
            .protocol(EMAIL_PROTOCOL)
            .endpoint(email)
            .build());
        log.info("[SNS] Subscription requested for {}", email);
    }

    private boolean isSubscribed(String topicArn) {
        String nextToken = null;
        do {
            ListSubscriptionsByTopicResponse page = sns.listSubscriptionsByTopic(ListSubscriptionsByTopicRequest.builder()
                .topicArn(topicArn)
                .nextToken(nextToken)
                .build());
            boolean found = page.subscriptions().stream()
                .anyMatch(subscription -> EMAIL_PROTOCOL.equals(subscription.protocol())
                    && email.equalsIgnoreCase(subscription.endpoint()));
            if (found) {
                return true;
            }
            nextToken = page.nextToken();
        } while (nextToken != null);
        return false;
    }
}
