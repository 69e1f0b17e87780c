package com.shlawgathon.sentientloop.backend.config;

import com.shlawgathon.sentientloop.backend.pubsub.GovernanceEventSubscriber;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.listener.adapter.MessageListenerAdapter;

/**
 * Redis Pub/Sub configuration for fanning governance events out to every
 * backend pod.
 */
@Configuration
public class RedisMessageConfig {

    public static final String GOVERNANCE_EVENTS_CHANNEL = "sentientloop:governance-events";

    /**
     * Consumed by the notification transports, not by this service.
     */
    public static final String NOTIFICATIONS_CHANNEL = "sentientloop:notifications";

    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(
            RedisConnectionFactory connectionFactory,
            MessageListenerAdapter messageListenerAdapter) {

        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(messageListenerAdapter, new ChannelTopic(GOVERNANCE_EVENTS_CHANNEL));
        return container;
    }

    @Bean
    public MessageListenerAdapter messageListenerAdapter(GovernanceEventSubscriber subscriber) {
        return new MessageListenerAdapter(subscriber, "handleMessage");
    }
}
