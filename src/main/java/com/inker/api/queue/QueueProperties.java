package com.inker.api.queue;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * @param type which backend to use
 * @param maxAttempts deliveries an item gets before it's dead-lettered
 * @param redisKeyPrefix namespace for every key the redis backend writes
 * @param deadLetterTtl how long the redis backend keeps dead letters around
 */
@ConfigurationProperties(prefix = "inker.queue")
public record QueueProperties(@DefaultValue("auto") QueueType type, @DefaultValue("3") int maxAttempts,
		@DefaultValue("inker:queue") String redisKeyPrefix, @DefaultValue("7d") Duration deadLetterTtl) {
}
