package com.inker.api.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.Assert;
import org.springframework.util.IdGenerator;
import org.springframework.util.StringUtils;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.Locale;

@Configuration
class QueueConfiguration {

	private final Logger log = LoggerFactory.getLogger(getClass());

	@Bean
	JobQueue jobQueue(QueueProperties properties, Environment environment, ObjectProvider<DataSource> dataSource,
			ObjectProvider<JdbcClient> db, ObjectProvider<TransactionTemplate> tx,
			ObjectProvider<StringRedisTemplate> redis, IdGenerator idGenerator, Clock clock) {
		Assert.isTrue(properties.maxAttempts() > 0, "inker.queue.max-attempts must be positive");
		var type = resolve(properties.type(), environment);
		var queue = switch (type) {
			case MEMORY -> new InMemoryJobQueue(idGenerator, clock, properties.maxAttempts());
			case JDBC -> {
				var ds = dataSource.getIfAvailable();
				Assert.state(ds != null, "the jdbc queue needs a configured DataSource");
				yield new JdbcJobQueue(ds, db.getObject(), tx.getObject(), idGenerator, clock,
						properties.maxAttempts());
			}
			case REDIS -> new RedisJobQueue(redis.getObject(), idGenerator, clock, properties.redisKeyPrefix(),
					properties.maxAttempts(), properties.deadLetterTtl());
			case AUTO -> throw new IllegalStateException("the queue type should have been resolved");
		};
		queue.initialize();
		this.log.info("using the {} queue, dead-lettering after {} attempts", type.name().toLowerCase(Locale.ROOT),
				properties.maxAttempts());
		return queue;
	}

	static QueueType resolve(QueueType configured, Environment environment) {
		if (configured != null && configured != QueueType.AUTO)
			return configured;
		return StringUtils.hasText(environment.getProperty("spring.datasource.url")) ? QueueType.JDBC
				: QueueType.MEMORY;
	}

}
