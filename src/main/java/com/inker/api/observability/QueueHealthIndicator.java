package com.inker.api.observability;

import com.inker.api.queue.JobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

class QueueHealthIndicator implements HealthIndicator {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final JobQueue queue;

	QueueHealthIndicator(JobQueue queue) {
		this.queue = queue;
	}

	@Override
	public Health health() {
		try {
			if (!this.queue.healthCheck())
				return Health.down().withDetail("backend", this.queue.getClass().getSimpleName()).build();
			var stats = this.queue.stats();
			return Health.up() //
				.withDetail("backend", this.queue.getClass().getSimpleName()) //
				.withDetail("pending", stats.pending()) //
				.withDetail("inFlight", stats.inFlight()) //
				.withDetail("dead", stats.dead()) //
				.build();
		} //
		catch (Throwable throwable) {
			this.log.warn("could not capture the health of the queue", throwable);
		}
		return Health.unknown().build();
	}

}
