package com.inker.api.observability;

import com.inker.api.queue.JobQueue;
import com.inker.api.storage.Storage;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
class HealthIndicators {

	@Bean
	StorageHealthIndicator storageHealthIndicator(Storage storage) {
		return new StorageHealthIndicator(storage);
	}

	@Bean
	QueueHealthIndicator queueHealthIndicator(JobQueue queue) {
		return new QueueHealthIndicator(queue);
	}

}
