package com.inker.api.jobs;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * @param enabled whether to poll the queue at all
 * @param concurrency how many threads poll and run jobs
 * @param pollInterval the pause between polls of an empty queue
 * @param visibilityTimeout how long a delivery stays leased before the queue may hand it
 * out again
 */
@ConfigurationProperties(prefix = "inker.worker")
public record WorkerProperties(@DefaultValue("true") boolean enabled, @DefaultValue("2") int concurrency,
		@DefaultValue("1s") Duration pollInterval, @DefaultValue("10m") Duration visibilityTimeout) {
}
