package com.inker.api.jobs;

import com.inker.api.Job;
import com.inker.api.JobStatus;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Micrometer meters for job processing. Tags are bounded: job states, error codes and
 * whether a submission was a duplicate.
 */
@Component
class JobMetrics {

	static final String SUBMITTED = "inker.jobs.submitted";

	static final String FINISHED = "inker.jobs.finished";

	static final String DURATION = "inker.jobs.duration";

	static final String STAGE = "inker.jobs.stage";

	private final MeterRegistry registry;

	JobMetrics(MeterRegistry registry) {
		this.registry = registry;
	}

	void submitted(boolean duplicate) {
		this.registry.counter(SUBMITTED, "duplicate", Boolean.toString(duplicate)).increment();
	}

	<T> T stage(JobStatus stage, Supplier<T> work) {
		return Timer.builder(STAGE) //
			.tag("stage", stage.value()) //
			.register(this.registry) //
			.record(work);
	}

	void finished(Job job) {
		var code = job.error() == null ? "none" : job.error().code();
		this.registry.counter(FINISHED, "status", job.status().value(), "code", code).increment();
		if (job.startedAt() != null && job.completedAt() != null)
			this.registry.timer(DURATION, "status", job.status().value())
				.record(Duration.between(job.startedAt(), job.completedAt()));
	}

}
