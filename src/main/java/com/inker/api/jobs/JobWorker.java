package com.inker.api.jobs;

import com.inker.api.queue.Delivery;
import com.inker.api.queue.JobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * pulls work items off the queue and runs them. Each of the configured threads drains
 * the queue, then sleeps for the poll interval. A job that runs to an outcome (even a
 * failed one) is acknowledged; one that throws is failed back to the queue.
 */
@Component
class JobWorker implements DisposableBean {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final AtomicReference<ScheduledExecutorService> executor = new AtomicReference<>();

	private final AtomicBoolean running = new AtomicBoolean();

	private final JobQueue queue;

	private final JobService jobService;

	private final WorkerProperties properties;

	JobWorker(JobQueue queue, JobService jobService, WorkerProperties properties) {
		this.queue = queue;
		this.jobService = jobService;
		this.properties = properties;
	}

	@EventListener(ApplicationReadyEvent.class)
	void start() {
		if (!this.properties.enabled()) {
			this.log.info("the job worker is disabled");
			return;
		}
		Assert.isTrue(this.properties.concurrency() > 0, "inker.worker.concurrency must be positive");
		if (!this.running.compareAndSet(false, true))
			return;
		var scheduler = Executors.newScheduledThreadPool(this.properties.concurrency(),
				new CustomizableThreadFactory("inker-worker-"));
		this.executor.set(scheduler);
		var interval = this.properties.pollInterval().toMillis();
		for (var i = 0; i < this.properties.concurrency(); i++)
			scheduler.scheduleWithFixedDelay(this::poll, 0, interval, TimeUnit.MILLISECONDS);
		this.log.info("started {} job worker thread(s) polling every {}", this.properties.concurrency(),
				this.properties.pollInterval());
	}

	private void poll() {
		try {
			this.drain();
		} //
		catch (Throwable throwable) {
			// an exception escaping here would cancel the schedule
			this.log.warn("the job worker couldn't poll the queue", throwable);
		}
	}

	/**
	 * runs queued jobs until the queue has nothing more to hand out.
	 * @return the number of deliveries processed
	 */
	int drain() {
		var processed = 0;
		while (true) {
			var delivery = this.queue.dequeue(this.properties.visibilityTimeout());
			if (delivery.isEmpty())
				return processed;
			this.process(delivery.get());
			processed += 1;
		}
	}

	private void process(Delivery delivery) {
		var jobId = delivery.item().jobId();
		this.log.debug("running job [{}], attempt {}", jobId, delivery.attempt());
		try {
			this.jobService.execute(jobId);
		} //
		catch (RuntimeException e) {
			this.log.warn("job [{}] couldn't run, handing it back to the queue", jobId, e);
			this.queue.fail(delivery.handle(), e.getClass().getName() + ": " + e.getMessage());
			return;
		}
		this.queue.ack(delivery.handle());
	}

	@Override
	public void destroy() throws Exception {
		this.running.set(false);
		var scheduler = this.executor.getAndSet(null);
		if (scheduler == null)
			return;
		scheduler.shutdown();
		if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
			this.log.warn("the job worker threads didn't stop in time, interrupting them");
			scheduler.shutdownNow();
		}
	}

}
