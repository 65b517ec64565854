package com.inker.api.jobs;

import com.inker.api.BackendUnavailableException;
import com.inker.api.queue.InMemoryJobQueue;
import com.inker.api.queue.QueueStats;
import com.inker.api.queue.WorkItem;
import com.inker.api.utils.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.util.AlternativeJdkIdGenerator;

import java.time.Duration;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class JobWorkerTests {

	private final InMemoryJobQueue queue = new InMemoryJobQueue(new AlternativeJdkIdGenerator(),
			MutableClock.startingAt("2024-01-01T00:00:00Z"), 2);

	private final JobService jobService = mock(JobService.class);

	private final JobWorker worker = new JobWorker(this.queue, this.jobService,
			new WorkerProperties(false, 1, Duration.ofSeconds(1), Duration.ofMinutes(10)));

	@Test
	void drainingRunsAndAcknowledgesEveryJob() {
		this.queue.enqueue(WorkItem.of("job-1"));
		this.queue.enqueue(WorkItem.of("job-2"));
		Assertions.assertEquals(2, this.worker.drain());
		verify(this.jobService).execute("job-1");
		verify(this.jobService).execute("job-2");
		Assertions.assertEquals(new QueueStats(0, 0, 0), this.queue.stats());
		Assertions.assertEquals(0, this.worker.drain(), "there's nothing left");
	}

	@Test
	void jobsThatThrowAreHandedBackUntilTheyAreDeadLettered() {
		doThrow(new BackendUnavailableException("the database is down", new RuntimeException())).when(this.jobService)
			.execute("job-1");
		this.queue.enqueue(WorkItem.of("job-1"));
		Assertions.assertEquals(2, this.worker.drain(), "the failed delivery comes straight back");
		verify(this.jobService, times(2)).execute("job-1");
		Assertions.assertEquals(new QueueStats(0, 0, 1), this.queue.stats());
	}

	@Test
	void aDisabledWorkerNeverStarts() throws Exception {
		this.queue.enqueue(WorkItem.of("job-1"));
		this.worker.start();
		this.worker.destroy();
		Assertions.assertEquals(1, this.queue.stats().pending(), "nothing was polled");
	}

}
