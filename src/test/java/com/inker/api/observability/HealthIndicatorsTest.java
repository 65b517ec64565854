package com.inker.api.observability;

import com.inker.api.queue.InMemoryJobQueue;
import com.inker.api.queue.JobQueue;
import com.inker.api.queue.WorkItem;
import com.inker.api.storage.InMemoryStorage;
import com.inker.api.storage.Storage;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;
import org.springframework.util.AlternativeJdkIdGenerator;

import java.time.Clock;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthIndicatorsTest {

	@Test
	void storage() {
		var storage = new InMemoryStorage(new AlternativeJdkIdGenerator(), Clock.systemUTC());
		var health = new StorageHealthIndicator(storage).health();
		Assertions.assertEquals(Status.UP, health.getStatus());
		Assertions.assertEquals("memory", health.getDetails().get("schemaVersion"));

		var down = mock(Storage.class);
		when(down.healthCheck()).thenReturn(false);
		when(down.schemaVersion()).thenReturn("1");
		Assertions.assertEquals(Status.DOWN, new StorageHealthIndicator(down).health().getStatus());
	}

	@Test
	void queue() {
		var queue = new InMemoryJobQueue(new AlternativeJdkIdGenerator(), Clock.systemUTC(), 3);
		queue.enqueue(WorkItem.of("job-1"));
		var health = new QueueHealthIndicator(queue).health();
		Assertions.assertEquals(Status.UP, health.getStatus());
		Assertions.assertEquals(1L, health.getDetails().get("pending"));

		var broken = mock(JobQueue.class);
		when(broken.healthCheck()).thenThrow(new IllegalStateException("boom"));
		Assertions.assertEquals(Status.UNKNOWN, new QueueHealthIndicator(broken).health().getStatus());
	}

}
