package com.inker.api;

import com.inker.api.queue.JobQueue;
import com.inker.api.storage.Storage;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.modulith.core.ApplicationModules;

@SpringBootTest
class ApiApplicationTests {

	@Test
	void contextLoads(@Autowired Storage storage, @Autowired JobQueue queue) {
		Assertions.assertEquals("1", storage.schemaVersion(), "the storage migrations should have run");
		Assertions.assertTrue(storage.healthCheck());
		Assertions.assertTrue(queue.healthCheck());
	}

	@Test
	void modules() {
		var am = ApplicationModules.of(ApiApplication.class);
		am.verify();
		System.out.println(am);
	}

}
