package com.inker.api.observability;

import com.inker.api.storage.Storage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

class StorageHealthIndicator implements HealthIndicator {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final Storage storage;

	StorageHealthIndicator(Storage storage) {
		this.storage = storage;
	}

	@Override
	public Health health() {
		try {
			var health = this.storage.healthCheck() ? Health.up() : Health.down();
			return health //
				.withDetail("backend", this.storage.getClass().getSimpleName()) //
				.withDetail("schemaVersion", this.storage.schemaVersion()) //
				.build();
		} //
		catch (Throwable throwable) {
			this.log.warn("could not capture the health of the storage", throwable);
		}
		return Health.unknown().build();
	}

}
