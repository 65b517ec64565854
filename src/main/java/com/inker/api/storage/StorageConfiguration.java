package com.inker.api.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.Assert;
import org.springframework.util.IdGenerator;
import org.springframework.util.StringUtils;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.Locale;

@Configuration
class StorageConfiguration {

	private final Logger log = LoggerFactory.getLogger(getClass());

	@Bean
	Storage storage(StorageProperties properties, Environment environment, ObjectProvider<DataSource> dataSource,
			ObjectProvider<JdbcClient> db, ObjectProvider<TransactionTemplate> tx, IdGenerator idGenerator,
			Clock clock) {
		var type = resolve(properties.type(), environment);
		var storage = switch (type) {
			case MEMORY -> new InMemoryStorage(idGenerator, clock);
			case FILE -> new FileSystemStorage(properties.directory(), idGenerator, clock);
			case JDBC -> {
				var ds = dataSource.getIfAvailable();
				Assert.state(ds != null, "the jdbc storage needs a configured DataSource");
				yield new JdbcStorage(ds, db.getObject(), tx.getObject(), idGenerator, clock);
			}
			case AUTO -> throw new IllegalStateException("the storage type should have been resolved");
		};
		storage.initialize();
		this.log.info("using the {} storage (schema version {})", type.name().toLowerCase(Locale.ROOT),
				storage.schemaVersion());
		return storage;
	}

	static StorageType resolve(StorageType configured, Environment environment) {
		if (configured != null && configured != StorageType.AUTO)
			return configured;
		return StringUtils.hasText(environment.getProperty("spring.datasource.url")) ? StorageType.JDBC
				: StorageType.MEMORY;
	}

}
