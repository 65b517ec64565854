package com.inker.api.utils;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.AlternativeJdkIdGenerator;
import org.springframework.util.IdGenerator;

import java.time.Clock;

@Configuration
class UtilsConfiguration {

	@Bean
	IdGenerator idGenerator() {
		return new AlternativeJdkIdGenerator();
	}

	@Bean
	Clock clock() {
		return Clock.systemUTC();
	}

}
