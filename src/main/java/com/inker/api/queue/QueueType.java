package com.inker.api.queue;

public enum QueueType {

	/**
	 * {@link #JDBC} when a datasource url is configured, {@link #MEMORY} otherwise.
	 */
	AUTO,

	MEMORY,

	JDBC,

	REDIS

}
