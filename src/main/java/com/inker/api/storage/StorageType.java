package com.inker.api.storage;

public enum StorageType {

	/**
	 * {@link #JDBC} when a datasource url is configured, {@link #MEMORY} otherwise.
	 */
	AUTO,

	MEMORY,

	FILE,

	JDBC

}
