package com.inker.api.utils;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

public abstract class JdbcUtils {

	public static Instant instant(ResultSet rs, String columnName) throws SQLException {
		return DateUtils.forOffsetDateTime(rs.getObject(columnName, OffsetDateTime.class));
	}

	/*
	 * JSON lives in text columns so that the same DDL runs on PostgreSQL and on H2.
	 */
	public static List<String> stringList(ResultSet rs, String columnName) throws SQLException {
		return JsonUtils.readStringList(rs.getString(columnName));
	}

	public static Map<String, String> stringMap(ResultSet rs, String columnName) throws SQLException {
		return JsonUtils.readStringMap(rs.getString(columnName));
	}

	/**
	 * @return {@code true} if the exception means the database was unreachable, timed out
	 * or failed transiently, as opposed to it rejecting what we asked for
	 */
	public static boolean isRetryable(DataAccessException exception) {
		return exception instanceof DataAccessResourceFailureException
				|| exception instanceof TransientDataAccessException
				|| exception instanceof RecoverableDataAccessException;
	}

}
