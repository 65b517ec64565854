package com.inker.api.utils;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * every timestamp this service hands out is truncated to microseconds, which is the
 * precision PostgreSQL keeps, so a value read back from any backend equals the value
 * that was written.
 */
public abstract class DateUtils {

	public static Instant now(Clock clock) {
		return clock.instant().truncatedTo(ChronoUnit.MICROS);
	}

	public static OffsetDateTime forInstant(Instant instant) {
		if (instant == null) {
			return null;
		}
		return instant.atOffset(ZoneOffset.UTC);
	}

	public static Instant forOffsetDateTime(OffsetDateTime dateTime) {
		if (dateTime == null) {
			return null;
		}
		return dateTime.toInstant();
	}

	public static double hoursBetween(Instant start, Instant end) {
		return (end.toEpochMilli() - start.toEpochMilli()) / 3_600_000.0;
	}

}
