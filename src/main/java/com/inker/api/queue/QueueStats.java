package com.inker.api.queue;

public record QueueStats(long pending, long inFlight, long dead) {
}
