package com.inker.api.queue;

import java.time.Instant;

/**
 * a leased {@link WorkItem}. Hand the {@code handle} back to {@link JobQueue#ack} or
 * {@link JobQueue#fail} before {@code leaseExpiresAt}, or a persistent queue will
 * deliver the item again.
 * @param attempt how many times the item has been delivered, this delivery included
 */
public record Delivery(String handle, WorkItem item, int attempt, Instant leaseExpiresAt) {
}
