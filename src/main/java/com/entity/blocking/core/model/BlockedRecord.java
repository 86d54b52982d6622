package com.entity.blocking.core.model;

/**
 * One element of the block key stream: a record id filed under a tagged key.
 */
public record BlockedRecord(BlockKey key, String recordId) {
}
