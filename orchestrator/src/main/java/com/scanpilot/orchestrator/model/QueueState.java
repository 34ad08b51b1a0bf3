package com.scanpilot.orchestrator.model;

/**
 * State of a durable queue entry.
 *
 *   READY   → CLAIMED (dispatcher took it for a worker slot)
 *   CLAIMED → READY   (dispatch failed before the job started; retried after backoff)
 *   CLAIMED → deleted (acknowledged)
 *   CLAIMED → DEAD    (attempts exhausted)
 */
public enum QueueState {
    READY,
    CLAIMED,
    DEAD
}
