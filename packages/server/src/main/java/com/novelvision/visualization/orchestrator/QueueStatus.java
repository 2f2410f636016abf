package com.novelvision.visualization.orchestrator;

import java.time.Duration;

/**
 * Queue snapshot. {@code position} (1-based) and {@code estimatedWait} are only set when a pending
 * job was asked about.
 */
public record QueueStatus(
    int pendingCount, int processingCount, Integer position, Duration estimatedWait) {}
