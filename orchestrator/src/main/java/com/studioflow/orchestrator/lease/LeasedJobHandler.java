package com.studioflow.orchestrator.lease;

import com.studioflow.orchestrator.model.Job;

/**
 * Worker for one single-stage job kind.
 *
 * {@link #handle} runs after the job was claimed. It must end the job
 * itself, through {@link JobLeaseService#markSucceeded} or
 * {@link JobLeaseService#failPermanently}; a job left RUNNING is failed
 * with PROCESSING_INCOMPLETE. Throwing counts as a retryable failure.
 */
public interface LeasedJobHandler {

    String kind();

    void handle(Job job);
}
