package com.studioflow.orchestrator.workflow;

import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.Stage;

/**
 * Work for one stage of a graph job.
 *
 * Nodes run inside the router's transaction and mutate the loaded job in
 * memory ({@code computed} patches, status). They never save the job
 * themselves: the router persists it once, under the job's version check.
 */
public interface StageNode {

    Stage stage();

    NodeResult run(Job job);
}
