package com.studioflow.orchestrator.workflow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studioflow.orchestrator.repository.JobStepRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Map;
import java.util.UUID;

/**
 * Human-facing record of what each stage of a job last did.
 *
 * Writes go through their own transaction and never throw: a failed
 * step-log insert must not abort the tick that produced it.
 */
@Component
public class StepLog {

    private static final Logger log = LoggerFactory.getLogger(StepLog.class);

    public static final String RUNNING   = "running";
    public static final String SUCCEEDED = "succeeded";
    public static final String WAITING   = "waiting";
    public static final String SKIPPED   = "skipped";
    public static final String FAILED    = "failed";

    private final JobStepRepository  stepRepo;
    private final ObjectMapper       json;
    private final TransactionTemplate requiresNew;

    public StepLog(JobStepRepository stepRepo, ObjectMapper objectMapper,
                   PlatformTransactionManager txManager) {
        this.stepRepo    = stepRepo;
        this.json        = objectMapper;
        this.requiresNew = new TransactionTemplate(txManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public void record(UUID jobId, String stepCode, String status) {
        record(jobId, stepCode, status, Map.of());
    }

    public void record(UUID jobId, String stepCode, String status, Map<String, Object> detail) {
        try {
            String detailJson = json.writeValueAsString(detail == null ? Map.of() : detail);
            requiresNew.executeWithoutResult(tx ->
                    stepRepo.upsert(UUID.randomUUID(), jobId, stepCode, status, detailJson));
        } catch (JsonProcessingException e) {
            log.warn("Step detail for {}/{} is not serializable: {}", jobId, stepCode, e.getMessage());
        } catch (Exception e) {
            log.warn("Could not write step {}={} for job {}: {}", stepCode, status, jobId, e.getMessage());
        }
    }
}
