package com.studioflow.orchestrator.workflow.node;

import com.studioflow.orchestrator.model.ProviderRun;
import com.studioflow.orchestrator.model.RunStatus;
import com.studioflow.orchestrator.model.RunType;
import com.studioflow.orchestrator.repository.ProviderRunRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/** Reads back the single non-candidate run a stage enqueued for a group. */
@Component
public class ProviderRuns {

    private final ProviderRunRepository runRepo;

    public ProviderRuns(ProviderRunRepository runRepo) {
        this.runRepo = runRepo;
    }

    /** The run, or empty while it has not been written yet. */
    public Optional<ProviderRun> find(UUID jobId, RunType type, UUID groupId) {
        List<ProviderRun> runs = runRepo.findByJobIdAndRunTypeAndGroupId(jobId, type.code(), groupId);
        return runs.stream().findFirst();
    }

    public static boolean isDone(Optional<ProviderRun> run) {
        return run.isPresent() && run.get().getStatus().isTerminal();
    }

    /** Response of a succeeded run; empty for failed or abandoned ones. */
    public static Map<String, Object> output(Optional<ProviderRun> run) {
        if (run.isEmpty() || run.get().getStatus() != RunStatus.SUCCEEDED || run.get().getResponse() == null) {
            return Map.of();
        }
        return run.get().getResponse();
    }
}
