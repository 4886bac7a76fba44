package com.studioflow.orchestrator.api;

import com.studioflow.orchestrator.api.dto.*;
import com.studioflow.orchestrator.blob.BlobStore;
import com.studioflow.orchestrator.candidate.CandidateSelectionException;
import com.studioflow.orchestrator.model.CandidateType;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.service.JobNotFoundException;
import com.studioflow.orchestrator.service.JobService;
import com.studioflow.orchestrator.workflow.StageRouter;
import com.studioflow.orchestrator.workflow.WorkflowException;
import com.studioflow.orchestrator.workflow.WorkflowNotifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * REST API for the job lifecycle.
 *
 * POST /jobs                                 create (idempotent per request hash)
 * GET  /jobs/{id}                            status, pending action, signed track URLs
 * GET  /jobs/{id}/candidates?type=           candidates, optionally of one type
 * POST /jobs/{id}/candidates/{cid}/select    human pick for a paused fan-in
 * POST /jobs/{id}/actions/resolve            answer upload / lyrics actions
 * POST /jobs/{id}/tick                       advance the job now
 * POST /jobs/{id}/cancel                     stop the job
 * GET  /jobs/{id}/steps                      step log
 */
@RestController
@RequestMapping("/jobs")
public class JobController {

    private final JobService       jobService;
    private final StageRouter      router;
    private final WorkflowNotifier notifier;
    private final BlobStore        blobs;
    private final Duration         urlTtl;

    public JobController(JobService jobService,
                         StageRouter router,
                         WorkflowNotifier notifier,
                         BlobStore blobs,
                         @Value("${studioflow.blob-store.url-ttl-sec:3600}") long urlTtlSeconds) {
        this.jobService = jobService;
        this.router     = router;
        this.notifier   = notifier;
        this.blobs      = blobs;
        this.urlTtl     = Duration.ofSeconds(urlTtlSeconds);
    }

    /**
     * Create a job.
     *
     * Example:
     *   curl -X POST http://localhost:8080/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"mode":"autopilot","input":{"title":"Night Drive","mood":"dreamy","outputs":["audio","video"]}}'
     *
     * 201 for a new job, 200 when the same request was submitted before.
     */
    @PostMapping
    public ResponseEntity<JobResponse> create(@RequestBody CreateJobRequest req) {
        JobService.CreatedJob created = call(() ->
                jobService.create(req.kind(), req.mode(), req.requestHash(), req.input()));
        return ResponseEntity.status(created.created() ? HttpStatus.CREATED : HttpStatus.OK)
                .body(view(created.job()));
    }

    @GetMapping("/{id}")
    public JobResponse getJob(@PathVariable UUID id) {
        return view(requireJob(id));
    }

    @GetMapping("/{id}/candidates")
    public List<CandidateResponse> getCandidates(@PathVariable UUID id,
                                                 @RequestParam(required = false) String type) {
        requireJob(id);
        CandidateType candidateType = type == null || type.isBlank() ? null : call(() -> CandidateType.fromCode(type));
        return jobService.candidates(id, candidateType).stream()
                .map(c -> CandidateResponse.from(c, this::sign))
                .toList();
    }

    /**
     * Pick a candidate while the job is paused on select_&lt;type&gt;.
     * 409 when the job is not waiting for this candidate's group.
     */
    @PostMapping("/{id}/candidates/{candidateId}/select")
    public CandidateResponse select(@PathVariable UUID id, @PathVariable UUID candidateId) {
        CandidateResponse chosen = call(() ->
                CandidateResponse.from(jobService.selectCandidate(id, candidateId), this::sign));
        notifier.notifyJob(id, "candidate_selected");
        return chosen;
    }

    @PostMapping("/{id}/actions/resolve")
    public JobResponse resolveAction(@PathVariable UUID id, @RequestBody ResolveActionRequest req) {
        call(() -> jobService.resolveAction(id, req.patch()));
        notifier.notifyJob(id, "action_resolved");
        return view(requireJob(id));
    }

    @PostMapping("/{id}/tick")
    public TickResponse tick(@PathVariable UUID id) {
        return call(() -> TickResponse.from(router.tick(id, "api")));
    }

    @PostMapping("/{id}/cancel")
    public JobResponse cancel(@PathVariable UUID id) {
        return view(call(() -> jobService.cancel(id)));
    }

    @GetMapping("/{id}/steps")
    public List<StepResponse> getSteps(@PathVariable UUID id) {
        requireJob(id);
        return jobService.steps(id).stream()
                .map(StepResponse::from)
                .toList();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Job requireJob(UUID id) {
        return jobService.findById(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found: " + id));
    }

    private JobResponse view(Job job) {
        return JobResponse.from(job, jobService.tracks(job.getId()), this::sign);
    }

    private String sign(String locator) {
        return blobs.sign(locator, urlTtl);
    }

    /** Maps domain exceptions onto HTTP statuses. */
    private static <T> T call(Supplier<T> action) {
        try {
            return action.get();
        } catch (JobNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (CandidateSelectionException | IllegalStateException | OptimisticLockingFailureException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (WorkflowException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
    }
}
