package com.studioflow.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.studioflow.orchestrator.candidate.CandidateController;
import com.studioflow.orchestrator.candidate.CandidateSelectionException;
import com.studioflow.orchestrator.model.*;
import com.studioflow.orchestrator.repository.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JobService.
 *
 * Repositories and the candidate controller are mocked; the tests check
 * which guard rejects a human decision and what reaches the database.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class JobServiceTest {

    @Mock JobRepository       jobRepo;
    @Mock CandidateRepository candidateRepo;
    @Mock JobStepRepository   stepRepo;
    @Mock TrackRepository     trackRepo;
    @Mock JobEventRepository  eventRepo;
    @Mock CandidateController candidates;

    private JobService jobService;
    private Job job;

    @BeforeEach
    void setUp() {
        jobService = new JobService(jobRepo, candidateRepo, stepRepo, trackRepo, eventRepo, candidates,
                new ObjectMapper(), 3);
        job = new Job(UUID.randomUUID(), Job.KIND_MUSIC_VIDEO, JobMode.CO_CREATE, Map.of("title", "t"), "h");
        when(jobRepo.findById(job.getId())).thenReturn(Optional.of(job));
        when(jobRepo.save(any())).thenAnswer(inv -> inv.getArgument(0));
    }

    // ------------------------------------------------------------------
    // create()
    // ------------------------------------------------------------------

    @Test
    void create_newRequest_insertsGraphJobAtIntent() {
        when(jobRepo.insertIfAbsent(any(), any(), any(), any(), any(), any(), anyInt())).thenReturn(1);
        when(jobRepo.findByKindAndRequestHash(eq(Job.KIND_MUSIC_VIDEO), any())).thenReturn(Optional.of(job));

        JobService.CreatedJob created = jobService.create(null, "co_create", null, Map.of("title", "t"));

        assertThat(created.created()).isTrue();
        assertThat(created.job()).isSameAs(job);
        verify(jobRepo).insertIfAbsent(any(), eq(Job.KIND_MUSIC_VIDEO), eq("CO_CREATE"), eq("INTENT"),
                contains("\"title\""), any(), eq(3));
    }

    @Test
    void create_replayedRequest_returnsExistingJob() {
        when(jobRepo.insertIfAbsent(any(), any(), any(), any(), any(), eq("client-key"), anyInt())).thenReturn(0);
        when(jobRepo.findByKindAndRequestHash(Job.KIND_MUSIC_VIDEO, "client-key")).thenReturn(Optional.of(job));

        JobService.CreatedJob created = jobService.create("music_video", "co_create", "client-key", Map.of());

        assertThat(created.created()).isFalse();
        assertThat(created.job().getId()).isEqualTo(job.getId());
    }

    @Test
    void create_singleStageKind_hasNoStage() {
        when(jobRepo.insertIfAbsent(any(), any(), any(), any(), any(), any(), anyInt())).thenReturn(1);
        when(jobRepo.findByKindAndRequestHash(eq("tts"), any())).thenReturn(Optional.of(job));

        jobService.create("tts", null, null, Map.of("text", "hi"));

        verify(jobRepo).insertIfAbsent(any(), eq("tts"), eq("AUTOPILOT"), eq(""), any(), any(), anyInt());
    }

    @Test
    void create_unknownMode_rejected() {
        assertThatThrownBy(() -> jobService.create(null, "karaoke", null, Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        verify(jobRepo, never()).insertIfAbsent(any(), any(), any(), any(), any(), any(), anyInt());
    }

    @Test
    void requestHash_ignoresKeyOrder() {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("title", "t");
        a.put("mood", "calm");
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("mood", "calm");
        b.put("title", "t");

        String ha = jobService.requestHash("music_video", JobMode.AUTOPILOT, a);

        assertThat(jobService.requestHash("music_video", JobMode.AUTOPILOT, b)).isEqualTo(ha);
        assertThat(jobService.requestHash("music_video", JobMode.BYO, b)).isNotEqualTo(ha);
        assertThat(ha).hasSize(64);
    }

    // ------------------------------------------------------------------
    // selectCandidate()
    // ------------------------------------------------------------------

    @Test
    void selectCandidate_matchingPendingPick_choosesAndRecordsEvent() {
        Candidate c = candidate(CandidateType.VIDEO);
        awaitPick(c);
        when(candidates.chooseCandidate(job, c.getId())).thenReturn(c);

        Candidate chosen = jobService.selectCandidate(job.getId(), c.getId());

        assertThat(chosen).isSameAs(c);
        verify(jobRepo).save(job);
        verify(eventRepo).save(argThat((JobEvent e) -> e.getJobId().equals(job.getId())));
    }

    @Test
    void selectCandidate_staleGroup_rejected() {
        Candidate c = candidate(CandidateType.VIDEO);
        job.patchComputed(Map.of("required_action", Map.of(
                "type", "select_video", "group_id", UUID.randomUUID().toString(), "attempt", 1)));

        assertThatThrownBy(() -> jobService.selectCandidate(job.getId(), c.getId()))
                .isInstanceOf(CandidateSelectionException.class);
        verify(candidates, never()).chooseCandidate(any(), any());
    }

    @Test
    void selectCandidate_wrongType_rejected() {
        Candidate c = candidate(CandidateType.AUDIO);
        job.patchComputed(Map.of("required_action", Map.of(
                "type", "select_video", "group_id", c.getGroupId().toString(), "attempt", 1)));

        assertThatThrownBy(() -> jobService.selectCandidate(job.getId(), c.getId()))
                .isInstanceOf(CandidateSelectionException.class);
    }

    @Test
    void selectCandidate_noPendingAction_rejected() {
        Candidate c = candidate(CandidateType.VIDEO);

        assertThatThrownBy(() -> jobService.selectCandidate(job.getId(), c.getId()))
                .isInstanceOf(CandidateSelectionException.class);
    }

    @Test
    void selectCandidate_foreignCandidate_rejected() {
        Candidate foreign = new Candidate(UUID.randomUUID(), CandidateType.VIDEO, UUID.randomUUID(), 0, 1, "native");
        when(candidateRepo.findById(foreign.getId())).thenReturn(Optional.of(foreign));
        awaitPick(foreign);

        assertThatThrownBy(() -> jobService.selectCandidate(job.getId(), foreign.getId()))
                .isInstanceOf(CandidateSelectionException.class)
                .hasMessageContaining("does not belong");
    }

    @Test
    void selectCandidate_unknownJob_throwsNotFound() {
        UUID unknown = UUID.randomUUID();
        when(jobRepo.findById(unknown)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> jobService.selectCandidate(unknown, UUID.randomUUID()))
                .isInstanceOf(JobNotFoundException.class);
    }

    // ------------------------------------------------------------------
    // resolveAction()
    // ------------------------------------------------------------------

    @Test
    void resolveAction_uploadAnswered_mergesPatchAndClearsAction() {
        job.patchComputed(Map.of("required_action", Map.of("type", "upload_audio", "message", "upload")));

        jobService.resolveAction(job.getId(), Map.of("audio_master_ref", "blob://ab/song.wav"));

        assertThat(job.getRequiredAction()).isNull();
        assertThat(job.getComputed())
                .containsEntry("audio_master_ref", "blob://ab/song.wav")
                .containsEntry("last_resolved_action", "upload_audio");
        verify(eventRepo).save(any(JobEvent.class));
    }

    @Test
    void resolveAction_selectionAction_rejected() {
        job.patchComputed(Map.of("required_action", Map.of("type", "select_audio")));

        assertThatThrownBy(() -> jobService.resolveAction(job.getId(), Map.of()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void resolveAction_nothingPending_rejected() {
        assertThatThrownBy(() -> jobService.resolveAction(job.getId(), Map.of("x", 1)))
                .isInstanceOf(IllegalStateException.class);
    }

    // ------------------------------------------------------------------
    // cancel()
    // ------------------------------------------------------------------

    @Test
    void cancel_runningJob_cancels() {
        job.setStatus(JobStatus.RUNNING);

        Job cancelled = jobService.cancel(job.getId());

        assertThat(cancelled.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(cancelled.getErrorCode()).isEqualTo("CANCELLED");
    }

    @Test
    void cancel_alreadyCancelled_isIdempotent() {
        job.setStatus(JobStatus.CANCELLED);

        jobService.cancel(job.getId());

        verify(jobRepo, never()).save(any());
    }

    @Test
    void cancel_succeededJob_rejected() {
        job.setStatus(JobStatus.SUCCEEDED);

        assertThatThrownBy(() -> jobService.cancel(job.getId())).isInstanceOf(IllegalStateException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Candidate candidate(CandidateType type) {
        Candidate c = new Candidate(job.getId(), type, UUID.randomUUID(), 0, 1, "native");
        c.setStatus(CandidateStatus.SUCCEEDED);
        when(candidateRepo.findById(c.getId())).thenReturn(Optional.of(c));
        return c;
    }

    private void awaitPick(Candidate c) {
        job.patchComputed(Map.of("required_action", Map.of(
                "type", c.getCandidateType().selectActionType(),
                "group_id", c.getGroupId().toString(),
                "attempt", c.getAttempt())));
    }
}
