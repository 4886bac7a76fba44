package com.studioflow.orchestrator.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.studioflow.orchestrator.model.JobEvent;
import com.studioflow.orchestrator.model.ProviderRun;
import com.studioflow.orchestrator.model.RunStatus;
import com.studioflow.orchestrator.model.RunType;
import com.studioflow.orchestrator.repository.JobEventRepository;
import com.studioflow.orchestrator.repository.ProviderRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ProviderRunQueueTest {

    @Mock ProviderRunRepository runRepo;
    @Mock JobEventRepository    eventRepo;

    private ProviderRunQueue queue;
    private final UUID jobId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        queue = new ProviderRunQueue(runRepo, eventRepo, new ObjectMapper());
    }

    @Test
    void enqueue_newKey_returnsInsertedId() {
        when(runRepo.insertIfAbsent(any(), any(), any(), any(), any(), any(), any(), anyInt(), any(), any()))
                .thenReturn(1);

        UUID id = queue.enqueue(spec(UUID.randomUUID()));

        assertThat(id).isNotNull();
        verify(runRepo, never()).findByIdempotencyKey(any());
    }

    @Test
    void enqueue_existingKey_returnsExistingRun() {
        RunSpec spec = spec(UUID.randomUUID());
        ProviderRun existing = new ProviderRun(UUID.randomUUID(), jobId, "native", spec.idempotencyKey(),
                RunType.LYRICS_CANDIDATE, spec.groupId(), spec.candidateId(), 1, Map.of());
        when(runRepo.insertIfAbsent(any(), any(), any(), any(), any(), any(), any(), anyInt(), any(), any()))
                .thenReturn(0);
        when(runRepo.findByIdempotencyKey(spec.idempotencyKey())).thenReturn(Optional.of(existing));

        assertThat(queue.enqueue(spec)).isEqualTo(existing.getId());
    }

    @Test
    void enqueue_passesRunTypeAndOptionalIdsAsStrings() {
        UUID group = UUID.randomUUID();
        RunSpec spec = new RunSpec(jobId, "native", RunType.ALIGN_LYRICS, group, null, 1,
                Map.of("lyrics_text", "la"), Map.of());
        when(runRepo.insertIfAbsent(any(), any(), any(), any(), any(), any(), any(), anyInt(), any(), any()))
                .thenReturn(1);

        queue.enqueue(spec);

        verify(runRepo).insertIfAbsent(any(), eq(jobId), eq("native"), eq(spec.idempotencyKey()),
                eq("align_lyrics"), eq(group.toString()), eq(""), eq(1), contains("lyrics_text"), contains("align_lyrics"));
    }

    @Test
    void idempotencyKey_stablePerCandidateAndAttempt() {
        UUID candidate = UUID.randomUUID();
        RunSpec first  = spec(candidate);
        RunSpec again  = spec(candidate);
        RunSpec retry  = new RunSpec(jobId, "native", RunType.LYRICS_CANDIDATE, first.groupId(), candidate, 2,
                Map.of(), Map.of());

        assertThat(again.idempotencyKey()).isEqualTo(first.idempotencyKey());
        assertThat(retry.idempotencyKey()).isNotEqualTo(first.idempotencyKey());
    }

    @Test
    void claimNext_flipsToRunning() {
        ProviderRun run = run(RunStatus.CREATED);
        when(runRepo.lockNextCreated()).thenReturn(Optional.of(run));

        Optional<ProviderRun> claimed = queue.claimNext("runs-1");

        assertThat(claimed).contains(run);
        assertThat(run.getStatus()).isEqualTo(RunStatus.RUNNING);
        assertThat(run.getWorkerId()).isEqualTo("runs-1");
        assertThat(run.getStartedAt()).isNotNull();
        verify(runRepo).save(run);
    }

    @Test
    void setResult_firstTerminalWrite_savesAndAnnounces() {
        ProviderRun run = run(RunStatus.RUNNING);
        when(runRepo.findById(run.getId())).thenReturn(Optional.of(run));

        boolean written = queue.setResult(run.getId(), RunStatus.SUCCEEDED, Map.of("lyrics_text", "x"), Map.of("k", 1));

        assertThat(written).isTrue();
        assertThat(run.getStatus()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(run.getFinishedAt()).isNotNull();
        assertThat(run.getMeta()).containsEntry("k", 1);
        verify(eventRepo).save(argThat((JobEvent e) -> e.getJobId().equals(jobId)));
    }

    @Test
    void setResult_alreadyTerminal_ignored() {
        ProviderRun run = run(RunStatus.FAILED);
        when(runRepo.findById(run.getId())).thenReturn(Optional.of(run));

        boolean written = queue.setResult(run.getId(), RunStatus.SUCCEEDED, Map.of(), Map.of());

        assertThat(written).isFalse();
        assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
        verify(runRepo, never()).save(any());
        verifyNoInteractions(eventRepo);
    }

    @Test
    void setResult_nonTerminalStatus_rejected() {
        assertThatThrownBy(() -> queue.setResult(UUID.randomUUID(), RunStatus.RUNNING, Map.of(), Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private RunSpec spec(UUID candidateId) {
        return new RunSpec(jobId, "native", RunType.LYRICS_CANDIDATE, UUID.nameUUIDFromBytes(jobId.toString().getBytes()),
                candidateId, 1, Map.of("title", "t"), Map.of());
    }

    private ProviderRun run(RunStatus status) {
        ProviderRun run = new ProviderRun(UUID.randomUUID(), jobId, "native", "key",
                RunType.LYRICS_CANDIDATE, UUID.randomUUID(), UUID.randomUUID(), 1, Map.of());
        run.setStatus(status);
        return run;
    }
}
