package com.studioflow.orchestrator.lease;

import com.studioflow.orchestrator.blob.BlobStore;
import com.studioflow.orchestrator.model.Artifact;
import com.studioflow.orchestrator.model.ComputedDocument;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.provider.NativeProvider;
import com.studioflow.orchestrator.repository.ArtifactRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Placeholder text-to-speech: one tone per request, long enough for the
 * text at a speaking pace. Stands in for a vendor voice.
 */
@Component
public class TtsJobHandler implements LeasedJobHandler {

    private static final Logger log = LoggerFactory.getLogger(TtsJobHandler.class);

    public static final String KIND = "tts";

    static final long MS_PER_WORD = 400;
    static final long MIN_MS      = 1_000;
    static final long MAX_MS      = 60_000;
    static final double TONE_HZ   = 330.0;

    private final JobLeaseService    leases;
    private final BlobStore          blobs;
    private final ArtifactRepository artifactRepo;

    public TtsJobHandler(JobLeaseService leases, BlobStore blobs, ArtifactRepository artifactRepo) {
        this.leases       = leases;
        this.blobs        = blobs;
        this.artifactRepo = artifactRepo;
    }

    @Override
    public String kind() { return KIND; }

    @Override
    public void handle(Job job) {
        String text = ComputedDocument.string(job.getInput(), "text");
        if (text == null) {
            leases.failPermanently(job.getId(), "INVALID_INPUT", "text is required");
            return;
        }
        long durationMs = durationFor(text);
        byte[] wav = NativeProvider.toneWav(durationMs, TONE_HZ);
        String locator = blobs.put(wav, "audio/wav");
        artifactRepo.save(new Artifact(job.getId(), "speech", locator, "audio/wav", wav.length));
        leases.markSucceeded(job.getId());
        log.info("Synthesized {} ms of speech for job {}", durationMs, job.getId());
    }

    static long durationFor(String text) {
        long words = text.trim().split("\\s+").length;
        return Math.max(MIN_MS, Math.min(MAX_MS, words * MS_PER_WORD));
    }
}
