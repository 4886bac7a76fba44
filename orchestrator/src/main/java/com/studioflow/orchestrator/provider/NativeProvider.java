package com.studioflow.orchestrator.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studioflow.orchestrator.model.ComputedDocument;
import com.studioflow.orchestrator.model.RunType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Built-in provider that needs no vendor account.
 *
 * Everything is computed synchronously in {@link #submit} and handed out
 * on the first {@link #poll}: lyric drafts, a short tone as placeholder
 * audio, a render manifest as placeholder video, even-spread lyric timing,
 * and fallback BPM / segment analysis for uploaded songs.
 */
@Component
public class NativeProvider implements Provider {

    private static final Logger log = LoggerFactory.getLogger(NativeProvider.class);

    public static final String NAME = "native";

    static final int  SAMPLE_RATE        = 8000;
    static final long MAX_AUDIO_MS       = 60_000;
    static final long DEFAULT_AUDIO_MS   = 30_000;
    static final long SHORT_SONG_MS      = 45_000;
    static final long SEGMENT_PLAN_MS    = 30_000;

    private static final String[] ANGLES = {"hopeful", "reflective", "anthemic", "playful"};

    private final Map<String, ProviderPoll> results = new ConcurrentHashMap<>();
    private final ObjectMapper json;

    public NativeProvider(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    @Override
    public String name() { return NAME; }

    @Override
    public String submit(ProviderRequest request, String idempotencyHint) {
        String providerJobId = NAME + "-" + idempotencyHint;
        results.put(providerJobId, generate(request));
        log.debug("Native provider produced {} for job {}", request.runType().code(), request.jobId());
        return providerJobId;
    }

    @Override
    public ProviderPoll poll(String providerJobId) {
        ProviderPoll result = results.remove(providerJobId);
        return result != null ? result : ProviderPoll.failed("Unknown native job " + providerJobId);
    }

    // ------------------------------------------------------------------
    // Generators
    // ------------------------------------------------------------------

    ProviderPoll generate(ProviderRequest request) {
        Map<String, Object> p = request.params();
        return switch (request.runType()) {
            case LYRICS_CANDIDATE   -> ProviderPoll.succeeded(Map.of("lyrics_text", lyrics(p, request.variantIndex())));
            case AUDIO_CANDIDATE    -> audio(p, request.variantIndex());
            case VIDEO_CANDIDATE    -> video(request);
            case ALIGN_LYRICS       -> ProviderPoll.succeeded(Map.of("timed_lyrics", TimedLyrics.spread(
                    ComputedDocument.string(p, "lyrics_text"),
                    durationOr(p, DEFAULT_AUDIO_MS),
                    ComputedDocument.string(p, "language"))));
            case BYO_BPM_DETECT     -> ProviderPoll.succeeded(bpm(p));
            case BYO_SEGMENT_DETECT -> ProviderPoll.succeeded(segments(p));
        };
    }

    static String lyrics(Map<String, Object> p, int variantIndex) {
        String title = orDefault(ComputedDocument.string(p, "title"), "Untitled");
        String theme = orDefault(ComputedDocument.string(p, "theme"), title.toLowerCase(Locale.ROOT));
        String mood  = orDefault(ComputedDocument.string(p, "mood"), "uplifting");
        String angle = ANGLES[Math.floorMod(variantIndex, ANGLES.length)];

        return String.join("\n",
                "[Verse]",
                "We were chasing " + theme + " through the " + mood + " night",
                "Every step a little " + angle + ", every street a little bright",
                "",
                "[Chorus]",
                title + ", " + title,
                "Sing it " + angle + ", sing it loud",
                title + ", " + title,
                "We are " + mood + " and we are proud",
                "",
                "[Outro]",
                "And the " + theme + " carries on");
    }

    private static ProviderPoll audio(Map<String, Object> p, int variantIndex) {
        long durationMs = Math.min(MAX_AUDIO_MS, durationOr(p, DEFAULT_AUDIO_MS));
        double frequency = 220.0 * (1.0 + 0.25 * Math.floorMod(variantIndex, 4));
        byte[] wav = toneWav(durationMs, frequency);

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("duration_ms", durationMs);
        output.put("format", "wav");
        output.put("sample_rate", SAMPLE_RATE);
        return ProviderPoll.succeeded(output, wav, "audio/wav");
    }

    private ProviderPoll video(ProviderRequest request) {
        Map<String, Object> manifest = new LinkedHashMap<>();
        manifest.put("kind", "render_manifest");
        manifest.put("variant_index", request.variantIndex());
        manifest.put("audio_ref", request.params().get("audio_ref"));
        manifest.put("style", orDefault(ComputedDocument.string(request.params(), "video_style"), "performance"));
        manifest.put("duration_ms", durationOr(request.params(), DEFAULT_AUDIO_MS));
        try {
            byte[] bytes = json.writeValueAsBytes(manifest);
            Map<String, Object> output = new LinkedHashMap<>();
            output.put("duration_ms", manifest.get("duration_ms"));
            output.put("format", "render_manifest");
            return ProviderPoll.succeeded(output, bytes, "application/json");
        } catch (JsonProcessingException e) {
            throw new ProviderException(ProviderException.Kind.BAD_RESPONSE, "Could not encode render manifest", e);
        }
    }

    static Map<String, Object> bpm(Map<String, Object> p) {
        long durationMs = durationOr(p, 0);
        int bpm = durationMs > 0 && durationMs < SHORT_SONG_MS ? 128 : 120;
        Map<String, Object> grid = new LinkedHashMap<>();
        grid.put("interval_ms", 60_000.0 / bpm);
        grid.put("offset_ms", 0);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("bpm", bpm);
        out.put("beat_grid", grid);
        out.put("method", "fallback");
        return out;
    }

    static Map<String, Object> segments(Map<String, Object> p) {
        long durationMs = durationOr(p, 0);
        List<Map<String, Object>> segments = new ArrayList<>();
        if (durationMs > 0) {
            String[] labels = {"intro", "verse", "chorus", "outro"};
            long step = durationMs / labels.length;
            for (int i = 0; i < labels.length; i++) {
                Map<String, Object> s = new LinkedHashMap<>();
                s.put("label", labels[i]);
                s.put("start_ms", i * step);
                s.put("end_ms", i == labels.length - 1 ? durationMs : (i + 1) * step);
                segments.add(s);
            }
        }
        Map<String, Object> plan = new LinkedHashMap<>();
        plan.put("kind", "first_30s");
        plan.put("start_ms", 0);
        plan.put("end_ms", durationMs > 0 ? Math.min(durationMs, SEGMENT_PLAN_MS) : SEGMENT_PLAN_MS);

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("segments", segments);
        out.put("segment_plan", plan);
        return out;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** 8-bit mono PCM WAV holding a sine tone. */
    public static byte[] toneWav(long durationMs, double frequency) {
        int samples = (int) (SAMPLE_RATE * durationMs / 1000);
        ByteArrayOutputStream out = new ByteArrayOutputStream(44 + samples);
        ByteBuffer header = ByteBuffer.allocate(44).order(ByteOrder.LITTLE_ENDIAN);
        header.put("RIFF".getBytes(StandardCharsets.US_ASCII));
        header.putInt(36 + samples);
        header.put("WAVE".getBytes(StandardCharsets.US_ASCII));
        header.put("fmt ".getBytes(StandardCharsets.US_ASCII));
        header.putInt(16);                 // PCM chunk size
        header.putShort((short) 1);        // PCM
        header.putShort((short) 1);        // mono
        header.putInt(SAMPLE_RATE);
        header.putInt(SAMPLE_RATE);        // byte rate
        header.putShort((short) 1);        // block align
        header.putShort((short) 8);        // bits per sample
        header.put("data".getBytes(StandardCharsets.US_ASCII));
        header.putInt(samples);
        out.writeBytes(header.array());
        for (int i = 0; i < samples; i++) {
            double v = Math.sin(2 * Math.PI * frequency * i / SAMPLE_RATE);
            out.write((int) (128 + 60 * v));
        }
        return out.toByteArray();
    }

    private static long durationOr(Map<String, Object> p, long fallback) {
        int d = ComputedDocument.integer(p, "duration_ms", 0);
        return d > 0 ? d : fallback;
    }

    private static String orDefault(String value, String fallback) {
        return value == null ? fallback : value;
    }
}
