package com.studioflow.orchestrator.workflow;

import com.studioflow.orchestrator.model.Stage;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.studioflow.orchestrator.model.Stage.*;

/**
 * Static transition table of the media pipeline.
 *
 * Every stage may also stay on itself (waiting on providers, paused on a
 * human). The only backwards edges are the retry edges from a fan-in to
 * its own fan-out.
 */
public final class StageGraph {

    private static final Map<Stage, Set<Stage>> EDGES = new EnumMap<>(Stage.class);

    static {
        edge(INTENT,              PLAN);
        edge(PLAN,                LYRICS_FANOUT, ARRANGEMENT, INGEST_AUDIO);
        edge(INGEST_AUDIO,        BYO_ANALYSIS_FANOUT);
        edge(BYO_ANALYSIS_FANOUT, BYO_ANALYSIS_FANIN);
        edge(BYO_ANALYSIS_FANIN,  ALIGN_LYRICS, BYO_ANALYSIS_FANOUT);
        edge(LYRICS_FANOUT,       LYRICS_FANIN);
        edge(LYRICS_FANIN,        ARRANGEMENT, LYRICS_FANOUT);
        edge(ARRANGEMENT,         PROVIDER_ROUTE);
        edge(PROVIDER_ROUTE,      AUDIO_FANOUT);
        edge(AUDIO_FANOUT,        AUDIO_FANIN);
        edge(AUDIO_FANIN,         ALIGN_LYRICS, AUDIO_FANOUT);
        edge(ALIGN_LYRICS,        VIDEO_FANOUT);
        edge(VIDEO_FANOUT,        VIDEO_FANIN);
        edge(VIDEO_FANIN,         COMPOSE_VIDEO, VIDEO_FANOUT);
        edge(COMPOSE_VIDEO,       QC_VIDEO);
        edge(QC_VIDEO,            PUBLISH_READY);
        edge(PUBLISH_READY);
    }

    private StageGraph() {}

    private static void edge(Stage from, Stage... to) {
        Set<Stage> targets = EnumSet.of(from);
        Collections.addAll(targets, to);
        EDGES.put(from, Collections.unmodifiableSet(targets));
    }

    /** Stages reachable from {@code from} in one step, {@code from} included. */
    public static Set<Stage> successors(Stage from) {
        return EDGES.getOrDefault(from, Set.of());
    }

    public static boolean allowed(Stage from, Stage to) {
        return successors(from).contains(to);
    }

    public static void requireAllowed(Stage from, Stage to) {
        if (!allowed(from, to)) {
            throw new IllegalStateException("Illegal stage transition " + from.code() + " -> " + to.code());
        }
    }
}
