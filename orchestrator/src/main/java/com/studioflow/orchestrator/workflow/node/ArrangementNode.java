package com.studioflow.orchestrator.workflow.node;

import com.studioflow.orchestrator.model.ComputedDocument;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.Stage;
import com.studioflow.orchestrator.workflow.NodeResult;
import com.studioflow.orchestrator.workflow.StageNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the section layout of the song from the promoted lyrics:
 * one section per stanza, labelled by its {@code [Tag]} header when present.
 */
@Component
public class ArrangementNode implements StageNode {

    private static final Pattern TAG = Pattern.compile("^\\[([^\\]]+)]\\s*$");

    @Override
    public Stage stage() { return Stage.ARRANGEMENT; }

    @Override
    public NodeResult run(Job job) {
        String lyrics = ComputedDocument.string(job.getComputed(), "lyrics_text");
        List<Map<String, Object>> sections = sections(lyrics);

        Map<String, Object> arrangement = new LinkedHashMap<>();
        arrangement.put("sections", sections);
        arrangement.put("section_count", sections.size());
        job.patchComputed(Map.of("arrangement", arrangement));
        return NodeResult.advance(Stage.PROVIDER_ROUTE);
    }

    static List<Map<String, Object>> sections(String lyrics) {
        List<Map<String, Object>> out = new ArrayList<>();
        if (lyrics == null) return out;
        for (String stanza : lyrics.trim().split("\\n\\s*\\n")) {
            String[] lines = stanza.strip().split("\\n");
            if (lines.length == 0 || lines[0].isBlank()) continue;
            Matcher m = TAG.matcher(lines[0].strip());
            String label = m.matches()
                    ? m.group(1).trim().toLowerCase(Locale.ROOT)
                    : (out.size() % 2 == 0 ? "verse" : "chorus");
            int lineCount = m.matches() ? lines.length - 1 : lines.length;

            Map<String, Object> section = new LinkedHashMap<>();
            section.put("index", out.size());
            section.put("label", label);
            section.put("lines", lineCount);
            out.add(section);
        }
        return out;
    }
}
