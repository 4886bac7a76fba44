package com.studioflow.orchestrator.workflow.node;

import com.studioflow.orchestrator.model.ComputedDocument;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.provider.NativeProvider;
import com.studioflow.orchestrator.provider.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** Provider list for one candidate type: computed, then input hints, then native. */
final class ProviderChoice {

    private static final Logger log = LoggerFactory.getLogger(ProviderChoice.class);

    private ProviderChoice() {}

    static List<String> resolve(Job job, String key, ProviderRegistry registry) {
        List<String> wanted = ComputedDocument.strings(job.getComputed(), key);
        if (wanted.isEmpty()) {
            wanted = ComputedDocument.strings(ComputedDocument.map(job.getInput(), "hints"), key);
        }
        List<String> known = wanted.stream().filter(registry::contains).distinct().toList();
        if (known.size() < wanted.size()) {
            log.warn("Job {}: dropping unregistered providers from {} {}", job.getId(), key, wanted);
        }
        return known.isEmpty() ? List.of(NativeProvider.NAME) : known;
    }
}
