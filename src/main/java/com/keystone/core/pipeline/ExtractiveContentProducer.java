package com.keystone.core.pipeline;

import com.keystone.core.model.Claim;
import com.keystone.core.model.ProducedOutput;
import com.keystone.core.model.ProvenanceRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic producer that writes the deliverable as a digest of the bound
 * evidence, one claim per provenance record. Used when no chat model is
 * configured.
 */
public class ExtractiveContentProducer implements ContentProducer {

    @Override
    public ProducedOutput produce(Request request) {
        if (request.evidence().isEmpty()) {
            return new ProducedOutput("", List.of(), name(), request.attempt());
        }
        StringBuilder content = new StringBuilder();
        List<String> deliverables = request.spec() != null ? request.spec().deliverables() : List.of();
        content.append(deliverables.isEmpty() ? "Result" : String.join(", ", deliverables))
                .append(" for: ").append(request.goal()).append('\n');
        List<Claim> claims = new ArrayList<>();
        for (ProvenanceRecord record : request.evidence()) {
            String text = String.format(Locale.ROOT, "%s reports %s (confidence %.2f)",
                    record.source(),
                    record.contentRef() == null || record.contentRef().isBlank() ? "its content" : record.contentRef(),
                    record.confidence());
            content.append("- ").append(text).append(" [").append(record.id()).append("]\n");
            claims.add(new Claim(text, List.of(record.id())));
        }
        return new ProducedOutput(content.toString().trim(), claims, name(), request.attempt());
    }

    @Override
    public String name() {
        return "extractive";
    }
}
