package com.keystone.core.llm;

import com.keystone.core.model.Claim;
import com.keystone.core.model.ProducedOutput;
import com.keystone.core.model.ProvenanceRecord;
import com.keystone.core.pipeline.ContentProducer;

import java.util.List;
import java.util.Locale;

/**
 * Content producer backed by a chat model. The model only sees the bound
 * evidence and must cite record ids for every claim; the Review stage checks
 * the citations against the ledger, so a hallucinated id fails review.
 */
public class LlmContentProducer implements ContentProducer {

    static final String SYSTEM_PROMPT = """
            You write the deliverable for a governed task using ONLY the evidence provided.
            Every factual statement must appear as a claim that cites one or more evidence ids
            exactly as given (for example PRV-000001). Never invent ids. If the evidence does not
            support a statement, leave the statement out. Address every deliverable by name.
            """;

    /** Shape the model is asked to return. */
    public record Draft(String content, List<DraftClaim> claims) {}

    public record DraftClaim(String text, List<String> evidenceIds) {}

    private final LlmService llm;

    public LlmContentProducer(LlmService llm) {
        this.llm = llm;
    }

    @Override
    public ProducedOutput produce(Request request) {
        Draft draft = llm.structuredCall(SYSTEM_PROMPT, userPrompt(request), Draft.class);
        List<Claim> claims = draft.claims() == null ? List.of() : draft.claims().stream()
                .filter(c -> c.text() != null && !c.text().isBlank())
                .map(c -> new Claim(c.text(), c.evidenceIds()))
                .toList();
        return new ProducedOutput(draft.content() == null ? "" : draft.content(), claims, name(), request.attempt());
    }

    @Override
    public String name() {
        return "llm";
    }

    @Override
    public int toolCallsPerInvocation() {
        return 1;
    }

    static String userPrompt(Request request) {
        var sb = new StringBuilder();
        sb.append("Goal: ").append(request.goal()).append("\n\n");
        if (request.spec() != null) {
            sb.append("Deliverables:\n");
            request.spec().deliverables().forEach(d -> sb.append("- ").append(d).append('\n'));
            sb.append("Constraints:\n");
            request.spec().constraints().forEach(c -> sb.append("- ").append(c).append('\n'));
        }
        sb.append("\nEvidence:\n");
        for (ProvenanceRecord record : request.evidence()) {
            sb.append(String.format(Locale.ROOT, "[%s] source=%s confidence=%.2f content=%s%n",
                    record.id(), record.source(), record.confidence(),
                    record.contentRef() == null ? "" : record.contentRef()));
        }
        if (!request.feedback().isEmpty()) {
            sb.append("\nThe previous attempt failed review. Fix the following:\n");
            request.feedback().forEach(f -> sb.append("- ").append(f).append('\n'));
        }
        return sb.toString();
    }
}
