package com.keystone.core.pipeline.stages;

import com.keystone.core.error.ErrorKind;
import com.keystone.core.error.UnsupportedClaimException;
import com.keystone.core.model.Claim;
import com.keystone.core.model.ProducedOutput;
import com.keystone.core.model.ProvenanceRecord;
import com.keystone.core.model.ReviewVerdict;
import com.keystone.core.model.Stage;
import com.keystone.core.model.TaskRecord;
import com.keystone.core.pipeline.PipelineStage;
import com.keystone.core.pipeline.StageResult;
import com.keystone.core.pipeline.TaskField;
import com.keystone.core.policy.PolicyRefs;
import com.keystone.core.policy.PolicyView;
import com.keystone.core.provenance.ProvenanceLedger;
import com.keystone.core.provenance.ProvenanceView;
import com.keystone.core.provenance.SourceDominanceWarning;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Checks produced output against the specification and the ledger. Every
 * claim must cite at least one record that resolves and belongs to the task's
 * evidence set; otherwise the review fails with decision
 * {@code UNSUPPORTED_CLAIM} and the verdict lists the offending claims. Other
 * shortfalls fail with {@code FAIL}. Source dominance is reported as a warning
 * and never fails the review on its own.
 */
public class ReviewStage implements PipelineStage {

    private final double dominanceThreshold;

    public ReviewStage(double dominanceThreshold) {
        this.dominanceThreshold = dominanceThreshold;
    }

    @Override
    public Stage stage() {
        return Stage.REVIEW;
    }

    @Override
    public Set<TaskField> writableFields() {
        return Set.of(TaskField.REVIEW);
    }

    @Override
    public StageResult execute(TaskRecord task, ProvenanceView provenance, PolicyView policy) {
        ProducedOutput output = task.output();
        List<String> changes = new ArrayList<>();
        List<String> unsupported = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> refs = new ArrayList<>(List.of(PolicyRefs.CLAIMS_TRACEABLE));

        if (output == null || !output.hasContent()) {
            changes.add("Produce non-empty output");
        } else {
            String content = output.content().toLowerCase(Locale.ROOT);
            if (task.spec() != null) {
                for (String deliverable : task.spec().deliverables()) {
                    if (deliverable.startsWith("Response to:")) {
                        continue;
                    }
                    if (!content.contains(deliverable.toLowerCase(Locale.ROOT))) {
                        changes.add("Include the deliverable: " + deliverable);
                    }
                }
            }
            if (output.claims().isEmpty()) {
                changes.add("Support the output with at least one cited claim");
            }
        }

        Map<String, ProvenanceRecord> backing = new LinkedHashMap<>();
        List<String> unsupportedReasons = new ArrayList<>();
        if (output != null) {
            for (Claim claim : output.claims()) {
                List<ProvenanceRecord> inScope;
                try {
                    inScope = provenance.resolveClaim(claim).stream()
                            .filter(r -> task.provenanceIds().contains(r.id()))
                            .toList();
                    if (inScope.isEmpty()) {
                        unsupportedReasons.add("Claim cites provenance outside the task's evidence: \""
                                + claim.text() + "\"");
                    }
                } catch (UnsupportedClaimException e) {
                    inScope = List.of();
                    unsupportedReasons.add(e.getMessage());
                }
                if (inScope.isEmpty()) {
                    unsupported.add(claim.text());
                    changes.add("Cite gathered provenance for: " + claim.text());
                } else {
                    inScope.forEach(r -> backing.putIfAbsent(r.id(), r));
                }
            }
        }

        Optional<SourceDominanceWarning> dominance =
                ProvenanceLedger.checkDominance(backing.values(), dominanceThreshold);
        dominance.ifPresent(w -> {
            warnings.add(w.describe());
            refs.add(PolicyRefs.SOURCE_DOMINANCE);
        });

        boolean passed = changes.isEmpty();
        var verdict = new ReviewVerdict(passed, changes, unsupported, warnings);
        if (passed) {
            String rationale = "All " + output.claims().size() + " claim(s) trace to gathered provenance"
                    + (warnings.isEmpty() ? "" : "; " + String.join("; ", warnings));
            return StageResult.of(task.toBuilder().review(verdict).build(), "PASS", rationale, refs);
        }
        String required = changes.size() + " required change(s): " + String.join("; ", changes);
        if (unsupported.isEmpty()) {
            return StageResult.of(task.toBuilder().review(verdict).build(), "FAIL", required, refs);
        }
        String rationale = ErrorKind.UNSUPPORTED_CLAIM + ": " + String.join("; ", unsupportedReasons) + "; " + required;
        return StageResult.of(task.toBuilder().review(verdict).build(), ErrorKind.UNSUPPORTED_CLAIM.name(),
                rationale, refs);
    }
}
