package com.keystone.core.policy;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.keystone.core.model.PolicyKind;
import com.keystone.core.model.PolicyRule;
import com.keystone.core.model.RuleEffect;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the bootstrap canon from YAML.
 * <pre>
 * rules:
 *   - id: INV-003
 *     kind: INVARIANT
 *     effect: NONE
 *     text: Conclusions require at least two independent sources...
 *     triggers: []
 * </pre>
 */
public final class CanonLoader {

    private CanonLoader() {}

    record CanonFile(List<CanonEntry> rules) {}

    record CanonEntry(String id, PolicyKind kind, RuleEffect effect, String text, List<String> triggers) {}

    public static List<PolicyRule> load(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read canon from " + resource.getDescription(), e);
        }
    }

    public static List<PolicyRule> load(InputStream in) throws IOException {
        var mapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        CanonFile file = mapper.readValue(in, CanonFile.class);
        if (file == null || file.rules() == null || file.rules().isEmpty()) {
            throw new IllegalStateException("Canon is empty");
        }
        Set<String> seen = new HashSet<>();
        return file.rules().stream()
                .map(e -> {
                    if (e.id() == null || e.kind() == null || e.text() == null) {
                        throw new IllegalStateException("Canon entry is missing id, kind or text: " + e);
                    }
                    if (!seen.add(e.id())) {
                        throw new IllegalStateException("Duplicate canon rule id: " + e.id());
                    }
                    return new PolicyRule(e.id(), e.kind(), e.text().trim(), 0, e.triggers(), e.effect(), null, null);
                })
                .toList();
    }
}
