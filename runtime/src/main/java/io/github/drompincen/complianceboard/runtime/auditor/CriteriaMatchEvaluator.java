package io.github.drompincen.complianceboard.runtime.auditor;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.complianceboard.protocol.api.AuditorInstructions;
import io.github.drompincen.complianceboard.protocol.api.EvidenceDto;
import io.github.drompincen.complianceboard.protocol.api.RequirementOutcome;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Built-in keyword matcher. A criterion matches an evidence item when every keyword of the criterion occurs
 * as a word of the evidence text (name, description, value and collection content). Negation words are kept
 * as keywords so that "no MFA enforced" does not match evidence stating that MFA is enforced.
 */
@Component
public class CriteriaMatchEvaluator implements RequirementEvaluator {

    private static final Set<String> NEGATIONS = Set.of("no", "not", "without", "missing", "disabled", "never", "none");
    private static final Set<String> STOPWORDS = Set.of("the", "and", "for", "are", "with", "all", "any",
            "has", "have", "been", "that", "this", "from", "must", "should", "least", "one");

    @Override
    public List<RequirementOutcome> evaluate(Context context) {
        AuditorInstructions instructions = context.auditor().instructions();
        if (instructions == null || instructions.requirements() == null) return List.of();

        Map<EvidenceDto, Set<String>> corpus = new LinkedHashMap<>();
        for (EvidenceDto evidence : context.evidence()) {
            corpus.put(evidence, words(text(evidence)));
        }

        List<RequirementOutcome> outcomes = new ArrayList<>();
        for (AuditorInstructions.Requirement req : instructions.requirements()) {
            if (corpus.isEmpty()) {
                outcomes.add(new RequirementOutcome(req.id(), req.title(), true, false, false, req.weight(),
                        "No evidence attached", List.of()));
                continue;
            }
            Set<String> reviewed = new LinkedHashSet<>();
            String matchedSuccess = firstMatch(req.successCriteria(), corpus, reviewed);
            String matchedFailure = firstMatch(req.failureCriteria(), corpus, reviewed);
            outcomes.add(new RequirementOutcome(req.id(), req.title(), true, matchedSuccess != null,
                    matchedFailure != null, req.weight(), findings(matchedSuccess, matchedFailure),
                    List.copyOf(reviewed)));
        }
        return outcomes;
    }

    private static String firstMatch(List<String> criteria, Map<EvidenceDto, Set<String>> corpus, Set<String> reviewed) {
        if (criteria == null) return null;
        String first = null;
        for (String criterion : criteria) {
            Set<String> keywords = keywords(criterion);
            if (keywords.isEmpty()) continue;
            for (Map.Entry<EvidenceDto, Set<String>> entry : corpus.entrySet()) {
                if (entry.getValue().containsAll(keywords)) {
                    reviewed.add(entry.getKey().name());
                    if (first == null) first = criterion;
                }
            }
        }
        return first;
    }

    private static String findings(String success, String failure) {
        if (failure != null) return "Failure criterion met: " + failure;
        if (success != null) return "Success criterion met: " + success;
        return "No success criterion is supported by the evidence";
    }

    static Set<String> keywords(String criterion) {
        Set<String> out = new LinkedHashSet<>();
        for (String word : words(criterion)) {
            if (NEGATIONS.contains(word) || (word.length() >= 3 && !STOPWORDS.contains(word))) {
                out.add(word);
            }
        }
        return out;
    }

    static Set<String> words(String text) {
        if (text == null || text.isBlank()) return Set.of();
        Set<String> out = new HashSet<>();
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (!token.isEmpty()) out.add(token);
        }
        return out;
    }

    private static String text(EvidenceDto evidence) {
        StringBuilder sb = new StringBuilder();
        append(sb, evidence.name());
        append(sb, evidence.description());
        JsonNode value = evidence.value();
        if (value != null && !value.isNull()) {
            append(sb, value.isValueNode() ? value.asText() : value.toString());
        }
        if (evidence.collection() != null) {
            append(sb, evidence.collection().name());
            append(sb, evidence.collection().content());
        }
        return sb.toString();
    }

    private static void append(StringBuilder sb, String part) {
        if (part != null) sb.append(part).append('\n');
    }
}
