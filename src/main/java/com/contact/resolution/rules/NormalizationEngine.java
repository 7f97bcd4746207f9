package com.contact.resolution.rules;

import com.contact.resolution.core.model.HandleKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Applies {@link NormalizationRule}s to handles in priority order
 * (lower number runs first), then lowercases and trims the result.
 *
 * <p>Rules must be idempotent: the engine's output fed back into the engine
 * has to come out unchanged, since cache keys are compared against
 * already-normalized values.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;

    public NormalizationEngine() {
        this.rules = new ArrayList<>();
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = new ArrayList<>(rules);
        sortRules();
    }

    public void addRule(NormalizationRule rule) {
        rules.add(rule);
        sortRules();
    }

    public void addRules(List<NormalizationRule> newRules) {
        rules.addAll(newRules);
        sortRules();
    }

    public boolean removeRule(String ruleName) {
        return rules.removeIf(r -> r.getName().equals(ruleName));
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Normalizes a handle of the given kind. Null or blank input yields an empty string.
     */
    public String normalize(String raw, HandleKind kind) {
        if (raw == null || raw.isBlank()) {
            return "";
        }

        String result = raw;
        for (NormalizationRule rule : rules) {
            if (rule.appliesTo(kind)) {
                String before = result;
                result = rule.apply(result);
                if (log.isTraceEnabled() && !before.equals(result)) {
                    log.trace("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
                }
            }
        }

        return result.toLowerCase(Locale.ROOT).trim();
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(NormalizationRule::getPriority));
    }
}
