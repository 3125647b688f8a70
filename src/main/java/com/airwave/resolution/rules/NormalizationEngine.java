package com.airwave.resolution.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Engine for applying normalization rules to artist names and titles.
 * Rules are applied in priority order (lower priority number = higher precedence).
 * The whole pass is repeated until the text stops changing, so the output is a fixed point.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    static final int MAX_PASSES = 8;

    private final List<NormalizationRule> rules;

    public NormalizationEngine() {
        this.rules = new ArrayList<>();
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = new ArrayList<>(rules);
        sortRules();
    }

    /**
     * Adds multiple rules to the engine.
     */
    public void addRules(List<NormalizationRule> newRules) {
        rules.addAll(newRules);
        sortRules();
    }

    /**
     * Gets all rules currently in the engine.
     */
    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Normalizes already lower-cased, transliterated text for the given target.
     */
    public String normalize(String text, NormalizationTarget target) {
        if (text == null || text.isBlank()) {
            return "";
        }

        String current = text;
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            String next = applyOnce(current, target);
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
        log.debug("Normalization of '{}' did not settle after {} passes", text, MAX_PASSES);
        return current;
    }

    private String applyOnce(String text, NormalizationTarget target) {
        String result = text;
        for (NormalizationRule rule : rules) {
            if (rule.appliesTo(target)) {
                String before = result;
                result = rule.apply(result);
                if (log.isTraceEnabled() && !before.equals(result)) {
                    log.trace("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
                }
            }
        }
        return result.trim().replaceAll("\\s+", " ");
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(NormalizationRule::getPriority));
    }
}
