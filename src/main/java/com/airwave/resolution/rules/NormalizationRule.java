package com.airwave.resolution.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A named regex substitution over lower-cased artist or title text.
 * A rule scoped to one field leaves the other untouched; an unscoped rule runs on both.
 */
public final class NormalizationRule {
    private final String name;
    private final Pattern pattern;
    private final String replacement;
    private final NormalizationTarget scope;
    private final int priority;

    private NormalizationRule(Builder builder) {
        this.name = builder.name;
        this.pattern = Pattern.compile(builder.pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        this.replacement = builder.replacement;
        this.scope = builder.scope;
        this.priority = builder.priority;
    }

    public String getName() {
        return name;
    }

    /**
     * Lower runs first.
     */
    public int getPriority() {
        return priority;
    }

    public boolean appliesTo(NormalizationTarget target) {
        return scope == null || scope == target;
    }

    public String apply(String text) {
        return text == null ? null : pattern.matcher(text).replaceAll(replacement);
    }

    @Override
    public String toString() {
        return name + "[" + pattern.pattern() + " -> '" + replacement + "', priority=" + priority
                + (scope != null ? ", " + scope : "") + "]";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private String replacement;
        private NormalizationTarget scope;
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        /**
         * Restricts the rule to one field.
         */
        public Builder only(NormalizationTarget scope) {
            this.scope = scope;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public NormalizationRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(pattern, "pattern is required");
            Objects.requireNonNull(replacement, "replacement is required");
            return new NormalizationRule(this);
        }
    }
}
