package com.contact.resolution.rules;

import com.contact.resolution.core.model.HandleKind;

import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A regex rewrite applied to a raw handle while normalizing it.
 * Rules are ordered by priority and can be limited to phone or email handles.
 */
public class NormalizationRule {
    private final String name;
    private final Pattern pattern;
    private final String replacement;
    private final Set<HandleKind> applicableKinds;
    private final int priority;

    private NormalizationRule(Builder builder) {
        this.name = builder.name;
        this.pattern = Pattern.compile(builder.pattern, Pattern.CASE_INSENSITIVE);
        this.replacement = builder.replacement;
        this.applicableKinds = builder.applicableKinds != null ?
                Set.copyOf(builder.applicableKinds) : Set.of();
        this.priority = builder.priority;
    }

    public String getName() {
        return name;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public String getReplacement() {
        return replacement;
    }

    public Set<HandleKind> getApplicableKinds() {
        return applicableKinds;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * A rule without explicit kinds applies to every kind.
     */
    public boolean appliesTo(HandleKind kind) {
        return applicableKinds.isEmpty() || applicableKinds.contains(kind);
    }

    public String apply(String input) {
        if (input == null) {
            return null;
        }
        return pattern.matcher(input).replaceAll(replacement);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NormalizationRule that = (NormalizationRule) o;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "NormalizationRule{" +
                "name='" + name + '\'' +
                ", pattern=" + pattern.pattern() +
                ", kinds=" + applicableKinds +
                ", priority=" + priority +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private String replacement = "";
        private Set<HandleKind> applicableKinds;
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

        public Builder applicableKinds(HandleKind... kinds) {
            this.applicableKinds = Set.of(kinds);
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
