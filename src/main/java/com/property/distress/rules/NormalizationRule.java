package com.property.distress.rules;

import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A regex rule applied during normalization.
 * A rewrite rule replaces every match; a reject rule turns the whole value into the empty
 * key when its pattern is found anywhere in the input.
 * Rules are ordered by priority and can be scoped to specific targets.
 */
public class NormalizationRule {

    public enum Action {
        REWRITE,
        REJECT
    }

    private final String name;
    private final Pattern pattern;
    private final String replacement;
    private final Set<NormalizationTarget> targets;
    private final int priority;
    private final Action action;

    private NormalizationRule(Builder builder) {
        this.name = builder.name;
        this.pattern = Pattern.compile(builder.pattern, Pattern.CASE_INSENSITIVE);
        this.replacement = builder.replacement;
        this.targets = builder.targets != null ? Set.copyOf(builder.targets) : Set.of();
        this.priority = builder.priority;
        this.action = builder.action;
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

    public Set<NormalizationTarget> getTargets() {
        return targets;
    }

    public int getPriority() {
        return priority;
    }

    public Action getAction() {
        return action;
    }

    public boolean isReject() {
        return action == Action.REJECT;
    }

    /**
     * A rule with no targets applies to every target.
     */
    public boolean appliesTo(NormalizationTarget target) {
        return targets.isEmpty() || targets.contains(target);
    }

    public boolean matches(String input) {
        return input != null && pattern.matcher(input).find();
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
                ", action=" + action +
                ", pattern=" + pattern.pattern() +
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
        private Set<NormalizationTarget> targets;
        private int priority = 100;
        private Action action = Action.REWRITE;

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

        public Builder targets(NormalizationTarget... targets) {
            this.targets = Set.of(targets);
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder rejectOnMatch() {
            this.action = Action.REJECT;
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
