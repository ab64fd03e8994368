package org.cardiocore.classifier;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

import org.cardiocore.exceptions.ConfigurationException;

/**
 * Ordered, immutable list of decision rules. The first matching rule wins and
 * later rules are never consulted, so declaration order is priority order.
 *
 * Tables are built once and shared between concurrent analyses without
 * locking. A table that is empty, has unnamed or duplicate rules, or a rule
 * without condition or outcome is rejected with a
 * {@link ConfigurationException} when it is built.
 */
public final class DecisionTable<I, T> {

    private final String tableName;
    private final List<DecisionRule<I, T>> rules;

    private DecisionTable(String tableName, List<DecisionRule<I, T>> rules) {
        this.tableName = tableName;
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    public static <I, T> Builder<I, T> builder(String tableName) {
        return new Builder<>(tableName);
    }

    /** @return the first rule whose condition holds, or null when none does */
    public DecisionRule<I, T> firstMatch(I input) {
        for (DecisionRule<I, T> rule : rules) {
            if (rule.matches(input)) {
                return rule;
            }
        }
        return null;
    }

    /**
     * Precedence scan over a collection: rules are tried in order and the first
     * rule matched by any element wins, whatever the element order.
     */
    public DecisionRule<I, T> firstMatchAmong(Collection<? extends I> inputs) {
        for (DecisionRule<I, T> rule : rules) {
            for (I input : inputs) {
                if (rule.matches(input)) {
                    return rule;
                }
            }
        }
        return null;
    }

    public List<DecisionRule<I, T>> getRules() {
        return rules;
    }

    public String getTableName() {
        return tableName;
    }

    @Override
    public String toString() {
        return "DecisionTable{" + tableName + ", rules=" + rules.size() + "}";
    }

    public static class Builder<I, T> {

        private final String tableName;
        private final List<DecisionRule<I, T>> entries = new ArrayList<>();

        private Builder(String tableName) {
            this.tableName = tableName;
        }

        public Builder<I, T> rule(String name, Predicate<I> condition, T outcome) {
            entries.add(new DecisionRule<>(name, condition, outcome));
            return this;
        }

        public DecisionTable<I, T> build() {
            if (tableName == null || tableName.trim().isEmpty()) {
                throw new ConfigurationException("Decision table requires a name");
            }
            if (entries.isEmpty()) {
                throw new ConfigurationException(tableName, "Decision table has no rules");
            }
            Set<String> names = new HashSet<>();
            for (DecisionRule<I, T> rule : entries) {
                if (rule.name == null || rule.name.trim().isEmpty()) {
                    throw new ConfigurationException(tableName, "Rule without a name");
                }
                if (!names.add(rule.name)) {
                    throw new ConfigurationException(tableName, "Duplicate rule name: " + rule.name);
                }
                if (!rule.isComplete()) {
                    throw new ConfigurationException(tableName, "Rule " + rule.name + " has no condition or outcome");
                }
            }
            return new DecisionTable<>(tableName, entries);
        }
    }
}
