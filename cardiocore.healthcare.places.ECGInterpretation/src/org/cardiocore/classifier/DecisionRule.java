package org.cardiocore.classifier;

import java.util.function.Predicate;

/**
 * A named (condition, outcome) pair. Rules are evaluated by a
 * {@link DecisionTable} in the order they were declared.
 */
public final class DecisionRule<I, T> {

    public final String name;
    public final T outcome;
    private final Predicate<I> condition;

    DecisionRule(String name, Predicate<I> condition, T outcome) {
        this.name = name;
        this.condition = condition;
        this.outcome = outcome;
    }

    public boolean matches(I input) {
        return condition.test(input);
    }

    boolean isComplete() {
        return condition != null && outcome != null;
    }

    @Override
    public String toString() {
        return "DecisionRule{" + name + " -> " + outcome + "}";
    }
}
