package com.docproof.engine;

import com.docproof.plan.model.ExecutionStep;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Groups sibling steps into dispatch units. Steps with an explicit {@code order} are stable-sorted
 * ascending and steps sharing an order value form one concurrent unit. Steps without an order follow,
 * in list order, one per unit.
 * <p>
 * {@link #sequence(List)} gives the same order for a non-parallel group, where steps sharing an order
 * value run one after another in list position.
 */
final class StepOrdering {

    private StepOrdering() {
    }

    static List<List<ExecutionStep>> units(List<ExecutionStep> steps) {
        List<ExecutionStep> ordered = new ArrayList<>();
        List<ExecutionStep> unordered = new ArrayList<>();
        split(steps, ordered, unordered);

        List<List<ExecutionStep>> units = new ArrayList<>();
        List<ExecutionStep> current = null;
        for (ExecutionStep s : ordered) {
            if (current != null && Objects.equals(current.get(0).getOrder(), s.getOrder())) {
                current.add(s);
            } else {
                current = new ArrayList<>();
                current.add(s);
                units.add(current);
            }
        }
        for (ExecutionStep s : unordered) {
            units.add(List.of(s));
        }
        return units;
    }

    static List<ExecutionStep> sequence(List<ExecutionStep> steps) {
        List<ExecutionStep> ordered = new ArrayList<>();
        List<ExecutionStep> unordered = new ArrayList<>();
        split(steps, ordered, unordered);
        ordered.addAll(unordered);
        return ordered;
    }

    private static void split(List<ExecutionStep> steps, List<ExecutionStep> ordered, List<ExecutionStep> unordered) {
        for (ExecutionStep s : steps) {
            (s.getOrder() != null ? ordered : unordered).add(s);
        }
        // List.sort is stable; ties keep list position
        ordered.sort(Comparator.comparing(ExecutionStep::getOrder));
    }
}
