package com.docproof.plan.timeout;

import com.docproof.plan.model.ExecutionPlan;
import com.docproof.plan.model.ExecutionStep;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Resolves the deadline of every step in a plan before it runs.
 * Precedence: step's {@code timeoutMs} → nearest ancestor's {@code timeoutMs} → plan
 * {@code globalConfig.defaultTimeout} → global default.
 */
public final class StepTimeoutResolver {

    private StepTimeoutResolver() {
    }

    /**
     * @param plan            plan to resolve
     * @param globalDefaultMs fallback when neither the step, its ancestors nor the plan set a timeout
     * @return step (by identity) → deadline in milliseconds
     */
    public static Map<ExecutionStep, Long> resolve(ExecutionPlan plan, long globalDefaultMs) {
        Map<ExecutionStep, Long> out = new IdentityHashMap<>();
        Long planDefault = plan.getGlobalLong(ExecutionPlan.GLOBAL_DEFAULT_TIMEOUT);
        long fallback = planDefault != null ? planDefault : globalDefaultMs;
        Deque<Pending> work = new ArrayDeque<>();
        for (ExecutionStep step : plan.getSteps()) {
            work.push(new Pending(step, fallback));
        }
        while (!work.isEmpty()) {
            Pending p = work.pop();
            Long own = p.step.getTimeoutMs();
            long resolved = own != null && own > 0 ? own : p.inherited;
            out.put(p.step, resolved);
            for (ExecutionStep child : p.step.getChildren()) {
                work.push(new Pending(child, resolved));
            }
        }
        return out;
    }

    private record Pending(ExecutionStep step, long inherited) {
    }
}
