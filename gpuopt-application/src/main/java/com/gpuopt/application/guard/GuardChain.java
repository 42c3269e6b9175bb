package com.gpuopt.application.guard;

import com.gpuopt.domain.DomainException;

import java.util.List;

/**
 * Ordered stages run in front of a request handler. The first rejection wins.
 */
public final class GuardChain {

    private final List<GuardStage> stages;

    public GuardChain(List<GuardStage> stages) {
        this.stages = List.copyOf(stages);
    }

    public GuardDecision evaluate(GuardContext context) {
        for (GuardStage stage : stages) {
            GuardDecision d = stage.evaluate(context);
            if (!d.proceeds()) return d;
        }
        return GuardDecision.proceed();
    }

    /**
     * @throws DomainException the rejection of the first stage that stops the request
     */
    public GuardContext enforce(GuardContext context) {
        GuardDecision d = evaluate(context);
        if (!d.proceeds()) throw d.rejection();
        return context;
    }

    public int size() {
        return stages.size();
    }
}
