package com.gpuopt.application.guard;

import com.gpuopt.domain.DomainException;

/**
 * Outcome of one stage: continue, or stop with the given rejection.
 */
public record GuardDecision(DomainException rejection) {

    private static final GuardDecision CONTINUE = new GuardDecision(null);

    public static GuardDecision proceed() {
        return CONTINUE;
    }

    public static GuardDecision reject(DomainException rejection) {
        return new GuardDecision(rejection);
    }

    public boolean proceeds() {
        return rejection == null;
    }
}
