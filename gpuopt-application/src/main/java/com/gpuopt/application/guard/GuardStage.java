package com.gpuopt.application.guard;

@FunctionalInterface
public interface GuardStage {
    GuardDecision evaluate(GuardContext context);
}
