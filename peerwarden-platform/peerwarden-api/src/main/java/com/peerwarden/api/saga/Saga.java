package com.peerwarden.api.saga;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Runs an ordered list of steps across systems that share no transaction.
 * 
 * When a step fails, the compensations of the steps that already completed
 * run in reverse order. Every compensation is attempted even if an earlier
 * one fails; all failures are reported in one {@link SagaFailedException}.
 */
public final class Saga {

    private static final Logger log = LoggerFactory.getLogger(Saga.class);

    private final String name;
    private final List<SagaStep> steps;

    private Saga(String name, List<SagaStep> steps) {
        this.name = name;
        this.steps = List.copyOf(steps);
    }

    public static Builder named(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    /**
     * Runs all steps with a fresh context and returns it.
     */
    public SagaContext run() {
        return run(new SagaContext());
    }

    public SagaContext run(SagaContext context) {
        Deque<SagaStep> completed = new ArrayDeque<>();
        for (SagaStep step : steps) {
            try {
                step.action().apply(context);
                completed.push(step);
            } catch (Exception e) {
                log.warn("Saga {} failed at step {}: {}", name, step.name(), e.getMessage());
                throw new SagaFailedException(name, step.name(), e, compensate(completed, context));
            }
        }
        return context;
    }

    private List<SagaFailedException.CompensationFailure> compensate(Deque<SagaStep> completed, SagaContext context) {
        List<SagaFailedException.CompensationFailure> failures = new ArrayList<>();
        while (!completed.isEmpty()) {
            SagaStep step = completed.pop();
            if (!step.isCompensable()) {
                continue;
            }
            try {
                step.compensation().apply(context);
                log.info("Saga {} compensated step {}", name, step.name());
            } catch (Exception e) {
                log.error("Saga {} could not compensate step {}: {}", name, step.name(), e.getMessage());
                failures.add(new SagaFailedException.CompensationFailure(step.name(), e));
            }
        }
        return failures;
    }

    public static final class Builder {
        private final String name;
        private final List<SagaStep> steps = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder step(String stepName, SagaStep.Action action) {
            return step(stepName, action, null);
        }

        public Builder step(String stepName, SagaStep.Action action, SagaStep.Action compensation) {
            steps.add(new SagaStep(stepName, action, compensation));
            return this;
        }

        public Saga build() {
            if (steps.isEmpty()) {
                throw new IllegalStateException("Saga " + name + " has no steps");
            }
            return new Saga(name, steps);
        }
    }
}
