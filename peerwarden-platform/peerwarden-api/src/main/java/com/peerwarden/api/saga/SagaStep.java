package com.peerwarden.api.saga;

/**
 * A forward action with an optional compensation that undoes it.
 */
public record SagaStep(String name, Action action, Action compensation) {

    @FunctionalInterface
    public interface Action {
        void apply(SagaContext context) throws Exception;
    }

    public boolean isCompensable() {
        return compensation != null;
    }
}
