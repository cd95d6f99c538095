package com.peerwarden.api.saga;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A saga step failed. Carries the original failure as cause and any
 * compensation failures, which are also attached as suppressed exceptions.
 */
public class SagaFailedException extends RuntimeException {

    private final String sagaName;
    private final String failedStep;
    private final List<CompensationFailure> compensationFailures;

    public SagaFailedException(String sagaName, String failedStep, Throwable cause,
                               List<CompensationFailure> compensationFailures) {
        super(buildMessage(sagaName, failedStep, cause, compensationFailures), cause);
        this.sagaName = sagaName;
        this.failedStep = failedStep;
        this.compensationFailures = List.copyOf(compensationFailures);
        compensationFailures.forEach(failure -> addSuppressed(failure.error()));
    }

    public String getSagaName() {
        return sagaName;
    }

    public String getFailedStep() {
        return failedStep;
    }

    public List<CompensationFailure> getCompensationFailures() {
        return compensationFailures;
    }

    public boolean isFullyCompensated() {
        return compensationFailures.isEmpty();
    }

    public record CompensationFailure(String step, Throwable error) {}

    private static String buildMessage(String sagaName, String failedStep, Throwable cause,
                                       List<CompensationFailure> compensationFailures) {
        String message = sagaName + " failed at step '" + failedStep + "': " + cause.getMessage();
        if (compensationFailures.isEmpty()) {
            return message;
        }
        return message + "; compensation also failed: " + compensationFailures.stream()
                .map(failure -> "'" + failure.step() + "': " + failure.error().getMessage())
                .collect(Collectors.joining(", "));
    }
}
