package com.servicehealth.analytics.service;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of an analytics computation.
 * Keeps "not enough history yet" apart from real failures even though the
 * public operations collapse both to an empty result.
 */
public final class AnalysisResult<T> {

    public enum Outcome {
        OK,
        INSUFFICIENT_DATA,
        FAILED
    }

    private final Outcome outcome;
    private final T value;
    private final String reason;
    private final Throwable cause;

    private AnalysisResult(Outcome outcome, T value, String reason, Throwable cause) {
        this.outcome = outcome;
        this.value = value;
        this.reason = reason;
        this.cause = cause;
    }

    public static <T> AnalysisResult<T> ok(T value) {
        return new AnalysisResult<>(Outcome.OK, Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> AnalysisResult<T> insufficientData(String reason) {
        return new AnalysisResult<>(Outcome.INSUFFICIENT_DATA, null, reason, null);
    }

    public static <T> AnalysisResult<T> failed(String reason, Throwable cause) {
        return new AnalysisResult<>(Outcome.FAILED, null, reason, cause);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isOk() {
        return outcome == Outcome.OK;
    }

    public T getValue() {
        if (!isOk()) {
            throw new IllegalStateException("No value for outcome " + outcome + ": " + reason);
        }
        return value;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    public String getReason() {
        return reason;
    }

    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return isOk() ? "AnalysisResult[OK]" : "AnalysisResult[" + outcome + ": " + reason + "]";
    }
}
