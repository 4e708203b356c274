package com.netflexity.anomaly.rule;

import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.time.Instant;

/**
 * Cancellation and deadline scope of one evaluation tick.
 *
 * Every backend call of a tick is awaited through {@link #await(Mono, String)},
 * which gives up as soon as the context is cancelled or its deadline passes.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public final class EvaluationContext {

    private final Instant deadline;
    private final Sinks.One<Boolean> cancellation = Sinks.one();
    private volatile boolean cancelled;

    private EvaluationContext(Instant deadline) {
        this.deadline = deadline;
    }

    /**
     * Context without a deadline
     */
    public static EvaluationContext background() {
        return new EvaluationContext(null);
    }

    public static EvaluationContext withTimeout(Duration timeout) {
        return new EvaluationContext(Instant.now().plus(timeout));
    }

    public void cancel() {
        cancelled = true;
        cancellation.tryEmitValue(Boolean.TRUE);
    }

    public boolean isCancelled() {
        return cancelled || (deadline != null && !Instant.now().isBefore(deadline));
    }

    /**
     * Fail with {@link RuleEvaluationException.ErrorKind#CANCELLED} if the tick must stop
     */
    public void checkActive(String operation) throws RuleEvaluationException {
        if (isCancelled()) {
            throw new RuleEvaluationException(RuleEvaluationException.ErrorKind.CANCELLED,
                    operation + " cancelled");
        }
    }

    /**
     * Block on {@code call} until it completes, the context is cancelled or the deadline passes.
     *
     * @param call      backend call
     * @param operation name used in error messages
     * @return the emitted value
     * @throws RuleEvaluationException CANCELLED on cancellation or deadline, BACKEND on any other failure
     */
    public <T> T await(Mono<T> call, String operation) throws RuleEvaluationException {
        checkActive(operation);
        Mono<T> guarded = call.takeUntilOther(cancellation.asMono());
        if (deadline != null) {
            Duration remaining = Duration.between(Instant.now(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                throw new RuleEvaluationException(RuleEvaluationException.ErrorKind.CANCELLED,
                        operation + " deadline exceeded");
            }
            guarded = guarded.timeout(remaining, Mono.error(new DeadlineExceededException()));
        }

        T result;
        try {
            result = guarded.block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof DeadlineExceededException) {
                throw new RuleEvaluationException(RuleEvaluationException.ErrorKind.CANCELLED,
                        operation + " deadline exceeded");
            }
            throw new RuleEvaluationException(RuleEvaluationException.ErrorKind.BACKEND,
                    operation + " failed: " + cause.getMessage(), cause);
        }

        if (cancelled) {
            throw new RuleEvaluationException(RuleEvaluationException.ErrorKind.CANCELLED,
                    operation + " cancelled");
        }
        if (result == null) {
            throw new RuleEvaluationException(RuleEvaluationException.ErrorKind.BACKEND,
                    operation + " returned no result");
        }
        return result;
    }

    /**
     * Signals that the context deadline, not a backend timeout, ended the call
     */
    private static final class DeadlineExceededException extends RuntimeException {
        DeadlineExceededException() {
            super("deadline exceeded", null, false, false);
        }
    }
}
