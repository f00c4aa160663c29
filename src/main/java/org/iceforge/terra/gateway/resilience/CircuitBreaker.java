package org.iceforge.terra.gateway.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * CLOSED / OPEN / HALF_OPEN breaker around the engine.
 *
 * <ul>
 *   <li>CLOSED: calls pass; {@code maxFailures} consecutive failures open the circuit.</li>
 *   <li>OPEN: calls fail fast with {@link CircuitOpenException} until {@code timeout} has passed.</li>
 *   <li>HALF_OPEN: a single trial call is let through; success closes, failure re-opens.</li>
 * </ul>
 *
 * All transitions happen under one lock. The breaker never retries. Every transition bumps a
 * generation counter; an admitted call carries the generation it was admitted in, and its outcome
 * is ignored once that generation has passed. Only the call admitted as the half-open trial can
 * settle or release the trial.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {CLOSED, OPEN, HALF_OPEN}

    private final int maxFailures;
    private final Duration timeout;
    private final Clock clock;
    private final Predicate<Throwable> recordAsFailure;
    private final ReentrantLock lock = new ReentrantLock();

    private State state = State.CLOSED;
    private int failureCount;
    private Instant lastFailureTime;
    private boolean trialInFlight;
    private long generation;

    public CircuitBreaker(int maxFailures, Duration timeout, Clock clock) {
        this(maxFailures, timeout, clock, t -> true);
    }

    /**
     * @param recordAsFailure decides which errors count; the rest are treated as a completed call
     */
    public CircuitBreaker(int maxFailures, Duration timeout, Clock clock, Predicate<Throwable> recordAsFailure) {
        if (maxFailures < 1) {
            throw new IllegalArgumentException("maxFailures must be >= 1");
        }
        this.maxFailures = maxFailures;
        this.timeout = Objects.requireNonNull(timeout);
        this.clock = Objects.requireNonNull(clock);
        this.recordAsFailure = Objects.requireNonNull(recordAsFailure);
    }

    public <T> T call(Callable<T> action) throws Exception {
        Permit permit = acquire();
        try {
            T result = action.call();
            onSuccess(permit);
            return result;
        } catch (Exception | Error e) {
            onError(permit, e);
            throw e;
        }
    }

    /**
     * Guards a reactive call. Admission is decided at subscription time; {@code callTimeout}
     * (if not null) is applied inside the guard, so a timeout counts as a failure. A cancelled
     * subscription releases a half-open trial without changing state.
     */
    public <T> Mono<T> protect(Mono<T> source, Duration callTimeout) {
        return Mono.defer(() -> {
            Permit permit = acquire();
            AtomicBoolean settled = new AtomicBoolean();
            Mono<T> guarded = callTimeout == null ? source : source.timeout(callTimeout);
            return guarded
                    .doOnSuccess(v -> {
                        if (settled.compareAndSet(false, true)) {
                            onSuccess(permit);
                        }
                    })
                    .doOnError(e -> {
                        if (settled.compareAndSet(false, true)) {
                            onError(permit, e);
                        }
                    })
                    .doOnCancel(() -> {
                        if (settled.compareAndSet(false, true)) {
                            releaseTrial(permit);
                        }
                    });
        });
    }

    public State state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public int failureCount() {
        lock.lock();
        try {
            return failureCount;
        } finally {
            lock.unlock();
        }
    }

    public Snapshot snapshot() {
        lock.lock();
        try {
            return new Snapshot(state, failureCount, lastFailureTime);
        } finally {
            lock.unlock();
        }
    }

    private Permit acquire() {
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                    return new Permit(generation, false);
                case OPEN: {
                    Duration elapsed = Duration.between(lastFailureTime, clock.instant());
                    if (elapsed.compareTo(timeout) >= 0) {
                        transition(State.HALF_OPEN);
                        trialInFlight = true;
                        log.warn("Circuit breaker HALF_OPEN after {}s cooldown, admitting trial call", timeout.toSeconds());
                        return new Permit(generation, true);
                    }
                    throw new CircuitOpenException("Service temporarily unavailable (circuit breaker open)",
                            timeout.minus(elapsed));
                }
                case HALF_OPEN:
                    if (trialInFlight) {
                        throw new CircuitOpenException("Service temporarily unavailable (trial call in progress)",
                                Duration.ofSeconds(1));
                    }
                    trialInFlight = true;
                    return new Permit(generation, true);
                default:
                    throw new IllegalStateException("Unknown breaker state " + state);
            }
        } finally {
            lock.unlock();
        }
    }

    private void onError(Permit permit, Throwable e) {
        if (recordAsFailure.test(e)) {
            onFailure(permit);
        } else {
            onSuccess(permit);
        }
    }

    private void onSuccess(Permit permit) {
        lock.lock();
        try {
            if (permit.generation() != generation) {
                return;
            }
            if (permit.trial() && state == State.HALF_OPEN) {
                transition(State.CLOSED);
                trialInFlight = false;
                failureCount = 0;
                log.warn("Circuit breaker CLOSED after successful trial call");
            } else if (!permit.trial() && state == State.CLOSED) {
                failureCount = 0;
            }
        } finally {
            lock.unlock();
        }
    }

    private void onFailure(Permit permit) {
        lock.lock();
        try {
            if (permit.generation() != generation) {
                return;
            }
            if (permit.trial() && state == State.HALF_OPEN) {
                failureCount++;
                lastFailureTime = clock.instant();
                transition(State.OPEN);
                trialInFlight = false;
                log.warn("Circuit breaker re-OPENED: trial call failed");
            } else if (!permit.trial() && state == State.CLOSED) {
                failureCount++;
                lastFailureTime = clock.instant();
                if (failureCount >= maxFailures) {
                    transition(State.OPEN);
                    log.warn("Circuit breaker OPEN after {} consecutive failures", failureCount);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private void releaseTrial(Permit permit) {
        lock.lock();
        try {
            if (permit.trial() && permit.generation() == generation && state == State.HALF_OPEN) {
                trialInFlight = false;
            }
        } finally {
            lock.unlock();
        }
    }

    // caller holds the lock
    private void transition(State next) {
        state = next;
        generation++;
    }

    private record Permit(long generation, boolean trial) {
    }

    public record Snapshot(State state, int failureCount, Instant lastFailureTime) {
    }
}
