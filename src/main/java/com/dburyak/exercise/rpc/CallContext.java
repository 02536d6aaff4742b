package com.dburyak.exercise.rpc;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.subjects.CompletableSubject;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Immutable context of a single RPC call. Carries cancellation, an optional deadline and typed attachments.
 * <p>
 * Every {@code with*} method returns a new child context, the parent is never modified. Children observe the
 * cancellation of their parent, but cancelling a child never affects the parent.
 */
public class CallContext {
    private static final CallContext BACKGROUND = new CallContext(Map.of(), null, null);

    private final Map<Key<?>, Object> values;
    private final CompletableSubject cancellation; // null means "never cancelled"
    private final Instant deadline;

    private CallContext(Map<Key<?>, Object> values, CompletableSubject cancellation, Instant deadline) {
        this.values = values;
        this.cancellation = cancellation;
        this.deadline = deadline;
    }

    /**
     * Root context: never cancelled, no deadline, no attachments.
     */
    public static CallContext background() {
        return BACKGROUND;
    }

    public <T> CallContext withValue(Key<T> key, T value) {
        if (key == null) {
            throw new IllegalArgumentException("key must not be null");
        }
        var newValues = new HashMap<Key<?>, Object>(values);
        newValues.put(key, value);
        return new CallContext(Collections.unmodifiableMap(newValues), cancellation, deadline);
    }

    /**
     * Returns the value attached under the given key, or null if there's none.
     */
    public <T> T get(Key<T> key) {
        return (T) values.get(key);
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    public boolean isCancelled() {
        return cancellation != null && cancellation.hasComplete();
    }

    /**
     * Completes when this context gets cancelled. Never completes for contexts that can't be cancelled.
     */
    public Completable cancelled() {
        return cancellation != null ? cancellation.hide() : Completable.never();
    }

    public Cancellable withCancel() {
        return new Cancellable(values, childCancellation(), deadline, null);
    }

    public Cancellable withDeadline(Instant deadline) {
        if (deadline == null) {
            throw new IllegalArgumentException("deadline must not be null");
        }
        var effectiveDeadline = (this.deadline != null && this.deadline.isBefore(deadline)) ? this.deadline
                : deadline;
        var childCancellation = childCancellation();
        var delayMs = Duration.between(Instant.now(), effectiveDeadline).toMillis();
        if (delayMs <= 0) {
            childCancellation.onComplete();
            return new Cancellable(values, childCancellation, effectiveDeadline, null);
        }
        var timer = Completable.timer(delayMs, MILLISECONDS)
                .subscribe(childCancellation::onComplete);
        return new Cancellable(values, childCancellation, effectiveDeadline, timer);
    }

    public Cancellable withTimeout(Duration timeout) {
        return withDeadline(Instant.now().plus(timeout));
    }

    private CompletableSubject childCancellation() {
        var child = CompletableSubject.create();
        if (cancellation != null) {
            cancellation.subscribe(child);
        }
        return child;
    }

    /**
     * Context which can be cancelled explicitly. Cancellation is idempotent.
     */
    public static final class Cancellable extends CallContext {
        private final CompletableSubject ownCancellation;
        private final Disposable deadlineTimer;

        private Cancellable(Map<Key<?>, Object> values, CompletableSubject cancellation, Instant deadline,
                Disposable deadlineTimer) {
            super(values, cancellation, deadline);
            this.ownCancellation = cancellation;
            this.deadlineTimer = deadlineTimer;
        }

        public void cancel() {
            if (deadlineTimer != null) {
                deadlineTimer.dispose();
            }
            ownCancellation.onComplete();
        }
    }

    /**
     * Typed key of a context attachment. Keys are compared by identity, two keys created with the same name are
     * different keys.
     */
    public static final class Key<T> {
        private final String name;

        private Key(String name) {
            this.name = name;
        }

        public static <T> Key<T> create(String name) {
            return new Key<>(name);
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
