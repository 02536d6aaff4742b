package com.dburyak.exercise.rpc;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;

class CallContextTest {
    private static final CallContext.Key<String> KEY = CallContext.Key.create("key");

    @Test
    void backgroundHasNothing() {
        var ctx = CallContext.background();
        assertThat(ctx).isSameAs(CallContext.background());
        assertThat(ctx.isCancelled()).isFalse();
        assertThat(ctx.deadline()).isEmpty();
        assertThat(ctx.get(KEY)).isNull();
    }

    @Test
    void withValueDoesNotModifyParent() {
        var parent = CallContext.background();
        var child = parent.withValue(KEY, "value");
        assertThat(child.get(KEY)).isEqualTo("value");
        assertThat(parent.get(KEY)).isNull();
        var grandChild = child.withValue(KEY, "other");
        assertThat(grandChild.get(KEY)).isEqualTo("other");
        assertThat(child.get(KEY)).isEqualTo("value");
    }

    @Test
    void keysWithSameNameAreDifferentKeys() {
        CallContext.Key<String> anotherKey = CallContext.Key.create("key");
        var ctx = CallContext.background().withValue(KEY, "value");
        assertThat(ctx.get(anotherKey)).isNull();
    }

    @Test
    void nullValuesAreAllowed() {
        var ctx = CallContext.background().withValue(KEY, null);
        assertThat(ctx.get(KEY)).isNull();
    }

    @Test
    void cancellationPropagatesToChildren() {
        var parent = CallContext.background().withCancel();
        var child = parent.withValue(KEY, "value").withCancel();
        var valueChild = parent.withValue(KEY, "value");
        var observer = child.cancelled().test();
        observer.assertNotComplete();

        parent.cancel();

        assertThat(parent.isCancelled()).isTrue();
        assertThat(child.isCancelled()).isTrue();
        assertThat(valueChild.isCancelled()).isTrue();
        observer.assertComplete();
    }

    @Test
    void cancellingChildDoesNotCancelParent() {
        var parent = CallContext.background().withCancel();
        var child = parent.withCancel();
        child.cancel();
        assertThat(child.isCancelled()).isTrue();
        assertThat(parent.isCancelled()).isFalse();
    }

    @Test
    void cancelIsIdempotent() {
        var ctx = CallContext.background().withCancel();
        ctx.cancel();
        ctx.cancel();
        assertThat(ctx.isCancelled()).isTrue();
    }

    @Test
    void deadlineCancelsContext() {
        var ctx = CallContext.background().withTimeout(Duration.ofMillis(50));
        assertThat(ctx.deadline()).isPresent();
        assertThat(ctx.cancelled().blockingAwait(5, SECONDS)).isTrue();
        assertThat(ctx.isCancelled()).isTrue();
    }

    @Test
    void pastDeadlineCancelsImmediately() {
        var ctx = CallContext.background().withDeadline(Instant.now().minusSeconds(1));
        assertThat(ctx.isCancelled()).isTrue();
    }

    @Test
    void childCantExtendParentDeadline() {
        var parentDeadline = Instant.now().plusSeconds(60);
        var parent = CallContext.background().withDeadline(parentDeadline);
        var child = parent.withDeadline(parentDeadline.plusSeconds(60));
        assertThat(child.deadline()).contains(parentDeadline);
        var earlier = parentDeadline.minusSeconds(30);
        assertThat(parent.withDeadline(earlier).deadline()).contains(earlier);
        parent.cancel();
        assertThat(child.isCancelled()).isTrue();
    }
}
