package com.dburyak.exercise.rpc;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServeMuxTest {

    @Test
    void routesByMethod() {
        var mux = new ServeMux()
                .handleFunc("foo", call -> Result.success("foo result"))
                .handleFunc("bar", call -> Result.success("bar result"));
        assertThat(mux.serve(new DirectCall("foo", null))).isEqualTo(Result.success("foo result"));
        assertThat(mux.serve(new DirectCall("bar", null))).isEqualTo(Result.success("bar result"));
    }

    @Test
    void unknownMethodIsNotFound() {
        var mux = new ServeMux().handleFunc("Echo", call -> Result.success(null));
        var result = mux.serve(new DirectCall("wat", true));
        assertThat(result).isEqualTo(Result.failure(ServeMux.METHOD_NOT_FOUND));
        assertThat(((Result.Failure) result).getError()).hasMessage("method not found");
    }

    @Test
    void emptyMuxFindsNothing() {
        var result = new ServeMux().serve(new DirectCall("Missing", null));
        assertThat(result.isFailure()).isTrue();
        assertThat(((Result.Failure) result).getError()).isSameAs(ServeMux.METHOD_NOT_FOUND);
    }

    @Test
    void matchesExactly() {
        var mux = new ServeMux().handleFunc("Echo", call -> Result.success("echo"));
        assertThat(mux.serve(new DirectCall("echo", null)).isFailure()).isTrue();
        assertThat(mux.serve(new DirectCall("Ech", null)).isFailure()).isTrue();
        assertThat(mux.serve(new DirectCall("Echo.Sub", null)).isFailure()).isTrue();
        assertThat(mux.serve(new DirectCall("", null)).isFailure()).isTrue();
    }

    @Test
    void registrationOverwritesAndChains() {
        var mux = new ServeMux();
        var returned = mux.handleFunc("m", call -> Result.success(1))
                .handleFunc("m", call -> Result.success(2));
        assertThat(returned).isSameAs(mux);
        assertThat(mux.serve(new DirectCall("m", null))).isEqualTo(Result.success(2));
    }

    @Test
    void initializedFromMap() {
        RpcHandler handler = call -> Result.success(call.method());
        var mux = new ServeMux(Map.of("a", handler, "b", handler));
        assertThat(mux.serve(new DirectCall("a", null))).isEqualTo(Result.success("a"));
        assertThat(mux.serve(new DirectCall("b", null))).isEqualTo(Result.success("b"));
        // the mux owns a copy, so it can still be extended
        mux.handle("c", handler);
        assertThat(mux.serve(new DirectCall("c", null))).isEqualTo(Result.success("c"));
    }

    @Test
    void muxesCanBeNested() {
        var inner = new ServeMux().handleFunc("inner", call -> Result.success("deep"));
        var outer = new ServeMux().handle("inner", inner);
        assertThat(outer.serve(new DirectCall("inner", null))).isEqualTo(Result.success("deep"));
    }

    @Test
    void rejectsNulls() {
        assertThatThrownBy(() -> new ServeMux().handle(null, call -> Result.success(null)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ServeMux().handle("m", null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
