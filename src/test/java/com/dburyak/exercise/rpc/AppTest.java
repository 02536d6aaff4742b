package com.dburyak.exercise.rpc;

import io.reactivex.rxjava3.plugins.RxJavaPlugins;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AppTest {
    private App app;

    @AfterEach
    void tearDown() {
        if (app != null) {
            app.shutdown();
        }
        RxJavaPlugins.reset();
    }

    @Test
    void startsWithClasspathConfig() {
        app = new App(new ServeMux().handleFunc("Null", call -> Result.success(null)));

        assertThat(app.start().blockingAwait(30, SECONDS)).isTrue();

        var cfg = app.getConfig();
        assertThat(cfg.getNumVerticles()).isEqualTo(2);
        assertThat(cfg.getPort()).isZero();
        assertThat(cfg.getApiPath()).isEqualTo("/rpc");
        assertThat(cfg.getGracefulShutdownTimeout()).isEqualTo(Duration.ofSeconds(1));
        assertThat(cfg.isStrictJsonRpcVersion()).isTrue();
    }

    @Test
    void shutdownIsIdempotent() {
        app = new App(call -> Result.success(null));
        app.start().blockingAwait(30, SECONDS);

        app.shutdown();
        app.shutdown();
    }

    @Test
    void requiresDispatcher() {
        assertThatThrownBy(() -> new App(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
