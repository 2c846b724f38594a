package com.libragraph.keeper.core.service;

import com.libragraph.keeper.core.config.EnvironmentConfig;
import com.libragraph.keeper.core.context.Lifetime;
import com.libragraph.keeper.core.context.ServiceContext;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimpleServiceTest {

    private final ServiceContext ctx = ServiceContext.root(Lifetime.create(), EnvironmentConfig.fromMap(Map.of()));

    @Test
    void callbacksAreInvokedInOrder() throws Exception {
        List<String> calls = new ArrayList<>();
        SimpleService service = SimpleService.builder("poller", "billing")
                .version("2.0.0")
                .onInit(c -> calls.add("init"))
                .onRun(c -> calls.add("run"))
                .onClose(c -> calls.add("close"))
                .build();

        service.init(ctx);
        service.run(ctx);
        service.close(ctx);

        assertThat(calls).containsExactly("init", "run", "close");
        assertThat(service.name()).isEqualTo("poller");
        assertThat(service.namespace()).isEqualTo("billing");
        assertThat(service.version()).isEqualTo("2.0.0");
    }

    @Test
    void initAndCloseAreOptional() throws Exception {
        SimpleService service = SimpleService.builder("poller", "billing").onRun(c -> { }).build();

        service.init(ctx);
        service.close(ctx);

        assertThat(service.version()).isEmpty();
    }

    @Test
    void runIsRequired() {
        assertThatThrownBy(() -> SimpleService.builder("poller", "billing").build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("run step");
    }
}
