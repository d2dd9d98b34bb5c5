package com.eainde.planner.thread;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MdcAwareExecutorTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("tasks see the submitter's MDC")
    void propagatesMdc() throws Exception {
        try (MdcAwareExecutor executor = new MdcAwareExecutor(2)) {
            MDC.put("runId", "run-42");

            String seen = CompletableFuture.supplyAsync(() -> MDC.get("runId"), executor).get();

            assertThat(seen).isEqualTo("run-42");
        }
    }

    @Test
    @DisplayName("pooled threads do not keep a previous task's MDC")
    void clearsAfterTask() throws Exception {
        try (MdcAwareExecutor executor = new MdcAwareExecutor(1)) {
            MDC.put("runId", "first");
            CompletableFuture.runAsync(() -> { }, executor).get();

            MDC.clear();
            String seen = CompletableFuture.supplyAsync(() -> MDC.get("runId"), executor).get();

            assertThat(seen).isNull();
        }
    }

    @Test
    @DisplayName("rejects a pool without workers")
    void noWorkers() {
        assertThatThrownBy(() -> new MdcAwareExecutor(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
