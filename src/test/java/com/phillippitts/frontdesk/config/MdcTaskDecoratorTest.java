package com.phillippitts.frontdesk.config;

import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MdcTaskDecoratorTest {

    private final MdcTaskDecorator decorator = new MdcTaskDecorator();

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void carriesSubmitterContextIntoTask() throws InterruptedException {
        ThreadContext.put("sessionId", "s-1");
        ThreadContext.put("callSid", "CA1");
        Map<String, String> seen = new HashMap<>();
        Runnable task = decorator.decorate(() -> seen.putAll(ThreadContext.getImmutableContext()));
        ThreadContext.clearAll();

        Thread worker = new Thread(task);
        worker.start();
        worker.join();

        assertThat(seen).containsEntry("sessionId", "s-1").containsEntry("callSid", "CA1");
    }

    @Test
    void restoresWorkerContextAfterTask() {
        ThreadContext.put("sessionId", "s-submitter");
        Runnable task = decorator.decorate(() -> assertThat(ThreadContext.get("sessionId")).isEqualTo("s-submitter"));

        ThreadContext.clearAll();
        ThreadContext.put("worker", "w-1");
        task.run();

        assertThat(ThreadContext.get("worker")).isEqualTo("w-1");
        assertThat(ThreadContext.get("sessionId")).isNull();
    }
}
