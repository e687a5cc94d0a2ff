package com.glisk.backend.pipeline.supervisor;

import com.glisk.backend.pipeline.config.PipelineProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class WorkerSupervisorTest {

    private WorkerSupervisor supervisor;

    @AfterEach
    void tearDown() {
        if (supervisor != null) supervisor.stop();
    }

    private PipelineProperties props() {
        PipelineProperties p = new PipelineProperties();
        p.setRestartDelay(Duration.ofMillis(20));
        p.setShutdownTimeout(Duration.ofSeconds(5));
        return p;
    }

    /** fails on its first iterations, then succeeds */
    private static final class FlakyWorker implements PipelineWorker {
        final AtomicInteger calls = new AtomicInteger();
        final CountDownLatch succeeded = new CountDownLatch(1);
        final AtomicInteger starts = new AtomicInteger();
        private final int failures;

        FlakyWorker(int failures) { this.failures = failures; }

        @Override public String name() { return "flaky"; }
        @Override public Duration pollInterval() { return Duration.ofMillis(10); }
        @Override public void onStart() { starts.incrementAndGet(); }

        @Override
        public void runOnce() {
            if (calls.incrementAndGet() <= failures) throw new IllegalStateException("boom #" + calls.get());
            succeeded.countDown();
        }
    }

    @Test
    void crashed_iteration_should_be_restarted() throws Exception {
        FlakyWorker worker = new FlakyWorker(2);
        supervisor = new WorkerSupervisor(List.of(worker), new SimpleAsyncTaskExecutor("test-"), props(), Clock.systemUTC());

        supervisor.start();

        assertThat(worker.succeeded.await(5, TimeUnit.SECONDS)).isTrue();
        WorkerState state = supervisor.states().get(0);
        assertThat(state.name()).isEqualTo("flaky");
        assertThat(state.restarts()).isEqualTo(2);
        assertThat(state.lastError()).contains("boom #2");
        assertThat(worker.starts.get()).isEqualTo(1);
    }

    @Test
    void error_should_leave_the_loop_down_with_its_cause() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        PipelineWorker broken = new PipelineWorker() {
            @Override public String name() { return "broken"; }
            @Override public Duration pollInterval() { return Duration.ofMillis(10); }
            @Override public void runOnce() {
                calls.incrementAndGet();
                throw new NoClassDefFoundError("com/example/Missing");
            }
        };
        supervisor = new WorkerSupervisor(List.of(broken), new SimpleAsyncTaskExecutor("test-"), props(), Clock.systemUTC());

        supervisor.start();

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        WorkerState state = supervisor.states().get(0);
        while ((state.running() || state.lastError() == null) && System.nanoTime() < deadline) {
            Thread.sleep(10);
            state = supervisor.states().get(0);
        }
        assertThat(state.running()).isFalse();
        assertThat(state.lastError()).contains("NoClassDefFoundError").contains("com/example/Missing");
        Thread.sleep(50);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void stop_should_end_every_loop() throws Exception {
        FlakyWorker worker = new FlakyWorker(0);
        supervisor = new WorkerSupervisor(List.of(worker), new SimpleAsyncTaskExecutor("test-"), props(), Clock.systemUTC());

        supervisor.start();
        assertThat(worker.succeeded.await(5, TimeUnit.SECONDS)).isTrue();
        supervisor.stop();

        assertThat(supervisor.isRunning()).isFalse();
        assertThat(supervisor.states()).allMatch(s -> !s.running());
        int callsAfterStop = worker.calls.get();
        Thread.sleep(50);
        assertThat(worker.calls.get()).isEqualTo(callsAfterStop);
    }

    @Test
    void disabled_pipeline_starts_nothing() {
        PipelineProperties p = props();
        p.setEnabled(false);
        FlakyWorker worker = new FlakyWorker(0);
        supervisor = new WorkerSupervisor(List.of(worker), new SimpleAsyncTaskExecutor("test-"), p, Clock.systemUTC());

        supervisor.start();

        assertThat(supervisor.isRunning()).isFalse();
        assertThat(supervisor.states()).isEmpty();
        assertThat(worker.calls.get()).isZero();
    }
}
