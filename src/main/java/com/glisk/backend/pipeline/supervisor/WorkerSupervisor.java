package com.glisk.backend.pipeline.supervisor;

import com.glisk.backend.pipeline.config.PipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs every {@link PipelineWorker} as its own endless loop on {@code pipelineExecutor}.
 * <ul>
 *   <li>an exception escaping {@code runOnce()} is logged and the loop resumes after {@code restart-delay}</li>
 *   <li>stop() only wakes sleeping loops; an iteration in progress finishes before its thread exits</li>
 * </ul>
 */
@Slf4j
@Component
public class WorkerSupervisor implements SmartLifecycle {

    private final List<PipelineWorker> workers;
    private final TaskExecutor executor;
    private final PipelineProperties props;
    private final Clock clock;

    private final List<Loop> loops = new ArrayList<>();
    private volatile CountDownLatch stopSignal = new CountDownLatch(0);
    private volatile CountDownLatch exited = new CountDownLatch(0);
    private volatile boolean running = false;

    public WorkerSupervisor(List<PipelineWorker> workers,
                            @Qualifier("pipelineExecutor") TaskExecutor executor,
                            PipelineProperties props,
                            Clock clock) {
        this.workers = workers;
        this.executor = executor;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public synchronized void start() {
        if (running) return;
        if (!props.isEnabled()) {
            log.info("pipeline.disabled workers={}", workers.size());
            return;
        }

        stopSignal = new CountDownLatch(1);
        exited = new CountDownLatch(workers.size());
        loops.clear();
        running = true;

        for (PipelineWorker w : workers) {
            Loop loop = new Loop(w);
            loops.add(loop);
            executor.execute(loop);
        }
        log.info("pipeline.started workers={}", workers.stream().map(PipelineWorker::name).toList());
    }

    @Override
    public synchronized void stop() {
        if (!running) return;
        running = false;
        stopSignal.countDown();

        try {
            boolean done = exited.await(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!done) {
                log.warn("pipeline.stop.timeout stillRunning={}",
                        loops.stream().filter(Loop::isAlive).map(l -> l.worker.name()).toList());
            } else {
                log.info("pipeline.stopped");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /** stop early in shutdown so loops finish while the datasource is still up */
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 100;
    }

    public List<WorkerState> states() {
        return loops.stream().map(Loop::snapshot).toList();
    }

    private boolean awaitStop(Duration d) {
        try {
            return stopSignal.await(Math.max(0, d.toMillis()), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private final class Loop implements Runnable {

        private final PipelineWorker worker;
        private final AtomicLong iterations = new AtomicLong();
        private final AtomicLong restarts = new AtomicLong();
        private volatile boolean alive = false;
        private volatile Instant lastSuccessAt;
        private volatile String lastError;

        private Loop(PipelineWorker worker) {
            this.worker = worker;
        }

        @Override
        public void run() {
            alive = true;
            Thread.currentThread().setName("pipeline-" + worker.name());
            try {
                startWorker();
                while (running) {
                    try {
                        worker.runOnce();
                        iterations.incrementAndGet();
                        lastSuccessAt = clock.instant();
                        if (awaitStop(worker.pollInterval())) break;
                    } catch (RuntimeException e) {
                        restarts.incrementAndGet();
                        lastError = e.getClass().getSimpleName() + ": " + e.getMessage();
                        log.error("worker.crashed worker={} restartIn={}", worker.name(), props.getRestartDelay(), e);
                        if (awaitStop(props.getRestartDelay())) break;
                    } catch (Error e) {
                        // not restarted: the loop stays down and health reports it
                        lastError = e.getClass().getSimpleName() + ": " + e.getMessage();
                        log.error("worker.died worker={}", worker.name(), e);
                        throw e;
                    }
                }
            } finally {
                alive = false;
                exited.countDown();
                log.info("worker.exited worker={} iterations={} restarts={}",
                        worker.name(), iterations.get(), restarts.get());
            }
        }

        private void startWorker() {
            try {
                worker.onStart();
            } catch (RuntimeException e) {
                lastError = e.getClass().getSimpleName() + ": " + e.getMessage();
                log.error("worker.start.failed worker={}", worker.name(), e);
            }
        }

        boolean isAlive() {
            return alive;
        }

        WorkerState snapshot() {
            return new WorkerState(worker.name(), alive, iterations.get(), restarts.get(), lastSuccessAt, lastError);
        }
    }
}
