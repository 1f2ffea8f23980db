/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.recall.memory.pipeline;

import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs pipeline jobs in the background off a bounded queue.
 * <p>
 * Jobs for the same session never run concurrently. A job that arrives while its session is being processed is
 * parked and run once the current one is done. Several parked jobs for a session collapse into one, as every run
 * picks up all events after the watermark anyway.
 */
@Slf4j
public class PipelineWorker implements AutoCloseable {
    private static final Duration POLL_INTERVAL = Duration.ofMillis(100);
    private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private final MemoryGenerationPipeline pipeline;
    private final BlockingQueue<PipelineJob> queue;
    private final ExecutorService executorService;
    private final int threads;
    private final Duration shutdownTimeout;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final Object bookkeeping = new Object();
    private final Set<String> inFlight = new HashSet<>();
    private final Map<String, PipelineJob> deferred = new HashMap<>();

    @Builder
    public PipelineWorker(
            @NonNull MemoryGenerationPipeline pipeline,
            PipelineSetup setup,
            ExecutorService executorService,
            Duration shutdownTimeout,
            Clock clock) {
        final var pipelineSetup = Objects.requireNonNullElse(setup, PipelineSetup.DEFAULT);
        this.pipeline = pipeline;
        this.threads = pipelineSetup.getWorkerThreads();
        this.queue = new ArrayBlockingQueue<>(pipelineSetup.getQueueCapacity());
        this.executorService = Objects.requireNonNullElseGet(executorService,
                                                             () -> Executors.newFixedThreadPool(threads));
        this.shutdownTimeout = Objects.requireNonNullElse(shutdownTimeout, DEFAULT_SHUTDOWN_TIMEOUT);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
    }

    public PipelineWorker start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Pipeline worker already running");
            return this;
        }
        for (int i = 0; i < threads; i++) {
            executorService.submit(this::drain);
        }
        log.info("Pipeline worker started with {} threads", threads);
        return this;
    }

    /**
     * Queues a job without waiting for it.
     *
     * @return false if the worker is not running or the queue is full
     */
    public boolean submit(@NonNull PipelineJob job) {
        if (!running.get()) {
            log.warn("Pipeline worker is not running. Dropping {} job for session {}",
                     job.getTrigger(), job.getSessionId());
            return false;
        }
        final var queued = job.getEnqueuedAt() == null
                           ? PipelineJob.builder()
                                   .sessionId(job.getSessionId())
                                   .namespace(job.getNamespace())
                                   .trigger(job.getTrigger())
                                   .gateNumber(job.getGateNumber())
                                   .enqueuedAt(clock.instant())
                                   .build()
                           : job;
        if (!queue.offer(queued)) {
            log.warn("Pipeline queue is full. Dropping {} job for session {}. It will be covered by the next "
                             + "trigger for the session", job.getTrigger(), job.getSessionId());
            return false;
        }
        log.debug("Queued {} job for session {}", job.getTrigger(), job.getSessionId());
        return true;
    }

    public int pendingJobs() {
        return queue.size();
    }

    public PipelineStats.Snapshot stats() {
        return pipeline.getStats().snapshot();
    }

    /**
     * Stops taking jobs, lets queued ones finish within the shutdown timeout and stops the threads
     */
    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping pipeline worker with {} pending jobs", queue.size());
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Pipeline worker did not stop in {}. {} jobs abandoned", shutdownTimeout, queue.size());
                executorService.shutdownNow();
            }
        }
        catch (InterruptedException e) {
            log.warn("Interrupted while stopping pipeline worker");
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void drain() {
        while (running.get() || !queue.isEmpty()) {
            final PipelineJob job;
            try {
                job = queue.poll(POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
            }
            catch (InterruptedException e) {
                log.info("Pipeline worker thread interrupted, exiting");
                Thread.currentThread().interrupt();
                return;
            }
            if (job != null) {
                handle(job);
            }
        }
    }

    private void handle(PipelineJob job) {
        final var sessionId = job.getSessionId();
        synchronized (bookkeeping) {
            if (!inFlight.add(sessionId)) {
                deferred.put(sessionId, job);
                log.debug("Session {} is being processed. Deferring {} job", sessionId, job.getTrigger());
                return;
            }
        }
        var current = job;
        while (current != null) {
            try {
                pipeline.process(current);
            }
            catch (RuntimeException e) {
                log.error("Unexpected error running {} job for session {}", current.getTrigger(), sessionId, e);
            }
            synchronized (bookkeeping) {
                current = deferred.remove(sessionId);
                if (current == null) {
                    inFlight.remove(sessionId);
                }
            }
        }
    }
}
