package com.example.preload.backend;

import com.example.preload.core.Assembler;
import com.example.preload.core.AssemblyException;
import com.example.preload.core.CancellationSignal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Simulated remote backend that assembles {@link TaskDetail}s slowly and can be told to fail a share of
 * requests.
 */
@Component
public class TaskDetailBackend implements Assembler<String, TaskDetail> {

    private static final long POLL_MILLIS = 10;

    private final AtomicLong requestCount = new AtomicLong();
    private volatile long latencyMillis;
    private volatile double failureRatio;

    public TaskDetailBackend(
        @Value("${preload.backend.latency:500ms}") Duration latency,
        @Value("${preload.backend.failure-ratio:0.0}") double failureRatio
    ) {
        setLatencyMillis(latency.toMillis());
        setFailureRatio(failureRatio);
    }

    @Override
    public TaskDetail assemble(String taskId, CancellationSignal signal) throws AssemblyException {
        requestCount.incrementAndGet();
        awaitLatency(signal);
        if (failureRatio > 0 && ThreadLocalRandom.current().nextDouble() < failureRatio) {
            throw new AssemblyException("backend unavailable");
        }
        int minutes = 15 + Math.floorMod(taskId.hashCode(), 8) * 5;
        return new TaskDetail(
            taskId,
            "Break " + taskId + " into focused " + minutes / 3 + "-minute blocks",
            minutes,
            List.of("guide-" + taskId, "video-" + taskId)
        );
    }

    // Sleeps in short steps so a cancelled load stops early.
    private void awaitLatency(CancellationSignal signal) {
        long deadline = System.currentTimeMillis() + latencyMillis;
        try {
            long remaining;
            while ((remaining = deadline - System.currentTimeMillis()) > 0) {
                if (signal.isCancelled()) {
                    throw new CancellationException("assembly cancelled");
                }
                Thread.sleep(Math.min(remaining, POLL_MILLIS));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("assembly interrupted");
        }
    }

    public void setLatencyMillis(long ms) {
        if (ms < 0) {
            throw new IllegalArgumentException("latency must not be negative, got: " + ms);
        }
        this.latencyMillis = ms;
    }

    public void setFailureRatio(double ratio) {
        if (ratio < 0.0 || ratio > 1.0) {
            throw new IllegalArgumentException("failureRatio must be within [0, 1], got: " + ratio);
        }
        this.failureRatio = ratio;
    }

    public long getLatencyMillis() {
        return latencyMillis;
    }

    public double getFailureRatio() {
        return failureRatio;
    }

    public long getRequestCount() {
        return requestCount.get();
    }

    public void resetCount() {
        requestCount.set(0);
    }
}
