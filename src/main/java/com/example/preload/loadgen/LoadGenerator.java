package com.example.preload.loadgen;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simulates users scrolling a task list against a running service: each step preloads the visible rows,
 * pauses as a reader would, then opens one of them.
 *
 * <p>Usage: {@code LoadGenerator [durationSeconds] [users] [totalTasks] [visibleRows] [alpha] [dwellMillis]}
 */
public class LoadGenerator {

    private static final Logger log = LoggerFactory.getLogger(LoadGenerator.class);

    private static final HttpClient client = HttpClient.newHttpClient();
    private static final String BASE_URL = System.getProperty("preload.baseUrl", "http://localhost:8080");

    public static void main(String[] args) throws Exception {
        int duration = args.length > 0 ? Integer.parseInt(args[0]) : 60;
        int users = args.length > 1 ? Integer.parseInt(args[1]) : 20;
        int totalTasks = args.length > 2 ? Integer.parseInt(args[2]) : 500;
        int visibleRows = args.length > 3 ? Integer.parseInt(args[3]) : 8;
        double alpha = args.length > 4 ? Double.parseDouble(args[4]) : 1.1;
        long dwellMillis = args.length > 5 ? Long.parseLong(args[5]) : 300;

        runScrollScenario(duration, users, totalTasks, visibleRows, alpha, dwellMillis);
    }

    static void runScrollScenario(int durationSeconds, int users, int totalTasks, int visibleRows,
                                  double alpha, long dwellMillis) throws Exception {
        log.info("Scroll scenario: users={}, tasks={}, visibleRows={}, alpha={}, dwell={}ms, duration={}s",
            users, totalTasks, visibleRows, alpha, dwellMillis, durationSeconds);

        ExecutorService executor = Executors.newFixedThreadPool(users);
        AtomicLong opens = new AtomicLong();
        AtomicLong readyOpens = new AtomicLong();
        ConcurrentLinkedQueue<Double> openLatencies = new ConcurrentLinkedQueue<>();
        long endTime = System.currentTimeMillis() + durationSeconds * 1000L;

        for (int i = 0; i < users; i++) {
            executor.submit(() -> {
                ScrollWindow window = new ScrollWindow(totalTasks, visibleRows, alpha);
                while (System.currentTimeMillis() < endTime) {
                    List<String> visible = window.nextVisible();
                    String opened = visible.get(ThreadLocalRandom.current().nextInt(visible.size()));
                    try {
                        send("/preload?ids=" + String.join(",", visible));
                        Thread.sleep(dwellMillis);

                        long start = System.currentTimeMillis();
                        String body = send("/task?id=" + opened);
                        openLatencies.add((double) (System.currentTimeMillis() - start));
                        opens.incrementAndGet();
                        if (body.contains("\"ready\":true")) {
                            readyOpens.incrementAndGet();
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    } catch (Exception e) {
                        log.warn("Request failed: {}", e.getMessage());
                    }
                }
            });
        }

        executor.shutdown();
        executor.awaitTermination(durationSeconds + 10L, TimeUnit.SECONDS);

        DescriptiveStatistics stats = new DescriptiveStatistics();
        openLatencies.forEach(stats::addValue);
        double readyRatio = opens.get() == 0 ? 0.0 : readyOpens.get() / (double) opens.get();
        log.info(String.format("Scroll scenario finished. Opens=%d, ReadyOnOpen=%.1f%%, P50=%.2fms, P99=%.2fms, Max=%.2fms",
            opens.get(), readyRatio * 100, stats.getPercentile(50), stats.getPercentile(99), stats.getMax()));
        log.info("Server stats: {}", send("/stats"));
    }

    private static String send(String pathAndQuery) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(BASE_URL + pathAndQuery))
            .GET()
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString()).body();
    }
}
