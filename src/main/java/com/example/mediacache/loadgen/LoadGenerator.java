package com.example.mediacache.loadgen;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives {@code POST /fetch} on a running instance.
 * Usage: java LoadGenerator <scenario> [durationSeconds] [threads] [universe] [alpha] [scanRatio]
 * Scenarios: ZIPF (popularity-skewed videos in mixed URL shapes), STAMPEDE (every thread on one video).
 */
public class LoadGenerator {

    private static final HttpClient client = HttpClient.newHttpClient();
    private static final String BASE_URL = System.getProperty("loadgen.baseUrl", "http://localhost:8080");

    public static void main(String[] args) throws Exception {
        if (args.length < 1) {
            System.out.println("Usage: java LoadGenerator <ZIPF|STAMPEDE> [durationSeconds] [threads] [universe] [alpha] [scanRatio]");
            return;
        }

        String scenario = args[0];
        int duration = args.length > 1 ? Integer.parseInt(args[1]) : 60;
        int threads = args.length > 2 ? Integer.parseInt(args[2]) : 50;

        System.out.println("Starting scenario: " + scenario + " duration: " + duration + "s threads: " + threads);

        switch (scenario) {
            case "ZIPF":
                int universe = args.length > 3 ? Integer.parseInt(args[3]) : 10_000;
                double alpha = args.length > 4 ? Double.parseDouble(args[4]) : 0.9;
                double scanRatio = args.length > 5 ? Double.parseDouble(args[5]) : 0.0;
                run(duration, threads, new LocatorWorkload(universe, alpha, scanRatio, System.nanoTime()));
                break;
            case "STAMPEDE":
                // universe of one: every request is the same video, rendered in varying shapes
                run(duration, threads, new LocatorWorkload(1, 1.0, 0.0, System.nanoTime()));
                break;
            default:
                System.out.println("Unknown scenario: " + scenario);
        }
    }

    private static void run(int durationSeconds, int threads, LocatorWorkload workload) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        AtomicLong requestCount = new AtomicLong();
        AtomicLong failures = new AtomicLong();
        ConcurrentLinkedQueue<Double> latencies = new ConcurrentLinkedQueue<>();
        long endTime = System.currentTimeMillis() + durationSeconds * 1000L;

        for (int i = 0; i < threads; i++) {
            String userAgent = "loadgen/" + i;
            executor.submit(() -> {
                while (System.currentTimeMillis() < endTime) {
                    try {
                        long start = System.nanoTime();
                        int status = sendFetch(workload.next(), userAgent);
                        latencies.add((System.nanoTime() - start) / 1_000_000.0);
                        requestCount.incrementAndGet();
                        if (status != 200) {
                            failures.incrementAndGet();
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    } catch (Exception e) {
                        failures.incrementAndGet();
                    }
                }
            });
        }

        executor.shutdown();
        executor.awaitTermination(durationSeconds + 30L, TimeUnit.SECONDS);

        DescriptiveStatistics stats = new DescriptiveStatistics();
        latencies.forEach(stats::addValue);

        System.out.println(String.format("Finished. Requests=%d, Failures=%d, RPS=%.1f",
            requestCount.get(), failures.get(), requestCount.get() / (double) durationSeconds));
        System.out.println(String.format("Latency Avg=%.2fms, P95=%.2fms, P99=%.2fms, Max=%.2fms",
            stats.getMean(), stats.getPercentile(95), stats.getPercentile(99), stats.getMax()));
        System.out.println("Server stats: " + sendGet("/cache/stats"));
    }

    private static int sendFetch(String locator, String userAgent) throws Exception {
        String body = "{\"url\":\"" + locator.replace("\"", "\\\"") + "\"}";
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(BASE_URL + "/fetch"))
            .header("Content-Type", "application/json")
            .header("User-Agent", userAgent)
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        return client.send(request, HttpResponse.BodyHandlers.discarding()).statusCode();
    }

    private static String sendGet(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(BASE_URL + path))
            .GET()
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString()).body();
    }
}
