package com.piratebomb.cache.loadgen;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Random;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Drives a running cache server over HTTP and prints latency percentiles.
 * Usage: java LoadGenerator &lt;scenario&gt; [durationSeconds] [scenario args...]
 */
public class LoadGenerator {

    private static final HttpClient client = HttpClient.newHttpClient();
    private static final String BASE_URL = "http://localhost:8080";

    public static void main(String[] args) throws Exception {
        if (args.length < 1) {
            System.out.println("Usage: java LoadGenerator <scenario> [durationSeconds]");
            System.out.println("  A [threads] [players] [alpha]   Zipf-distributed player lookups");
            System.out.println("  B [threads] [identifier]        rate-limit counter hammering");
            System.out.println("  C [threads] [players] [hot] [hotRatio]  hot/cold player lookups");
            return;
        }

        String scenario = args[0];
        int duration = args.length > 1 ? Integer.parseInt(args[1]) : 60;

        System.out.println("Starting Scenario: " + scenario + " Duration: " + duration + "s");

        switch (scenario) {
            case "A":
                int threads = args.length > 2 ? Integer.parseInt(args[2]) : 50;
                int players = args.length > 3 ? Integer.parseInt(args[3]) : 100_000;
                double alpha = args.length > 4 ? Double.parseDouble(args[4]) : 0.9;
                runPlayerLookups(duration, threads, players, alpha);
                break;
            case "B":
                int bThreads = args.length > 2 ? Integer.parseInt(args[2]) : 100;
                String identifier = args.length > 3 ? args[3] : "loadgen-" + System.currentTimeMillis();
                runRateLimitHammer(duration, bThreads, identifier);
                break;
            case "C":
                int cThreads = args.length > 2 ? Integer.parseInt(args[2]) : 200;
                int cPlayers = args.length > 3 ? Integer.parseInt(args[3]) : 100_000;
                int cHot = args.length > 4 ? Integer.parseInt(args[4]) : 1_000;
                double cHotRatio = args.length > 5 ? Double.parseDouble(args[5]) : 0.8;
                runHotColdLookups(duration, cThreads, cPlayers, cHot, cHotRatio);
                break;
            default:
                System.out.println("Unknown scenario: " + scenario);
        }
    }

    // Scenario A: popular players are read far more often than the long tail
    private static void runPlayerLookups(int durationSeconds, int threads, int players, double alpha) throws Exception {
        final ZipfDistribution zipf = new ZipfDistribution(players, alpha);
        ConcurrentLinkedQueue<Double> latencies = new ConcurrentLinkedQueue<>();
        AtomicLong requestCount = new AtomicLong();
        long endTime = System.currentTimeMillis() + durationSeconds * 1000L;

        System.out.println(String.format("Initializing Scenario A (Players=%d, Threads=%d, Alpha=%.2f)...", players, threads, alpha));

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                while (System.currentTimeMillis() < endTime) {
                    String address = playerAddress(zipf.sample());
                    timedRequest(get("/players/" + address), latencies, requestCount);
                }
            });
        }

        executor.shutdown();
        executor.awaitTermination(durationSeconds + 10, TimeUnit.SECONDS);
        report("Scenario A", latencies, requestCount.get(), durationSeconds);
    }

    // Scenario B: many clients counting against one identifier; the final count must equal the request count
    private static void runRateLimitHammer(int durationSeconds, int threads, String identifier) throws Exception {
        ConcurrentLinkedQueue<Double> latencies = new ConcurrentLinkedQueue<>();
        AtomicLong requestCount = new AtomicLong();
        long endTime = System.currentTimeMillis() + durationSeconds * 1000L;

        System.out.println(String.format("Initializing Scenario B (Threads=%d, Identifier=%s)...", threads, identifier));

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                while (System.currentTimeMillis() < endTime) {
                    timedRequest(post("/cache/rate/" + identifier), latencies, requestCount);
                }
            });
        }

        executor.shutdown();
        executor.awaitTermination(durationSeconds + 10, TimeUnit.SECONDS);
        report("Scenario B", latencies, requestCount.get(), durationSeconds);

        HttpResponse<String> last = client.send(post("/cache/rate/" + identifier), HttpResponse.BodyHandlers.ofString());
        System.out.println("Counter after one more request (expect " + (requestCount.get() + 1) + "): " + last.body());
    }

    // Scenario C: a fixed hot set takes most of the traffic
    private static void runHotColdLookups(int durationSeconds, int threads, int players, int hotPlayers, double hotRatio) throws Exception {
        ConcurrentLinkedQueue<Double> latencies = new ConcurrentLinkedQueue<>();
        AtomicLong requestCount = new AtomicLong();
        long endTime = System.currentTimeMillis() + durationSeconds * 1000L;

        System.out.println(String.format("Initializing Scenario C (Threads=%d, Players=%d, Hot=%d, HotRatio=%.2f)...",
            threads, players, hotPlayers, hotRatio));

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                Random rand = new Random();
                while (System.currentTimeMillis() < endTime) {
                    int rank = rand.nextDouble() < hotRatio
                        ? rand.nextInt(hotPlayers)
                        : hotPlayers + rand.nextInt(players - hotPlayers);
                    timedRequest(get("/players/" + playerAddress(rank)), latencies, requestCount);
                }
            });
        }

        executor.shutdown();
        executor.awaitTermination(durationSeconds + 10, TimeUnit.SECONDS);
        report("Scenario C", latencies, requestCount.get(), durationSeconds);
    }

    private static void timedRequest(HttpRequest request, ConcurrentLinkedQueue<Double> latencies, AtomicLong requestCount) {
        try {
            long start = System.currentTimeMillis();
            client.send(request, HttpResponse.BodyHandlers.discarding());
            latencies.add((double) (System.currentTimeMillis() - start));
            requestCount.incrementAndGet();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            System.err.println("Request failed: " + e.getMessage());
        }
    }

    private static void report(String scenario, ConcurrentLinkedQueue<Double> latencies, long requests, int durationSeconds)
        throws Exception {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        latencies.forEach(stats::addValue);

        System.out.println(String.format("%s finished. Requests=%d, RPS=%.1f, Avg=%.2fms, P95=%.2fms, P99=%.2fms, Max=%.2fms",
            scenario, requests, requests / (double) durationSeconds,
            stats.getMean(), stats.getPercentile(95), stats.getPercentile(99), stats.getMax()));

        HttpResponse<String> cacheStats = client.send(get("/cache/stats"), HttpResponse.BodyHandlers.ofString());
        System.out.println("Cache stats: " + cacheStats.body());
    }

    private static String playerAddress(int rank) {
        return String.format("0x%040x", rank);
    }

    private static HttpRequest get(String path) {
        return HttpRequest.newBuilder().uri(URI.create(BASE_URL + path)).GET().build();
    }

    private static HttpRequest post(String path) {
        return HttpRequest.newBuilder().uri(URI.create(BASE_URL + path)).POST(HttpRequest.BodyPublishers.noBody()).build();
    }
}
