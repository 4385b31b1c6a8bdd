package org.postevent.lookup;

import org.postevent.cdp.Tab;
import org.postevent.lookup.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.regex.Pattern;

/**
 * Runs every configured extractor against a query at the same time, each in a tab of its own, and
 * collects one {@link SourceResult} per extractor. A failing source never affects the others.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 *
 * try (var browser = BrowserProcess.startHeadless(null, null);
 *      var lookup = new Lookup(extractors, browser::newTab, 3)) {
 *     LookupResult result = lookup.run("8.8.8.8");
 * }
 * }</pre>
 */
public class Lookup implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Lookup.class);
    private static final Pattern IPV4 = Pattern.compile(
            "^(?:(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\.){3}(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)$");
    private final List<Extractor> extractors;
    private final TabOpener tabOpener;
    private final ExecutorService executor;

    public Lookup(List<Extractor> extractors, TabOpener tabOpener, int workers) {
        if (extractors.isEmpty()) throw new IllegalArgumentException("No extractors configured");
        if (workers < 1) throw new IllegalArgumentException("workers must be at least 1: " + workers);
        this.extractors = List.copyOf(extractors);
        this.tabOpener = tabOpener;
        this.executor = Executors.newFixedThreadPool(workers, new NamedThreadFactory("lookup"));
    }

    public static boolean isValidIpv4(String query) {
        return query != null && IPV4.matcher(query).matches();
    }

    /**
     * Looks up an IPv4 address in every source.
     *
     * @throws IllegalArgumentException if {@code query} is not a dotted-quad IPv4 address
     */
    public LookupResult run(String query) throws InterruptedException {
        if (!isValidIpv4(query)) {
            throw new IllegalArgumentException("Please enter a valid IPv4 address: " + query);
        }
        log.info("Starting lookup for {}", query);
        long start = System.nanoTime();
        var futures = new ArrayList<Future<SourceResult>>(extractors.size());
        for (var extractor : extractors) {
            futures.add(executor.submit(() -> runSource(extractor, query)));
        }
        var results = new ArrayList<SourceResult>(extractors.size());
        try {
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    // runSource catches everything, this is an Error escaping an extractor
                    results.add(SourceResult.failure(extractors.get(i), e.getCause(), Duration.ZERO));
                }
            }
        } catch (InterruptedException e) {
            futures.forEach(future -> future.cancel(true));
            throw e;
        }
        var elapsed = Duration.ofNanos(System.nanoTime() - start);
        var result = new LookupResult(query, List.copyOf(results), elapsed);
        log.info("Lookup for {} complete in {} ms: {} of {} sources succeeded", query, elapsed.toMillis(),
                result.successCount(), results.size());
        return result;
    }

    private SourceResult runSource(Extractor extractor, String query) {
        long start = System.nanoTime();
        try (Tab tab = tabOpener.open()) {
            var data = extractor.extract(tab, query);
            log.debug("{} finished in {} ms", extractor.displayName(), (System.nanoTime() - start) / 1_000_000);
            return SourceResult.success(extractor, data, Duration.ofNanos(System.nanoTime() - start));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SourceResult.failure(extractor, e, Duration.ofNanos(System.nanoTime() - start));
        } catch (Exception e) {
            log.warn("{} lookup failed: {}", extractor.displayName(), e.toString());
            log.debug("{} lookup failure", extractor.displayName(), e);
            return SourceResult.failure(extractor, e, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
