package com.dumpstermap.cleaner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Concurrent reachability check over the websites of cleaned listings.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Listings without a website pass through untouched and never receive a {@link WebsiteCheck}.</li>
 *   <li>A website lacking an http(s) scheme is probed as {@code https://<website>}.</li>
 *   <li>Every probe holds a permit of a fair semaphore while it is in flight, so at most {@code concurrency}
 *       probes run at once however large the batch or the executor.</li>
 *   <li>Each probe has its own timeout, counted from the moment it holds a permit and enforced here as well as by
 *       the transport: a probe still running at its deadline is interrupted and gets a {@code timeout} verdict.
 *       A timeout, connection error or 4xx/5xx status is the final verdict for that listing only: nothing is
 *       retried and sibling probes are never cancelled.</li>
 *   <li>Progress is observable through {@link ValidationRun#completed()} and logged every {@value #PROGRESS_EVERY} verdicts.</li>
 * </ul>
 * Without an injected executor each run gets its own pool of {@code concurrency} daemon threads, shut down when
 * the run completes.
 *
 * @author DumpsterMap Data Team
 * @since 1.0
 */
public class WebsiteValidator {
    private static final Logger logger = LoggerFactory.getLogger(WebsiteValidator.class);

    static final int PROGRESS_EVERY = 100;

    private static final ScheduledThreadPoolExecutor DEADLINES = new ScheduledThreadPoolExecutor(1, r -> {
        Thread t = new Thread(r, "website-probe-deadline");
        t.setDaemon(true);
        return t;
    });

    static {
        DEADLINES.setRemoveOnCancelPolicy(true);
    }

    private final WebsiteProbeTransport transport;
    private final int concurrency;
    private final Duration timeout;
    private final Executor executor;
    private final Semaphore permits;

    public WebsiteValidator(WebsiteProbeTransport transport, int concurrency, Duration timeout) {
        this(transport, concurrency, timeout, null);
    }

    /**
     * @param transport   network seam
     * @param concurrency maximum number of probes in flight
     * @param timeout     per-probe timeout
     * @param executor    executor owned by the caller, or null for a per-run pool
     */
    public WebsiteValidator(WebsiteProbeTransport transport, int concurrency, Duration timeout, Executor executor) {
        if (transport == null) throw new IllegalArgumentException("transport must not be null");
        if (concurrency <= 0) throw new IllegalArgumentException("concurrency must be positive: " + concurrency);
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        this.transport = transport;
        this.concurrency = concurrency;
        this.timeout = timeout;
        this.executor = executor;
        this.permits = new Semaphore(concurrency, true);
    }

    /**
     * Starts probing and returns immediately.
     * @param listings listings to validate
     * @return handle reporting progress and, on completion, every listing in input order
     */
    public ValidationRun start(List<Listing> listings) {
        List<Listing> input = List.copyOf(listings);
        int total = (int) input.stream().filter(Listing::hasWebsite).count();
        AtomicInteger completed = new AtomicInteger();

        ExecutorService ownPool = executor == null && total > 0
            ? Executors.newFixedThreadPool(Math.min(concurrency, total), probeThreads())
            : null;
        Executor base = ownPool != null ? ownPool : executor;
        Executor exec = base == null ? Runnable::run : new MdcAwareExecutor(base);

        logger.info("Validating {} websites ({} listings without website skipped), concurrency {}",
            total, input.size() - total, concurrency);

        List<CompletableFuture<Listing>> futures = new ArrayList<>(input.size());
        for (Listing listing : input) {
            if (!listing.hasWebsite()) {
                futures.add(CompletableFuture.completedFuture(listing));
                continue;
            }
            futures.add(CompletableFuture
                .supplyAsync(() -> listing.withWebsiteCheck(check(listing.website())), exec)
                .exceptionally(e -> listing.withWebsiteCheck(WebsiteCheck.error(listing.website(), unwrap(e))))
                .whenComplete((r, e) -> reportProgress(completed.incrementAndGet(), total)));
        }

        CompletableFuture<List<Listing>> result = CompletableFuture
            .allOf(futures.toArray(new CompletableFuture<?>[0]))
            .thenApply(v -> futures.stream().map(CompletableFuture::join).toList());
        if (ownPool != null) {
            result.whenComplete((r, e) -> ownPool.shutdown());
        }
        return new ValidationRun(total, completed, result);
    }

    /**
     * Blocking convenience over {@link #start(List)}.
     */
    public List<Listing> validateAll(List<Listing> listings) throws InterruptedException {
        return start(listings).await();
    }

    /**
     * Probes a single website and converts every outcome into a verdict.
     * @param website website as stored on the listing
     * @return verdict, never null
     */
    WebsiteCheck check(String website) {
        if (Utils.isBlank(website)) return WebsiteCheck.noUrl(website);
        String url = website.trim();
        String lower = url.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            url = "https://" + url;
        }
        boolean acquired = false;
        try {
            permits.acquire();
            acquired = true;
            return probeWithDeadline(url);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return WebsiteCheck.error(url, e);
        } finally {
            if (acquired) permits.release();
        }
    }

    /**
     * Runs one transport call under a deadline that starts once the permit is held. When the deadline fires first
     * the worker is interrupted and the verdict is {@code timeout}, whatever the transport eventually returns.
     */
    private WebsiteCheck probeWithDeadline(String url) {
        Deadline deadline = new Deadline(Thread.currentThread());
        ScheduledFuture<?> timer = DEADLINES.schedule(deadline::expire, timeout.toNanos(), TimeUnit.NANOSECONDS);
        WebsiteCheck verdict;
        try {
            WebsiteProbeTransport.ProbeResponse response = transport.probe(URI.create(url), timeout);
            String finalUrl = response.finalUri() == null ? url : response.finalUri().toString();
            verdict = WebsiteCheck.ofStatus(url, response.statusCode(), finalUrl);
        } catch (HttpTimeoutException e) {
            verdict = WebsiteCheck.timeout(url);
        } catch (InterruptedException e) {
            if (!deadline.expired()) Thread.currentThread().interrupt();
            verdict = WebsiteCheck.error(url, e);
        } catch (Exception e) {
            logger.debug("Probe of {} failed: {}", url, e.toString());
            verdict = WebsiteCheck.error(url, e);
        } finally {
            timer.cancel(false);
        }
        if (deadline.finish()) {
            // clear the interrupt raised by the deadline so it never reaches the next task on this thread
            Thread.interrupted();
            verdict = WebsiteCheck.timeout(url);
        }
        if (WebsiteCheck.TIMEOUT.equals(verdict.status())) {
            logger.debug("Timeout probing {}", url);
        }
        return verdict;
    }

    private static Throwable unwrap(Throwable e) {
        return e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
    }

    private static void reportProgress(int done, int total) {
        if (done % PROGRESS_EVERY == 0 || done == total) {
            logger.info("Validated {}/{} websites", done, total);
        }
    }

    /**
     * Interrupt handshake between a probing worker and its deadline timer; at most one side wins.
     */
    private static final class Deadline {
        private final Thread worker;
        private boolean finished;
        private boolean expired;

        Deadline(Thread worker) {
            this.worker = worker;
        }

        synchronized void expire() {
            if (finished) return;
            expired = true;
            worker.interrupt();
        }

        synchronized boolean expired() {
            return expired;
        }

        /** Marks the probe done; returns true when the deadline fired first. */
        synchronized boolean finish() {
            finished = true;
            return expired;
        }
    }

    private static ThreadFactory probeThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "website-probe-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
