package com.dumpstermap.cleaner;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tests for concurrent website validation against an instrumented fake transport.
 */
public class WebsiteValidatorTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    /**
     * Fake transport recording peak concurrency. Hosts starting with "timeout", "refused" or "boom" fail;
     * hosts starting with "missing" answer 404; everything else answers 200.
     */
    static final class FakeTransport implements WebsiteProbeTransport {
        final AtomicInteger active = new AtomicInteger();
        final AtomicInteger maxActive = new AtomicInteger();
        final Queue<URI> probed = new ConcurrentLinkedQueue<>();
        final long delayMillis;
        final CountDownLatch gate;

        FakeTransport(long delayMillis) {
            this(delayMillis, null);
        }

        FakeTransport(long delayMillis, CountDownLatch gate) {
            this.delayMillis = delayMillis;
            this.gate = gate;
        }

        @Override
        public ProbeResponse probe(URI uri, Duration timeout) throws IOException, InterruptedException {
            int now = active.incrementAndGet();
            maxActive.accumulateAndGet(now, Math::max);
            probed.add(uri);
            try {
                if (gate != null) gate.await(5, TimeUnit.SECONDS);
                if (delayMillis > 0) Thread.sleep(delayMillis);
                String host = uri.getHost();
                if (host.startsWith("timeout")) throw new HttpTimeoutException("request timed out");
                if (host.startsWith("refused")) throw new ConnectException("Connection refused");
                if (host.startsWith("boom")) throw new IllegalStateException("transport bug");
                if (host.startsWith("missing")) return new ProbeResponse(404, uri);
                return new ProbeResponse(200, uri.resolve("/home"));
            } finally {
                active.decrementAndGet();
            }
        }
    }

    private static List<Listing> withWebsites(int count) {
        List<Listing> listings = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            listings.add(ListingFixtures.provider("Provider " + i, null, null, "https://site" + i + ".com/").listing());
        }
        return listings;
    }

    @Test
    void testConcurrencyBoundWithDefaultPool() throws InterruptedException {
        FakeTransport transport = new FakeTransport(20);
        WebsiteValidator validator = new WebsiteValidator(transport, 4, TIMEOUT);

        List<Listing> result = validator.validateAll(withWebsites(40));

        assertEquals(40, result.size());
        assertEquals(40, transport.probed.size());
        assertTrue(transport.maxActive.get() <= 4, "peak " + transport.maxActive.get());
        assertTrue(result.stream().allMatch(l -> l.websiteCheck().reachable()));
    }

    @Test
    void testConcurrencyBoundWithLargerInjectedExecutor() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(32);
        try {
            FakeTransport transport = new FakeTransport(20);
            WebsiteValidator validator = new WebsiteValidator(transport, 3, TIMEOUT, pool);

            validator.validateAll(withWebsites(60));

            assertTrue(transport.maxActive.get() <= 3, "peak " + transport.maxActive.get());
            assertEquals(60, transport.probed.size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testListingsWithoutWebsitePassThrough() throws InterruptedException {
        FakeTransport transport = new FakeTransport(0);
        WebsiteValidator validator = new WebsiteValidator(transport, 2, TIMEOUT);
        Listing noSite = ListingFixtures.record("No Site").with("phone", "555-111-2222").listing();
        Listing blankSite = ListingFixtures.record("Blank Site").with("website", "  ").listing();
        Listing site = ListingFixtures.record("Site").with("website", "acme.com").listing();

        ValidationRun run = validator.start(List.of(noSite, site, blankSite));
        List<Listing> result = run.await();

        assertEquals(1, run.total());
        assertEquals(List.of("No Site", "Site", "Blank Site"), result.stream().map(Listing::name).toList());
        assertSame(noSite, result.get(0));
        assertNull(result.get(2).websiteCheck());
        assertNotNull(result.get(1).websiteCheck());
        assertEquals(1, transport.probed.size());
    }

    @Test
    void testSchemeIsAddedWhenMissing() throws InterruptedException {
        FakeTransport transport = new FakeTransport(0);
        WebsiteValidator validator = new WebsiteValidator(transport, 1, TIMEOUT);
        Listing listing = ListingFixtures.record("Acme").with("website", "www.acme.com").listing();

        WebsiteCheck check = validator.validateAll(List.of(listing)).get(0).websiteCheck();

        assertEquals(URI.create("https://www.acme.com"), transport.probed.peek());
        assertEquals("https://www.acme.com", check.url());
        assertEquals("200", check.status());
        assertEquals("https://www.acme.com/home", check.finalUrl());
        assertEquals("reachable", check.verdict());
    }

    @Test
    void testFailuresAreIsolatedPerListing() throws InterruptedException {
        FakeTransport transport = new FakeTransport(5);
        WebsiteValidator validator = new WebsiteValidator(transport, 5, TIMEOUT);
        List<Listing> listings = List.of(
            ListingFixtures.record("ok").with("website", "http://ok.com").listing(),
            ListingFixtures.record("slow").with("website", "timeout.com").listing(),
            ListingFixtures.record("down").with("website", "refused.com").listing(),
            ListingFixtures.record("bug").with("website", "boom.com").listing(),
            ListingFixtures.record("gone").with("website", "missing.com").listing());

        List<Listing> result = validator.validateAll(listings);

        assertEquals("reachable", result.get(0).websiteCheck().verdict());
        assertEquals("unreachable:timeout", result.get(1).websiteCheck().verdict());
        assertEquals("unreachable:ConnectException", result.get(2).websiteCheck().verdict());
        assertEquals("unreachable:IllegalStateException", result.get(3).websiteCheck().verdict());
        assertEquals("unreachable:404", result.get(4).websiteCheck().verdict());
        assertNull(result.get(1).websiteCheck().finalUrl());
        assertEquals(5, transport.probed.size());
    }

    @Test
    void testProgressIsObservableWhileRunning() throws InterruptedException {
        CountDownLatch gate = new CountDownLatch(1);
        FakeTransport transport = new FakeTransport(0, gate);
        WebsiteValidator validator = new WebsiteValidator(transport, 2, TIMEOUT);

        ValidationRun run = validator.start(withWebsites(6));

        assertFalse(run.isDone());
        assertEquals(0, run.completed());
        assertEquals(6, run.total());
        gate.countDown();
        run.await();
        assertTrue(run.isDone());
        assertEquals(6, run.completed());
    }

    @Test
    void testSlowTransportIsCutOffAtTimeout() throws InterruptedException {
        WebsiteProbeTransport slow = (uri, timeout) -> {
            Thread.sleep(1500);
            return new WebsiteProbeTransport.ProbeResponse(200, uri);
        };
        WebsiteValidator validator = new WebsiteValidator(slow, 2, Duration.ofMillis(100));

        long started = System.nanoTime();
        WebsiteCheck check = validator.validateAll(
            List.of(ListingFixtures.record("Slow").with("website", "slow.com").listing())).get(0).websiteCheck();
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000;

        assertEquals("unreachable:timeout", check.verdict());
        assertTrue(elapsedMillis < 1000, "took " + elapsedMillis + "ms");
    }

    @Test
    void testTransportIgnoringInterruptStillTimesOut() throws InterruptedException {
        WebsiteProbeTransport stubborn = (uri, timeout) -> {
            long until = System.nanoTime() + 300_000_000L;
            while (System.nanoTime() < until) {
                Thread.onSpinWait();
            }
            return new WebsiteProbeTransport.ProbeResponse(200, uri);
        };
        WebsiteValidator validator = new WebsiteValidator(stubborn, 1, Duration.ofMillis(50));

        List<Listing> result = validator.validateAll(List.of(
            ListingFixtures.record("A").with("website", "a.com").listing(),
            ListingFixtures.record("B").with("website", "b.com").listing()));

        assertEquals(WebsiteCheck.TIMEOUT, result.get(0).websiteCheck().status());
        assertEquals(WebsiteCheck.TIMEOUT, result.get(1).websiteCheck().status());
    }

    @Test
    void testTimeoutDoesNotLeakInterruptIntoWorker() throws Exception {
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            WebsiteProbeTransport slow = (uri, timeout) -> {
                Thread.sleep(1000);
                return new WebsiteProbeTransport.ProbeResponse(200, uri);
            };
            WebsiteValidator validator = new WebsiteValidator(slow, 1, Duration.ofMillis(50), single);
            validator.validateAll(List.of(ListingFixtures.record("Slow").with("website", "slow.com").listing()));

            assertFalse(single.submit(() -> Thread.currentThread().isInterrupted()).get(2, TimeUnit.SECONDS));
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    void testFastProbesUnaffectedByDeadline() throws InterruptedException {
        FakeTransport transport = new FakeTransport(10);
        WebsiteValidator validator = new WebsiteValidator(transport, 3, Duration.ofMillis(500));

        List<Listing> result = validator.validateAll(withWebsites(12));

        assertTrue(result.stream().allMatch(l -> l.websiteCheck().reachable()));
        assertTrue(transport.maxActive.get() <= 3);
    }

    @Test
    void testEmptyBatch() throws InterruptedException {
        WebsiteValidator validator = new WebsiteValidator(new FakeTransport(0), 2, TIMEOUT);
        ValidationRun run = validator.start(List.of());
        assertTrue(run.await().isEmpty());
        assertEquals(0, run.total());
    }

    @Test
    void testRejectsInvalidSettings() {
        FakeTransport transport = new FakeTransport(0);
        assertThrows(IllegalArgumentException.class, () -> new WebsiteValidator(null, 1, TIMEOUT));
        assertThrows(IllegalArgumentException.class, () -> new WebsiteValidator(transport, 0, TIMEOUT));
        assertThrows(IllegalArgumentException.class, () -> new WebsiteValidator(transport, 1, Duration.ZERO));
    }
}
