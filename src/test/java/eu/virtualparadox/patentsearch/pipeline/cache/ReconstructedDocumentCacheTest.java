package eu.virtualparadox.patentsearch.pipeline.cache;

import eu.virtualparadox.patentsearch.pipeline.ReconstructedDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReconstructedDocumentCacheTest {

    private final ReconstructedDocumentCache cache = new ReconstructedDocumentCache();

    @Test
    @DisplayName("Concurrent callers for one document share a single reconstruction")
    void testSingleFlight() throws Exception {
        final AtomicInteger reconstructions = new AtomicInteger();
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        final ExecutorService executor = Executors.newFixedThreadPool(8);

        try {
            final List<Future<ReconstructedDocument>> futures = new ArrayList<>();
            futures.add(executor.submit(() -> cache.getOrReconstruct("US1", id -> {
                reconstructions.incrementAndGet();
                started.countDown();
                await(release);
                return document(id);
            })));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            for (int i = 0; i < 7; i++) {
                futures.add(executor.submit(() -> cache.getOrReconstruct("US1", id -> {
                    reconstructions.incrementAndGet();
                    return document(id);
                })));
            }
            release.countDown();

            final ReconstructedDocument first = futures.get(0).get(5, TimeUnit.SECONDS);
            for (final Future<ReconstructedDocument> future : futures) {
                assertThat(future.get(5, TimeUnit.SECONDS)).isSameAs(first);
            }
            assertThat(reconstructions).hasValue(1);
            assertThat(cache.size()).isEqualTo(1);
        }
        finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("A slow reconstruction does not block other documents")
    void testDifferentKeysIndependent() throws Exception {
        final CountDownLatch release = new CountDownLatch(1);
        final ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            final Future<ReconstructedDocument> slow = executor.submit(() -> cache.getOrReconstruct("US1", id -> {
                await(release);
                return document(id);
            }));

            final ReconstructedDocument other = cache.getOrReconstruct("US2", this::document);
            assertThat(other.documentId()).isEqualTo("US2");
            assertThat(slow).isNotDone();

            release.countDown();
            assertThat(slow.get(5, TimeUnit.SECONDS).documentId()).isEqualTo("US1");
        }
        finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Failures are passed on but not cached")
    void testFailureNotCached() {
        assertThatThrownBy(() -> cache.getOrReconstruct("US1", id -> {
            throw new IllegalStateException("broken pdf");
        })).isInstanceOf(IllegalStateException.class).hasMessage("broken pdf");
        assertThat(cache.size()).isZero();

        final ReconstructedDocument document = cache.getOrReconstruct("US1", this::document);
        assertThat(document.documentId()).isEqualTo("US1");
    }

    @Test
    @DisplayName("Waiting callers receive the failure of the in-flight reconstruction")
    void testWaiterSeesFailure() throws Exception {
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        final ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            final Future<ReconstructedDocument> failing = executor.submit(() -> cache.getOrReconstruct("US1", id -> {
                started.countDown();
                await(release);
                throw new IllegalStateException("broken pdf");
            }));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            final Thread releaser = new Thread(() -> {
                sleepQuietly();
                release.countDown();
            });
            releaser.start();

            assertThatThrownBy(() -> cache.getOrReconstruct("US1", this::document))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("broken pdf");
            releaser.join();
            assertThat(failing).failsWithin(5, TimeUnit.SECONDS);
        }
        finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Evicted documents are reconstructed again")
    void testEvict() {
        final AtomicInteger reconstructions = new AtomicInteger();

        cache.getOrReconstruct("US1", id -> {
            reconstructions.incrementAndGet();
            return document(id);
        });
        cache.evict("US1");
        cache.getOrReconstruct("US1", id -> {
            reconstructions.incrementAndGet();
            return document(id);
        });

        assertThat(reconstructions).hasValue(2);
        cache.clear();
        assertThat(cache.size()).isZero();
    }

    private ReconstructedDocument document(final String documentId) {
        return new ReconstructedDocument(documentId, 0, List.of(), List.of());
    }

    private static void await(final CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch not released");
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static void sleepQuietly() {
        try {
            Thread.sleep(200);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
