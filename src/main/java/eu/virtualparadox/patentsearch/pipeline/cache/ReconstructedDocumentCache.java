package eu.virtualparadox.patentsearch.pipeline.cache;

import eu.virtualparadox.patentsearch.pipeline.ReconstructedDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Keeps reconstructed documents by document id.
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li>At most one reconstruction runs per document id. Concurrent callers for the same id wait
 *       for the in-flight reconstruction and receive its result, or its exception.</li>
 *   <li>The reconstruction runs on the calling thread and outside of any map lock, so callers
 *       working on different ids never block each other.</li>
 *   <li>Failed reconstructions are not kept; the next call for the id tries again.</li>
 * </ul>
 */
@Component
@Slf4j
public class ReconstructedDocumentCache {

    private final ConcurrentMap<String, CompletableFuture<ReconstructedDocument>> documents = new ConcurrentHashMap<>();

    /**
     * Returns the cached reconstruction of {@code documentId}, running {@code reconstruction} if
     * there is none yet.
     *
     * @param documentId     cache key
     * @param reconstruction computes the document for a key; may throw
     * @return reconstructed document
     */
    public ReconstructedDocument getOrReconstruct(final String documentId,
                                                  final Function<String, ReconstructedDocument> reconstruction) {
        final CompletableFuture<ReconstructedDocument> created = new CompletableFuture<>();
        final CompletableFuture<ReconstructedDocument> existing = documents.putIfAbsent(documentId, created);
        if (existing != null) {
            log.debug("Serving document {} from cache", documentId);
            return await(existing);
        }

        try {
            final ReconstructedDocument document = reconstruction.apply(documentId);
            created.complete(document);
            return document;
        } catch (RuntimeException | Error e) {
            documents.remove(documentId, created);
            created.completeExceptionally(e);
            throw e;
        }
    }

    public void evict(final String documentId) {
        documents.remove(documentId);
    }

    public void clear() {
        documents.clear();
    }

    public int size() {
        return documents.size();
    }

    private static ReconstructedDocument await(final CompletableFuture<ReconstructedDocument> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
