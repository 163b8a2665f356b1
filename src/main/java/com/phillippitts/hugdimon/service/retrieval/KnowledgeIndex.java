package com.phillippitts.hugdimon.service.retrieval;

import com.phillippitts.hugdimon.domain.ContextChunk;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Copy-on-write store of {@link ContextChunk}s.
 *
 * <p>Readers take an immutable {@link #snapshot()} and never block. Writers are serialized by a
 * lock, build a new list and publish it through a volatile write, so a reader sees either the
 * whole update or none of it. Adding a chunk whose id is already indexed replaces it. Every
 * publication bumps {@link #version()}.
 */
public class KnowledgeIndex {

    private static final Logger LOG = LogManager.getLogger(KnowledgeIndex.class);

    private final int dimension;
    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile List<ContextChunk> chunks = List.of();
    private final AtomicLong version = new AtomicLong();

    public KnowledgeIndex(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    public int dimension() {
        return dimension;
    }

    /** @return immutable view of the chunks at the time of the call */
    public List<ContextChunk> snapshot() {
        return chunks;
    }

    public int size() {
        return chunks.size();
    }

    /** @return counter that changes whenever the content is republished */
    public long version() {
        return version.get();
    }

    public void add(ContextChunk chunk) {
        addAll(List.of(chunk));
    }

    /**
     * Adds or replaces chunks in one atomic publication.
     *
     * @throws IllegalArgumentException if any chunk's embedding dimension differs from the index
     */
    public void addAll(Collection<ContextChunk> incoming) {
        Objects.requireNonNull(incoming, "incoming");
        incoming.forEach(this::checkDimension);
        writeLock.lock();
        try {
            Map<String, ContextChunk> byId = byId(chunks);
            incoming.forEach(c -> byId.put(c.id(), c));
            publish(List.copyOf(byId.values()));
        } finally {
            writeLock.unlock();
        }
        LOG.debug("Indexed {} chunk(s); index size {}", incoming.size(), chunks.size());
    }

    /** @return true if a chunk with this id was removed */
    public boolean remove(String chunkId) {
        writeLock.lock();
        try {
            Map<String, ContextChunk> byId = byId(chunks);
            if (byId.remove(chunkId) == null) {
                return false;
            }
            publish(List.copyOf(byId.values()));
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    /** Replaces the whole content in one atomic publication. */
    public void replaceAll(Collection<ContextChunk> replacement) {
        Objects.requireNonNull(replacement, "replacement");
        replacement.forEach(this::checkDimension);
        writeLock.lock();
        try {
            publish(List.copyOf(byId(new ArrayList<>(replacement)).values()));
        } finally {
            writeLock.unlock();
        }
        LOG.info("Knowledge index replaced: {} chunk(s)", chunks.size());
    }

    private void publish(List<ContextChunk> next) {
        chunks = next;
        version.incrementAndGet();
    }

    private void checkDimension(ContextChunk chunk) {
        Objects.requireNonNull(chunk, "chunk");
        if (chunk.dimension() != dimension) {
            throw new IllegalArgumentException("Chunk " + chunk.id() + " has dimension " + chunk.dimension()
                    + ", index expects " + dimension);
        }
    }

    private static Map<String, ContextChunk> byId(List<ContextChunk> list) {
        Map<String, ContextChunk> m = new LinkedHashMap<>();
        list.forEach(c -> m.put(c.id(), c));
        return m;
    }
}
