package me.golemcore.narrator.testsupport;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.narrator.port.outbound.StoragePort;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link StoragePort} backed by a map of JSON strings, so values go through
 * the same serialization as on disk.
 */
public class InMemoryStorageAdapter implements StoragePort {

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private final Map<String, String> values = new ConcurrentHashMap<>();
    private final AtomicInteger writes = new AtomicInteger();
    private volatile boolean failing;

    @Override
    public <T> CompletableFuture<T> get(String key, Class<T> type) {
        if (failing) {
            return CompletableFuture.failedFuture(new IllegalStateException("storage unavailable"));
        }
        String json = values.get(key);
        if (json == null) {
            return CompletableFuture.completedFuture(null);
        }
        try {
            return CompletableFuture.completedFuture(objectMapper.readValue(json, type));
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public CompletableFuture<Void> set(String key, Object value) {
        if (failing) {
            return CompletableFuture.failedFuture(new IllegalStateException("storage unavailable"));
        }
        try {
            values.put(key, objectMapper.writeValueAsString(value));
            writes.incrementAndGet();
            return CompletableFuture.completedFuture(null);
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public CompletableFuture<Void> delete(String key) {
        values.remove(key);
        return CompletableFuture.completedFuture(null);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public String raw(String key) {
        return values.get(key);
    }

    public int getWriteCount() {
        return writes.get();
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }
}
