package de.unibi.cebitec.corpus.sync.ctrl;

import de.unibi.cebitec.corpus.sync.model.FetchTask;
import de.unibi.cebitec.corpus.sync.transfer.ObjectFetcher;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Writes {@code "data:" + key} for every key, except for keys marked as failing. Counts calls per key and the
 * highest number of concurrent fetches.
 */
class StubFetcher implements ObjectFetcher {

    private final Set<String> failingKeys = Collections.synchronizedSet(new HashSet<>());
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger maxActive = new AtomicInteger();
    private final long delayMillis;

    StubFetcher() {
        this(0);
    }

    StubFetcher(long delayMillis) {
        this.delayMillis = delayMillis;
    }

    StubFetcher failing(String key) {
        this.failingKeys.add(key);
        return this;
    }

    @Override
    public long fetch(FetchTask task, Path target) throws IOException {
        this.calls.computeIfAbsent(task.getKey(), k -> new AtomicInteger()).incrementAndGet();
        int now = this.active.incrementAndGet();
        this.maxActive.accumulateAndGet(now, Math::max);
        try {
            if (this.delayMillis > 0) {
                Thread.sleep(this.delayMillis);
            }
            if (this.failingKeys.contains(task.getKey())) {
                throw new IOException("HTTP 500 for " + task.getKey());
            }
            byte[] body = ("data:" + task.getKey()).getBytes(StandardCharsets.UTF_8);
            Files.write(target, body);
            return body.length;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new java.io.InterruptedIOException("interrupted");
        } finally {
            this.active.decrementAndGet();
        }
    }

    int callsFor(String key) {
        AtomicInteger count = this.calls.get(key);
        return count == null ? 0 : count.get();
    }

    int totalCalls() {
        int total = 0;
        for (AtomicInteger count : this.calls.values()) {
            total += count.get();
        }
        return total;
    }

    int getMaxActive() {
        return this.maxActive.get();
    }
}
