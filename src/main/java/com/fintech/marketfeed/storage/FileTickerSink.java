package com.fintech.marketfeed.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.marketfeed.config.FeedConfiguration;
import com.fintech.marketfeed.domain.Ticker;
import com.fintech.marketfeed.error.PersistenceException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Flat-file ticker sink: {@code {source}_ticker.csv} and {@code {source}_ticker.json}
 * in the persistence directory, one file per enabled format.
 *
 * Every destination path has its own lock, held for the whole read-modify-write
 * and released in a finally block. A failed write is logged at WARN; once the
 * same destination has failed {@code escalationThreshold} times in a row the
 * log level becomes ERROR until a write succeeds again.
 */
public class FileTickerSink implements TickerSink {

    private static final Logger log = LoggerFactory.getLogger(FileTickerSink.class);

    private final Path directory;
    private final List<TickerFileWriter> writers;
    private final int escalationThreshold;

    private final Map<Path, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Map<Path, AtomicInteger> consecutiveFailures = new ConcurrentHashMap<>();

    private final Map<PersistenceFormat, Counter> failureCounters = new EnumMap<>(PersistenceFormat.class);
    private final AtomicLong recordsWritten = new AtomicLong(0);

    public FileTickerSink(FeedConfiguration.PersistenceSettings settings, ObjectMapper mapper, MeterRegistry meterRegistry) {
        this.directory = settings.directory();
        this.escalationThreshold = settings.escalationThreshold();

        List<TickerFileWriter> enabled = new ArrayList<>();
        if (settings.formats().contains(PersistenceFormat.CSV)) {
            enabled.add(new CsvTickerWriter());
        }
        if (settings.formats().contains(PersistenceFormat.JSON)) {
            enabled.add(new JsonTickerWriter(mapper));
        }
        this.writers = List.copyOf(enabled);

        for (TickerFileWriter writer : writers) {
            failureCounters.put(writer.format(), Counter.builder("marketfeed.persistence.failures")
                .tag("format", writer.format().name().toLowerCase())
                .description("Failed ticker file writes")
                .register(meterRegistry));
        }
        meterRegistry.gauge("marketfeed.persistence.writes", recordsWritten);
    }

    @Override
    public void reset(String source) {
        ensureDirectory();
        PersistenceException failure = null;
        for (TickerFileWriter writer : writers) {
            Path file = destination(source, writer.format());
            try {
                withLock(file, () -> writer.reset(file));
                succeeded(file);
                log.info("Reset {}", file);
            } catch (IOException e) {
                failure = accumulate(failure, failed(file, writer.format(), "reset", e));
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public void appendTicker(Ticker ticker) {
        ensureDirectory();
        PersistenceException failure = null;
        for (TickerFileWriter writer : writers) {
            Path file = destination(ticker.source(), writer.format());
            try {
                withLock(file, () -> writer.append(file, ticker));
                succeeded(file);
            } catch (IOException e) {
                failure = accumulate(failure, failed(file, writer.format(), "append", e));
            }
        }
        if (failure != null) {
            throw failure;
        }
        recordsWritten.incrementAndGet();
        if (log.isDebugEnabled()) {
            log.debug("Persisted {} {} last={}", ticker.source(), ticker.symbol(), ticker.last());
        }
    }

    /** Destination file for a source and format. */
    public Path destination(String source, PersistenceFormat format) {
        return directory.resolve(format.fileName(source));
    }

    /** Consecutive failed writes for a destination since its last successful write. */
    public int consecutiveFailures(Path file) {
        AtomicInteger count = consecutiveFailures.get(file);
        return count == null ? 0 : count.get();
    }

    public long getRecordsWritten() {
        return recordsWritten.get();
    }

    private void withLock(Path file, FileOperation operation) throws IOException {
        ReentrantLock lock = locks.computeIfAbsent(file, p -> new ReentrantLock());
        lock.lock();
        try {
            operation.run();
        } finally {
            lock.unlock();
        }
    }

    private void ensureDirectory() {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            log.error("Cannot create persistence directory {}", directory, e);
            throw new PersistenceException(directory, "Cannot create persistence directory " + directory, e);
        }
    }

    private void succeeded(Path file) {
        AtomicInteger count = consecutiveFailures.get(file);
        if (count != null && count.getAndSet(0) > 0) {
            log.info("Writes to {} recovered", file);
        }
    }

    private PersistenceException failed(Path file, PersistenceFormat format, String operation, IOException cause) {
        failureCounters.get(format).increment();
        int failures = consecutiveFailures.computeIfAbsent(file, p -> new AtomicInteger()).incrementAndGet();
        if (failures >= escalationThreshold) {
            log.error("Persistence {} to {} failed {} times in a row: {}", operation, file, failures, cause.getMessage(), cause);
        } else {
            log.warn("Persistence {} to {} failed ({} consecutive): {}", operation, file, failures, cause.getMessage());
        }
        return new PersistenceException(file, "Failed to " + operation + " " + file, cause);
    }

    private static PersistenceException accumulate(PersistenceException first, PersistenceException next) {
        if (first == null) {
            return next;
        }
        first.addSuppressed(next);
        return first;
    }

    @FunctionalInterface
    private interface FileOperation {
        void run() throws IOException;
    }
}
