package com.fintech.marketfeed.storage;

import com.fintech.marketfeed.domain.Ticker;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Format-specific file operations. Callers hold the destination's write lock.
 */
interface TickerFileWriter {

    PersistenceFormat format();

    void reset(Path file) throws IOException;

    void append(Path file, Ticker ticker) throws IOException;
}
