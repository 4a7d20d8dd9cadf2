package com.fintech.marketfeed.storage;

import com.fintech.marketfeed.domain.Ticker;
import com.fintech.marketfeed.util.TimestampConverter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * {@code timestamp,exchange,symbol,price} rows with standard CSV quoting.
 * The header is written whenever the file is missing or empty.
 */
class CsvTickerWriter implements TickerFileWriter {

    static final String HEADER = "timestamp,exchange,symbol,price";
    private static final String LINE_END = "\n";

    @Override
    public PersistenceFormat format() {
        return PersistenceFormat.CSV;
    }

    @Override
    public void reset(Path file) throws IOException {
        Files.writeString(file, HEADER + LINE_END, StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    }

    @Override
    public void append(Path file, Ticker ticker) throws IOException {
        boolean needsHeader = !Files.exists(file) || Files.size(file) == 0;
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE)) {
            StringBuilder out = new StringBuilder();
            if (needsHeader) {
                out.append(HEADER).append(LINE_END);
            }
            out.append(row(ticker)).append(LINE_END);
            writer.write(out.toString());
        }
    }

    static String row(Ticker ticker) {
        return String.join(",",
            escape(TimestampConverter.format(ticker.timestamp())),
            escape(ticker.source()),
            escape(ticker.symbol()),
            ticker.last() == null ? "" : escape(ticker.last().toPlainString()));
    }

    /** RFC 4180: quote fields containing a delimiter, quote or line break; double embedded quotes. */
    static String escape(String value) {
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }
}
