package com.fintech.marketfeed.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fintech.marketfeed.domain.Ticker;
import com.fintech.marketfeed.util.TimestampConverter;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * One JSON array per file. Every append reads the array, adds the record and
 * rewrites the whole file through a sibling temp file and a rename, so readers
 * never observe a half-written array.
 */
class JsonTickerWriter implements TickerFileWriter {

    private final ObjectMapper mapper;

    JsonTickerWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public PersistenceFormat format() {
        return PersistenceFormat.JSON;
    }

    @Override
    public void reset(Path file) throws IOException {
        replace(file, mapper.createArrayNode());
    }

    @Override
    public void append(Path file, Ticker ticker) throws IOException {
        ArrayNode records = read(file);

        ObjectNode record = records.addObject();
        record.put("timestamp", TimestampConverter.format(ticker.timestamp()));
        record.put("exchange", ticker.source());
        record.put("symbol", ticker.symbol());
        if (ticker.last() == null) {
            record.putNull("price");
        } else {
            record.put("price", ticker.last().toPlainString());
        }

        replace(file, records);
    }

    private ArrayNode read(Path file) throws IOException {
        if (!Files.exists(file) || Files.size(file) == 0) {
            return mapper.createArrayNode();
        }
        JsonNode existing = mapper.readTree(file.toFile());
        if (existing == null || existing.isMissingNode()) {
            return mapper.createArrayNode();
        }
        if (!existing.isArray()) {
            throw new IOException(file + " does not contain a JSON array");
        }
        return (ArrayNode) existing;
    }

    private void replace(Path file, ArrayNode content) throws IOException {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), content);
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
