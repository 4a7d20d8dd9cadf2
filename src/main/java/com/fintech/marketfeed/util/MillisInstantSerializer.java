package com.fintech.marketfeed.util;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.time.Instant;

/**
 * Writes instants as {@code yyyy-MM-ddTHH:mm:ss.SSSZ}, keeping a zero millisecond
 * fraction that the default ISO_INSTANT rendering drops.
 */
public class MillisInstantSerializer extends StdSerializer<Instant> {

    public MillisInstantSerializer() {
        super(Instant.class);
    }

    @Override
    public void serialize(Instant value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeString(TimestampConverter.format(value));
    }
}
