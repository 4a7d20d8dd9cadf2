package com.fintech.marketfeed.domain;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One order book level, serialized as a two-element {@code [price, size]} array.
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
public record PriceLevel(BigDecimal price, BigDecimal size) {

    public PriceLevel {
        Objects.requireNonNull(price, "Price cannot be null");
        Objects.requireNonNull(size, "Size cannot be null");
    }
}
