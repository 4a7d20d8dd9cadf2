package com.fintech.marketfeed.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Instrument types that can be listed for one exchange, as select options.
 */
@Schema(description = "Instrument types available for an exchange")
public record InstrumentTypesResponse(
    @Schema(description = "Source id", example = "okx")
    String exchange,

    @JsonProperty("instrument_types")
    List<InstrumentType> instrumentTypes
) {

    public static InstrumentTypesResponse of(String exchange, List<String> types) {
        return new InstrumentTypesResponse(exchange, types.stream()
            .map(type -> new InstrumentType(type, label(type)))
            .collect(Collectors.toList()));
    }

    /** "usdm_futures" -> "Usdm Futures" */
    static String label(String type) {
        return Arrays.stream(type.split("_"))
            .filter(word -> !word.isEmpty())
            .map(word -> word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1))
            .collect(Collectors.joining(" "));
    }

    @Schema(description = "One selectable instrument type")
    public record InstrumentType(
        @Schema(description = "Value to pass as instrument_type", example = "swap")
        String value,

        @Schema(description = "Display label", example = "Swap")
        String label
    ) {}
}
