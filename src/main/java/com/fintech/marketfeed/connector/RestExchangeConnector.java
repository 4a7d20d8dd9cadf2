package com.fintech.marketfeed.connector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fintech.marketfeed.error.ConnectorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Base for connectors that poll a vendor's public REST API.
 *
 * Handles the HTTP round trip, error translation to {@link ConnectorException}
 * and the unified symbol format ({@code BASE/QUOTE} for spot,
 * {@code BASE/QUOTE:SETTLE} for derivatives). Subclasses only describe the
 * vendor's endpoints and response shapes.
 */
public abstract class RestExchangeConnector implements ExchangeConnector {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final String sourceId;
    private final RestClient restClient;
    protected final ObjectMapper mapper;

    protected RestExchangeConnector(String sourceId, RestClient restClient, ObjectMapper mapper) {
        this.sourceId = sourceId;
        this.restClient = restClient;
        this.mapper = mapper;
    }

    @Override
    public String sourceId() {
        return sourceId;
    }

    /**
     * GET request against the vendor.
     *
     * @param path path relative to the connector's base URL
     * @param query alternating query parameter names and values; null values are skipped
     */
    protected JsonNode get(String path, Object... query) {
        try {
            String body = restClient.get()
                .uri(builder -> {
                    builder.path(path);
                    for (int i = 0; i + 1 < query.length; i += 2) {
                        if (query[i + 1] != null) {
                            builder.queryParam(String.valueOf(query[i]), query[i + 1]);
                        }
                    }
                    return builder.build();
                })
                .retrieve()
                .body(String.class);

            if (body == null || body.isBlank()) {
                throw new ConnectorException(sourceId, "Empty response from " + sourceId + " " + path);
            }
            return mapper.readTree(body);

        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            throw new ConnectorException(sourceId,
                String.format("%s returned HTTP %d for %s: %s", sourceId, status, path,
                    abbreviate(e.getResponseBodyAsString())),
                isClientStatus(status), e);
        } catch (RestClientException e) {
            throw new ConnectorException(sourceId,
                String.format("Request to %s %s failed: %s", sourceId, path, e.getMessage()), e);
        } catch (JsonProcessingException e) {
            throw new ConnectorException(sourceId, "Malformed JSON from " + sourceId + " " + path, e);
        }
    }

    protected ObjectNode object() {
        return mapper.createObjectNode();
    }

    protected ArrayNode array() {
        return mapper.createArrayNode();
    }

    /** Copies a vendor value under a unified key, skipping absent values. */
    protected static void copy(ObjectNode target, String key, JsonNode value) {
        if (value != null && !value.isNull() && !value.isMissingNode()) {
            target.set(key, value);
        }
    }

    /** Splits {@code BASE/QUOTE[:SETTLE]} into its parts; settle is null for spot symbols. */
    protected UnifiedSymbol parse(String symbol) {
        if (symbol == null) {
            throw ConnectorException.clientError(sourceId, "Symbol is required");
        }
        String trimmed = symbol.trim().toUpperCase(Locale.ROOT);
        int slash = trimmed.indexOf('/');
        if (slash <= 0 || slash == trimmed.length() - 1) {
            throw ConnectorException.clientError(sourceId, "Unsupported symbol format '" + symbol + "', expected BASE/QUOTE");
        }
        String base = trimmed.substring(0, slash);
        String rest = trimmed.substring(slash + 1);
        int colon = rest.indexOf(':');
        if (colon < 0) {
            return new UnifiedSymbol(base, rest, null);
        }
        if (colon == 0 || colon == rest.length() - 1) {
            throw ConnectorException.clientError(sourceId, "Unsupported symbol format '" + symbol + "'");
        }
        return new UnifiedSymbol(base, rest.substring(0, colon), rest.substring(colon + 1));
    }

    /** Percentage change from open to last, or null when either is unavailable. */
    protected static BigDecimal percentChange(JsonNode open, JsonNode last) {
        BigDecimal o = decimalOrNull(open);
        BigDecimal l = decimalOrNull(last);
        if (o == null || l == null || o.signum() == 0) {
            return null;
        }
        return l.subtract(o).multiply(HUNDRED).divide(o, 8, RoundingMode.HALF_UP).stripTrailingZeros();
    }

    protected static BigDecimal decimalOrNull(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        String text = node.asText().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Throws unless the node is a JSON array. */
    protected JsonNode requireArray(JsonNode node, String what) {
        if (node == null || !node.isArray()) {
            throw new ConnectorException(sourceId, "Unexpected " + what + " payload from " + sourceId);
        }
        return node;
    }

    protected ConnectorException error(String message) {
        return new ConnectorException(sourceId, message);
    }

    /** Failure caused by the request itself, e.g. a symbol the vendor does not list. */
    protected ConnectorException clientError(String message) {
        return ConnectorException.clientError(sourceId, message);
    }

    // 429 and Binance's 418 ban are rate limiting, which is the vendor pushing back
    static boolean isClientStatus(int status) {
        return status >= 400 && status < 500 && status != 429 && status != 418;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }

    /** Unified symbol split into its currencies. */
    protected record UnifiedSymbol(String base, String quote, String settle) {

        public boolean isDerivative() {
            return settle != null;
        }

        public String unified() {
            return settle == null ? base + "/" + quote : base + "/" + quote + ":" + settle;
        }
    }
}
