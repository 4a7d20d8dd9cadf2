package com.fintech.marketfeed.cucumber;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.marketfeed.config.FeedConfiguration;
import com.fintech.marketfeed.domain.MarketDataSnapshot;
import com.fintech.marketfeed.domain.PollTarget;
import com.fintech.marketfeed.error.UnknownSourceException;
import com.fintech.marketfeed.ingestion.TickerEventPublisher;
import com.fintech.marketfeed.scheduler.PollingScheduler;
import com.fintech.marketfeed.service.MarketDataQueryService;
import com.fintech.marketfeed.storage.FileTickerSink;
import com.fintech.marketfeed.storage.PersistenceFormat;
import io.cucumber.java.Before;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;
import io.cucumber.spring.CucumberContextConfiguration;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Cucumber step definitions for the market feed BDD tests.
 *
 * Polling is disabled in the test profile; ticks are driven through
 * {@link PollingScheduler#pollOnce} so row counts are exact.
 */
@CucumberContextConfiguration
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("test")
public class MarketFeedSteps {

    private static final long PERSIST_TIMEOUT_MS = 5_000;

    @Autowired
    private FeedConfiguration configuration;

    @Autowired
    private PollingScheduler scheduler;

    @Autowired
    private FileTickerSink sink;

    @Autowired
    private TickerEventPublisher publisher;

    @Autowired
    private MarketDataQueryService queryService;

    @Autowired
    private ObjectMapper objectMapper;

    private MarketDataSnapshot snapshot;
    private RuntimeException queryFailure;

    @Before
    public void setUp() {
        snapshot = null;
        queryFailure = null;
    }

    // ================ Given Steps ================

    @Given("the market feed is running with exchange {string}")
    public void theMarketFeedIsRunningWithExchange(String exchange) {
        assertThat(configuration.sourceIds()).contains(exchange);
        assertThat(scheduler.isRunning()).isFalse();
    }

    @Given("the ticker files for {string} have been reset")
    public void theTickerFilesHaveBeenReset(String exchange) throws Exception {
        // Let earlier tickers land first so none arrive after the reset
        awaitPersisted();
        sink.reset(exchange);
    }

    // ================ When Steps ================

    @Given("every configured symbol is polled {int} times")
    public void everyConfiguredSymbolIsPolled(int times) throws Exception {
        long before = sink.getRecordsWritten();
        List<PollTarget> targets = scheduler.targets();
        for (int i = 0; i < times; i++) {
            for (PollTarget target : targets) {
                assertThat(scheduler.pollOnce(target)).isTrue();
            }
        }
        long expected = before + (long) times * targets.size();
        awaitCondition(() -> sink.getRecordsWritten() >= expected);
    }

    @When("I query market data for {string} on {string}")
    public void iQueryMarketData(String symbol, String exchange) {
        try {
            snapshot = queryService.queryMarketData(exchange, symbol);
        } catch (RuntimeException e) {
            queryFailure = e;
        }
    }

    // ================ Then Steps ================

    @Then("the CSV file for {string} has a header and {int} rows")
    public void theCsvFileHasRows(String exchange, int rows) throws Exception {
        List<String> lines = csvLines(exchange);
        assertThat(lines).first().isEqualTo("timestamp,exchange,symbol,price");
        assertThat(lines).hasSize(rows + 1);
    }

    @Then("the JSON file for {string} holds {int} records")
    public void theJsonFileHoldsRecords(String exchange, int records) throws Exception {
        JsonNode array = json(exchange);
        assertThat(array.isArray()).isTrue();
        assertThat(array.size()).isEqualTo(records);
    }

    @Then("the last JSON record for {string} matches the last CSV row")
    public void theLastJsonRecordMatchesTheLastCsvRow(String exchange) throws Exception {
        List<String> lines = csvLines(exchange);
        String[] row = lines.get(lines.size() - 1).split(",", -1);
        JsonNode array = json(exchange);
        JsonNode last = array.get(array.size() - 1);

        assertThat(last.get("timestamp").asText()).isEqualTo(row[0]);
        assertThat(last.get("exchange").asText()).isEqualTo(row[1]);
        assertThat(last.get("symbol").asText()).isEqualTo(row[2]);
        assertThat(last.get("price").asText()).isEqualTo(row[3]);
    }

    @Then("every facet is present without errors")
    public void everyFacetIsPresentWithoutErrors() {
        assertThat(queryFailure).isNull();
        assertThat(snapshot.errors()).isEmpty();
        assertThat(snapshot.ticker()).isNotNull();
        assertThat(snapshot.orderbook()).isNotNull();
        assertThat(snapshot.trades()).isNotEmpty();
        assertThat(snapshot.marketInfo()).isNotNull();
    }

    @Then("the order book has {int} levels per side")
    public void theOrderBookHasLevelsPerSide(int levels) {
        assertThat(snapshot.orderbook().bids()).hasSize(levels);
        assertThat(snapshot.orderbook().asks()).hasSize(levels);
    }

    @Then("the query is rejected as an unknown exchange")
    public void theQueryIsRejectedAsAnUnknownExchange() {
        assertThat(snapshot).isNull();
        assertThat(queryFailure).isInstanceOf(UnknownSourceException.class);
    }

    // ================ Helpers ================

    private List<String> csvLines(String exchange) throws IOException {
        return Files.readAllLines(sink.destination(exchange, PersistenceFormat.CSV), StandardCharsets.UTF_8);
    }

    private JsonNode json(String exchange) throws IOException {
        Path file = sink.destination(exchange, PersistenceFormat.JSON);
        return objectMapper.readTree(file.toFile());
    }

    private void awaitPersisted() throws InterruptedException {
        // The ring buffer is empty again once every published ticker was handed to the sink
        long capacity = configuration.persistence().ringBufferSize();
        awaitCondition(() -> publisher.getRemainingCapacity() == capacity);
        Thread.sleep(50);
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + PERSIST_TIMEOUT_MS;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(condition.getAsBoolean()).as("condition within %d ms", PERSIST_TIMEOUT_MS).isTrue();
    }
}
