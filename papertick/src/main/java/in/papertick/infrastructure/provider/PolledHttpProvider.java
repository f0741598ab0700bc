package in.papertick.infrastructure.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.papertick.config.ProviderConfig;
import in.papertick.domain.data.ProviderEvent;
import in.papertick.domain.data.Tick;
import in.papertick.infrastructure.common.MinIntervalRateLimiter;
import in.papertick.infrastructure.common.ReconnectionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Real-time quote via the unofficial Eastmoney-style endpoint.
 *
 * Endpoint: {@code /api/qt/stock/get?secid=1.600000&fields=f43,f57,f58,...}
 * - f43 is the latest price; values above 10 000 are scaled by 100
 *
 * Behaviour:
 * - one GET per call, spaced by a rate limiter shared by every symbol
 * - per-call timeout
 * - I/O errors, timeouts, 429 and 5xx retried with capped exponential backoff
 * - other statuses, empty data and bad bodies reported at once as error events
 */
public final class PolledHttpProvider implements MarketDataProvider {
    private static final Logger log = LoggerFactory.getLogger(PolledHttpProvider.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String QUOTE_PATH = "/api/qt/stock/get";
    static final String FIELDS = "f43,f57,f58,f59,f170,f44,f45,f46,f47,f48";
    static final String API_KEY_HEADER = "X-Api-Key";

    private static final BigDecimal SCALED_THRESHOLD = new BigDecimal("10000");
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final ProviderConfig.PolledHttp cfg;
    private final HttpClient httpClient;
    private final MinIntervalRateLimiter rateLimiter;
    private final String baseUrl;

    public PolledHttpProvider(ProviderConfig.PolledHttp cfg) {
        this.cfg = cfg;
        this.baseUrl = cfg.baseUrl().endsWith("/")
            ? cfg.baseUrl().substring(0, cfg.baseUrl().length() - 1)
            : cfg.baseUrl();
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(cfg.timeout())
            .build();
        this.rateLimiter = new MinIntervalRateLimiter(cfg.minSpacing());
        log.info("[PROVIDER] Polled HTTP quotes from {} (timeout={}ms, spacing={}ms, retries={})",
            baseUrl, cfg.timeout().toMillis(), cfg.minSpacing().toMillis(), cfg.maxRetries());
    }

    @Override
    public String name() {
        return "polled_http";
    }

    @Override
    public ProviderEvent nextTick(String symbol) {
        SymbolCodes.SecId secId;
        try {
            secId = SymbolCodes.parse(symbol);
        } catch (IllegalArgumentException e) {
            return ProviderEvent.ofError(symbol, e.getMessage());
        }

        ReconnectionPolicy retry = ReconnectionPolicy.exponential(
            cfg.retryInitialDelay(), cfg.retryMaxDelay(), 2.0, cfg.maxRetries() + 1);

        while (true) {
            try {
                rateLimiter.acquire();
                BigDecimal price = fetchPrice(secId);
                return ProviderEvent.ofTick(new Tick(symbol, price, Instant.now()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ProviderEvent.ofError(symbol, "Interrupted while fetching quote");
            } catch (ProviderException e) {
                if (!e.isTransient()) {
                    log.warn("[PROVIDER] {} ({}) permanent failure: {}", symbol, secId.canonical(), e.getMessage());
                    return ProviderEvent.ofError(symbol, e.getMessage());
                }

                Optional<Duration> backoff = retry.onFailure();
                if (backoff.isEmpty()) {
                    log.warn("[PROVIDER] {} giving up after {} attempts: {}",
                        symbol, retry.failures(), e.getMessage());
                    return ProviderEvent.ofError(symbol,
                        e.getMessage() + " (after " + retry.failures() + " attempts)");
                }

                Duration delay = backoff.get();
                log.debug("[PROVIDER] {} transient failure #{}, retry in {}ms: {}",
                    symbol, retry.failures(), delay.toMillis(), e.getMessage());
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return ProviderEvent.ofError(symbol, "Interrupted while backing off");
                }
            }
        }
    }

    private BigDecimal fetchPrice(SymbolCodes.SecId secId) throws ProviderException, InterruptedException {
        URI uri = URI.create(baseUrl + QUOTE_PATH + "?secid=" + secId.asParam() + "&fields=" + FIELDS);
        HttpRequest.Builder rb = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(cfg.timeout())
            .header("User-Agent", "Mozilla/5.0 (PaperTick/0.1)")
            .header("Accept", "application/json,text/plain,*/*")
            .GET();
        if (cfg.apiKey() != null && !cfg.apiKey().isBlank()) {
            rb.header(API_KEY_HEADER, cfg.apiKey());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(rb.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ProviderException("Quote request timed out after " + cfg.timeout().toMillis() + "ms", true, e);
        } catch (IOException e) {
            throw new ProviderException("Quote request failed: " + e.getMessage(), true, e);
        }

        int status = response.statusCode();
        if (status == 429 || status >= 500) {
            throw new ProviderException("HTTP " + status + " from quote endpoint", true);
        }
        if (status != 200) {
            throw new ProviderException("HTTP " + status + " from quote endpoint", false);
        }
        return parsePrice(response.body());
    }

    static BigDecimal parsePrice(String body) throws ProviderException {
        JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException("Unparsable quote body: " + e.getOriginalMessage(), false, e);
        }
        JsonNode data = root == null ? null : root.get("data");
        if (data == null || data.isNull() || data.isEmpty()) {
            throw new ProviderException("Empty quote data", false);
        }
        JsonNode f43 = data.get("f43");
        if (f43 == null || !f43.isNumber()) {
            throw new ProviderException("Missing price field f43", false);
        }

        BigDecimal price = f43.decimalValue();
        if (price.compareTo(SCALED_THRESHOLD) > 0) {
            price = price.divide(HUNDRED);
        }
        if (price.signum() <= 0) {
            throw new ProviderException("Non-positive price: " + price, false);
        }
        return price;
    }
}
