package io.healthsamurai.auditledger.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.healthsamurai.auditledger.config.LedgerConfig;
import io.healthsamurai.auditledger.exception.StorageException;
import io.healthsamurai.auditledger.storage.SiemSink;
import io.healthsamurai.auditledger.util.JsonUtil;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for posting audit records to a SIEM ingestion endpoint.
 * Supports multiple authentication methods: none, Basic Auth, Bearer Token.
 */
public class SiemClient implements SiemSink {

    private static final Logger log = LoggerFactory.getLogger(SiemClient.class);

    private final String siemUrl;
    private final String authType;
    private final String authHeader;
    private final Duration requestTimeout;
    private final HttpClient httpClient;

    /**
     * Creates a new SiemClient with configuration from environment/system properties.
     */
    public SiemClient() {
        this.siemUrl = LedgerConfig.getSiemUrl();
        this.authType = LedgerConfig.getAuthType();
        this.authHeader = buildAuthHeader(authType);
        this.requestTimeout = Duration.ofSeconds(LedgerConfig.getSiemRequestTimeoutSeconds());

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(LedgerConfig.CONNECTION_TIMEOUT_SECONDS))
                .build();

        log.info("SiemClient initialized - URL: {}, Auth: {}, request timeout: {}s",
                siemUrl, authType, requestTimeout.toSeconds());
    }

    /**
     * Constructor for testing with custom HttpClient.
     */
    public SiemClient(HttpClient httpClient, String siemUrl, String authType, String authHeader) {
        this(httpClient, siemUrl, authType, authHeader, Duration.ofSeconds(LedgerConfig.REQUEST_TIMEOUT_SECONDS));
    }

    public SiemClient(HttpClient httpClient, String siemUrl, String authType, String authHeader,
                      Duration requestTimeout) {
        this.httpClient = httpClient;
        this.siemUrl = siemUrl;
        this.authType = authType;
        this.authHeader = authHeader;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Posts a document to the SIEM endpoint and waits for the answer.
     *
     * @param document The enriched audit record
     * @throws StorageException if the request fails or the endpoint answers with a non-2xx status
     */
    @Override
    public void send(ObjectNode document) throws StorageException {
        HttpRequest request = buildRequest(document);

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while sending audit record to SIEM", e);
        } catch (IOException e) {
            throw new StorageException("Failed to send audit record to SIEM at " + request.uri() + ": " + e.getMessage(), e);
        }
        checkResponse(response);
    }

    /**
     * Posts a document without holding a thread while the request is in flight. The executor is
     * not used; the HttpClient completes the exchange on its own threads.
     */
    @Override
    public CompletableFuture<Void> sendAsync(ObjectNode document, Executor executor) {
        HttpRequest request;
        try {
            request = buildRequest(document);
        } catch (StorageException e) {
            return CompletableFuture.failedFuture(e);
        }

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, ex) -> {
                    if (ex != null) {
                        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                        throw new CompletionException(new StorageException(
                                "Failed to send audit record to SIEM at " + request.uri() + ": " + cause.getMessage(), cause));
                    }
                    try {
                        checkResponse(response);
                    } catch (StorageException e) {
                        throw new CompletionException(e);
                    }
                    return null;
                });
    }

    private HttpRequest buildRequest(ObjectNode document) throws StorageException {
        if (document == null) {
            throw new StorageException("SIEM document must not be null");
        }

        // Use URL as-is (the configured value is the full ingestion endpoint)
        String url = siemUrl.endsWith("/")
                ? siemUrl.substring(0, siemUrl.length() - 1)
                : siemUrl;

        try {
            String jsonBody = JsonUtil.toJson(document);
            log.debug("Sending audit record to SIEM {}: {}", url, jsonBody);

            HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .header("Content-Type", LedgerConfig.CONTENT_TYPE_JSON)
                    .header("Accept", LedgerConfig.CONTENT_TYPE_JSON)
                    .timeout(requestTimeout)
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody, StandardCharsets.UTF_8));

            if (authHeader != null && !authHeader.isEmpty()) {
                requestBuilder.header("Authorization", authHeader);
            }
            return requestBuilder.build();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new StorageException("Cannot build SIEM request for " + url + ": " + e.getMessage(), e);
        }
    }

    private static void checkResponse(HttpResponse<String> response) throws StorageException {
        int statusCode = response.statusCode();
        if (statusCode < 200 || statusCode >= 300) {
            throw new StorageException("SIEM returned error. Status: " + statusCode + ", Body: " + response.body());
        }
        log.debug("Audit record accepted by SIEM. Status: {}", statusCode);
    }

    /**
     * Builds the Authorization header value for the configured auth type.
     *
     * @return The header value, or null when no credentials apply
     */
    static String buildAuthHeader(String authType) {
        switch (authType) {
            case LedgerConfig.AUTH_TYPE_BASIC -> {
                String username = LedgerConfig.getConfig(LedgerConfig.AUDIT_SIEM_AUTH_USERNAME, "");
                String password = LedgerConfig.getConfig(LedgerConfig.AUDIT_SIEM_AUTH_PASSWORD, "");
                if (!username.isEmpty()) {
                    String credentials = username + ":" + password;
                    String encoded = Base64.getEncoder()
                            .encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
                    return "Basic " + encoded;
                }
                log.warn("Basic auth configured but no username provided");
                return null;
            }
            case LedgerConfig.AUTH_TYPE_BEARER -> {
                String token = LedgerConfig.getConfig(LedgerConfig.AUDIT_SIEM_AUTH_TOKEN, "");
                if (!token.isEmpty()) {
                    return "Bearer " + token;
                }
                log.warn("Bearer auth configured but no token provided");
                return null;
            }
            default -> {
                return null;
            }
        }
    }

    public String getSiemUrl() {
        return siemUrl;
    }

    public String getAuthType() {
        return authType;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }
}
