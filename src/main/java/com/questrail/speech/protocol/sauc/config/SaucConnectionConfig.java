package com.questrail.speech.protocol.sauc.config;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Endpoint and handshake configuration for one connection.
 *
 * <p>Handshake headers identify the resource, the caller's credentials and
 * correlation ids. They are supplied by the caller and written to the upgrade
 * request verbatim; the core never interprets them.</p>
 */
public record SaucConnectionConfig(
        URI endpoint,
        Map<String, String> handshakeHeaders,
        Duration pingInterval,
        int maxFramePayloadBytes
) {
    public static final String HEADER_APP_KEY = "X-Api-App-Key";
    public static final String HEADER_ACCESS_KEY = "X-Api-Access-Key";
    public static final String HEADER_RESOURCE_ID = "X-Api-Resource-Id";
    public static final String HEADER_CONNECT_ID = "X-Api-Connect-Id";
    public static final String HEADER_REQUEST_ID = "X-Api-Request-Id";

    public static final URI DEFAULT_ENDPOINT =
            URI.create("wss://openspeech.bytedance.com/api/v3/sauc/bigmodel_async");

    public SaucConnectionConfig {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(pingInterval, "pingInterval");

        String scheme = endpoint.getScheme() == null ? "" : endpoint.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("ws") && !scheme.equals("wss")) {
            throw new IllegalArgumentException("endpoint must be ws:// or wss://: " + endpoint);
        }
        if (pingInterval.isNegative()) {
            throw new IllegalArgumentException("pingInterval must be non-negative");
        }
        if (maxFramePayloadBytes <= 0) {
            throw new IllegalArgumentException("maxFramePayloadBytes must be positive");
        }
        handshakeHeaders = Map.copyOf(handshakeHeaders == null ? Map.of() : handshakeHeaders);
    }

    public boolean secure() {
        return "wss".equalsIgnoreCase(endpoint.getScheme());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private URI endpoint = DEFAULT_ENDPOINT;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private Duration pingInterval = Duration.ofSeconds(20);
        private int maxFramePayloadBytes = 1 << 20;

        public Builder withEndpoint(URI endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder withAppKey(String appKey) {
            return withHeader(HEADER_APP_KEY, appKey);
        }

        public Builder withAccessKey(String accessKey) {
            return withHeader(HEADER_ACCESS_KEY, accessKey);
        }

        public Builder withResourceId(String resourceId) {
            return withHeader(HEADER_RESOURCE_ID, resourceId);
        }

        public Builder withConnectId(String connectId) {
            return withHeader(HEADER_CONNECT_ID, connectId);
        }

        public Builder withRequestId(String requestId) {
            return withHeader(HEADER_REQUEST_ID, requestId);
        }

        public Builder withHeader(String name, String value) {
            headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder withPingInterval(Duration pingInterval) {
            this.pingInterval = pingInterval;
            return this;
        }

        public Builder withMaxFramePayloadBytes(int maxFramePayloadBytes) {
            this.maxFramePayloadBytes = maxFramePayloadBytes;
            return this;
        }

        /**
         * Builds the config. A random connect id is generated when none was
         * given, so every connection is correlatable on the service side.
         */
        public SaucConnectionConfig build() {
            Map<String, String> effective = new LinkedHashMap<>(headers);
            effective.putIfAbsent(HEADER_CONNECT_ID, UUID.randomUUID().toString());
            return new SaucConnectionConfig(endpoint, effective, pingInterval, maxFramePayloadBytes);
        }
    }
}
