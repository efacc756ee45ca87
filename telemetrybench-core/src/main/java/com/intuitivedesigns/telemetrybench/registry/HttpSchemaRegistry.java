/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.telemetrybench.driver.Futures;
import com.intuitivedesigns.telemetrybench.errors.SchemaRegistryException;
import com.intuitivedesigns.telemetrybench.metrics.MetricsRuntime;
import org.apache.avro.Schema;
import org.apache.avro.SchemaParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Confluent-compatible schema registry client over {@link HttpClient}.
 *
 * <ul>
 *   <li>{@code POST /subjects/{subject}/versions} with {@code {"schema": "..."}} returns {@code {"id": N}}</li>
 *   <li>{@code GET /schemas/ids/{id}} returns {@code {"schema": "..."}}</li>
 * </ul>
 * Both directions are cached for the life of the client.
 */
public final class HttpSchemaRegistry implements SchemaRegistry {

    private static final Logger log = LoggerFactory.getLogger(HttpSchemaRegistry.class);

    private static final String CONTENT_TYPE = "Content-Type";
    private static final String ACCEPT = "Accept";
    private static final String REGISTRY_CT = "application/vnd.schemaregistry.v1+json";

    private final HttpClient client;
    private final String baseUrl;
    private final ObjectMapper json = new ObjectMapper();
    private final Duration requestTimeout;
    private final MetricsRuntime metrics;

    private final Map<String, CompletableFuture<Integer>> idBySubjectSchema = new ConcurrentHashMap<>();
    private final Map<Integer, CompletableFuture<Schema>> schemaById = new ConcurrentHashMap<>();

    public HttpSchemaRegistry(String baseUrl, Duration requestTimeout, MetricsRuntime metrics) {
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl"));
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(requestTimeout)
                .build();
    }

    @Override
    public CompletableFuture<Integer> register(String subject, Schema schema) {
        final String key = subject + '\u0000' + schema;
        final CompletableFuture<Integer> cached = idBySubjectSchema.get(key);
        if (cached != null && !cached.isCompletedExceptionally()) {
            return cached;
        }

        final byte[] body;
        try {
            final ObjectNode root = json.createObjectNode();
            root.put("schema", schema.toString());
            body = json.writeValueAsBytes(root);
        } catch (IOException e) {
            return Futures.failed(new SchemaRegistryException("Failed to encode registration for " + subject, e));
        }

        final HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/subjects/" + pathSegment(subject) + "/versions"))
                .header(CONTENT_TYPE, REGISTRY_CT)
                .header(ACCEPT, REGISTRY_CT)
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .timeout(requestTimeout)
                .build();

        final long startNanos = System.nanoTime();
        final CompletableFuture<Integer> result = send(request, "register " + subject)
                .thenApply(node -> {
                    final JsonNode id = node.get("id");
                    if (id == null || !id.canConvertToInt()) {
                        throw new SchemaRegistryException("Registry response for " + subject + " has no id: " + node);
                    }
                    metrics.timer("registry.register.latency", Duration.ofNanos(System.nanoTime() - startNanos));
                    schemaById.putIfAbsent(id.intValue(), CompletableFuture.completedFuture(schema));
                    log.debug("Registered subject={} id={}", subject, id.intValue());
                    return id.intValue();
                });
        idBySubjectSchema.put(key, result);
        return result;
    }

    @Override
    public CompletableFuture<Schema> schemaById(int id) {
        final CompletableFuture<Schema> cached = schemaById.get(id);
        if (cached != null && !cached.isCompletedExceptionally()) {
            return cached;
        }

        final HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/schemas/ids/" + id))
                .header(ACCEPT, REGISTRY_CT)
                .GET()
                .timeout(requestTimeout)
                .build();

        final CompletableFuture<Schema> result = send(request, "fetch schema " + id)
                .thenApply(node -> {
                    final JsonNode schemaText = node.get("schema");
                    if (schemaText == null || !schemaText.isTextual()) {
                        throw new SchemaRegistryException("Registry response for schema " + id + " has no schema: " + node);
                    }
                    try {
                        return new Schema.Parser().parse(schemaText.textValue());
                    } catch (SchemaParseException e) {
                        throw new SchemaRegistryException("Registry returned an invalid schema for id " + id, e);
                    }
                });
        schemaById.put(id, result);
        return result;
    }

    private CompletableFuture<JsonNode> send(HttpRequest request, String what) {
        return client.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
                .handle((response, error) -> {
                    if (error != null) {
                        metrics.counter("registry.errors");
                        final Throwable cause = Futures.unwrap(error);
                        throw new SchemaRegistryException("Schema registry " + what + " failed: " + cause.getMessage(), cause);
                    }
                    final JsonNode node = parse(response.body(), what);
                    if (response.statusCode() / 100 != 2) {
                        metrics.counter("registry.errors");
                        throw new SchemaRegistryException("Schema registry " + what + " returned HTTP "
                                + response.statusCode() + ": " + describeError(node));
                    }
                    return node;
                });
    }

    private JsonNode parse(byte[] body, String what) {
        if (body == null || body.length == 0) {
            return json.createObjectNode();
        }
        try {
            return json.readTree(body);
        } catch (IOException e) {
            throw new SchemaRegistryException("Unparseable schema registry response to " + what, e);
        }
    }

    private static String describeError(JsonNode node) {
        final JsonNode message = node.get("message");
        final JsonNode code = node.get("error_code");
        if (message == null) return node.toString();
        return (code == null) ? message.asText() : message.asText() + " (error_code " + code.asText() + ")";
    }

    private static String stripTrailingSlash(String url) {
        String u = url.trim();
        while (u.endsWith("/")) u = u.substring(0, u.length() - 1);
        return u;
    }

    /** Percent-encodes one URL path segment; unlike form encoding a space becomes {@code %20}. */
    static String pathSegment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
