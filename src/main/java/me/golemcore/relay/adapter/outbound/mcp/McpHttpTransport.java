package me.golemcore.relay.adapter.outbound.mcp;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.exception.AuthException;
import me.golemcore.relay.domain.exception.ProtocolException;
import me.golemcore.relay.domain.exception.RelayException;
import me.golemcore.relay.domain.exception.SessionExpiredException;
import me.golemcore.relay.domain.exception.ToolExecutionException;
import me.golemcore.relay.domain.exception.ToolNotFoundException;
import me.golemcore.relay.domain.exception.ToolTimeoutException;
import me.golemcore.relay.domain.exception.TransportException;
import me.golemcore.relay.domain.model.McpSession;
import me.golemcore.relay.domain.model.ToolDefinition;
import me.golemcore.relay.domain.model.ToolResult;
import me.golemcore.relay.domain.model.TransportKind;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.ToolTransport;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

/**
 * JSON-RPC 2.0 client for a single MCP server over streamable HTTP.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>{@code initialize} request, server may assign a session id in the
 * {@code Mcp-Session-Id} response header
 * <li>{@code notifications/initialized} notification
 * <li>{@code tools/list} at the start of every turn
 * <li>{@code tools/call} per model tool call
 * <li>{@code DELETE} on close to end the server-side session
 * </ol>
 *
 * <p>
 * Every request after the handshake carries the current session id and, when
 * configured, a bearer token. Responses are either a single JSON body or an
 * event stream that is read until the matching response arrives. A session id
 * returned by the server replaces the stored one atomically.
 *
 * <p>
 * A 404 on a request that carried a session id means the server dropped the
 * session. A network failure also discards the session, so the next call
 * performs a fresh handshake.
 *
 * <p>
 * Not a Spring bean. Created per configured server by
 * {@link McpTransportManager}.
 *
 * @see McpTransportManager
 */
@Slf4j
public class McpHttpTransport implements ToolTransport {

    static final String HEADER_SESSION_ID = "Mcp-Session-Id";
    static final String PROTOCOL_VERSION = "2024-11-05";

    private static final String JSONRPC_VERSION = "2.0";
    private static final String CLIENT_NAME = "golemcore-relay";
    private static final String CLIENT_VERSION = "0.1.0";
    private static final String ACCEPT = "application/json, text/event-stream";
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int METHOD_NOT_FOUND = -32601;
    private static final int INVALID_PARAMS = -32602;
    private static final Pattern IPV4_LITERAL = Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final String name;
    private final RelayProperties.McpServerProperties config;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Executor handshakeExecutor;
    private final SseEventReader sseReader;
    private final HttpUrl endpoint;
    private final boolean loopbackEndpoint;

    private final AtomicInteger nextId = new AtomicInteger(1);
    private final AtomicReference<McpSession> session = new AtomicReference<>();
    private final Object handshakeLock = new Object();

    public McpHttpTransport(RelayProperties.McpServerProperties config, OkHttpClient sharedClient,
            ObjectMapper objectMapper, Executor handshakeExecutor) {
        this.name = config.getName();
        this.config = config;
        this.objectMapper = objectMapper;
        this.handshakeExecutor = handshakeExecutor;
        this.sseReader = new SseEventReader(name, objectMapper);
        this.httpClient = sharedClient.newBuilder()
                .callTimeout(config.getTimeout())
                .readTimeout(config.getTimeout())
                .build();
        this.endpoint = parseEndpoint(config.getUrl());
        this.loopbackEndpoint = endpoint != null && isLoopback(endpoint.host());

        if (endpoint == null) {
            log.info("[MCP:{}] No URL configured, running in local-only mode without remote tools", name);
        } else if (config.isLocalOnly() && !loopbackEndpoint) {
            log.warn("[MCP:{}] local-only is set but {} is not a loopback address; calls will be refused",
                    name, endpoint.host());
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public TransportKind getKind() {
        return TransportKind.STREAMABLE_HTTP;
    }

    @Override
    public Optional<McpSession> currentSession() {
        return Optional.ofNullable(session.get());
    }

    @Override
    public void initialize() {
        if (endpoint == null || session.get() != null) {
            return;
        }
        synchronized (handshakeLock) {
            if (session.get() != null) {
                return;
            }
            ensureDialable();
            log.info("[MCP:{}] Initializing session with {}", name, endpoint);

            Map<String, Object> params = new LinkedHashMap<>();
            params.put("protocolVersion", PROTOCOL_VERSION);
            params.put("capabilities", Map.of());
            params.put("clientInfo", Map.of("name", CLIENT_NAME, "version", CLIENT_VERSION));

            RpcReply reply = await(sendRequest("initialize", params, null, null));
            JsonNode result = reply.result();
            if (result == null || !result.isObject()) {
                throw new ProtocolException("[MCP:" + name + "] Malformed initialize result");
            }
            String negotiated = result.path("protocolVersion").asText(PROTOCOL_VERSION);
            McpSession established = new McpSession(reply.sessionId(), negotiated, TransportKind.STREAMABLE_HTTP);

            sendNotification("notifications/initialized", established);
            session.set(established);
            log.info("[MCP:{}] Session established: id={}, protocol={}", name,
                    established.hasSessionId() ? established.sessionId() : "(none)", negotiated);
        }
    }

    @Override
    public List<ToolDefinition> listTools() {
        if (endpoint == null) {
            return List.of();
        }
        initialize();

        List<ToolDefinition> tools = new ArrayList<>();
        String cursor = null;
        do {
            Map<String, Object> params = cursor != null ? Map.of("cursor", cursor) : Map.of();
            JsonNode result = await(sendRequest("tools/list", params, session.get(), null)).result();
            tools.addAll(parseToolDefinitions(result));
            JsonNode next = result != null ? result.get("nextCursor") : null;
            cursor = next != null && next.isTextual() && !next.asText().isBlank() ? next.asText() : null;
        } while (cursor != null);

        log.debug("[MCP:{}] Listed tools: {}", name, tools.stream().map(ToolDefinition::getName).toList());
        return tools;
    }

    @Override
    public CompletableFuture<ToolResult> callTool(String toolName, Map<String, Object> arguments) {
        if (endpoint == null) {
            return CompletableFuture.failedFuture(
                    new TransportException("[MCP:" + name + "] No endpoint configured"));
        }

        CompletableFuture<ToolResult> result = new CompletableFuture<>();
        AtomicReference<Call> inFlight = new AtomicReference<>();
        result.whenComplete((value, ex) -> {
            // cancelled, timed out by the caller, or already done; cancel() is idempotent
            if (ex != null) {
                Call call = inFlight.get();
                if (call != null) {
                    call.cancel();
                }
            }
        });

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", toolName);
        params.put("arguments", arguments != null ? arguments : Map.of());

        sessionAsync()
                .thenCompose(current -> sendRequest("tools/call", params, current, inFlight))
                .whenComplete((reply, ex) -> {
                    if (ex != null) {
                        result.completeExceptionally(toToolFailure(toolName, unwrap(ex)));
                        return;
                    }
                    try {
                        result.complete(parseToolCallResult(toolName, reply.result()));
                    } catch (RelayException e) {
                        result.completeExceptionally(e);
                    }
                });
        return result;
    }

    @Override
    public void close() {
        McpSession current = session.getAndSet(null);
        if (current == null || !current.hasSessionId() || endpoint == null) {
            return;
        }
        log.info("[MCP:{}] Closing session {}", name, current.sessionId());
        Request request = newRequestBuilder(current).delete().build();
        try (Response response = httpClient.newCall(request).execute()) {
            log.debug("[MCP:{}] Session termination returned HTTP {}", name, response.code());
        } catch (IOException e) {
            log.warn("[MCP:{}] Failed to terminate session: {}", name, e.getMessage());
        }
    }

    // ==================== JSON-RPC ====================

    private CompletableFuture<McpSession> sessionAsync() {
        McpSession current = session.get();
        if (current != null) {
            return CompletableFuture.completedFuture(current);
        }
        return CompletableFuture.supplyAsync(() -> {
            initialize();
            return session.get();
        }, handshakeExecutor);
    }

    CompletableFuture<RpcReply> sendRequest(String method, Map<String, Object> params, McpSession current,
            AtomicReference<Call> inFlight) {
        try {
            ensureDialable();
        } catch (TransportException e) {
            return CompletableFuture.failedFuture(e);
        }

        int id = nextId.getAndIncrement();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jsonrpc", JSONRPC_VERSION);
        body.put("id", id);
        body.put("method", method);
        body.put("params", params);

        Request request;
        try {
            String json = objectMapper.writeValueAsString(body);
            log.debug("[MCP:{}] → {}", name, json);
            request = newRequestBuilder(current).post(RequestBody.create(json, JSON)).build();
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    new ProtocolException("[MCP:" + name + "] Failed to encode " + method, e));
        }

        CompletableFuture<RpcReply> future = new CompletableFuture<>();
        Call call = httpClient.newCall(request);
        if (inFlight != null) {
            inFlight.set(call);
        }
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failed, IOException e) {
                future.completeExceptionally(mapIoFailure(method, failed, e, current));
            }

            @Override
            public void onResponse(Call ok, Response response) {
                try (response) {
                    future.complete(readReply(response, id, current));
                } catch (RuntimeException e) {
                    future.completeExceptionally(e);
                } catch (IOException e) {
                    future.completeExceptionally(mapIoFailure(method, ok, e, current));
                }
            }
        });
        return future;
    }

    private void sendNotification(String method, McpSession current) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jsonrpc", JSONRPC_VERSION);
        body.put("method", method);
        try {
            String json = objectMapper.writeValueAsString(body);
            log.debug("[MCP:{}] → (notification) {}", name, json);
            Request request = newRequestBuilder(current).post(RequestBody.create(json, JSON)).build();
            try (Response response = httpClient.newCall(request).execute()) {
                if (response.code() == 401 || response.code() == 403) {
                    throw new AuthException("[MCP:" + name + "] Server rejected credentials (HTTP "
                            + response.code() + ")");
                }
                if (!response.isSuccessful()) {
                    throw new ProtocolException("[MCP:" + name + "] " + method + " rejected with HTTP "
                            + response.code());
                }
            }
        } catch (JsonProcessingException e) {
            throw new ProtocolException("[MCP:" + name + "] Failed to encode " + method, e);
        } catch (IOException e) {
            throw new TransportException("[MCP:" + name + "] " + method + " failed: " + e.getMessage(), e);
        }
    }

    private RpcReply readReply(Response response, int id, McpSession current) throws IOException {
        int code = response.code();
        if (code == 401 || code == 403) {
            throw new AuthException("[MCP:" + name + "] Server rejected credentials (HTTP " + code + ")");
        }
        if (code == 404 && current != null && current.hasSessionId()) {
            session.compareAndSet(current, null);
            log.warn("[MCP:{}] Session {} was not found on the server", name, current.sessionId());
            throw new SessionExpiredException("[MCP:" + name + "] Session " + current.sessionId() + " expired");
        }
        if (!response.isSuccessful()) {
            throw new TransportException("[MCP:" + name + "] HTTP " + code);
        }

        String returnedSessionId = response.header(HEADER_SESSION_ID);
        if (current != null) {
            adoptSessionId(current, returnedSessionId);
        }

        ResponseBody body = response.body();
        if (body == null) {
            throw new ProtocolException("[MCP:" + name + "] Empty response to request " + id);
        }
        JsonNode message;
        MediaType contentType = body.contentType();
        if (contentType != null && "event-stream".equals(contentType.subtype())) {
            message = sseReader.readResponse(body.source(), id);
        } else {
            String text = body.string();
            if (text.isBlank()) {
                throw new ProtocolException("[MCP:" + name + "] Empty response to request " + id);
            }
            log.debug("[MCP:{}] ← {}", name, text);
            try {
                message = objectMapper.readTree(text);
            } catch (JsonProcessingException e) {
                throw new ProtocolException("[MCP:" + name + "] Malformed JSON-RPC response", e);
            }
        }

        JsonNode error = message.get("error");
        if (error != null && !error.isNull()) {
            throw new JsonRpcErrorException(
                    error.path("code").asInt(-1),
                    error.path("message").asText("Unknown MCP error"));
        }
        if (!message.has("result")) {
            throw new ProtocolException("[MCP:" + name + "] Response to request " + id + " has no result");
        }
        return new RpcReply(message.get("result"), returnedSessionId);
    }

    /**
     * Replaces the session the request was sent on. Replies to a session that
     * has since been discarded or replaced are ignored.
     */
    private void adoptSessionId(McpSession sentOn, String returned) {
        if (returned == null || returned.isBlank() || returned.equals(sentOn.sessionId())) {
            return;
        }
        if (session.compareAndSet(sentOn, sentOn.withSessionId(returned))) {
            log.info("[MCP:{}] Server replaced session id {} -> {}", name, sentOn.sessionId(), returned);
        } else {
            log.debug("[MCP:{}] Ignoring session id {} from a reply to stale session {}", name, returned,
                    sentOn.sessionId());
        }
    }

    private RuntimeException mapIoFailure(String method, Call call, IOException e, McpSession current) {
        if (call.isCanceled()) {
            return new CancellationException("[MCP:" + name + "] " + method + " cancelled");
        }
        if (isCallTimeout(e)) {
            return new ToolTimeoutException("[MCP:" + name + "] " + method + " timed out after "
                    + config.getTimeout().toMillis() + "ms", e);
        }
        if (current != null) {
            session.compareAndSet(current, null);
        }
        log.warn("[MCP:{}] {} failed, session discarded: {}", name, method, e.getMessage());
        return new TransportException("[MCP:" + name + "] " + method + " failed: " + e.getMessage(), e);
    }

    private static boolean isCallTimeout(IOException e) {
        return e instanceof InterruptedIOException;
    }

    private Request.Builder newRequestBuilder(McpSession current) {
        Request.Builder builder = new Request.Builder()
                .url(endpoint)
                .header("Accept", ACCEPT);
        if (current != null && current.hasSessionId()) {
            builder.header(HEADER_SESSION_ID, current.sessionId());
        }
        if (config.getAuthToken() != null && !config.getAuthToken().isBlank()) {
            builder.header("Authorization", "Bearer " + config.getAuthToken());
        }
        return builder;
    }

    private void ensureDialable() {
        if (endpoint == null) {
            throw new TransportException("[MCP:" + name + "] No endpoint configured");
        }
        if (config.isLocalOnly() && !loopbackEndpoint) {
            throw new TransportException("[MCP:" + name + "] Refusing to dial non-loopback address "
                    + endpoint.host() + " in local-only mode");
        }
    }

    private <T> T await(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("[MCP:" + name + "] Interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof RelayException relayException) {
                throw relayException;
            }
            throw new TransportException("[MCP:" + name + "] " + cause.getMessage(), cause);
        }
    }

    private RuntimeException toToolFailure(String toolName, Throwable cause) {
        if (cause instanceof JsonRpcErrorException rpcError) {
            if (rpcError.getCode() == METHOD_NOT_FOUND || (rpcError.getCode() == INVALID_PARAMS
                    && rpcError.getMessage().toLowerCase(Locale.ROOT).contains("unknown tool"))) {
                return new ToolNotFoundException("Tool not found on server " + name + ": " + toolName);
            }
            return new ToolExecutionException("MCP tool " + toolName + " failed: " + rpcError.getMessage());
        }
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        return new TransportException("[MCP:" + name + "] " + cause.getMessage(), cause);
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    // ==================== Parsing ====================

    private List<ToolDefinition> parseToolDefinitions(JsonNode result) {
        if (result == null) {
            return List.of();
        }
        JsonNode toolsNode = result.get("tools");
        if (toolsNode == null || !toolsNode.isArray()) {
            return List.of();
        }

        List<ToolDefinition> tools = new ArrayList<>();
        for (JsonNode toolNode : toolsNode) {
            String toolName = toolNode.has("name") ? toolNode.get("name").asText() : null;
            if (toolName == null) {
                continue;
            }
            String description = toolNode.has("description") ? toolNode.get("description").asText() : "";

            Map<String, Object> inputSchema = Map.of("type", "object", "properties", Map.of());
            if (toolNode.has("inputSchema")) {
                try {
                    inputSchema = objectMapper.convertValue(toolNode.get("inputSchema"), MAP_TYPE_REF);
                } catch (IllegalArgumentException e) {
                    log.warn("[MCP:{}] Failed to parse inputSchema for tool '{}': {}", name, toolName,
                            e.getMessage());
                }
            }

            tools.add(ToolDefinition.builder()
                    .name(toolName)
                    .description(description)
                    .inputSchema(inputSchema)
                    .build());
        }
        return tools;
    }

    private ToolResult parseToolCallResult(String toolName, JsonNode result) {
        if (result == null || result.isNull()) {
            throw new ToolExecutionException("No result from MCP tool: " + toolName);
        }

        boolean isError = result.path("isError").asBoolean(false);

        StringBuilder output = new StringBuilder();
        JsonNode contentNode = result.get("content");
        if (contentNode != null && contentNode.isArray()) {
            for (JsonNode item : contentNode) {
                String type = item.path("type").asText("text");
                String part = "text".equals(type) && item.has("text")
                        ? item.get("text").asText()
                        : "[" + type + " content]";
                if (!output.isEmpty()) {
                    output.append('\n');
                }
                output.append(part);
            }
        }

        if (isError) {
            throw new ToolExecutionException(output.isEmpty() ? "MCP tool error" : output.toString());
        }
        return ToolResult.success(output.isEmpty() ? "(no output)" : output.toString());
    }

    // ==================== Addressing ====================

    private static HttpUrl parseEndpoint(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        HttpUrl parsed = HttpUrl.parse(url.trim());
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid MCP server URL: " + url);
        }
        return parsed;
    }

    static boolean isLoopback(String host) {
        if (host == null) {
            return false;
        }
        if ("localhost".equalsIgnoreCase(host)) {
            return true;
        }
        // Only literals are checked; resolving names here would dial DNS
        if (IPV4_LITERAL.matcher(host).matches() || host.contains(":")) {
            try {
                return InetAddress.getByName(host).isLoopbackAddress();
            } catch (UnknownHostException e) {
                return false;
            }
        }
        return false;
    }

    record RpcReply(JsonNode result, String sessionId) {
    }

    /**
     * JSON-RPC error object returned by the server.
     */
    static class JsonRpcErrorException extends ProtocolException {
        private final int code;

        JsonRpcErrorException(int code, String message) {
            super(message);
            this.code = code;
        }

        int getCode() {
            return code;
        }
    }
}
