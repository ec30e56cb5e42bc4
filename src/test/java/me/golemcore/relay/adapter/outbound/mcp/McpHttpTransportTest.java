package me.golemcore.relay.adapter.outbound.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.relay.domain.exception.AuthException;
import me.golemcore.relay.domain.exception.SessionExpiredException;
import me.golemcore.relay.domain.exception.ToolExecutionException;
import me.golemcore.relay.domain.exception.ToolNotFoundException;
import me.golemcore.relay.domain.exception.ToolTimeoutException;
import me.golemcore.relay.domain.exception.TransportException;
import me.golemcore.relay.domain.model.McpSession;
import me.golemcore.relay.domain.model.ToolDefinition;
import me.golemcore.relay.domain.model.ToolResult;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class McpHttpTransportTest {

    private static final String URL = "http://127.0.0.1:8931/mcp";
    private static final String SESSION_1 = "session-1";
    private static final String SESSION_2 = "session-2";
    private static final String TOKEN = "secret-token";

    private static final String INITIALIZE_RESULT = """
            {"jsonrpc":"2.0","id":1,"result":{"protocolVersion":"2024-11-05",
             "capabilities":{"tools":{}},"serverInfo":{"name":"test","version":"1"}}}
            """;

    private OkHttpMockEngine engine;
    private OkHttpClient client;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        client = new OkHttpClient.Builder().addInterceptor(engine).build();
    }

    private McpHttpTransport transport(String url, boolean localOnly) {
        RelayProperties.McpServerProperties config = new RelayProperties.McpServerProperties();
        config.setName("files");
        config.setUrl(url);
        config.setLocalOnly(localOnly);
        config.setAuthToken(TOKEN);
        config.setTimeout(Duration.ofSeconds(5));
        return new McpHttpTransport(config, client, objectMapper, Runnable::run);
    }

    private void enqueueHandshake(String sessionId) {
        engine.enqueueJson(200, INITIALIZE_RESULT, Map.of(McpHttpTransport.HEADER_SESSION_ID, sessionId));
        engine.enqueueStatus(202);
    }

    private static String textResult(int id, String text) {
        return "{\"jsonrpc\":\"2.0\",\"id\":" + id + ",\"result\":{\"content\":[{\"type\":\"text\",\"text\":\""
                + text + "\"}]}}";
    }

    private static Throwable failureOf(CompletableFuture<ToolResult> future) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        return e.getCause();
    }

    @Test
    void shouldPerformHandshakeBeforeListingTools() {
        McpHttpTransport transport = transport(URL, true);
        enqueueHandshake(SESSION_1);
        engine.enqueueJson(200, """
                {"jsonrpc":"2.0","id":2,"result":{"tools":[
                  {"name":"read_file","description":"Read a file",
                   "inputSchema":{"type":"object","properties":{"path":{"type":"string"}},"required":["path"]}}
                ]}}
                """);

        List<ToolDefinition> tools = transport.listTools();

        assertEquals(1, tools.size());
        assertEquals("read_file", tools.get(0).getName());
        assertEquals(List.of("path"), tools.get(0).getInputSchema().get("required"));

        OkHttpMockEngine.CapturedRequest initialize = engine.takeRequest();
        assertTrue(initialize.body().contains("\"method\":\"initialize\""));
        assertNull(initialize.header(McpHttpTransport.HEADER_SESSION_ID));
        assertEquals("Bearer " + TOKEN, initialize.header("Authorization"));

        OkHttpMockEngine.CapturedRequest initialized = engine.takeRequest();
        assertTrue(initialized.body().contains("notifications/initialized"));
        assertFalse(initialized.body().contains("\"id\""));
        assertEquals(SESSION_1, initialized.header(McpHttpTransport.HEADER_SESSION_ID));

        OkHttpMockEngine.CapturedRequest list = engine.takeRequest();
        assertTrue(list.body().contains("tools/list"));
        assertEquals(SESSION_1, list.header(McpHttpTransport.HEADER_SESSION_ID));
        assertEquals("Bearer " + TOKEN, list.header("Authorization"));
        assertTrue(list.header("Accept").contains("text/event-stream"));

        McpSession session = transport.currentSession().orElseThrow();
        assertEquals(SESSION_1, session.sessionId());
        assertEquals("2024-11-05", session.protocolVersion());
    }

    @Test
    void shouldFollowPaginationCursor() {
        McpHttpTransport transport = transport(URL, true);
        enqueueHandshake(SESSION_1);
        engine.enqueueJson(200, """
                {"jsonrpc":"2.0","id":2,"result":{"tools":[{"name":"a"}],"nextCursor":"page-2"}}
                """);
        engine.enqueueJson(200, """
                {"jsonrpc":"2.0","id":3,"result":{"tools":[{"name":"b"}]}}
                """);

        List<ToolDefinition> tools = transport.listTools();

        assertEquals(List.of("a", "b"), tools.stream().map(ToolDefinition::getName).toList());
        List<OkHttpMockEngine.CapturedRequest> requests = engine.takeAll();
        assertTrue(requests.get(3).body().contains("\"cursor\":\"page-2\""));
    }

    @Test
    void shouldReturnTextContentFromToolCall() throws Exception {
        McpHttpTransport transport = transport(URL, true);
        enqueueHandshake(SESSION_1);
        engine.enqueueJson(200, textResult(2, "hello from tool"));

        ToolResult result = transport.callTool("read_file", Map.of("path", "/tmp/a")).get(5, TimeUnit.SECONDS);

        assertTrue(result.isSuccess());
        assertEquals("hello from tool", result.getContent());
        List<OkHttpMockEngine.CapturedRequest> requests = engine.takeAll();
        assertTrue(requests.get(2).body().contains("\"name\":\"read_file\""));
        assertTrue(requests.get(2).body().contains("\"path\":\"/tmp/a\""));
    }

    @Test
    void shouldReadResponseFromEventStream() throws Exception {
        McpHttpTransport transport = transport(URL, true);
        enqueueHandshake(SESSION_1);
        engine.enqueueSse("""
                event: message
                data: {"jsonrpc":"2.0","method":"notifications/progress","params":{"progress":1}}

                event: message
                data: {"jsonrpc":"2.0","id":2,"result":{"content":[{"type":"text","text":"streamed"}]}}

                """, Map.of());

        ToolResult result = transport.callTool("read_file", Map.of()).get(5, TimeUnit.SECONDS);

        assertEquals("streamed", result.getContent());
    }

    @Test
    void shouldAdoptSessionIdReplacedByServer() throws Exception {
        McpHttpTransport transport = transport(URL, true);
        enqueueHandshake(SESSION_1);
        engine.enqueueJson(200, textResult(2, "ok"), Map.of(McpHttpTransport.HEADER_SESSION_ID, SESSION_2));
        engine.enqueueJson(200, textResult(3, "ok"));

        transport.callTool("read_file", Map.of()).get(5, TimeUnit.SECONDS);
        assertEquals(SESSION_2, transport.currentSession().orElseThrow().sessionId());

        transport.callTool("read_file", Map.of()).get(5, TimeUnit.SECONDS);
        List<OkHttpMockEngine.CapturedRequest> requests = engine.takeAll();
        assertEquals(SESSION_2, requests.get(3).header(McpHttpTransport.HEADER_SESSION_ID));
    }

    @Test
    void shouldInvalidateSessionOnNotFoundAndRehandshakeOnNextCall() throws Exception {
        McpHttpTransport transport = transport(URL, true);
        enqueueHandshake(SESSION_1);
        engine.enqueueStatus(404);

        Throwable failure = failureOf(transport.callTool("read_file", Map.of()));
        assertInstanceOf(SessionExpiredException.class, failure);
        assertTrue(transport.currentSession().isEmpty());

        enqueueHandshake(SESSION_2);
        engine.enqueueJson(200, textResult(4, "again"));

        ToolResult result = transport.callTool("read_file", Map.of()).get(5, TimeUnit.SECONDS);
        assertEquals("again", result.getContent());
        assertEquals(SESSION_2, transport.currentSession().orElseThrow().sessionId());
        assertEquals(6, engine.getRequestCount());
    }

    @Test
    void shouldIgnoreSessionIdFromReplyToDiscardedSession() throws Exception {
        McpHttpTransport transport = transport(URL, true);
        enqueueHandshake(SESSION_1);
        transport.initialize();
        McpSession stale = transport.currentSession().orElseThrow();
        assertEquals(SESSION_1, stale.sessionId());

        engine.enqueueStatus(404);
        failureOf(transport.callTool("read_file", Map.of()));
        enqueueHandshake(SESSION_2);
        transport.initialize();
        assertEquals(SESSION_2, transport.currentSession().orElseThrow().sessionId());

        // late reply to a request that went out on the old session
        engine.enqueueJson(200, textResult(9, "late"), Map.of(McpHttpTransport.HEADER_SESSION_ID, "session-1b"));
        transport.sendRequest("tools/call", Map.of("name", "read_file"), stale, null).get(5, TimeUnit.SECONDS);

        assertEquals(SESSION_2, transport.currentSession().orElseThrow().sessionId());
    }

    @Test
    void shouldNotRepeatHandshakeWhenAlreadyInitialized() {
        McpHttpTransport transport = transport(URL, true);
        enqueueHandshake(SESSION_1);

        transport.initialize();
        transport.initialize();

        assertEquals(2, engine.getRequestCount());
        assertEquals(SESSION_1, transport.currentSession().orElseThrow().sessionId());
    }

    @Test
    void shouldReportAuthFailure() {
        McpHttpTransport transport = transport(URL, true);
        engine.enqueueStatus(401);

        assertThrows(AuthException.class, transport::listTools);
        assertTrue(transport.currentSession().isEmpty());
    }

    @Test
    void shouldDiscardSessionOnConnectionFailure() {
        McpHttpTransport transport = transport(URL, true);
        enqueueHandshake(SESSION_1);
        engine.enqueueFailure(new IOException("connection reset"));

        Throwable failure = failureOf(transport.callTool("read_file", Map.of()));

        assertInstanceOf(TransportException.class, failure);
        assertTrue(transport.currentSession().isEmpty());
    }

    @Test
    void shouldMapTimeoutWithoutDiscardingSession() {
        McpHttpTransport transport = transport(URL, true);
        enqueueHandshake(SESSION_1);
        engine.enqueueFailure(new InterruptedIOException("timeout"));

        Throwable failure = failureOf(transport.callTool("slow_tool", Map.of()));

        assertInstanceOf(ToolTimeoutException.class, failure);
        assertEquals(SESSION_1, transport.currentSession().orElseThrow().sessionId());
    }

    @Test
    void shouldMapRemoteToolErrorToExecutionFailure() {
        McpHttpTransport transport = transport(URL, true);
        enqueueHandshake(SESSION_1);
        engine.enqueueJson(200, """
                {"jsonrpc":"2.0","id":2,"result":{"isError":true,"content":[{"type":"text","text":"disk full"}]}}
                """);

        Throwable failure = failureOf(transport.callTool("write_file", Map.of()));

        assertInstanceOf(ToolExecutionException.class, failure);
        assertEquals("disk full", failure.getMessage());
    }

    @Test
    void shouldMapMethodNotFoundToToolNotFound() {
        McpHttpTransport transport = transport(URL, true);
        enqueueHandshake(SESSION_1);
        engine.enqueueJson(200, """
                {"jsonrpc":"2.0","id":2,"error":{"code":-32602,"message":"Unknown tool: nope"}}
                """);

        Throwable failure = failureOf(transport.callTool("nope", Map.of()));

        assertInstanceOf(ToolNotFoundException.class, failure);
    }

    @Test
    void shouldDescribeNonTextContent() throws Exception {
        McpHttpTransport transport = transport(URL, true);
        enqueueHandshake(SESSION_1);
        engine.enqueueJson(200, """
                {"jsonrpc":"2.0","id":2,"result":{"content":[
                  {"type":"text","text":"caption"},{"type":"image","data":"AAAA","mimeType":"image/png"}]}}
                """);

        ToolResult result = transport.callTool("screenshot", Map.of()).get(5, TimeUnit.SECONDS);

        assertEquals("caption\n[image content]", result.getContent());
    }

    @Test
    void shouldRefuseNonLoopbackEndpointInLocalOnlyMode() {
        McpHttpTransport transport = transport("http://10.1.2.3:8931/mcp", true);

        assertThrows(TransportException.class, transport::listTools);
        assertEquals(0, engine.getRequestCount());
    }

    @Test
    void shouldDialRemoteEndpointWhenLocalOnlyDisabled() {
        McpHttpTransport transport = transport("http://tools.internal:8931/mcp", false);
        enqueueHandshake(SESSION_1);
        engine.enqueueJson(200, "{\"jsonrpc\":\"2.0\",\"id\":2,\"result\":{\"tools\":[]}}");

        assertTrue(transport.listTools().isEmpty());
        assertEquals(3, engine.getRequestCount());
    }

    @Test
    void shouldExposeNoToolsWithoutUrl() {
        McpHttpTransport transport = transport("", true);

        transport.initialize();

        assertTrue(transport.listTools().isEmpty());
        assertEquals(0, engine.getRequestCount());
        assertInstanceOf(TransportException.class, failureOf(transport.callTool("any", Map.of())));
    }

    @Test
    void shouldTerminateSessionOnClose() {
        McpHttpTransport transport = transport(URL, true);
        enqueueHandshake(SESSION_1);
        transport.initialize();
        engine.takeAll();
        engine.enqueueStatus(200);

        transport.close();

        OkHttpMockEngine.CapturedRequest delete = engine.takeRequest();
        assertEquals("DELETE", delete.method());
        assertEquals(SESSION_1, delete.header(McpHttpTransport.HEADER_SESSION_ID));
        assertTrue(transport.currentSession().isEmpty());
    }

    @Test
    void shouldRecognizeLoopbackLiterals() {
        assertTrue(McpHttpTransport.isLoopback("localhost"));
        assertTrue(McpHttpTransport.isLoopback("127.0.0.1"));
        assertTrue(McpHttpTransport.isLoopback("::1"));
        assertFalse(McpHttpTransport.isLoopback("192.168.0.10"));
        assertFalse(McpHttpTransport.isLoopback("example.com"));
    }
}
