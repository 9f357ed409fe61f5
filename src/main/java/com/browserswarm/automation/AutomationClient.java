package com.browserswarm.automation;

import com.browserswarm.config.SwarmProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpTransportSessionNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Session-bound client for the remote browser-control backend, on top of the MCP sync client.
 * <p>
 * The streamable-HTTP transport handles the session header, event-stream replies and pushed
 * responses. This class adds what the worker needs around it: a built-in catalog when the
 * backend cannot be reached, exactly one re-handshake and retry when the session expired, and
 * {@link #callOperation(String, Map)} never throwing; every failure ends up in
 * {@link OperationResult#error()}.
 */
@Slf4j
public class AutomationClient implements AutoCloseable {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final String SESSION_NOT_FOUND = "session not found";
    private static final TypeReference<Map<String, Object>> SCHEMA_TYPE = new TypeReference<>() {
    };

    private final SwarmProperties.Automation config;
    private final Supplier<McpSyncClient> sessionFactory;
    private final ObjectMapper objectMapper;

    @Nullable
    private McpSyncClient session;
    private volatile List<AutomationOperation> operations = List.of();
    private volatile boolean fallbackCatalog;

    public AutomationClient(SwarmProperties.Automation config, ObjectMapper objectMapper) {
        this(config, streamableHttp(config), objectMapper);
    }

    AutomationClient(SwarmProperties.Automation config, Supplier<McpSyncClient> sessionFactory, ObjectMapper objectMapper) {
        this.config = config;
        this.sessionFactory = sessionFactory;
        this.objectMapper = objectMapper;
    }

    /**
     * Performs the handshake and loads the operation catalog. On any failure the built-in
     * fallback catalog is used instead, so basic operations can still be attempted.
     */
    public synchronized void connect() {
        try {
            McpSchema.ListToolsResult catalog = session().listTools();
            operations = parseCatalog(catalog);
            fallbackCatalog = false;
            log.info("Loaded {} operations from automation backend at {}.", operations.size(), config.endpointUrl());
        } catch (RuntimeException ex) {
            log.error("Failed to initialize automation session: {}", describe(ex));
            closeSession();
            operations = fallbackOperations();
            fallbackCatalog = true;
        }
    }

    public OperationResult callOperation(String name, @Nullable Map<String, Object> arguments) {
        McpSchema.CallToolRequest request = new McpSchema.CallToolRequest(name, arguments != null ? arguments : Map.of());
        try {
            McpSchema.CallToolResult result;
            try {
                result = invoke(request);
            } catch (SessionExpiredException ex) {
                log.warn("Automation session expired during {}; re-handshaking once.", name);
                renewSession();
                result = invoke(request);
            }
            return toOperationResult(result);
        } catch (RuntimeException ex) {
            String reason = describe(ex);
            log.error("Operation {} failed: {}", name, reason);
            return OperationResult.failure("Failed to execute operation " + name + ": " + reason);
        }
    }

    public List<AutomationOperation> operations() {
        return operations;
    }

    public boolean usingFallbackCatalog() {
        return fallbackCatalog;
    }

    @Override
    public synchronized void close() {
        closeSession();
    }

    private McpSchema.CallToolResult invoke(McpSchema.CallToolRequest request) {
        McpSyncClient current = session();
        try {
            return current.callTool(request);
        } catch (RuntimeException ex) {
            if (isSessionExpired(ex)) {
                throw new SessionExpiredException(describe(ex), ex);
            }
            throw ex;
        }
    }

    private synchronized McpSyncClient session() {
        if (session == null) {
            session = openSession();
        }
        return session;
    }

    private synchronized void renewSession() {
        closeSession();
        session = openSession();
    }

    private McpSyncClient openSession() {
        McpSyncClient created = sessionFactory.get();
        try {
            McpSchema.InitializeResult initialized = created.initialize();
            String server = initialized != null && initialized.serverInfo() != null
                    ? initialized.serverInfo().name()
                    : "unknown server";
            log.info("Automation session initialized with {}.", server);
            return created;
        } catch (RuntimeException ex) {
            close(created);
            throw ex;
        }
    }

    private void closeSession() {
        if (session != null) {
            close(session);
            session = null;
        }
    }

    private static void close(McpSyncClient client) {
        try {
            if (!client.closeGracefully()) {
                client.close();
            }
        } catch (RuntimeException ex) {
            log.warn("Failed to close automation session: {}", ex.getMessage());
        }
    }

    private OperationResult toOperationResult(McpSchema.CallToolResult result) {
        List<String> texts = new ArrayList<>();
        List<ImageAttachment> images = new ArrayList<>();
        if (result.content() != null) {
            for (McpSchema.Content item : result.content()) {
                if (item instanceof McpSchema.TextContent text) {
                    texts.add(text.text());
                } else if (item instanceof McpSchema.ImageContent image) {
                    images.add(new ImageAttachment(
                            Base64.getDecoder().decode(image.data()),
                            image.mimeType() != null ? image.mimeType() : "image/png"));
                } else if (item instanceof McpSchema.EmbeddedResource embedded
                        && embedded.resource() instanceof McpSchema.TextResourceContents resource) {
                    texts.add(resource.text());
                }
            }
        }
        if (Boolean.TRUE.equals(result.isError())) {
            String error = texts.isEmpty() ? "Operation reported an error" : String.join("\n", texts);
            return new OperationResult(texts, images, error);
        }
        return new OperationResult(texts, images, null);
    }

    private List<AutomationOperation> parseCatalog(McpSchema.ListToolsResult catalog) {
        if (catalog == null || catalog.tools() == null) {
            throw new AutomationProtocolException("Operation catalog is missing");
        }
        List<AutomationOperation> parsed = new ArrayList<>();
        for (McpSchema.Tool tool : catalog.tools()) {
            Map<String, Object> schema = tool.inputSchema() != null
                    ? objectMapper.convertValue(tool.inputSchema(), SCHEMA_TYPE)
                    : Map.of();
            parsed.add(new AutomationOperation(tool.name(), tool.description(), schema));
        }
        return List.copyOf(parsed);
    }

    static boolean isSessionExpired(Throwable error) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof McpTransportSessionNotFoundException) {
                return true;
            }
            String message = cause.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains(SESSION_NOT_FOUND)) {
                return true;
            }
        }
        return false;
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    static Supplier<McpSyncClient> streamableHttp(SwarmProperties.Automation config) {
        return () -> {
            HttpClientStreamableHttpTransport transport = HttpClientStreamableHttpTransport.builder(config.getServerUrl())
                    .endpoint(config.getEndpointPath())
                    .connectTimeout(CONNECT_TIMEOUT)
                    .build();
            return McpClient.sync(transport)
                    .requestTimeout(config.getRequestTimeout())
                    .initializationTimeout(config.getRequestTimeout())
                    .clientInfo(new McpSchema.Implementation(config.getClientName(), config.getClientVersion()))
                    .build();
        };
    }

    static List<AutomationOperation> fallbackOperations() {
        return List.of(
                new AutomationOperation("browser_navigate", "Navigate to a URL",
                        objectSchema(Map.of("url", property("URL to navigate to")), List.of("url"))),
                new AutomationOperation("browser_click", "Click on an element",
                        objectSchema(Map.of(
                                "element", property("Element description"),
                                "ref", property("Element reference")), List.of("element", "ref"))),
                new AutomationOperation("browser_type", "Type text into an element",
                        objectSchema(Map.of(
                                "element", property("Element description"),
                                "ref", property("Element reference"),
                                "text", property("Text to type")), List.of("element", "ref", "text"))),
                new AutomationOperation("browser_snapshot", "Get accessibility snapshot of the page",
                        objectSchema(Map.of(), List.of())));
    }

    private static Map<String, Object> objectSchema(Map<String, Object> properties, List<String> required) {
        return Map.of("type", "object", "properties", properties, "required", required);
    }

    private static Map<String, Object> property(String description) {
        return Map.of("type", "string", "description", description);
    }
}
