package io.calcport.engine.server;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.calcport.engine.execution.TranslationRequest;
import io.calcport.engine.execution.TranslationResponse;
import io.calcport.engine.execution.WorkbookTranslator;
import io.calcport.engine.mapping.IdentifierMapper;
import io.calcport.engine.mapping.IdentifierTable;
import io.calcport.engine.mapping.MappingException;
import io.calcport.engine.mapping.MappingImportException;
import io.calcport.engine.mapping.MappingUpdate;
import io.calcport.engine.mapping.NamingConflictException;
import io.calcport.engine.mapping.ReservedWords;
import io.calcport.engine.serialization.TranslationCodec;
import io.calcport.engine.translate.TranslatorOptions;
import io.calcport.engine.transpiler.DuckDBDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON-over-HTTP front end for the translator.
 *
 * Uses Java's built-in com.sun.net.httpserver - no external dependencies.
 *
 * Endpoints:
 * - POST /translate - Translate a workbook's calculations
 * - POST /mappings/generate - Assign identifiers for a field list
 * - POST /mappings/import - Validate and normalise a persisted mapping table
 * - POST /mappings/rename - Give one field a new identifier
 * - GET /health - Health check
 */
public class CalcHttpServer {

    private static final Logger log = LoggerFactory.getLogger(CalcHttpServer.class);

    private final HttpServer server;
    private final TranslatorOptions defaults;
    private final IdentifierMapper mapper = new IdentifierMapper();
    private final TranslationCodec codec = new TranslationCodec(mapper);
    private final WorkbookTranslator translator = new WorkbookTranslator(DuckDBDialect.INSTANCE);

    public CalcHttpServer(int port) throws IOException {
        this(port, TranslatorOptions.fromSystemProperties());
    }

    public CalcHttpServer(int port, TranslatorOptions defaults) throws IOException {
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.defaults = defaults;
        setupRoutes();
    }

    private void setupRoutes() {
        server.createContext("/translate", new JsonHandler() {
            @Override
            Object handle(Map<String, Object> body) {
                TranslationRequest request = codec.readRequest(body, defaults);
                TranslationResponse response = translator.translate(request);
                return codec.writeResponse(response);
            }
        });

        server.createContext("/mappings/generate", new JsonHandler() {
            @Override
            Object handle(Map<String, Object> body) {
                TranslationRequest request = codec.readRequest(body, defaults);
                IdentifierTable table = mapper.assignAll(
                        request.table().withReservedWords(reservedWords(request.options())), request.fields());
                return tableTree(table);
            }
        });

        server.createContext("/mappings/import", new JsonHandler() {
            @Override
            Object handle(Map<String, Object> body) {
                return tableTree(importTable(body));
            }
        });

        server.createContext("/mappings/rename", new JsonHandler() {
            @Override
            Object handle(Map<String, Object> body) {
                String sourceKey = CalcHttpJson.getString(body, "source_key");
                String identifier = CalcHttpJson.getString(body, "identifier");
                if (sourceKey == null || identifier == null) {
                    throw new IllegalArgumentException("Rename needs 'source_key' and 'identifier'");
                }
                MappingUpdate update = mapper.rename(importTable(body), sourceKey, identifier);
                Map<String, Object> tree = tableTree(update.table());
                tree.put("status", update.status().wireName());
                return tree;
            }
        });

        server.createContext("/health", exchange -> {
            addCorsHeaders(exchange);
            sendResponse(exchange, 200, "{\"status\":\"ok\"}");
        });
    }

    private IdentifierTable importTable(Map<String, Object> body) {
        List<Object> records = CalcHttpJson.getList(body, "mappings");
        if (records == null) {
            throw new IllegalArgumentException("Request needs a 'mappings' array");
        }
        TranslatorOptions options = TranslationCodec.readOptions(body.get("options"), defaults);
        return codec.mappings().importRecords(records, reservedWords(options));
    }

    private Map<String, Object> tableTree(IdentifierTable table) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("mappings", codec.mappings().export(table));
        tree.put("summary", codec.summary(table.summary()));
        return tree;
    }

    private static ReservedWords reservedWords(TranslatorOptions options) {
        return ReservedWords.forDialect(DuckDBDialect.INSTANCE, options.sourceRelation(), options.rowAlias());
    }

    /**
     * POST-only handler taking and returning JSON. Maps rejected input to 4xx.
     */
    private abstract class JsonHandler implements HttpHandler {

        abstract Object handle(Map<String, Object> body);

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            addCorsHeaders(exchange);
            if ("OPTIONS".equals(exchange.getRequestMethod())) {
                exchange.sendResponseHeaders(204, -1);
                exchange.close();
                return;
            }
            if (!"POST".equals(exchange.getRequestMethod())) {
                sendResponse(exchange, 405, error("Method not allowed"));
                return;
            }
            String path = exchange.getRequestURI().getPath();
            try {
                Map<String, Object> body = CalcHttpJson.parseObject(readBody(exchange));
                sendResponse(exchange, 200, CalcHttpJson.toJson(handle(body)));
            } catch (NamingConflictException e) {
                Map<String, Object> tree = new LinkedHashMap<>();
                tree.put("error", e.getMessage());
                tree.put("diagnostics", codec.diagnostics(List.of(e.toDiagnostic())));
                sendResponse(exchange, 409, CalcHttpJson.toJson(tree));
            } catch (MappingImportException e) {
                List<Object> problems = new ArrayList<>();
                for (MappingImportException.Problem p : e.problems()) {
                    Map<String, Object> problem = new LinkedHashMap<>();
                    problem.put("index", p.index());
                    problem.put("source_key", p.sourceKey());
                    problem.put("reason", p.reason());
                    problems.add(problem);
                }
                Map<String, Object> tree = new LinkedHashMap<>();
                tree.put("error", "Mapping import rejected");
                tree.put("problems", problems);
                sendResponse(exchange, 422, CalcHttpJson.toJson(tree));
            } catch (MappingException e) {
                sendResponse(exchange, 422, error(e.getMessage()));
            } catch (IllegalArgumentException e) {
                log.debug("Bad request to {}: {}", path, e.getMessage());
                sendResponse(exchange, 400, error(e.getMessage()));
            } catch (RuntimeException e) {
                log.error("Request to {} failed", path, e);
                sendResponse(exchange, 500, error(String.valueOf(e.getMessage())));
            }
        }
    }

    private static String error(String message) {
        return CalcHttpJson.toJson(Map.of("error", message == null ? "" : message));
    }

    private static void addCorsHeaders(HttpExchange exchange) {
        exchange.getResponseHeaders().add("Access-Control-Allow-Origin", "*");
        exchange.getResponseHeaders().add("Access-Control-Allow-Methods", "GET, POST, OPTIONS");
        exchange.getResponseHeaders().add("Access-Control-Allow-Headers", "Content-Type");
    }

    private static String readBody(HttpExchange exchange) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static void sendResponse(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    public void start() {
        server.setExecutor(null);
        server.start();
        log.info("Calculation translator listening on port {}", getPort());
    }

    public void stop() {
        server.stop(0);
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    public static void main(String[] args) throws IOException {
        int port = 8080;
        if (args.length > 0) {
            try {
                port = Integer.parseInt(args[0]);
            } catch (NumberFormatException e) {
                log.warn("Invalid port '{}', using {}", args[0], port);
            }
        }

        CalcHttpServer server = new CalcHttpServer(port);
        server.start();
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop));
    }
}
