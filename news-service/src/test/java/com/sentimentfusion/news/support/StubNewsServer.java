package com.sentimentfusion.news.support;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process HTTP stub that serves canned JSON and records what it was asked for.
 */
public final class StubNewsServer implements AutoCloseable {

    private final HttpServer server;
    private final List<URI> requests = new CopyOnWriteArrayList<>();
    private final List<Map<String, List<String>>> headers = new CopyOnWriteArrayList<>();

    private StubNewsServer(HttpServer server) {
        this.server = server;
    }

    public static StubNewsServer start(String path, int status, String body) {
        try {
            HttpServer http = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
            StubNewsServer stub = new StubNewsServer(http);
            http.createContext(path, exchange -> stub.respond(exchange, status, body));
            http.start();
            return stub;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String fixture(String name) {
        try (InputStream in = StubNewsServer.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) throw new IllegalArgumentException("Missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public String baseUrl() {
        return "http://localhost:" + server.getAddress().getPort();
    }

    public List<URI> requests() {
        return requests;
    }

    public String header(int request, String name) {
        List<String> values = headers.get(request).get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private void respond(HttpExchange exchange, int status, String body) throws IOException {
        requests.add(exchange.getRequestURI());
        headers.add(exchange.getRequestHeaders());
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
        exchange.close();
    }

    @Override
    public void close() {
        server.stop(0);
    }
}
