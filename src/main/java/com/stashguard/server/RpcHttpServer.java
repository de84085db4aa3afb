package com.stashguard.server;

import com.stashguard.rpc.PayloadLimits;
import com.stashguard.rpc.RpcDispatcher;
import com.stashguard.rpc.RpcResponse;
import com.stashguard.rpc.RpcStatus;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * HTTP transport for the RPC dispatcher: {@code POST /rpc} with a JSON envelope body and an
 * optional {@code Authorization: Bearer <token>} header.
 */
public class RpcHttpServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(RpcHttpServer.class);

    public static final String RPC_PATH = "/rpc";
    private static final String BEARER_PREFIX = "Bearer ";
    // UTF-8 encodes a char in at most 4 bytes, so anything longer is over the char limit too.
    private static final int MAX_BODY_BYTES = PayloadLimits.MAX_PAYLOAD_CHARS * 4;

    private final RpcDispatcher dispatcher;
    private final String bindHost;
    private final int port;

    private HttpServer server;
    private ExecutorService executor;

    public RpcHttpServer(RpcDispatcher dispatcher, String bindHost, int port) {
        this.dispatcher = dispatcher;
        this.bindHost = bindHost;
        this.port = port;
    }

    /**
     * Binds the socket and starts serving.
     *
     * @throws IOException if the address cannot be bound
     */
    public synchronized void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("Server already started");
        }
        server = HttpServer.create(new InetSocketAddress(bindHost, port), 0);
        server.createContext(RPC_PATH, this::handle);
        executor = Executors.newFixedThreadPool(Math.max(2, Runtime.getRuntime().availableProcessors() * 2));
        server.setExecutor(executor);
        server.start();
        LOGGER.info("RPC server listening on {}:{}", bindHost, getPort());
    }

    /**
     * @return the bound port, which differs from the configured one when that was 0
     */
    public synchronized int getPort() {
        return server == null ? port : server.getAddress().getPort();
    }

    public synchronized void stop() {
        if (server == null) {
            return;
        }
        server.stop(1);
        executor.shutdown();
        server = null;
        executor = null;
        LOGGER.info("RPC server stopped");
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.getResponseHeaders().add("Allow", "POST");
                exchange.sendResponseHeaders(405, -1);
                return;
            }
            if (!RPC_PATH.equals(exchange.getRequestURI().getPath())) {
                exchange.sendResponseHeaders(404, -1);
                return;
            }

            RpcResponse response;
            String body = readBody(exchange.getRequestBody());
            if (body == null) {
                response = RpcResponse.error(null, RpcStatus.INVALID_ARGUMENT,
                    "Payload exceeds limit of " + PayloadLimits.MAX_PAYLOAD_CHARS + " characters");
            } else {
                response = dispatcher.dispatch(body, bearerToken(exchange.getRequestHeaders().getFirst("Authorization")));
            }
            send(exchange, response);
        } catch (IOException e) {
            LOGGER.warn("I/O error serving {}: {}", exchange.getRemoteAddress(), e.getMessage());
            throw e;
        } finally {
            exchange.close();
        }
    }

    /**
     * Extracts the token from an {@code Authorization} header value.
     *
     * @return the token, or null if the header is absent or not a bearer credential
     */
    static String bearerToken(String header) {
        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    private static String readBody(InputStream in) throws IOException {
        byte[] bytes = in.readNBytes(MAX_BODY_BYTES + 1);
        if (bytes.length > MAX_BODY_BYTES) {
            return null;
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static void send(HttpExchange exchange, RpcResponse response) throws IOException {
        byte[] payload = response.body().toString().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json; charset=utf-8");
        exchange.getResponseHeaders().add("Cache-Control", "no-store");
        exchange.sendResponseHeaders(response.httpStatus(), payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }
}
