package com.cronhooks.support;

import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Local HTTP endpoint that records every request and answers with a configured status and body.
 */
public class MockWebhookServer implements AutoCloseable {

    public static class RecordedRequest {
        public final String path;
        public final String method;
        public final String body;
        public final Map<String, List<String>> headers;

        RecordedRequest(String path, String method, String body, Map<String, List<String>> headers) {
            this.path = path;
            this.method = method;
            this.body = body;
            this.headers = headers;
        }

        public String header(String name) {
            for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
                if (entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
                    return entry.getValue().get(0);
                }
            }
            return null;
        }
    }

    private static class Reply {
        final int status;
        final String body;
        final long delayMillis;

        Reply(int status, String body, long delayMillis) {
            this.status = status;
            this.body = body;
            this.delayMillis = delayMillis;
        }
    }

    private final HttpServer server;
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
    private final Map<String, Reply> replies = new ConcurrentHashMap<>();
    private final Map<String, CountDownLatch> latches = new ConcurrentHashMap<>();
    private boolean closed;

    public MockWebhookServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            String path = exchange.getRequestURI().getPath();
            String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            Map<String, List<String>> headers = new ConcurrentHashMap<>();
            exchange.getRequestHeaders().forEach((name, values) -> headers.put(name, new ArrayList<>(values)));
            requests.add(new RecordedRequest(path, exchange.getRequestMethod(), body, headers));

            Reply reply = replies.getOrDefault(path, new Reply(200, "", 0));
            if (reply.delayMillis > 0) {
                try {
                    Thread.sleep(reply.delayMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }

            byte[] bytes = reply.body.getBytes(StandardCharsets.UTF_8);
            try {
                exchange.sendResponseHeaders(reply.status, bytes.length == 0 ? -1 : bytes.length);
                if (bytes.length > 0) {
                    try (OutputStream os = exchange.getResponseBody()) {
                        os.write(bytes);
                    }
                }
            } catch (IOException e) {
                // Client went away, e.g. after a timeout
            } finally {
                exchange.close();
                CountDownLatch latch = latches.get(path);
                if (latch != null) {
                    latch.countDown();
                }
            }
        });
        server.setExecutor(executor);
        server.start();
    }

    public MockWebhookServer respond(String path, int status, String body) {
        replies.put(path, new Reply(status, body, 0));
        return this;
    }

    public MockWebhookServer respondSlowly(String path, int status, String body, long delayMillis) {
        replies.put(path, new Reply(status, body, delayMillis));
        return this;
    }

    /**
     * Latch that counts down once per completed request to {@code path}. Call before the requests are made.
     */
    public CountDownLatch expect(String path, int count) {
        CountDownLatch latch = new CountDownLatch(count);
        latches.put(path, latch);
        return latch;
    }

    public boolean await(CountDownLatch latch, long seconds) throws InterruptedException {
        return latch.await(seconds, TimeUnit.SECONDS);
    }

    public String url(String path) {
        return "http://127.0.0.1:" + server.getAddress().getPort() + path;
    }

    public List<RecordedRequest> requests() {
        return new ArrayList<>(requests);
    }

    public List<RecordedRequest> requests(String path) {
        return requests.stream().filter(r -> r.path.equals(path)).collect(Collectors.toList());
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        server.stop(0);
        executor.shutdownNow();
    }
}
