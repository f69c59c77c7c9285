/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.digdug.http;

import com.sun.net.httpserver.HttpServer;
import io.digdug.process.TestPorts;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

class ApacheHttpClientTest {

    HttpServer server;
    String baseUrl;
    ApacheHttpClient client;
    final Map<String, String> received = new ConcurrentHashMap<>();

    @BeforeEach
    void beforeEach() throws Exception {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/echo", exchange -> {
            received.put("method", exchange.getRequestMethod());
            String auth = exchange.getRequestHeaders().getFirst("Authorization");
            if (auth != null) {
                received.put("auth", auth);
            }
            received.put("contentType", String.valueOf(exchange.getRequestHeaders().getFirst("Content-Type")));
            byte[] body = exchange.getRequestBody().readAllBytes();
            exchange.getResponseHeaders().add("X-Test", "yes");
            exchange.sendResponseHeaders(201, body.length == 0 ? -1 : body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        server.createContext("/fail", exchange -> {
            byte[] body = "{\"error\":\"broken\"}".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(500, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        server.start();
        baseUrl = "http://localhost:" + server.getAddress().getPort();
        client = new ApacheHttpClient().connectTimeout(2000).readTimeout(2000);
    }

    @AfterEach
    void afterEach() throws Exception {
        client.close();
        server.stop(0);
    }

    @Test
    void testJsonPut() {
        HttpResponse response = client.invoke(HttpRequest.put(baseUrl + "/echo")
                .basicAuth("jane", "s3cret")
                .json(Map.of("passed", true)));
        assertEquals(201, response.status());
        assertTrue(response.isSuccess());
        assertEquals("{\"passed\":true}", response.getBodyString());
        assertEquals(Map.of("passed", true), response.getBodyJson());
        assertEquals("yes", response.getHeader("x-test"));
        assertEquals("PUT", received.get("method"));
        assertEquals("Basic amFuZTpzM2NyZXQ=", received.get("auth"));
        assertTrue(received.get("contentType").startsWith("application/json"));
    }

    @Test
    void testErrorStatusIsReturned() {
        HttpResponse response = client.invoke(HttpRequest.get(baseUrl + "/fail"));
        assertEquals(500, response.status());
        assertTrue(response.isServerError());
        assertFalse(response.isSuccess());
    }

    @Test
    void testEmptyBody() {
        HttpResponse response = client.invoke(HttpRequest.get(baseUrl + "/echo"));
        assertEquals("", response.getBodyString());
        assertNull(response.getBodyJson());
    }

    @Test
    void testStream() {
        String body = client.stream(baseUrl + "/fail", (status, length, in) -> status + ":" + length + ":"
                + new String(in.readAllBytes(), StandardCharsets.UTF_8));
        assertEquals("500:18:{\"error\":\"broken\"}", body);
    }

    @Test
    void testConnectionRefused() {
        String url = "http://localhost:" + TestPorts.freePort() + "/";
        assertThrows(UncheckedIOException.class, () -> client.invoke(HttpRequest.get(url)));
    }

}
