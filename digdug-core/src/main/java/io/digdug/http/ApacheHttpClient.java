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

import org.apache.hc.client5.http.auth.AuthScope;
import org.apache.hc.client5.http.auth.UsernamePasswordCredentials;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.DefaultRedirectStrategy;
import org.apache.hc.client5.http.impl.auth.BasicCredentialsProvider;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.HttpMessage;
import org.apache.hc.core5.http.io.SocketConfig;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Blocking HTTP client used for artifact downloads and provider REST calls.
 * <p>
 * Automatic retries are disabled: callers own their retry policy. Transport failures surface
 * as {@link UncheckedIOException}, non-2xx responses are returned to the caller.
 */
public class ApacheHttpClient implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ApacheHttpClient.class);

    private CloseableHttpClient httpClient;
    private volatile HttpUriRequestBase currentRequest;

    private int readTimeout = 30000;
    private int connectTimeout = 30000;
    private ProxySettings proxy;

    /**
     * Receives a streamed response. The stream is closed by the client after the handler returns.
     */
    @FunctionalInterface
    public interface StreamHandler<T> {
        T handle(int status, long contentLength, InputStream body) throws IOException;
    }

    public ApacheHttpClient proxy(ProxySettings proxy) {
        this.proxy = proxy;
        httpClient = null; // will force lazy rebuild
        return this;
    }

    public ApacheHttpClient readTimeout(int millis) {
        this.readTimeout = millis;
        httpClient = null;
        return this;
    }

    public ApacheHttpClient connectTimeout(int millis) {
        this.connectTimeout = millis;
        httpClient = null;
        return this;
    }

    private synchronized CloseableHttpClient client() {
        if (httpClient == null) {
            initHttpClient();
        }
        return httpClient;
    }

    private void initHttpClient() {
        PoolingHttpClientConnectionManagerBuilder connectionManagerBuilder = PoolingHttpClientConnectionManagerBuilder.create();
        HttpClientBuilder clientBuilder = HttpClientBuilder.create();
        clientBuilder.useSystemProperties();
        clientBuilder.disableAutomaticRetries();
        clientBuilder.setRedirectStrategy(DefaultRedirectStrategy.INSTANCE);
        clientBuilder.disableCookieManagement();
        connectionManagerBuilder
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setSocketTimeout(readTimeout, TimeUnit.MILLISECONDS)
                        .setConnectTimeout(connectTimeout, TimeUnit.MILLISECONDS)
                        .build())
                .setDefaultSocketConfig(SocketConfig.custom()
                        .setSoTimeout(readTimeout, TimeUnit.MILLISECONDS).build());
        RequestConfig.Builder configBuilder = RequestConfig.custom()
                .setResponseTimeout(readTimeout, TimeUnit.MILLISECONDS);
        if (proxy != null) {
            HttpHost proxyHost = new HttpHost(proxy.scheme(), proxy.host(), proxy.port());
            clientBuilder.setProxy(proxyHost);
            if (proxy.hasCredentials()) {
                BasicCredentialsProvider credsProvider = new BasicCredentialsProvider();
                char[] password = proxy.password() == null ? new char[0] : proxy.password().toCharArray();
                credsProvider.setCredentials(new AuthScope(proxyHost), new UsernamePasswordCredentials(proxy.username(), password));
                clientBuilder.setDefaultCredentialsProvider(credsProvider);
            }
            LOGGER.debug("using proxy: {}", proxy);
        }
        clientBuilder
                .setDefaultRequestConfig(configBuilder.build())
                .setConnectionManager(connectionManagerBuilder.build());
        httpClient = clientBuilder.build();
        LOGGER.debug("http client created");
    }

    /**
     * Send a request and read the full response body.
     *
     * @throws UncheckedIOException on transport errors
     */
    public HttpResponse invoke(HttpRequest request) {
        HttpUriRequestBase httpRequest = new HttpUriRequestBase(request.getMethod(), URI.create(request.getUrl()));
        request.getHeaders().forEach(httpRequest::addHeader);
        if (request.getBody() != null) {
            String contentType = request.getHeader(HttpRequest.CONTENT_TYPE);
            httpRequest.setEntity(new ByteArrayEntity(request.getBody(),
                    contentType == null ? ContentType.APPLICATION_OCTET_STREAM : ContentType.parse(contentType)));
        }
        LOGGER.debug("request: {}", request);
        HttpResponse response = execute(httpRequest, r -> {
            HttpEntity entity = r.getEntity();
            byte[] bytes = entity == null ? new byte[0] : EntityUtils.toByteArray(entity);
            return new HttpResponse(r.getCode(), toHeaders(r), bytes);
        });
        LOGGER.debug("response: {} {}", request, response.status());
        return response;
    }

    /**
     * GET the url and hand the body stream to the handler.
     *
     * @throws UncheckedIOException on transport errors, or if the handler throws an IOException
     */
    public <T> T stream(String url, StreamHandler<T> handler) {
        LOGGER.debug("request: GET {}", url);
        return execute(new HttpGet(url), r -> {
            HttpEntity entity = r.getEntity();
            if (entity == null) {
                return handler.handle(r.getCode(), 0, InputStream.nullInputStream());
            }
            try (InputStream is = entity.getContent()) {
                return handler.handle(r.getCode(), entity.getContentLength(), is);
            }
        });
    }

    private <T> T execute(HttpUriRequestBase request, ResponseReader<T> reader) {
        currentRequest = request;
        try {
            return client().execute(request, reader::read);
        } catch (IOException e) {
            throw new UncheckedIOException(request.getMethod() + " " + request.getRequestUri() + " failed: " + e.getMessage(), e);
        } finally {
            currentRequest = null;
        }
    }

    @FunctionalInterface
    private interface ResponseReader<T> {
        T read(ClassicHttpResponse response) throws IOException;
    }

    /**
     * Abort the request in flight, if any. The blocked caller fails with an IOException.
     */
    public void abort() {
        HttpUriRequestBase req = currentRequest;
        if (req != null) {
            req.abort();
            LOGGER.debug("http request aborted");
        }
    }

    private static Map<String, List<String>> toHeaders(HttpMessage msg) {
        Header[] headers = msg.getHeaders();
        Map<String, List<String>> map = new LinkedHashMap<>(headers.length);
        for (Header header : headers) {
            map.computeIfAbsent(header.getName(), k -> new ArrayList<>()).add(header.getValue());
        }
        return map;
    }

    @Override
    public synchronized void close() throws IOException {
        if (httpClient != null) {
            try {
                httpClient.close();
                LOGGER.debug("http client closed");
            } finally {
                httpClient = null;
            }
        }
    }

}
