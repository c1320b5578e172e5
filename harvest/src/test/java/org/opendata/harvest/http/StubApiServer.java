/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.opendata.harvest.http;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * In-process HTTP server standing in for the open-data API in tests.
 *
 * <p>Handlers are matched by path prefix, longest first registered wins on
 * ties. Unmatched paths return 404.
 */
public class StubApiServer implements AutoCloseable {

  /**
   * Produces the response for one request.
   */
  @FunctionalInterface
  public interface Responder {
    StubResponse respond(URI uri, Headers headers) throws IOException;
  }

  /**
   * Status and body of a stub response.
   */
  public static final class StubResponse {
    final int status;
    final byte[] body;
    final String contentType;

    private StubResponse(int status, byte[] body, String contentType) {
      this.status = status;
      this.body = body;
      this.contentType = contentType;
    }

    public static StubResponse json(String body) {
      return new StubResponse(200, body.getBytes(StandardCharsets.UTF_8), "application/json");
    }

    public static StubResponse csv(String body) {
      return new StubResponse(200, body.getBytes(StandardCharsets.UTF_8), "text/csv");
    }

    public static StubResponse status(int status, String body) {
      return new StubResponse(status, body.getBytes(StandardCharsets.UTF_8), "text/plain");
    }
  }

  private final HttpServer server;
  private final ExecutorService executor;
  private final Map<String, Responder> responders = new LinkedHashMap<String, Responder>();
  private final List<URI> requests = new ArrayList<URI>();
  private final List<Headers> requestHeaders = new ArrayList<Headers>();

  public StubApiServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
    executor = Executors.newFixedThreadPool(16);
    server.setExecutor(executor);
    server.createContext("/", this::handle);
    server.start();
  }

  public String baseUrl() {
    return "http://127.0.0.1:" + server.getAddress().getPort();
  }

  public synchronized StubApiServer on(String pathPrefix, Responder responder) {
    responders.put(pathPrefix, responder);
    return this;
  }

  public synchronized List<URI> getRequests() {
    return new ArrayList<URI>(requests);
  }

  public synchronized int requestCount() {
    return requests.size();
  }

  public synchronized Headers lastHeaders() {
    return requestHeaders.get(requestHeaders.size() - 1);
  }

  /** Decodes the query parameters of a request URI. */
  public static Map<String, String> queryParams(URI uri) {
    Map<String, String> params = new LinkedHashMap<String, String>();
    String raw = uri.getRawQuery();
    if (raw == null) {
      return params;
    }
    for (String pair : raw.split("&")) {
      int eq = pair.indexOf('=');
      String name = eq < 0 ? pair : pair.substring(0, eq);
      String value = eq < 0 ? "" : pair.substring(eq + 1);
      params.put(URLDecoder.decode(name, StandardCharsets.UTF_8),
          URLDecoder.decode(value, StandardCharsets.UTF_8));
    }
    return params;
  }

  /** Returns the value of one query parameter as a long, or the default. */
  public static long longParam(URI uri, String name, long defaultValue) {
    String value = queryParams(uri).get(name);
    return value == null ? defaultValue : Long.parseLong(value);
  }

  private void handle(HttpExchange exchange) throws IOException {
    URI uri = exchange.getRequestURI();
    Responder responder = null;
    int longest = -1;
    synchronized (this) {
      requests.add(uri);
      requestHeaders.add(exchange.getRequestHeaders());
      for (Map.Entry<String, Responder> entry : responders.entrySet()) {
        if (uri.getPath().startsWith(entry.getKey()) && entry.getKey().length() > longest) {
          responder = entry.getValue();
          longest = entry.getKey().length();
        }
      }
    }
    StubResponse response = responder != null
        ? responder.respond(uri, exchange.getRequestHeaders())
        : StubResponse.status(404, "not found: " + uri.getPath());
    exchange.getResponseHeaders().set("Content-Type", response.contentType);
    exchange.sendResponseHeaders(response.status,
        response.body.length == 0 ? -1 : response.body.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(response.body);
    }
  }

  @Override public void close() {
    server.stop(0);
    executor.shutdownNow();
  }
}
