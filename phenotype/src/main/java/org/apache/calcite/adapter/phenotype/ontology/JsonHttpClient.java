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
package org.apache.calcite.adapter.phenotype.ontology;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Minimal JSON-over-HTTP GET client shared by the web ontology providers.
 *
 * <p>Connections use fixed connect and read timeouts so a stalled service
 * surfaces as an {@link IOException}. Rate limiting (429) and server errors
 * (5xx) are retried with exponential backoff; a 404 is reported as a null
 * body.
 */
final class JsonHttpClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(JsonHttpClient.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  static final int CONNECT_TIMEOUT_MS = 30000;
  static final int READ_TIMEOUT_MS = 60000;

  private final int maxRetries;
  private final long retryBackoffMs;

  JsonHttpClient(int maxRetries, long retryBackoffMs) {
    this.maxRetries = maxRetries;
    this.retryBackoffMs = retryBackoffMs;
  }

  /**
   * Fetches and parses a JSON document.
   *
   * @return The parsed body, or null if the server answered 404
   * @throws IOException on transport errors, timeouts, non-JSON bodies or
   *     non-retryable HTTP errors
   */
  @Nullable JsonNode get(String url, Map<String, String> headers) throws IOException {
    int retries = 0;
    IOException lastException = null;

    while (retries <= maxRetries) {
      try {
        String body = doGet(url, headers);
        return body == null ? null : MAPPER.readTree(body);
      } catch (IOException e) {
        lastException = e;
        if (!isRetryable(e)) {
          throw e;
        }
        retries++;
        if (retries <= maxRetries) {
          long backoff = retryBackoffMs * (1L << (retries - 1));
          LOGGER.warn("Request failed, retrying in {}ms (attempt {}/{}): {}",
              backoff, retries, maxRetries, e.getMessage());
          try {
            Thread.sleep(backoff);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted during retry backoff", ie);
          }
        }
      }
    }
    throw lastException != null ? lastException : new IOException("Request failed after retries");
  }

  private @Nullable String doGet(String urlString, Map<String, String> headers)
      throws IOException {
    HttpURLConnection conn = (HttpURLConnection) new URL(urlString).openConnection();
    try {
      conn.setRequestMethod("GET");
      conn.setConnectTimeout(CONNECT_TIMEOUT_MS);
      conn.setReadTimeout(READ_TIMEOUT_MS);
      conn.setRequestProperty("Accept", "application/json");
      for (Map.Entry<String, String> e : headers.entrySet()) {
        conn.setRequestProperty(e.getKey(), e.getValue());
      }

      int responseCode = conn.getResponseCode();
      LOGGER.debug("HTTP GET {} -> {}", urlString, responseCode);

      if (responseCode >= 200 && responseCode < 300) {
        return readResponse(conn.getInputStream());
      }
      if (responseCode == HttpURLConnection.HTTP_NOT_FOUND) {
        return null;
      }
      String errorBody = readResponse(conn.getErrorStream());
      throw new IOException("HTTP " + responseCode + ": " + errorBody);
    } finally {
      conn.disconnect();
    }
  }

  static boolean isRetryable(IOException e) {
    String message = e.getMessage();
    if (message == null || !message.startsWith("HTTP ")) {
      return false;
    }
    return message.startsWith("HTTP 429") || message.startsWith("HTTP 5");
  }

  private static String readResponse(InputStream input) throws IOException {
    if (input == null) {
      return "";
    }
    StringBuilder response = new StringBuilder();
    try (BufferedReader reader = new BufferedReader(
        new InputStreamReader(input, StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        response.append(line);
      }
    }
    return response.toString();
  }
}
