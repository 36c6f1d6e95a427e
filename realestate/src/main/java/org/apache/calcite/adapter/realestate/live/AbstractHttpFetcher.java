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
package org.apache.calcite.adapter.realestate.live;

import org.apache.calcite.adapter.realestate.LiveFetchException;
import org.apache.calcite.adapter.realestate.retry.Deadline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;

/**
 * Base class for fetchers that read a source over HTTP.
 *
 * <p>Classifies failures for the retry wrapper: timeouts, I/O errors, HTTP 429
 * and 5xx are retryable; any other non-200 status and a body that cannot be
 * parsed are fatal.
 */
public abstract class AbstractHttpFetcher implements DatasetFetcher {
  private static final Logger LOGGER = LoggerFactory.getLogger(AbstractHttpFetcher.class);

  protected final HttpClient httpClient;
  protected final ObjectMapper mapper = new ObjectMapper();
  private final Duration requestTimeout;

  protected AbstractHttpFetcher(Duration requestTimeout) {
    this(HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(30))
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build(), requestTimeout);
  }

  protected AbstractHttpFetcher(HttpClient httpClient, Duration requestTimeout) {
    this.httpClient = httpClient;
    this.requestTimeout = requestTimeout;
  }

  /** User-Agent sent with every request. */
  protected String getUserAgent() {
    return "realestate-data/1.0";
  }

  /**
   * GETs a URL and returns the body of a 200 response.
   *
   * @throws LiveFetchException on any failure, retryable as described above
   */
  protected String getText(String url, Deadline deadline) {
    Duration timeout = deadline.cap(requestTimeout);
    if (timeout.isZero()) {
      throw new LiveFetchException("Deadline expired before requesting " + url, true);
    }
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(url))
        .timeout(timeout)
        .header("User-Agent", getUserAgent())
        .GET()
        .build();
    HttpResponse<String> response;
    try {
      LOGGER.debug("GET {}", url);
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (HttpTimeoutException e) {
      throw new LiveFetchException("Timed out requesting " + url, true, e);
    } catch (IOException e) {
      throw new LiveFetchException("Request to " + url + " failed: " + e.getMessage(), true, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LiveFetchException("Interrupted while requesting " + url, false, e);
    }
    int status = response.statusCode();
    if (status != 200) {
      boolean retryable = status == 429 || status >= 500;
      throw new LiveFetchException("HTTP " + status + " from " + url, retryable);
    }
    return response.body();
  }

  /** GETs and parses a JSON document. */
  protected JsonNode getJson(String url, Deadline deadline) {
    String body = getText(url, deadline);
    try {
      return mapper.readTree(body);
    } catch (IOException e) {
      throw new LiveFetchException("Malformed JSON from " + url + ": " + e.getMessage(),
          false, e);
    }
  }

  /** GETs and parses a CSV document, header row included. */
  protected List<String[]> getCsv(String url, char separator, Deadline deadline) {
    String body = getText(url, deadline);
    try (CSVReader reader = new CSVReaderBuilder(new StringReader(body))
        .withCSVParser(new CSVParserBuilder().withSeparator(separator).build())
        .build()) {
      return reader.readAll();
    } catch (IOException | CsvException e) {
      throw new LiveFetchException("Malformed CSV from " + url + ": " + e.getMessage(),
          false, e);
    }
  }
}
