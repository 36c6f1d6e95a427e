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
package org.apache.calcite.adapter.realestate.remote;

import org.apache.calcite.adapter.realestate.Fixtures;
import org.apache.calcite.adapter.realestate.MutableClock;
import org.apache.calcite.adapter.realestate.NetworkException;
import org.apache.calcite.adapter.realestate.cache.CacheFormat;
import org.apache.calcite.adapter.realestate.retry.Deadline;

import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okio.Buffer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link GithubReleaseStore} against a local HTTP server.
 */
@Tag("unit")
public class GithubReleaseStoreTest {

  @TempDir
  Path tempDir;

  private MockWebServer server;
  private GithubReleaseStore store;
  private MutableClock clock;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
    clock = new MutableClock(Fixtures.NOW);
    store = new GithubReleaseStore(
        HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build(), new ObjectMapper(),
        server.url("/").toString(), Duration.ofSeconds(5), "secret-token");
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  private Deadline deadline() {
    return Deadline.none(clock);
  }

  private String releaseJson() {
    String base = server.url("/download/").toString();
    return "{\"tag_name\":\"cache-latest\",\"assets\":["
        + "{\"name\":\"abecip.json.gz\",\"size\":120,"
        + "\"updated_at\":\"2024-05-30T10:00:00Z\","
        + "\"browser_download_url\":\"" + base + "abecip.json.gz\","
        + "\"digest\":\"sha256:0a1b\"},"
        + "{\"name\":\"rppi.csv\",\"size\":64,\"updated_at\":\"bogus\","
        + "\"browser_download_url\":\"" + base + "rppi.csv\"},"
        + "{\"name\":\"itbi.rds\",\"size\":10,"
        + "\"updated_at\":\"2024-05-30T10:00:00Z\","
        + "\"browser_download_url\":\"" + base + "itbi.rds\"}"
        + "]}";
  }

  @Test void testListAssets() throws Exception {
    server.enqueue(new MockResponse().setBody(releaseJson()));

    List<RemoteAsset> assets =
        store.listAssets("viniciusoike/realestatebr", "cache-latest", deadline());

    assertEquals(2, assets.size());
    RemoteAsset abecip = assets.get(0);
    assertEquals("abecip", abecip.getDatasetId());
    assertEquals(CacheFormat.JSON_GZ, abecip.getFormat());
    assertEquals(120, abecip.getSize());
    assertEquals(Instant.parse("2024-05-30T10:00:00Z"), abecip.getUpdatedAt());
    assertEquals("sha256:0a1b", abecip.getDigest());
    assertEquals(Instant.EPOCH, assets.get(1).getUpdatedAt());
    assertNull(assets.get(1).getDigest());

    RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
    assertNotNull(request);
    assertEquals("/repos/viniciusoike/realestatebr/releases/tags/cache-latest",
        request.getPath());
    assertEquals("Bearer secret-token", request.getHeader("Authorization"));
    assertEquals("application/vnd.github+json", request.getHeader("Accept"));
  }

  @Test void testMissingReleaseIsFatal() {
    server.enqueue(new MockResponse().setResponseCode(404));

    NetworkException e = assertThrows(NetworkException.class,
        () -> store.listAssets("owner/repo", "nope", deadline()));
    assertFalse(e.isRetryable());
  }

  @Test void testServerErrorsAreRetryable() {
    server.enqueue(new MockResponse().setResponseCode(503));
    server.enqueue(new MockResponse().setResponseCode(429));
    server.enqueue(new MockResponse().setResponseCode(403));

    assertTrue(assertThrows(NetworkException.class,
        () -> store.listAssets("owner/repo", "t", deadline())).isRetryable());
    assertTrue(assertThrows(NetworkException.class,
        () -> store.listAssets("owner/repo", "t", deadline())).isRetryable());
    assertFalse(assertThrows(NetworkException.class,
        () -> store.listAssets("owner/repo", "t", deadline())).isRetryable());
  }

  @Test void testMalformedListingIsFatal() {
    server.enqueue(new MockResponse().setBody("{not json"));

    NetworkException e = assertThrows(NetworkException.class,
        () -> store.listAssets("owner/repo", "t", deadline()));
    assertFalse(e.isRetryable());
  }

  @Test void testExpiredDeadlineSendsNothing() {
    Deadline deadline = Deadline.after(clock, Duration.ofSeconds(1));
    clock.advance(Duration.ofSeconds(2));

    NetworkException e = assertThrows(NetworkException.class,
        () -> store.listAssets("owner/repo", "t", deadline));
    assertTrue(e.isRetryable());
    assertEquals(0, server.getRequestCount());
  }

  @Test void testRequestTimeoutIsTheTimeLeft() throws Exception {
    MutableClock ticking = new MutableClock(Fixtures.NOW) {
      @Override public Instant instant() {
        Instant now = super.instant();
        advance(Duration.ofMillis(600));
        return now;
      }
    };
    Deadline deadline = Deadline.after(ticking, Duration.ofSeconds(1));
    server.enqueue(new MockResponse().setBody(releaseJson()));

    // One clock read per request: 400ms are left when the request is built.
    assertEquals(2, store.listAssets("owner/repo", "t", deadline).size());
    assertEquals(1, server.getRequestCount());

    NetworkException e = assertThrows(NetworkException.class,
        () -> store.listAssets("owner/repo", "t", deadline));
    assertTrue(e.isRetryable());
    assertEquals(1, server.getRequestCount());
  }

  @Test void testDownload() throws Exception {
    byte[] bytes = {0x1f, (byte) 0x8b, 1, 2, 3};
    server.enqueue(new MockResponse().setBody(new Buffer().write(bytes)));
    RemoteAsset asset = new RemoteAsset("abecip.json.gz", CacheFormat.JSON_GZ, bytes.length,
        Fixtures.NOW, server.url("/download/abecip.json.gz").toString(), null);
    Path target = tempDir.resolve("abecip.json.gz");

    store.download(asset, target, deadline());

    assertArrayEquals(bytes, Files.readAllBytes(target));
    assertEquals("/download/abecip.json.gz", server.takeRequest().getPath());
  }

  @Test void testFailedDownloadLeavesNoFile() {
    server.enqueue(new MockResponse().setResponseCode(500).setBody("oops"));
    RemoteAsset asset = new RemoteAsset("abecip.json.gz", CacheFormat.JSON_GZ, 10,
        Fixtures.NOW, server.url("/download/abecip.json.gz").toString(), null);
    Path target = tempDir.resolve("abecip.json.gz");

    NetworkException e = assertThrows(NetworkException.class,
        () -> store.download(asset, target, deadline()));
    assertTrue(e.isRetryable());
    assertFalse(Files.exists(target));
  }
}
