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
package org.apache.calcite.adapter.realestate.cache;

import org.apache.calcite.adapter.realestate.CacheMissException;
import org.apache.calcite.adapter.realestate.DataTable;
import org.apache.calcite.adapter.realestate.DatasetException;
import org.apache.calcite.adapter.realestate.TierResult;
import org.apache.calcite.adapter.realestate.registry.DatasetDescriptor;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Local persisted cache keyed by dataset id.
 *
 * <p>Each dataset occupies one payload file ({@code <id>.json.gz}, or a CSV
 * form dropped in from a remote asset) plus a {@code <id>.meta.json} sidecar.
 * Writes go to a temporary file in the same directory and are renamed into
 * place, so a reader never sees a partial entry. Writers for the same id are
 * serialised by a {@code <id>.lock} file, and within this JVM by an
 * in-process lock, since {@link FileChannel#tryLock()} is per process.
 *
 * <p>Reads never touch the network.
 */
public class LocalCacheTier {
  private static final Logger LOGGER = LoggerFactory.getLogger(LocalCacheTier.class);

  private static final ConcurrentHashMap<String, Lock> LOCK_MAP = new ConcurrentHashMap<>();
  private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]*");
  private static final String META_SUFFIX = ".meta.json";
  private static final String LOCK_SUFFIX = ".lock";
  private static final String TEMP_SUFFIX = ".tmp";
  private static final long LOCK_POLL_MILLIS = 50;

  private final Path directory;
  private final PayloadCodec codec;
  private final StalenessPolicy staleness;
  private final Function<String, @Nullable DatasetDescriptor> descriptors;
  private final Clock clock;
  private final Duration lockTimeout;
  private final ObjectMapper mapper = new ObjectMapper();

  public LocalCacheTier(Path directory, PayloadCodec codec, StalenessPolicy staleness,
      Function<String, @Nullable DatasetDescriptor> descriptors, Clock clock,
      Duration lockTimeout) {
    this.directory = directory;
    this.codec = codec;
    this.staleness = staleness;
    this.descriptors = descriptors;
    this.clock = clock;
    this.lockTimeout = lockTimeout;
  }

  public Path getDirectory() {
    return directory;
  }

  /**
   * Reads a cached entry.
   *
   * @param acceptStale whether an entry older than its threshold is returned
   * @return the entry, or null on a miss (absent, unreadable, or stale and not
   *     accepted)
   */
  public @Nullable CacheEntry load(String datasetId, boolean acceptStale) {
    checkId(datasetId);
    Path file = null;
    CacheFormat format = null;
    for (CacheFormat candidate : CacheFormat.values()) {
      Path path = directory.resolve(candidate.fileName(datasetId));
      if (Files.isRegularFile(path)) {
        file = path;
        format = candidate;
        break;
      }
    }
    if (file == null) {
      LOGGER.debug("No cached payload for '{}' in {}", datasetId, directory);
      return null;
    }

    try {
      CacheMetadata meta = readMetadata(datasetId);
      Instant savedAt = meta != null
          ? Instant.ofEpochMilli(meta.savedAt)
          : Files.getLastModifiedTime(file).toInstant();
      boolean stale = staleness.isStale(savedAt, descriptors.apply(datasetId), clock.instant());
      if (stale && !acceptStale) {
        LOGGER.debug("Cached payload for '{}' saved at {} is stale", datasetId, savedAt);
        return null;
      }
      TierResult payload = codec.read(file, format);
      return new CacheEntry(datasetId, payload, savedAt, Files.size(file), format,
          meta != null ? meta.source : null, file, stale);
    } catch (IOException e) {
      LOGGER.warn("Ignoring unreadable cache entry {}: {}", file, e.getMessage());
      return null;
    }
  }

  /**
   * Like {@link #load} but raises {@link CacheMissException} on a miss.
   */
  public CacheEntry require(String datasetId, boolean acceptStale) {
    CacheEntry entry = load(datasetId, acceptStale);
    if (entry == null) {
      throw new CacheMissException("No usable cached copy of '" + datasetId + "' in "
          + directory);
    }
    return entry;
  }

  /**
   * Saves a payload atomically, replacing any earlier entry for the id.
   *
   * @param source tier the payload came from, recorded in the sidecar
   * @param mergeTables whether a multi-table payload keeps cached tables it
   *     does not itself carry
   * @param digest digest of the remote asset the payload came from, or null
   * @throws DatasetException if the entry cannot be written
   */
  public CacheEntry save(String datasetId, TierResult payload, String source,
      boolean mergeTables, @Nullable String digest) {
    checkId(datasetId);
    try {
      Files.createDirectories(directory);
      return withLock(datasetId, () -> {
        TierResult toWrite = payload;
        if (mergeTables && !payload.isSingle()) {
          toWrite = merge(datasetId, payload);
        }
        Path target = directory.resolve(CacheFormat.JSON_GZ.fileName(datasetId));
        Path temp = Files.createTempFile(directory, datasetId + ".", TEMP_SUFFIX);
        try {
          codec.writeJson(toWrite, temp);
          moveIntoPlace(temp, target);
        } finally {
          Files.deleteIfExists(temp);
        }
        for (CacheFormat other : CacheFormat.values()) {
          if (other != CacheFormat.JSON_GZ) {
            Files.deleteIfExists(directory.resolve(other.fileName(datasetId)));
          }
        }

        Instant savedAt = clock.instant();
        CacheMetadata meta = toMetadata(toWrite, CacheFormat.JSON_GZ, Files.size(target),
            savedAt, source);
        meta.digest = digest;
        writeMetadata(datasetId, meta);
        LOGGER.debug("Saved '{}' to {} ({} bytes)", datasetId, target, meta.sizeBytes);
        return new CacheEntry(datasetId, toWrite, savedAt, meta.sizeBytes,
            CacheFormat.JSON_GZ, source, target, false);
      });
    } catch (IOException e) {
      throw new DatasetException("Failed to save '" + datasetId + "' to cache: "
          + e.getMessage(), e);
    }
  }

  public CacheEntry save(String datasetId, TierResult payload, String source,
      boolean mergeTables) {
    return save(datasetId, payload, source, mergeTables, null);
  }

  /** Saves without merging. */
  public CacheEntry save(String datasetId, TierResult payload, String source) {
    return save(datasetId, payload, source, false, null);
  }

  private TierResult merge(String datasetId, TierResult payload) {
    CacheEntry existing = load(datasetId, true);
    if (existing == null || existing.getPayload().isSingle()) {
      return payload;
    }
    Map<String, DataTable> tables =
        new LinkedHashMap<>(existing.getPayload().asMultiple().getTables());
    tables.putAll(payload.asMultiple().getTables());
    return TierResult.multiple(tables);
  }

  /** Summaries of every cached dataset, newest first. */
  public List<CacheSummary> list() {
    List<CacheSummary> summaries = new ArrayList<>();
    if (!Files.isDirectory(directory)) {
      return summaries;
    }
    Instant now = clock.instant();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
      for (Path path : stream) {
        String name = path.getFileName().toString();
        CacheFormat format = CacheFormat.fromFileName(name);
        if (format == null || !Files.isRegularFile(path)) {
          continue;
        }
        String datasetId = format.datasetId(name);
        CacheMetadata meta = readMetadata(datasetId);
        Instant savedAt = meta != null
            ? Instant.ofEpochMilli(meta.savedAt)
            : Files.getLastModifiedTime(path).toInstant();
        boolean stale = staleness.isStale(savedAt, descriptors.apply(datasetId), now);
        summaries.add(
            new CacheSummary(datasetId, name, format, Files.size(path), savedAt,
                StalenessPolicy.ageDays(savedAt, now), stale,
                meta != null ? meta.source : null,
                meta != null && meta.tables != null ? meta.tables : new ArrayList<String>()));
      }
    } catch (IOException e) {
      throw new DatasetException("Failed to list cache directory " + directory, e);
    }
    summaries.sort(Comparator.comparing(CacheSummary::getSavedAt).reversed()
        .thenComparing(CacheSummary::getDatasetId));
    return summaries;
  }

  /** Sidecar of a cached dataset, or null if absent or unreadable. */
  public @Nullable CacheMetadata metadata(String datasetId) {
    checkId(datasetId);
    try {
      return readMetadata(datasetId);
    } catch (IOException e) {
      LOGGER.warn("Unreadable cache metadata for '{}': {}", datasetId, e.getMessage());
      return null;
    }
  }

  /** Whether any payload file exists for the id, fresh or not. */
  public boolean contains(String datasetId) {
    checkId(datasetId);
    for (CacheFormat format : CacheFormat.values()) {
      if (Files.isRegularFile(directory.resolve(format.fileName(datasetId)))) {
        return true;
      }
    }
    return false;
  }

  /**
   * Removes the cached payload and sidecar of one dataset.
   *
   * @return number of files removed
   */
  public int clear(String datasetId) {
    checkId(datasetId);
    if (!Files.isDirectory(directory)) {
      return 0;
    }
    try {
      int removed = withLock(datasetId, () -> {
        int count = 0;
        for (CacheFormat format : CacheFormat.values()) {
          if (Files.deleteIfExists(directory.resolve(format.fileName(datasetId)))) {
            count++;
          }
        }
        if (Files.deleteIfExists(directory.resolve(datasetId + META_SUFFIX))) {
          count++;
        }
        return count;
      });
      LOGGER.info("Removed {} cached file(s) for '{}'", removed, datasetId);
      return removed;
    } catch (IOException e) {
      throw new DatasetException("Failed to clear cache for '" + datasetId + "'", e);
    }
  }

  /**
   * Removes every cached dataset, leftover temporary files and lock files
   * older than an hour.
   *
   * @return number of payload and sidecar files removed
   */
  public int clearAll() {
    if (!Files.isDirectory(directory)) {
      return 0;
    }
    Set<String> ids = new LinkedHashSet<>();
    long oneHourAgo = clock.millis() - TimeUnit.HOURS.toMillis(1);
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
      for (Path path : stream) {
        String name = path.getFileName().toString();
        CacheFormat format = CacheFormat.fromFileName(name);
        if (format != null) {
          ids.add(format.datasetId(name));
        } else if (name.endsWith(META_SUFFIX)) {
          ids.add(name.substring(0, name.length() - META_SUFFIX.length()));
        } else if (name.endsWith(TEMP_SUFFIX)) {
          Files.deleteIfExists(path);
        } else if (name.endsWith(LOCK_SUFFIX)
            && Files.getLastModifiedTime(path).toMillis() < oneHourAgo) {
          Files.deleteIfExists(path);
        }
      }
    } catch (IOException e) {
      throw new DatasetException("Failed to clear cache directory " + directory, e);
    }
    int removed = 0;
    for (String id : ids) {
      if (SAFE_ID.matcher(id).matches()) {
        removed += clear(id);
      }
    }
    return removed;
  }

  private @Nullable CacheMetadata readMetadata(String datasetId) throws IOException {
    Path metaFile = directory.resolve(datasetId + META_SUFFIX);
    if (!Files.isRegularFile(metaFile)) {
      return null;
    }
    return mapper.readValue(metaFile.toFile(), CacheMetadata.class);
  }

  private void writeMetadata(String datasetId, CacheMetadata meta) throws IOException {
    Path target = directory.resolve(datasetId + META_SUFFIX);
    Path temp = Files.createTempFile(directory, datasetId + ".meta.", TEMP_SUFFIX);
    try {
      mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), meta);
      moveIntoPlace(temp, target);
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  static CacheMetadata toMetadata(TierResult payload, CacheFormat format, long sizeBytes,
      Instant savedAt, String source) {
    CacheMetadata meta = new CacheMetadata();
    meta.savedAt = savedAt.toEpochMilli();
    meta.format = format.getExtension();
    meta.sizeBytes = sizeBytes;
    meta.source = source;
    if (payload.isSingle()) {
      DataTable table = payload.asSingle().getTable();
      meta.rowCount = table.rowCount();
      meta.colCount = table.columnCount();
    } else {
      int columns = 0;
      for (Map.Entry<String, DataTable> entry
          : payload.asMultiple().getTables().entrySet()) {
        meta.tables.add(entry.getKey());
        meta.rowCount += entry.getValue().rowCount();
        columns = Math.max(columns, entry.getValue().columnCount());
      }
      meta.colCount = columns;
    }
    return meta;
  }

  private static void moveIntoPlace(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  /** Body run while holding the lock of one dataset id. */
  @FunctionalInterface
  private interface LockedAction<T> {
    T run() throws IOException;
  }

  private <T> T withLock(String datasetId, LockedAction<T> action) throws IOException {
    Path lockFile = directory.resolve(datasetId + LOCK_SUFFIX);
    Lock processLock =
        LOCK_MAP.computeIfAbsent(lockFile.toAbsolutePath().toString(), k -> new ReentrantLock());
    long deadline = System.nanoTime() + lockTimeout.toNanos();
    boolean acquired = false;
    try {
      acquired = processLock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS);
      if (!acquired) {
        throw new IOException("Timeout waiting for lock on " + lockFile);
      }
      try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE,
          StandardOpenOption.WRITE)) {
        FileLock fileLock = channel.tryLock();
        while (fileLock == null) {
          if (System.nanoTime() >= deadline) {
            throw new IOException("Timeout waiting for file lock " + lockFile);
          }
          Thread.sleep(LOCK_POLL_MILLIS);
          fileLock = channel.tryLock();
        }
        try {
          return action.run();
        } finally {
          fileLock.release();
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while waiting for lock on " + lockFile, e);
    } finally {
      if (acquired) {
        processLock.unlock();
      }
    }
  }

  private static void checkId(String datasetId) {
    if (datasetId == null || !SAFE_ID.matcher(datasetId).matches()) {
      throw new IllegalArgumentException("Invalid dataset id for cache: " + datasetId);
    }
  }
}
