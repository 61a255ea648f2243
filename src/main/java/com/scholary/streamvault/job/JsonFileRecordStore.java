package com.scholary.streamvault.job;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Record store backed by a single JSON document.
 *
 * <p>Every mutation rewrites the whole file through a temp file and an atomic move, so a crash
 * mid-write leaves the previous version intact. The file holds history for one collection (jobs
 * or schedule entries) and stays small enough for this to be cheap.
 */
public class JsonFileRecordStore<T> implements RecordStore<T> {

  private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileRecordStore.class);

  private final Path file;
  private final ObjectMapper objectMapper;
  private final JavaType mapType;
  private final Map<String, T> records;

  public JsonFileRecordStore(Path file, Class<T> recordType, ObjectMapper objectMapper) {
    this.file = file;
    this.objectMapper = objectMapper;
    this.mapType =
        objectMapper
            .getTypeFactory()
            .constructMapType(LinkedHashMap.class, String.class, recordType);
    this.records = read();
  }

  @Override
  public synchronized Map<String, T> loadAll() {
    return new LinkedHashMap<>(records);
  }

  @Override
  public synchronized void save(String id, T record) {
    Map<String, T> next = new LinkedHashMap<>(records);
    next.put(id, record);
    commit(next);
  }

  @Override
  public synchronized void saveAll(Map<String, T> batch) {
    Map<String, T> next = new LinkedHashMap<>(records);
    next.putAll(batch);
    commit(next);
  }

  @Override
  public synchronized void delete(String id) {
    if (!records.containsKey(id)) {
      return;
    }
    Map<String, T> next = new LinkedHashMap<>(records);
    next.remove(id);
    commit(next);
  }

  @Override
  public synchronized void clear() {
    commit(new LinkedHashMap<>());
  }

  private void commit(Map<String, T> next) {
    write(next);
    records.clear();
    records.putAll(next);
  }

  private Map<String, T> read() {
    if (!Files.exists(file)) {
      LOGGER.info("No record file at {}, starting empty", file);
      return new LinkedHashMap<>();
    }
    try {
      Map<String, T> loaded = objectMapper.readValue(file.toFile(), mapType);
      LOGGER.info("Loaded {} records from {}", loaded.size(), file);
      return loaded;
    } catch (IOException e) {
      throw new JobStoreException("Failed to read record file: " + file, e);
    }
  }

  private void write(Map<String, T> snapshot) {
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path temp = file.resolveSibling(file.getFileName() + ".tmp");
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
      try {
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw new JobStoreException("Failed to write record file: " + file, e);
    }
  }
}
