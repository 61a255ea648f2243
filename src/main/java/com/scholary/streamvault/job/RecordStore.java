package com.scholary.streamvault.job;

import java.util.Map;

/**
 * Abstraction for durable record storage.
 *
 * <p>Decouples the job store from the storage engine. Jobs and schedule entries are the only
 * persisted entities; statistics are always derived.
 *
 * @param <T> the record type
 */
public interface RecordStore<T> {

  /**
   * Load every stored record.
   *
   * @return records keyed by id, in insertion order
   * @throws JobStoreException if the backing storage cannot be read
   */
  Map<String, T> loadAll();

  /**
   * Insert or replace one record.
   *
   * @throws JobStoreException if the write fails
   */
  void save(String id, T record);

  /**
   * Insert or replace several records in one write.
   *
   * @throws JobStoreException if the write fails
   */
  void saveAll(Map<String, T> records);

  /**
   * Remove one record. Unknown ids are ignored.
   *
   * @throws JobStoreException if the write fails
   */
  void delete(String id);

  /**
   * Remove every record.
   *
   * @throws JobStoreException if the write fails
   */
  void clear();
}
