package com.scholary.streamvault.job;

import java.util.LinkedHashMap;
import java.util.Map;

/** Non-durable record store. Used when {@code downloads.store.type=memory} and in tests. */
public class InMemoryRecordStore<T> implements RecordStore<T> {

  private final Map<String, T> records = new LinkedHashMap<>();

  @Override
  public synchronized Map<String, T> loadAll() {
    return new LinkedHashMap<>(records);
  }

  @Override
  public synchronized void save(String id, T record) {
    records.put(id, record);
  }

  @Override
  public synchronized void saveAll(Map<String, T> batch) {
    records.putAll(batch);
  }

  @Override
  public synchronized void delete(String id) {
    records.remove(id);
  }

  @Override
  public synchronized void clear() {
    records.clear();
  }
}
