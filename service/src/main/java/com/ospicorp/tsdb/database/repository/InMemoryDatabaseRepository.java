package com.ospicorp.tsdb.database.repository;

import com.ospicorp.tsdb.database.model.AccessKey;
import com.ospicorp.tsdb.database.model.Database;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "tsdb.storage.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryDatabaseRepository implements DatabaseRepository {

  private final Map<String, Entry> databases = new ConcurrentHashMap<>();

  @Override
  public boolean create(Database database) {
    return databases.putIfAbsent(database.name(), new Entry(database)) == null;
  }

  @Override
  public Optional<Database> find(String name) {
    return Optional.ofNullable(databases.get(name)).map(Entry::database);
  }

  @Override
  public List<Database> findAll() {
    return databases.values().stream()
        .map(Entry::database)
        .sorted(Comparator.comparing(Database::name))
        .toList();
  }

  @Override
  public boolean delete(String name) {
    return databases.remove(name) != null;
  }

  @Override
  public boolean addKey(String database, AccessKey key) {
    Entry entry = databases.get(database);
    return entry != null && entry.keys().putIfAbsent(key.key(), key) == null;
  }

  @Override
  public boolean removeKey(String database, String key) {
    Entry entry = databases.get(database);
    return entry != null && entry.keys().remove(key) != null;
  }

  @Override
  public List<AccessKey> keys(String database) {
    Entry entry = databases.get(database);
    if (entry == null) {
      return List.of();
    }
    return entry.keys().values().stream()
        .sorted(Comparator.comparing(AccessKey::createdAt).thenComparing(AccessKey::key))
        .toList();
  }

  private record Entry(Database database, Map<String, AccessKey> keys) {
    Entry(Database database) {
      this(database, new ConcurrentHashMap<>());
    }
  }
}
