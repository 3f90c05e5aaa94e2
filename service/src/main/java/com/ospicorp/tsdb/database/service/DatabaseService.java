package com.ospicorp.tsdb.database.service;

import com.ospicorp.tsdb.database.DatabaseDroppedEvent;
import com.ospicorp.tsdb.database.DatabaseExistsException;
import com.ospicorp.tsdb.database.model.AccessKey;
import com.ospicorp.tsdb.database.model.Database;
import com.ospicorp.tsdb.database.model.Permission;
import com.ospicorp.tsdb.database.repository.DatabaseRepository;
import com.ospicorp.tsdb.series.repository.PointStore;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.List;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class DatabaseService {
  private static final Logger log = LoggerFactory.getLogger(DatabaseService.class);
  private static final int GENERATED_KEY_BYTES = 24;

  private final DatabaseRepository repository;
  private final PointStore pointStore;
  private final ApplicationEventPublisher events;
  private final Clock clock;
  private final SecureRandom random = new SecureRandom();

  public DatabaseService(DatabaseRepository repository, PointStore pointStore,
      ApplicationEventPublisher events, Clock clock) {
    this.repository = repository;
    this.pointStore = pointStore;
    this.events = events;
    this.clock = clock;
  }

  public Database create(String name) {
    if (!StringUtils.hasText(name) || !name.matches(Database.NAME_REGEX)) {
      throw new IllegalArgumentException("Invalid database name: " + name);
    }
    Database database = new Database(name, now());
    if (!repository.create(database)) {
      throw new DatabaseExistsException("Database already exists: " + name);
    }
    pointStore.createDatabase(name);
    log.info("Created database {}", name);
    return database;
  }

  public List<Database> list() {
    return repository.findAll();
  }

  public Database require(String name) {
    return repository.find(name)
        .orElseThrow(() -> new NoSuchElementException("Database not found: " + name));
  }

  /**
   * Drops a database. Continuous queries are stopped first so none writes into the dropped
   * points; a write racing the drop fails as not found instead of recreating the series.
   */
  public void delete(String name) {
    require(name);
    events.publishEvent(new DatabaseDroppedEvent(name));
    pointStore.dropDatabase(name);
    repository.delete(name);
    log.info("Deleted database {}", name);
  }

  public AccessKey addKey(String database, String key, Permission permission) {
    require(database);
    String value = StringUtils.hasText(key) ? key : generateKey();
    AccessKey accessKey = new AccessKey(value, permission, now());
    if (!repository.addKey(database, accessKey)) {
      throw new DatabaseExistsException("Key already registered for database " + database);
    }
    log.info("Added {} key to database {}", permission.code(), database);
    return accessKey;
  }

  public void removeKey(String database, String key) {
    require(database);
    if (!repository.removeKey(database, key)) {
      throw new NoSuchElementException("Key not found for database " + database);
    }
    log.info("Removed key from database {}", database);
  }

  public List<AccessKey> keys(String database) {
    require(database);
    return repository.keys(database);
  }

  private String generateKey() {
    byte[] bytes = new byte[GENERATED_KEY_BYTES];
    random.nextBytes(bytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MILLIS);
  }
}
