package com.ospicorp.tsdb.database.repository;

import com.ospicorp.tsdb.database.model.AccessKey;
import com.ospicorp.tsdb.database.model.Database;
import java.util.List;
import java.util.Optional;

public interface DatabaseRepository {

  /** @return {@code false} when a database with that name already exists */
  boolean create(Database database);

  Optional<Database> find(String name);

  List<Database> findAll();

  boolean delete(String name);

  /** @return {@code false} when the database already holds that key */
  boolean addKey(String database, AccessKey key);

  boolean removeKey(String database, String key);

  List<AccessKey> keys(String database);
}
