package com.ospicorp.tsdb.database.repository;

import com.ospicorp.tsdb.database.model.AccessKey;
import com.ospicorp.tsdb.database.model.Database;
import com.ospicorp.tsdb.database.model.Permission;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "tsdb.storage.type", havingValue = "jdbc")
public class JdbcDatabaseRepository implements DatabaseRepository {

  private static final RowMapper<Database> DATABASE = (rs, i) ->
      new Database(rs.getString("name"), rs.getTimestamp("created_at").toInstant());

  private static final RowMapper<AccessKey> ACCESS_KEY = (rs, i) -> new AccessKey(
      rs.getString("key"),
      Permission.fromCode(rs.getString("permission")),
      rs.getTimestamp("created_at").toInstant());

  private final JdbcTemplate jdbc;

  public JdbcDatabaseRepository(JdbcTemplate jdbc) {
    this.jdbc = jdbc;
  }

  @Override
  public boolean create(Database database) {
    return jdbc.update("""
        INSERT INTO databases (name, created_at) VALUES (?, ?)
        ON CONFLICT (name) DO NOTHING
        """, database.name(), Timestamp.from(database.createdAt())) == 1;
  }

  @Override
  public Optional<Database> find(String name) {
    return jdbc.query("SELECT name, created_at FROM databases WHERE name = ?", DATABASE, name)
        .stream().findFirst();
  }

  @Override
  public List<Database> findAll() {
    return jdbc.query("SELECT name, created_at FROM databases ORDER BY name", DATABASE);
  }

  @Override
  public boolean delete(String name) {
    return jdbc.update("DELETE FROM databases WHERE name = ?", name) == 1;
  }

  @Override
  public boolean addKey(String database, AccessKey key) {
    return jdbc.update("""
        INSERT INTO access_keys (database, key, permission, created_at)
        SELECT name, ?, ?, ? FROM databases WHERE name = ?
        ON CONFLICT (database, key) DO NOTHING
        """, key.key(), key.permission().code(), Timestamp.from(key.createdAt()), database) == 1;
  }

  @Override
  public boolean removeKey(String database, String key) {
    return jdbc.update("DELETE FROM access_keys WHERE database = ? AND key = ?",
        database, key) == 1;
  }

  @Override
  public List<AccessKey> keys(String database) {
    return jdbc.query("""
        SELECT key, permission, created_at FROM access_keys
        WHERE database = ? ORDER BY created_at, key
        """, ACCESS_KEY, database);
  }
}
