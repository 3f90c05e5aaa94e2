package com.ospicorp.tsdb.security;

import com.ospicorp.tsdb.database.model.AccessKey;
import com.ospicorp.tsdb.database.model.Permission;
import com.ospicorp.tsdb.database.repository.DatabaseRepository;
import java.util.List;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Checks the key presented for a database operation. A database without keys is open; the
 * admin key passes every check.
 */
@Component
public class DatabaseAuthorization {
  private final DatabaseRepository databases;
  private final AdminAuthorization admin;

  public DatabaseAuthorization(DatabaseRepository databases, AdminAuthorization admin) {
    this.databases = databases;
    this.admin = admin;
  }

  public void require(String database, Permission permission, String presentedKey) {
    if (admin.isAdmin(presentedKey)) {
      return;
    }
    List<AccessKey> keys = databases.keys(database);
    if (keys.isEmpty()) {
      return;
    }
    if (!StringUtils.hasText(presentedKey)) {
      throw new AuthenticationCredentialsNotFoundException(
          "Database " + database + " requires a " + permission.code() + " key");
    }
    boolean granted = keys.stream()
        .anyMatch(key -> key.permission() == permission
            && AdminAuthorization.matches(key.key(), presentedKey));
    if (!granted) {
      throw new AccessDeniedException(
          "Key does not grant " + permission.code() + " access to database " + database);
    }
  }
}
