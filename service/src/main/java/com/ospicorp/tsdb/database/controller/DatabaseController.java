package com.ospicorp.tsdb.database.controller;

import com.ospicorp.tsdb.database.model.AccessKey;
import com.ospicorp.tsdb.database.model.CreateDatabaseRequest;
import com.ospicorp.tsdb.database.model.CreateKeyRequest;
import com.ospicorp.tsdb.database.model.Database;
import com.ospicorp.tsdb.database.service.DatabaseService;
import com.ospicorp.tsdb.security.AdminAuthorization;
import com.ospicorp.tsdb.security.ApiKeys;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Database and access key administration; guarded by the admin key when one is configured. */
@RestController
@RequestMapping("/db")
@Tag(name = "Administration")
public class DatabaseController {
  private final DatabaseService databases;
  private final AdminAuthorization admin;

  public DatabaseController(DatabaseService databases, AdminAuthorization admin) {
    this.databases = databases;
    this.admin = admin;
  }

  @PostMapping
  @Operation(summary = "Create a database")
  @ApiResponses({
      @ApiResponse(responseCode = "201", description = "Created",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = Database.class))),
      @ApiResponse(responseCode = "409", description = "Database already exists",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<Database> create(@Valid @RequestBody CreateDatabaseRequest body,
      HttpServletRequest request) {
    admin.requireAdmin(ApiKeys.resolve(request));
    Database database = databases.create(body.name());
    return ResponseEntity.created(URI.create("/db/" + database.name())).body(database);
  }

  @GetMapping
  @Operation(summary = "List databases")
  public List<Database> list(HttpServletRequest request) {
    admin.requireAdmin(ApiKeys.resolve(request));
    return databases.list();
  }

  @DeleteMapping("/{db}")
  @Operation(summary = "Delete a database with its series, keys and continuous queries")
  @ApiResponses({
      @ApiResponse(responseCode = "204", description = "Deleted"),
      @ApiResponse(responseCode = "404", description = "Unknown database",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<Void> delete(@PathVariable String db, HttpServletRequest request) {
    admin.requireAdmin(ApiKeys.resolve(request));
    databases.delete(db);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{db}/keys")
  @Operation(summary = "Add a read or write key",
      description = "A key is generated when none is given. Once a database has a key, "
          + "every request to it must present one.")
  @ApiResponses({
      @ApiResponse(responseCode = "201", description = "Created",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = AccessKey.class))),
      @ApiResponse(responseCode = "404", description = "Unknown database",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<AccessKey> addKey(@PathVariable String db,
      @Valid @RequestBody CreateKeyRequest body, HttpServletRequest request) {
    admin.requireAdmin(ApiKeys.resolve(request));
    AccessKey key = databases.addKey(db, body.key(), body.permission());
    return ResponseEntity.created(URI.create("/db/" + db + "/keys/" + key.key())).body(key);
  }

  @GetMapping("/{db}/keys")
  @Operation(summary = "List the keys of a database")
  public List<AccessKey> keys(@PathVariable String db, HttpServletRequest request) {
    admin.requireAdmin(ApiKeys.resolve(request));
    return databases.keys(db);
  }

  @DeleteMapping("/{db}/keys/{key}")
  @Operation(summary = "Remove a key")
  public ResponseEntity<Void> removeKey(@PathVariable String db, @PathVariable String key,
      HttpServletRequest request) {
    admin.requireAdmin(ApiKeys.resolve(request));
    databases.removeKey(db, key);
    return ResponseEntity.noContent().build();
  }
}
