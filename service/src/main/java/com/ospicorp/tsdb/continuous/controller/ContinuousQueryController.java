package com.ospicorp.tsdb.continuous.controller;

import com.ospicorp.tsdb.continuous.model.ContinuousQueryView;
import com.ospicorp.tsdb.continuous.model.CreateContinuousQueryRequest;
import com.ospicorp.tsdb.continuous.service.ContinuousQueryService;
import com.ospicorp.tsdb.database.model.Permission;
import com.ospicorp.tsdb.security.ApiKeys;
import com.ospicorp.tsdb.security.DatabaseAuthorization;
import com.ospicorp.tsdb.series.InvalidParameterException;
import com.ospicorp.tsdb.series.model.TimePrecision;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/db/{db}/continuous_queries")
@Tag(name = "Continuous queries")
public class ContinuousQueryController {
  private final ContinuousQueryService service;
  private final DatabaseAuthorization authorization;

  public ContinuousQueryController(ContinuousQueryService service,
      DatabaseAuthorization authorization) {
    this.service = service;
    this.authorization = authorization;
  }

  @GetMapping
  @Operation(summary = "List running continuous queries and streams")
  public List<ContinuousQueryView> list(@PathVariable String db, HttpServletRequest request) {
    authorization.require(db, Permission.READ, ApiKeys.resolve(request));
    return service.list(db);
  }

  @PostMapping
  @Operation(summary = "Register a continuous query",
      description = "The query needs an into clause and must be raw or grouped by time.")
  public ResponseEntity<ContinuousQueryView> register(@PathVariable String db,
      @Valid @RequestBody CreateContinuousQueryRequest body,
      @RequestParam(name = "time_precision", defaultValue = "s") String timePrecision,
      HttpServletRequest request) {
    authorization.require(db, Permission.WRITE, ApiKeys.resolve(request));
    TimePrecision precision;
    try {
      precision = TimePrecision.parse(timePrecision);
    } catch (IllegalArgumentException ex) {
      throw new InvalidParameterException("Invalid time_precision. Supported values: s,ms,u.",
          1001, "https://docs.ospicorp.com/tsdb/errors/1001");
    }
    ContinuousQueryView view = service.register(db, body.query(), precision);
    return ResponseEntity.created(URI.create("/db/" + db + "/continuous_queries/" + view.id()))
        .body(view);
  }

  @DeleteMapping("/{id}")
  @Operation(summary = "Stop a continuous query or stream")
  public ResponseEntity<Void> stop(@PathVariable String db, @PathVariable long id,
      HttpServletRequest request) {
    authorization.require(db, Permission.WRITE, ApiKeys.resolve(request));
    service.stop(db, id);
    return ResponseEntity.noContent().build();
  }
}
