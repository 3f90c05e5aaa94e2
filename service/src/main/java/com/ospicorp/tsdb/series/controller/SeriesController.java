package com.ospicorp.tsdb.series.controller;

import com.ospicorp.tsdb.continuous.model.ContinuousQueryView;
import com.ospicorp.tsdb.continuous.service.ContinuousQueryService;
import com.ospicorp.tsdb.database.model.Permission;
import com.ospicorp.tsdb.query.ast.DeleteStatement;
import com.ospicorp.tsdb.query.ast.SelectStatement;
import com.ospicorp.tsdb.query.ast.Statement;
import com.ospicorp.tsdb.query.parser.QueryParser;
import com.ospicorp.tsdb.security.ApiKeys;
import com.ospicorp.tsdb.security.DatabaseAuthorization;
import com.ospicorp.tsdb.series.InvalidParameterException;
import com.ospicorp.tsdb.series.model.SeriesInfo;
import com.ospicorp.tsdb.series.model.SeriesResult;
import com.ospicorp.tsdb.series.model.SeriesWrite;
import com.ospicorp.tsdb.series.model.TimePrecision;
import com.ospicorp.tsdb.series.model.WriteSummary;
import com.ospicorp.tsdb.series.service.SeriesService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import java.net.URI;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.filter.ShallowEtagHeaderFilter;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/db/{db}")
@Tag(name = "Series")
public class SeriesController {
  private static final String ERROR_DOCS_BASE = "https://docs.ospicorp.com/tsdb/errors/";
  private static final String SERIES_COLUMN = "series";

  private final SeriesService seriesService;
  private final ContinuousQueryService continuousQueries;
  private final DatabaseAuthorization authorization;

  public SeriesController(SeriesService seriesService, ContinuousQueryService continuousQueries,
      DatabaseAuthorization authorization) {
    this.seriesService = seriesService;
    this.continuousQueries = continuousQueries;
    this.authorization = authorization;
  }

  @PostMapping("/points")
  @Operation(summary = "Write points",
      description = "Appends points to one or more series, creating them on first write.")
  @ApiResponses({
      @ApiResponse(responseCode = "204", description = "Points stored"),
      @ApiResponse(responseCode = "200", description = "Points stored, with summary",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = WriteSummary.class))),
      @ApiResponse(responseCode = "400", description = "Malformed points",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "404", description = "Unknown database",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<WriteSummary> writePoints(
      @PathVariable @Parameter(description = "Database name", example = "metrics") String db,
      @RequestBody List<SeriesWrite> writes,
      @RequestParam(name = "time_precision", defaultValue = "s")
          @Parameter(description = "Unit of time values: s, ms or u") String timePrecision,
      @RequestParam(required = false)
          @Parameter(description = "Return a summary of what was written") String summary,
      HttpServletRequest request) {
    authorization.require(db, Permission.WRITE, ApiKeys.resolve(request));
    WriteSummary written = seriesService.write(db, writes, parsePrecision(timePrecision));
    if (summary != null && !"false".equalsIgnoreCase(summary)) {
      return ResponseEntity.ok(written);
    }
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/series")
  @Operation(summary = "Query series",
      description = "Evaluates a select query. A query with an into clause registers a "
          + "continuous query instead. Without q, lists the series of the database.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Query results",
          content = {
              @Content(mediaType = "application/json",
                  array = @ArraySchema(schema = @Schema(implementation = SeriesResult.class))),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "201", description = "Continuous query registered",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = ContinuousQueryView.class))),
      @ApiResponse(responseCode = "400", description = "Invalid query",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "404", description = "Unknown database or series",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<?> query(
      @PathVariable @Parameter(description = "Database name", example = "metrics") String db,
      @RequestParam(required = false)
          @Parameter(description = "Query", example = "select value from cpu.idle") String q,
      @RequestParam(name = "time_precision", defaultValue = "s") String timePrecision,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept,
      HttpServletRequest request) {
    String key = ApiKeys.resolve(request);
    TimePrecision precision = parsePrecision(timePrecision);
    MediaType contentType = selectMediaType(format, accept);
    if (!StringUtils.hasText(q)) {
      authorization.require(db, Permission.READ, key);
      List<SeriesInfo> series = seriesService.list(db);
      return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(series);
    }
    Statement statement = QueryParser.parse(q);
    if (statement instanceof DeleteStatement) {
      throw new IllegalArgumentException("delete queries must be sent with DELETE");
    }
    SelectStatement select = (SelectStatement) statement;
    if (select.isContinuous()) {
      authorization.require(db, Permission.WRITE, key);
      ContinuousQueryView registered = continuousQueries.register(db, select, q, precision);
      return ResponseEntity
          .created(URI.create("/db/" + db + "/continuous_queries/" + registered.id()))
          .contentType(MediaType.APPLICATION_JSON)
          .body(registered);
    }
    authorization.require(db, Permission.READ, key);
    List<SeriesResult> results = seriesService.query(db, select, precision);
    Object body = contentType.isCompatibleWith(CsvHttpMessageConverter.TEXT_CSV)
        ? csvRows(results)
        : results;
    return ResponseEntity.ok().contentType(contentType).body(body);
  }

  @DeleteMapping("/series")
  @Operation(summary = "Delete points",
      description = "Removes points matched by a delete query, e.g. "
          + "delete from cpu.idle where time < now() - 7d.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Number of points removed"),
      @ApiResponse(responseCode = "400", description = "Invalid query",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public Map<String, Long> delete(@PathVariable String db, @RequestParam String q,
      @RequestParam(name = "time_precision", defaultValue = "s") String timePrecision,
      HttpServletRequest request) {
    authorization.require(db, Permission.WRITE, ApiKeys.resolve(request));
    Statement statement = QueryParser.parse(q);
    if (!(statement instanceof DeleteStatement delete)) {
      throw new IllegalArgumentException("Expected a delete query");
    }
    long deleted = seriesService.delete(db, delete, parsePrecision(timePrecision));
    return Map.of("deleted", deleted);
  }

  @GetMapping(value = "/series/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  @Operation(summary = "Stream a query",
      description = "Sends the query results as server-sent 'series' events, first for the "
          + "query window, then for each new interval.")
  public SseEmitter stream(@PathVariable String db, @RequestParam String q,
      @RequestParam(name = "time_precision", defaultValue = "s") String timePrecision,
      HttpServletRequest request) {
    authorization.require(db, Permission.READ, ApiKeys.resolve(request));
    TimePrecision precision = parsePrecision(timePrecision);
    SelectStatement select = QueryParser.parseSelect(q);
    ShallowEtagHeaderFilter.disableContentCaching(request);
    return continuousQueries.subscribe(db, select, q, precision);
  }

  static List<Map<String, Object>> csvRows(List<SeriesResult> results) {
    List<Map<String, Object>> rows = new ArrayList<>();
    for (SeriesResult result : results) {
      List<String> header = csvHeader(result.columns());
      for (List<Object> datapoint : result.datapoints()) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(SERIES_COLUMN, result.name());
        for (int i = 0; i < header.size(); i++) {
          row.put(header.get(i), datapoint.get(i));
        }
        rows.add(row);
      }
    }
    return rows;
  }

  /** Column names made unique against {@code series} and each other: time, time_2, ... */
  private static List<String> csvHeader(List<String> columns) {
    Set<String> taken = new HashSet<>();
    taken.add(SERIES_COLUMN);
    List<String> header = new ArrayList<>(columns.size());
    for (String column : columns) {
      String name = column;
      for (int n = 2; !taken.add(name); n++) {
        name = column + "_" + n;
      }
      header.add(name);
    }
    return header;
  }

  private static TimePrecision parsePrecision(String value) {
    try {
      return TimePrecision.parse(value);
    } catch (IllegalArgumentException ex) {
      throw invalidParameter("Invalid time_precision. Supported values: s,ms,u.", 1001);
    }
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw invalidParameter("Invalid format value. Supported values: json,csv.", 1002);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes;
    try {
      mediaTypes = MediaType.parseMediaTypes(accept);
    } catch (IllegalArgumentException ex) {
      return MediaType.APPLICATION_JSON;
    }
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CsvHttpMessageConverter.TEXT_CSV)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
    }
    return MediaType.APPLICATION_JSON;
  }

  private static InvalidParameterException invalidParameter(String message, int errorCode) {
    return new InvalidParameterException(message, errorCode, ERROR_DOCS_BASE + errorCode);
  }
}
