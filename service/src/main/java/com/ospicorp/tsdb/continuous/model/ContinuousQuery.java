package com.ospicorp.tsdb.continuous.model;

import com.ospicorp.tsdb.query.ast.SelectStatement;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A registered continuous query and its progress. Runs of one query are serialized by the
 * service, which owns the mutable state.
 */
public class ContinuousQuery {

  /** {@code resumeFrom} before the first run. */
  public static final long NOT_STARTED = Long.MIN_VALUE;

  private final long id;
  private final String database;
  private final String query;
  private final SelectStatement statement;
  private final ContinuousQueryKind kind;
  private final Instant createdAt;
  private final Set<String> targets = ConcurrentHashMap.newKeySet();
  private volatile long resumeFrom = NOT_STARTED;
  private volatile Instant lastRunAt;
  private volatile long runs;
  private volatile boolean stopped;

  public ContinuousQuery(long id, String database, String query, SelectStatement statement,
      ContinuousQueryKind kind, Instant createdAt) {
    this.id = id;
    this.database = database;
    this.query = query;
    this.statement = statement;
    this.kind = kind;
    this.createdAt = createdAt;
  }

  public long id() {
    return id;
  }

  public String database() {
    return database;
  }

  public String query() {
    return query;
  }

  public SelectStatement statement() {
    return statement;
  }

  public ContinuousQueryKind kind() {
    return kind;
  }

  public long resumeFrom() {
    return resumeFrom;
  }

  public long runs() {
    return runs;
  }

  public boolean started() {
    return resumeFrom != NOT_STARTED;
  }

  public boolean stopped() {
    return stopped;
  }

  public void stop() {
    stopped = true;
  }

  /** Series this query has written to; excluded from its own regex sources. */
  public Set<String> targets() {
    return targets;
  }

  public void completed(Instant runAt, long nextResumeFrom) {
    this.lastRunAt = runAt;
    this.resumeFrom = nextResumeFrom;
    this.runs++;
  }

  public ContinuousQueryView view() {
    return new ContinuousQueryView(id, query, kind, statement.into(), createdAt, lastRunAt, runs);
  }
}
