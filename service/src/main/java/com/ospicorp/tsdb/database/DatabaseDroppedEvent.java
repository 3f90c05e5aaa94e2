package com.ospicorp.tsdb.database;

/** Published after a database and its points have been removed. */
public record DatabaseDroppedEvent(String database) {}
