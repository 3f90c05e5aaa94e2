package com.ospicorp.tsdb.query.ast;

/** What a statement reads from. */
public sealed interface Source permits SeriesSource, RegexSource, MergeSource, JoinSource {
}
