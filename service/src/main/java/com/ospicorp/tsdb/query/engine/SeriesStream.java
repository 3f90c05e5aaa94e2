package com.ospicorp.tsdb.query.engine;

import com.ospicorp.tsdb.series.model.DataPoint;
import java.util.List;

/** Points a source resolved to, oldest first, under the name its result will carry. */
record SeriesStream(String name, List<String> columns, List<DataPoint> points) {}
