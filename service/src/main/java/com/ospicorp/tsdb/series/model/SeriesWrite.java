package com.ospicorp.tsdb.series.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.util.List;

/** One element of the body posted to {@code /db/{db}/points}. */
public record SeriesWrite(
    @NotBlank @Pattern(regexp = SeriesWrite.SERIES_NAME_REGEX) String series,
    List<String> columns,
    @JsonProperty("extra_columns") List<String> extraColumns,
    @NotNull List<JsonNode> points
) {
  public static final String SERIES_NAME_REGEX = "^[A-Za-z0-9_.:-]{1,255}$";
}
