package com.ospicorp.tsdb.series.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TimePrecisionTest {

  @Test
  void convertsBetweenUnits() {
    assertThat(TimePrecision.S.toMillis(1_311_836_012L)).isEqualTo(1_311_836_012_000L);
    assertThat(TimePrecision.U.toMillis(1_311_836_012_345_678L)).isEqualTo(1_311_836_012_345L);
    assertThat(TimePrecision.S.fromMillis(-1L)).isEqualTo(-1L);
    assertThat(TimePrecision.U.fromMillis(5L)).isEqualTo(5_000L);
  }

  @Test
  void secondsBeyondTheMillisecondRangeAreRejected() {
    assertThatThrownBy(() -> TimePrecision.S.toMillis(9_300_000_000_000_000L))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("out of range");
    assertThatThrownBy(() -> TimePrecision.S.toMillis(Long.MIN_VALUE / 10))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void millisecondsBeyondTheMicrosecondRangeAreRejected() {
    assertThatThrownBy(() -> TimePrecision.U.fromMillis(9_300_000_000_000_000L))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("precision u");
  }
}
