package com.ospicorp.tsdb.query.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ospicorp.tsdb.query.ast.BinaryExpr;
import com.ospicorp.tsdb.query.ast.Call;
import com.ospicorp.tsdb.query.ast.DeleteStatement;
import com.ospicorp.tsdb.query.ast.FieldRef;
import com.ospicorp.tsdb.query.ast.Fill;
import com.ospicorp.tsdb.query.ast.JoinSource;
import com.ospicorp.tsdb.query.ast.MergeSource;
import com.ospicorp.tsdb.query.ast.NumberLiteral;
import com.ospicorp.tsdb.query.ast.Operator;
import com.ospicorp.tsdb.query.ast.RegexLiteral;
import com.ospicorp.tsdb.query.ast.RegexSource;
import com.ospicorp.tsdb.query.ast.SelectStatement;
import com.ospicorp.tsdb.query.ast.SeriesSource;
import com.ospicorp.tsdb.query.ast.Star;
import com.ospicorp.tsdb.query.ast.StringLiteral;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class QueryParserTest {

  @Test
  void parsesSourceWrittenWithEqualsSign() {
    SelectStatement select =
        QueryParser.parseSelect("select value from=cpu.idle where time>now()-1d");

    assertThat(select.source()).isEqualTo(new SeriesSource("cpu.idle"));
    assertThat(select.fields()).hasSize(1);
    assertThat(select.fields().get(0).expr()).isEqualTo(new FieldRef("value"));
    BinaryExpr where = (BinaryExpr) select.where();
    assertThat(where.operator()).isEqualTo(Operator.GT);
    assertThat(where.left()).isEqualTo(new FieldRef("time"));
    assertThat(select.ascending()).isFalse();
    assertThat(select.limit()).isNull();
  }

  @Test
  void seriesNameWithRegexCharactersIsARegex() {
    SelectStatement select = QueryParser.parseSelect(
        "select value from cpu.* where time>now()-7d and time<now()-6d");

    assertThat(select.source()).isInstanceOf(RegexSource.class);
    RegexSource regex = (RegexSource) select.source();
    assertThat(regex.matches("cpu.idle")).isTrue();
    assertThat(regex.matches("mem.used")).isFalse();
    assertThat(((BinaryExpr) select.where()).operator()).isEqualTo(Operator.AND);
  }

  @Test
  void slashDelimitedRegexSource() {
    SelectStatement select = QueryParser.parseSelect("select last(value) from /.*/ limit=1");

    assertThat(select.source()).isInstanceOf(RegexSource.class);
    assertThat(select.limit()).isEqualTo(1);
    Call last = (Call) select.fields().get(0).expr();
    assertThat(last.name()).isEqualTo("last");
  }

  @Test
  void clausesMayAppearInAnyOrder() {
    SelectStatement select = QueryParser.parseSelect(
        "select count(*) from users.events group_by email,time(1h) where time>now()-7d");

    assertThat(select.groupBy().interval()).isEqualTo(Duration.ofHours(1));
    assertThat(select.groupBy().columns()).containsExactly("email");
    assertThat(select.where()).isNotNull();
    Call count = (Call) select.fields().get(0).expr();
    assertThat(count.arguments()).containsExactly(new Star());
  }

  @Test
  void groupByMayBeWrittenAsTwoWords() {
    SelectStatement select = QueryParser.parseSelect(
        "select mean(value) from cpu group by time(5m) fill(0) order asc limit 10");

    assertThat(select.groupBy().interval()).isEqualTo(Duration.ofMinutes(5));
    assertThat(select.fill().mode()).isEqualTo(Fill.Mode.VALUE);
    assertThat(select.fill().value()).isEqualTo(0L);
    assertThat(select.ascending()).isTrue();
    assertThat(select.limit()).isEqualTo(10);
  }

  @Test
  void parsesMergeAndInnerJoinSources() {
    SelectStatement merge = QueryParser.parseSelect(
        "select count(*) from merge(newsletter.signups,user.signups) group_by time(1h)");
    assertThat(merge.source())
        .isEqualTo(new MergeSource(List.of("newsletter.signups", "user.signups")));

    SelectStatement join = QueryParser.parseSelect("select diff(t1.value, t2.value) "
        + "from inner_join(memory.total, t1, memory.used, t2) group_by time(1m)");
    assertThat(join.source())
        .isEqualTo(new JoinSource("memory.total", "t1", "memory.used", "t2"));
    Call diff = (Call) join.fields().get(0).expr();
    assertThat(diff.arguments()).containsExactly(new FieldRef("t1.value"),
        new FieldRef("t2.value"));
  }

  @Test
  void parsesTopPercentileAndDistinct() {
    SelectStatement top = QueryParser.parseSelect(
        "select top(10, count(*)) from=users.events group_by email,time(1h)");
    Call call = (Call) top.fields().get(0).expr();
    assertThat(call.name()).isEqualTo("top");
    assertThat(call.argument(0)).isEqualTo(new NumberLiteral(10L));

    SelectStatement percentile = QueryParser.parseSelect(
        "select percentile(95, value) from response_times group_by time(10m)");
    assertThat(((Call) percentile.fields().get(0).expr()).argument(0))
        .isEqualTo(new NumberLiteral(95L));

    SelectStatement distinct = QueryParser.parseSelect(
        "select count(distinct(email)) from user.events group_by time(15m)");
    Call count = (Call) distinct.fields().get(0).expr();
    assertThat(((Call) count.argument(0)).name()).isEqualTo("distinct");
  }

  @Test
  void parsesStringAndRegexConditions() {
    SelectStatement select = QueryParser.parseSelect(
        "select count(*) from events where type='login' and email =~ /paul/");

    BinaryExpr and = (BinaryExpr) select.where();
    BinaryExpr type = (BinaryExpr) and.left();
    assertThat(type.operator()).isEqualTo(Operator.EQ);
    assertThat(type.right()).isEqualTo(new StringLiteral("login"));
    BinaryExpr email = (BinaryExpr) and.right();
    assertThat(email.operator()).isEqualTo(Operator.MATCH);
    assertThat(email.right()).isInstanceOf(RegexLiteral.class);
  }

  @Test
  void arithmeticBindsTighterThanComparison() {
    SelectStatement select =
        QueryParser.parseSelect("select value * 2 + 1 as scaled from cpu where value / 2 > 3");

    assertThat(select.fields().get(0).alias()).isEqualTo("scaled");
    BinaryExpr sum = (BinaryExpr) select.fields().get(0).expr();
    assertThat(sum.operator()).isEqualTo(Operator.ADD);
    assertThat(((BinaryExpr) sum.left()).operator()).isEqualTo(Operator.MUL);
    BinaryExpr where = (BinaryExpr) select.where();
    assertThat(where.operator()).isEqualTo(Operator.GT);
    assertThat(((BinaryExpr) where.left()).operator()).isEqualTo(Operator.DIV);
  }

  @Test
  void parsesIntoTargets() {
    SelectStatement fixed = QueryParser.parseSelect("select count(*) from user.events "
        + "where time<forever group_by time(1d) into=user.events.count.per_day");
    assertThat(fixed.into()).isEqualTo("user.events.count.per_day");
    assertThat(fixed.isContinuous()).isTrue();

    SelectStatement templated = QueryParser.parseSelect("select percentile(95,value) "
        + "from stats.* where time<forever group_by time(1d) into :series_name.percentiles.95");
    assertThat(templated.into()).isEqualTo(":series_name.percentiles.95");
  }

  @Test
  void parsesDeleteStatements() {
    DeleteStatement byName = (DeleteStatement) QueryParser.parse(
        "delete from cpu.idle where time > now() - 2d and time < now() - 1d");
    assertThat(byName.source()).isEqualTo(new SeriesSource("cpu.idle"));

    DeleteStatement byRegex = (DeleteStatement) QueryParser.parse("delete from /^cpu\\..*/");
    assertThat(byRegex.source()).isInstanceOf(RegexSource.class);
    assertThat(byRegex.where()).isNull();
  }

  @Test
  void rejectsMalformedQueriesWithPosition() {
    assertThatThrownBy(() -> QueryParser.parse("select value from"))
        .isInstanceOf(QueryParseException.class);

    assertThatThrownBy(() -> QueryParser.parse("select value frm cpu"))
        .isInstanceOf(QueryParseException.class)
        .hasMessageContaining("position 13");

    assertThatThrownBy(() -> QueryParser.parse("select nosuch(value) from cpu"))
        .isInstanceOf(QueryParseException.class)
        .hasMessageContaining("nosuch");

    assertThatThrownBy(() -> QueryParser.parse("update cpu set value = 1"))
        .isInstanceOf(QueryParseException.class);
  }

  @Test
  void rejectsInvalidClauseCombinations() {
    assertThatThrownBy(() -> QueryParser.parse("select value from cpu fill(0)"))
        .isInstanceOf(QueryParseException.class)
        .hasMessageContaining("fill()");

    assertThatThrownBy(() -> QueryParser.parse("select value from cpu limit 1 limit 2"))
        .isInstanceOf(QueryParseException.class);

    assertThatThrownBy(() -> QueryParser.parse("select value from cpu limit 0"))
        .isInstanceOf(QueryParseException.class);

    assertThatThrownBy(() -> QueryParser.parse("select value from inner_join(a, x, b, x)"))
        .isInstanceOf(QueryParseException.class)
        .hasMessageContaining("aliases");

    assertThatThrownBy(() -> QueryParser.parse("select value from merge(a)"))
        .isInstanceOf(QueryParseException.class);

    assertThatThrownBy(() -> QueryParser.parse("delete from merge(a, b)"))
        .isInstanceOf(QueryParseException.class);

    assertThatThrownBy(() -> QueryParser.parse("select top(0, count(*)) from cpu"))
        .isInstanceOf(QueryParseException.class);

    assertThatThrownBy(() -> QueryParser.parse("select sum(*) from cpu"))
        .isInstanceOf(QueryParseException.class);

    assertThatThrownBy(() -> QueryParser.parse("select count(*) as time from cpu"))
        .isInstanceOf(QueryParseException.class)
        .hasMessageContaining("reserved");
  }

  @Test
  void durationsBeyondTheMillisecondRangeReportTheirPosition() {
    String bucket = "select count(*) from cpu group_by time(9999999999999d)";
    assertThatThrownBy(() -> QueryParser.parse(bucket))
        .isInstanceOfSatisfying(QueryParseException.class, ex -> assertThat(ex.getPosition())
            .isEqualTo(bucket.indexOf("9999999999999d")))
        .hasMessageContaining("out of range");

    String weeks = "select value from cpu where time > now() - 2000000000000000000w";
    assertThatThrownBy(() -> QueryParser.parse(weeks))
        .isInstanceOfSatisfying(QueryParseException.class, ex -> assertThat(ex.getPosition())
            .isEqualTo(weeks.indexOf("2000000000000000000w")));

    assertThatThrownBy(() -> QueryParser.parse(
        "select value from cpu where time > now() - 99999999999999999999s"))
        .isInstanceOf(QueryParseException.class)
        .hasMessageContaining("out of range");
  }
}
