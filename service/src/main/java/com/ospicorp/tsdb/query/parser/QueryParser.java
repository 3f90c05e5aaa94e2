package com.ospicorp.tsdb.query.parser;

import com.ospicorp.tsdb.query.Durations;
import com.ospicorp.tsdb.query.Functions;
import com.ospicorp.tsdb.query.ast.BinaryExpr;
import com.ospicorp.tsdb.query.ast.Call;
import com.ospicorp.tsdb.query.ast.DeleteStatement;
import com.ospicorp.tsdb.query.ast.DurationLiteral;
import com.ospicorp.tsdb.query.ast.Expr;
import com.ospicorp.tsdb.query.ast.FieldRef;
import com.ospicorp.tsdb.query.ast.Fill;
import com.ospicorp.tsdb.query.ast.Forever;
import com.ospicorp.tsdb.query.ast.GroupBy;
import com.ospicorp.tsdb.query.ast.JoinSource;
import com.ospicorp.tsdb.query.ast.MergeSource;
import com.ospicorp.tsdb.query.ast.Now;
import com.ospicorp.tsdb.query.ast.NumberLiteral;
import com.ospicorp.tsdb.query.ast.Operator;
import com.ospicorp.tsdb.query.ast.RegexLiteral;
import com.ospicorp.tsdb.query.ast.RegexSource;
import com.ospicorp.tsdb.query.ast.SelectField;
import com.ospicorp.tsdb.query.ast.SelectStatement;
import com.ospicorp.tsdb.query.ast.SeriesSource;
import com.ospicorp.tsdb.query.ast.Source;
import com.ospicorp.tsdb.query.ast.Star;
import com.ospicorp.tsdb.query.ast.Statement;
import com.ospicorp.tsdb.query.ast.StringLiteral;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.springframework.util.StringUtils;

/**
 * Recursive descent parser for the query language.
 *
 * <pre>
 * select field [as alias] {, field} from[=] source {where expr | group_by item {, item}
 *     | fill(none|null|previous|number) | limit[=] n | order asc|desc | into[=] target}
 * delete from[=] source [where expr]
 * </pre>
 *
 * Clauses after the source may come in any order, each at most once.
 */
public final class QueryParser {

  private static final Pattern SERIES_NAME = Pattern.compile("^[A-Za-z0-9_.:-]{1,255}$");
  private static final Set<String> RESERVED_ALIASES = Set.of("time", "sequence_number");
  private static final Pattern ALIAS = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");
  private static final String REGEX_CHARACTERS = "*+?[]{}()|^$\\";
  private static final Set<String> KEYWORDS = Set.of(
      "select", "from", "where", "group_by", "group", "fill", "limit", "order", "into", "as",
      "and", "or", "delete");

  private final QueryScanner scanner;

  private QueryParser(String query) {
    this.scanner = new QueryScanner(query);
  }

  public static Statement parse(String query) {
    if (!StringUtils.hasText(query)) {
      throw new QueryParseException("Query must not be empty", 0);
    }
    return new QueryParser(query.trim()).statement();
  }

  public static SelectStatement parseSelect(String query) {
    Statement statement = parse(query);
    if (statement instanceof SelectStatement select) {
      return select;
    }
    throw new QueryParseException("Expected a select query", 0);
  }

  private Statement statement() {
    Token first = scanner.next();
    Statement statement;
    if (first.isKeyword("select")) {
      statement = select();
    } else if (first.isKeyword("delete")) {
      statement = delete();
    } else {
      throw error("Expected 'select' or 'delete' but found " + first.describe(), first);
    }
    Token end = scanner.peek();
    if (!end.is(TokenType.EOF)) {
      throw error("Unexpected " + end.describe(), end);
    }
    return statement;
  }

  private SelectStatement select() {
    List<SelectField> fields = new ArrayList<>();
    do {
      fields.add(selectField());
    } while (accept(TokenType.COMMA));
    expectKeyword("from");
    Source source = source();

    Expr where = null;
    GroupBy groupBy = null;
    Fill fill = null;
    Integer limit = null;
    Boolean ascending = null;
    String into = null;
    while (!scanner.peek().is(TokenType.EOF)) {
      Token clause = scanner.next();
      switch (clause.lower()) {
        case "where" -> {
          requireAbsent(where, clause);
          where = expression();
        }
        case "group_by", "group" -> {
          requireAbsent(groupBy, clause);
          if (clause.isKeyword("group")) {
            expectKeyword("by");
          }
          groupBy = groupBy();
        }
        case "fill" -> {
          requireAbsent(fill, clause);
          fill = fill();
        }
        case "limit" -> {
          requireAbsent(limit, clause);
          limit = limit();
        }
        case "order" -> {
          requireAbsent(ascending, clause);
          ascending = order();
        }
        case "into" -> {
          requireAbsent(into, clause);
          into = into();
        }
        default -> throw error("Unexpected " + clause.describe(), clause);
      }
    }
    if (fill != null && fill.mode() != Fill.Mode.NONE && (groupBy == null || !groupBy.byTime())) {
      throw new QueryParseException("fill() requires group_by time(...)", 0);
    }
    return new SelectStatement(fields, source, where, groupBy, fill, limit,
        Boolean.TRUE.equals(ascending), into);
  }

  private DeleteStatement delete() {
    expectKeyword("from");
    int position = scanner.position();
    Source source = source();
    if (source instanceof MergeSource || source instanceof JoinSource) {
      throw new QueryParseException("delete accepts a series name or a regex", position);
    }
    Expr where = null;
    if (scanner.peek().isKeyword("where")) {
      scanner.next();
      where = expression();
    }
    return new DeleteStatement(source, where);
  }

  private SelectField selectField() {
    Expr expr = expression();
    String alias = null;
    if (scanner.peek().isKeyword("as")) {
      scanner.next();
      Token name = scanner.next();
      if (!name.is(TokenType.IDENTIFIER) || !ALIAS.matcher(name.text()).matches()) {
        throw error("Invalid alias " + name.describe(), name);
      }
      if (RESERVED_ALIASES.contains(name.text())) {
        throw error("Alias " + name.describe() + " is reserved for point columns", name);
      }
      alias = name.text();
    }
    return new SelectField(expr, alias);
  }

  private Source source() {
    scanner.skipOptionalEquals();
    int position = scanner.position();
    String text = scanner.rawWord();
    if (text.length() >= 2 && text.startsWith("/") && text.endsWith("/")) {
      return regexSource(text.substring(1, text.length() - 1), position);
    }
    String lower = text.toLowerCase(Locale.ROOT);
    if (lower.startsWith("merge(") && text.endsWith(")")) {
      List<String> names = arguments(text, "merge(".length(), position);
      if (names.size() < 2) {
        throw new QueryParseException("merge() needs at least two series", position);
      }
      names.forEach(name -> seriesName(name, position));
      return new MergeSource(names);
    }
    if (lower.startsWith("inner_join(") && text.endsWith(")")) {
      List<String> arguments = arguments(text, "inner_join(".length(), position);
      if (arguments.size() != 4) {
        throw new QueryParseException(
            "inner_join() takes (series, alias, series, alias)", position);
      }
      seriesName(arguments.get(0), position);
      seriesName(arguments.get(2), position);
      for (String alias : List.of(arguments.get(1), arguments.get(3))) {
        if (!ALIAS.matcher(alias).matches()) {
          throw new QueryParseException("Invalid join alias '" + alias + "'", position);
        }
      }
      if (arguments.get(1).equals(arguments.get(3))) {
        throw new QueryParseException("Join aliases must differ", position);
      }
      return new JoinSource(arguments.get(0), arguments.get(1), arguments.get(2), arguments.get(3));
    }
    for (char c : text.toCharArray()) {
      if (REGEX_CHARACTERS.indexOf(c) >= 0) {
        return regexSource(text, position);
      }
    }
    return new SeriesSource(seriesName(text, position));
  }

  private static List<String> arguments(String text, int offset, int position) {
    List<String> arguments = new ArrayList<>();
    for (String part : text.substring(offset, text.length() - 1).split(",")) {
      String argument = part.trim();
      if (argument.isEmpty()) {
        throw new QueryParseException("Empty argument in '" + text + "'", position);
      }
      arguments.add(argument);
    }
    return arguments;
  }

  private static RegexSource regexSource(String pattern, int position) {
    try {
      return new RegexSource(Pattern.compile(pattern));
    } catch (PatternSyntaxException ex) {
      throw new QueryParseException("Invalid regular expression '" + pattern + "'", position);
    }
  }

  private static String seriesName(String name, int position) {
    if (!SERIES_NAME.matcher(name).matches()) {
      throw new QueryParseException("Invalid series name '" + name + "'", position);
    }
    return name;
  }

  private GroupBy groupBy() {
    Duration interval = null;
    List<String> columns = new ArrayList<>();
    do {
      Token item = scanner.next();
      if (!item.is(TokenType.IDENTIFIER) || KEYWORDS.contains(item.lower())) {
        throw error("Expected a column or time(...) but found " + item.describe(), item);
      }
      if (item.isKeyword("time") && scanner.peek().is(TokenType.LPAREN)) {
        if (interval != null) {
          throw error("group_by accepts a single time(...)", item);
        }
        scanner.next();
        Token width = expect(TokenType.DURATION, "a duration like 1h");
        interval = duration(width);
        if (interval.toMillis() <= 0) {
          throw error("Time buckets must be at least 1ms", width);
        }
        expect(TokenType.RPAREN, "')'");
      } else {
        columns.add(item.text());
      }
    } while (accept(TokenType.COMMA));
    return new GroupBy(interval, columns);
  }

  private Fill fill() {
    expect(TokenType.LPAREN, "'('");
    Token value = scanner.next();
    Fill fill;
    if (value.isKeyword("none")) {
      fill = Fill.NONE;
    } else if (value.isKeyword("null")) {
      fill = new Fill(Fill.Mode.NULL, null);
    } else if (value.isKeyword("previous")) {
      fill = new Fill(Fill.Mode.PREVIOUS, null);
    } else {
      boolean negative = value.isOperator("-");
      Token number = negative ? scanner.next() : value;
      if (!number.is(TokenType.NUMBER)) {
        throw error("Expected none, null, previous or a number but found " + number.describe(),
            number);
      }
      Number parsed = number(number.text());
      fill = new Fill(Fill.Mode.VALUE, negative ? negate(parsed) : parsed);
    }
    expect(TokenType.RPAREN, "')'");
    return fill;
  }

  private int limit() {
    scanner.skipOptionalEquals();
    Token value = expect(TokenType.NUMBER, "a positive integer");
    try {
      int limit = Integer.parseInt(value.text());
      if (limit < 1) {
        throw error("limit must be at least 1", value);
      }
      return limit;
    } catch (NumberFormatException ex) {
      throw error("Invalid limit " + value.describe(), value);
    }
  }

  private boolean order() {
    if (scanner.peek().isKeyword("by")) {
      scanner.next();
      expectKeyword("time");
    }
    Token direction = scanner.next();
    if (direction.isKeyword("asc")) {
      return true;
    }
    if (direction.isKeyword("desc")) {
      return false;
    }
    throw error("Expected asc or desc but found " + direction.describe(), direction);
  }

  private String into() {
    scanner.skipOptionalEquals();
    int position = scanner.position();
    return seriesName(scanner.rawWord(), position);
  }

  private Expr expression() {
    Expr left = conjunction();
    while (scanner.peek().isKeyword("or")) {
      scanner.next();
      left = new BinaryExpr(Operator.OR, left, conjunction());
    }
    return left;
  }

  private Expr conjunction() {
    Expr left = comparison();
    while (scanner.peek().isKeyword("and")) {
      scanner.next();
      left = new BinaryExpr(Operator.AND, left, comparison());
    }
    return left;
  }

  private Expr comparison() {
    Expr left = additive();
    Token token = scanner.peek();
    if (token.type() != TokenType.OPERATOR) {
      return left;
    }
    Operator operator = switch (token.text()) {
      case "=" -> Operator.EQ;
      case "!=" -> Operator.NE;
      case "<" -> Operator.LT;
      case "<=" -> Operator.LE;
      case ">" -> Operator.GT;
      case ">=" -> Operator.GE;
      case "=~" -> Operator.MATCH;
      case "!~" -> Operator.NOT_MATCH;
      default -> null;
    };
    if (operator == null) {
      return left;
    }
    scanner.next();
    if (operator == Operator.MATCH || operator == Operator.NOT_MATCH) {
      int position = scanner.position();
      String pattern = scanner.regexLiteral();
      try {
        return new BinaryExpr(operator, left, new RegexLiteral(Pattern.compile(pattern)));
      } catch (PatternSyntaxException ex) {
        throw new QueryParseException("Invalid regular expression '" + pattern + "'", position);
      }
    }
    return new BinaryExpr(operator, left, additive());
  }

  private Expr additive() {
    Expr left = multiplicative();
    while (scanner.peek().isOperator("+") || scanner.peek().isOperator("-")) {
      Operator operator = scanner.next().isOperator("+") ? Operator.ADD : Operator.SUB;
      left = new BinaryExpr(operator, left, multiplicative());
    }
    return left;
  }

  private Expr multiplicative() {
    Expr left = unary();
    while (scanner.peek().is(TokenType.STAR) || scanner.peek().isOperator("/")) {
      Operator operator = scanner.next().is(TokenType.STAR) ? Operator.MUL : Operator.DIV;
      left = new BinaryExpr(operator, left, unary());
    }
    return left;
  }

  private Expr unary() {
    if (scanner.peek().isOperator("-")) {
      scanner.next();
      Expr operand = unary();
      if (operand instanceof NumberLiteral literal) {
        return new NumberLiteral(negate(literal.value()));
      }
      return new BinaryExpr(Operator.SUB, new NumberLiteral(0L), operand);
    }
    return primary();
  }

  private Expr primary() {
    Token token = scanner.next();
    switch (token.type()) {
      case NUMBER:
        return new NumberLiteral(number(token.text()));
      case DURATION:
        return new DurationLiteral(duration(token));
      case STRING:
        return new StringLiteral(token.text());
      case STAR:
        return new Star();
      case LPAREN: {
        Expr inner = expression();
        expect(TokenType.RPAREN, "')'");
        return inner;
      }
      case IDENTIFIER:
        return identifier(token);
      default:
        throw error("Unexpected " + token.describe(), token);
    }
  }

  private Expr identifier(Token token) {
    if (KEYWORDS.contains(token.lower())) {
      throw error("Unexpected keyword " + token.describe(), token);
    }
    if (token.isKeyword("forever")) {
      return new Forever();
    }
    if (!scanner.peek().is(TokenType.LPAREN)) {
      return new FieldRef(token.text());
    }
    scanner.next();
    String name = token.lower();
    if (!Functions.isKnown(name)) {
      throw error("Unknown function " + token.describe(), token);
    }
    List<Expr> arguments = new ArrayList<>();
    if (!accept(TokenType.RPAREN)) {
      do {
        arguments.add(expression());
      } while (accept(TokenType.COMMA));
      expect(TokenType.RPAREN, "')'");
    }
    if (Functions.NOW.equals(name)) {
      if (!arguments.isEmpty()) {
        throw error("now() takes no arguments", token);
      }
      return new Now();
    }
    Call call = new Call(name, arguments);
    validateArity(call, token);
    return call;
  }

  private void validateArity(Call call, Token token) {
    int expected = switch (call.name()) {
      case "percentile", "top", "diff" -> 2;
      default -> 1;
    };
    if (call.arguments().size() != expected) {
      throw error(call.name() + "() takes " + expected + " argument" + (expected > 1 ? "s" : ""),
          token);
    }
    if ("top".equals(call.name())) {
      if (!(call.argument(0) instanceof NumberLiteral n) || !(n.value() instanceof Long)
          || n.value().longValue() < 1) {
        throw error("top() expects a positive count as its first argument", token);
      }
      if (!(call.argument(1) instanceof Call inner)
          || !Functions.AGGREGATES.contains(inner.name())) {
        throw error("top() expects an aggregate as its second argument", token);
      }
    }
    if ("percentile".equals(call.name())
        && !(call.argument(0) instanceof NumberLiteral)
        && !(call.argument(1) instanceof NumberLiteral)) {
      throw error("percentile() expects a number between 0 and 100", token);
    }
    if (call.argument(0) instanceof Star && !"count".equals(call.name())) {
      throw error("Only count() accepts *", token);
    }
  }

  private static Number number(String text) {
    if (text.contains(".")) {
      return Double.parseDouble(text);
    }
    try {
      return Long.parseLong(text);
    } catch (NumberFormatException ex) {
      return Double.parseDouble(text);
    }
  }

  private static Number negate(Number value) {
    return value instanceof Long l ? (Number) (-l) : (Number) (-value.doubleValue());
  }

  private boolean accept(TokenType type) {
    if (scanner.peek().is(type)) {
      scanner.next();
      return true;
    }
    return false;
  }

  private Token expect(TokenType type, String description) {
    Token token = scanner.next();
    if (!token.is(type)) {
      throw error("Expected " + description + " but found " + token.describe(), token);
    }
    return token;
  }

  private void expectKeyword(String keyword) {
    Token token = scanner.next();
    if (!token.isKeyword(keyword)) {
      throw error("Expected '" + keyword + "' but found " + token.describe(), token);
    }
  }

  private void requireAbsent(Object clause, Token token) {
    if (clause != null) {
      throw error("Duplicate " + token.lower() + " clause", token);
    }
  }

  private Duration duration(Token token) {
    try {
      return Durations.parse(token.text());
    } catch (IllegalArgumentException ex) {
      throw error(ex.getMessage(), token);
    }
  }

  private QueryParseException error(String message, Token token) {
    return new QueryParseException(message, token.position());
  }
}
