package com.ospicorp.tsdb.query.parser;

import com.ospicorp.tsdb.query.Durations;

/**
 * Splits a query into tokens on demand. Series names, regex sources and {@code into} targets
 * follow their own lexical rules, so the parser reads them through {@link #rawWord()} and
 * {@link #regexLiteral()}, which rewind any token already peeked.
 */
final class QueryScanner {

  private final String input;
  private int position;
  private Token lookahead;

  QueryScanner(String input) {
    this.input = input;
  }

  Token peek() {
    if (lookahead == null) {
      lookahead = scan();
    }
    return lookahead;
  }

  Token next() {
    Token token = peek();
    lookahead = null;
    return token;
  }

  int position() {
    return lookahead != null ? lookahead.position() : position;
  }

  /** Consumes a {@code =} directly following a keyword such as {@code from=} or {@code limit=}. */
  void skipOptionalEquals() {
    rewind();
    skipWhitespace();
    if (position < input.length() && input.charAt(position) == '='
        && (position + 1 >= input.length() || input.charAt(position + 1) != '~')) {
      position++;
    }
  }

  /**
   * Reads a source or target up to the next whitespace outside parentheses. Text starting with
   * {@code /} runs to the closing slash.
   */
  String rawWord() {
    rewind();
    skipWhitespace();
    int start = position;
    if (position < input.length() && input.charAt(position) == '/') {
      return "/" + readRegexBody() + "/";
    }
    int depth = 0;
    while (position < input.length()) {
      char c = input.charAt(position);
      if (Character.isWhitespace(c) && depth == 0) {
        break;
      }
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
      }
      position++;
    }
    if (depth != 0) {
      throw new QueryParseException(
          "Unbalanced parentheses in '" + input.substring(start, position) + "'", start);
    }
    if (start == position) {
      throw new QueryParseException("Expected a series name", start);
    }
    return input.substring(start, position);
  }

  /** Reads {@code /pattern/} and returns the pattern with {@code \/} unescaped. */
  String regexLiteral() {
    rewind();
    skipWhitespace();
    if (position >= input.length() || input.charAt(position) != '/') {
      throw new QueryParseException("Expected a regular expression like /pattern/", position);
    }
    return readRegexBody();
  }

  private String readRegexBody() {
    int start = position;
    position++;
    StringBuilder pattern = new StringBuilder();
    while (position < input.length()) {
      char c = input.charAt(position);
      if (c == '\\' && position + 1 < input.length() && input.charAt(position + 1) == '/') {
        pattern.append('/');
        position += 2;
        continue;
      }
      if (c == '/') {
        position++;
        return pattern.toString();
      }
      pattern.append(c);
      position++;
    }
    throw new QueryParseException("Unterminated regular expression", start);
  }

  private void rewind() {
    if (lookahead != null) {
      position = lookahead.position();
      lookahead = null;
    }
  }

  private void skipWhitespace() {
    while (position < input.length() && Character.isWhitespace(input.charAt(position))) {
      position++;
    }
  }

  private Token scan() {
    skipWhitespace();
    if (position >= input.length()) {
      return new Token(TokenType.EOF, "", position);
    }
    int start = position;
    char c = input.charAt(position);
    if (Character.isLetter(c) || c == '_') {
      while (position < input.length() && isIdentifierPart(input.charAt(position))) {
        position++;
      }
      return new Token(TokenType.IDENTIFIER, input.substring(start, position), start);
    }
    if (Character.isDigit(c)) {
      return scanNumber(start);
    }
    if (c == '\'' || c == '"') {
      return scanString(start, c);
    }
    position++;
    switch (c) {
      case '(':
        return new Token(TokenType.LPAREN, "(", start);
      case ')':
        return new Token(TokenType.RPAREN, ")", start);
      case ',':
        return new Token(TokenType.COMMA, ",", start);
      case '*':
        return new Token(TokenType.STAR, "*", start);
      case '+':
      case '-':
      case '/':
        return new Token(TokenType.OPERATOR, String.valueOf(c), start);
      case '=':
        return operator(start, '~', "=~", "=");
      case '!':
        if (position < input.length()
            && (input.charAt(position) == '=' || input.charAt(position) == '~')) {
          return new Token(TokenType.OPERATOR, "!" + input.charAt(position++), start);
        }
        break;
      case '<':
        if (position < input.length() && input.charAt(position) == '>') {
          position++;
          return new Token(TokenType.OPERATOR, "!=", start);
        }
        return operator(start, '=', "<=", "<");
      case '>':
        return operator(start, '=', ">=", ">");
      default:
        break;
    }
    throw new QueryParseException("Unexpected character '" + c + "'", start);
  }

  private Token operator(int start, char second, String twoChar, String oneChar) {
    if (position < input.length() && input.charAt(position) == second) {
      position++;
      return new Token(TokenType.OPERATOR, twoChar, start);
    }
    return new Token(TokenType.OPERATOR, oneChar, start);
  }

  private Token scanNumber(int start) {
    while (position < input.length() && Character.isDigit(input.charAt(position))) {
      position++;
    }
    if (position + 1 < input.length() && input.charAt(position) == '.'
        && Character.isDigit(input.charAt(position + 1))) {
      position++;
      while (position < input.length() && Character.isDigit(input.charAt(position))) {
        position++;
      }
      return new Token(TokenType.NUMBER, input.substring(start, position), start);
    }
    int unitStart = position;
    while (position < input.length() && Character.isLetter(input.charAt(position))) {
      position++;
    }
    if (unitStart == position) {
      return new Token(TokenType.NUMBER, input.substring(start, position), start);
    }
    String text = input.substring(start, position);
    if (!Durations.isDuration(text)) {
      throw new QueryParseException("Invalid duration '" + text + "'", start);
    }
    return new Token(TokenType.DURATION, text, start);
  }

  private Token scanString(int start, char quote) {
    position++;
    StringBuilder value = new StringBuilder();
    while (position < input.length()) {
      char c = input.charAt(position++);
      if (c == '\\' && position < input.length()) {
        value.append(input.charAt(position++));
      } else if (c == quote) {
        return new Token(TokenType.STRING, value.toString(), start);
      } else {
        value.append(c);
      }
    }
    throw new QueryParseException("Unterminated string", start);
  }

  private static boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '.';
  }
}
