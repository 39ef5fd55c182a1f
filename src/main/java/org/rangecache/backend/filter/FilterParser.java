package org.rangecache.backend.filter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.rangecache.backend.exception.InvalidRequestException;
import org.springframework.stereotype.Component;

/**
 * Parser for the supported {@code $filter} subset.
 *
 * <pre>
 *   expr       := andExpr ('or' andExpr)*
 *   andExpr    := unary ('and' unary)*
 *   unary      := 'not' unary | '(' expr ')' | function | comparison
 *   function   := WORD '(' field (',' literal)* ')'
 *   comparison := field ('eq'|'ne'|'gt'|'ge'|'lt'|'le') literal
 *   field      := QUOTED_NAME | WORD+
 * </pre>
 *
 * Bare field names may span several words ({@code Customer Name eq 'x'}).
 */
@Component
public class FilterParser {

  private static final Set<String> RESERVED = Set.of("and", "or", "not");

  /** Returns null for a blank filter. */
  public FilterExpression parse(String filter) {
    if (filter == null || filter.isBlank()) return null;
    List<Token> tokens = tokenize(filter);
    Cursor cursor = new Cursor(filter, tokens);
    FilterExpression expr = parseOr(cursor);
    if (!cursor.atEnd()) {
      throw cursor.error("Unexpected '" + cursor.peek().text + "'");
    }
    return expr;
  }

  private FilterExpression parseOr(Cursor c) {
    List<FilterExpression> parts = new ArrayList<>();
    parts.add(parseAnd(c));
    while (c.acceptWord("or")) {
      parts.add(parseAnd(c));
    }
    return parts.size() == 1 ? parts.get(0) : new FilterExpression.Or(parts);
  }

  private FilterExpression parseAnd(Cursor c) {
    List<FilterExpression> parts = new ArrayList<>();
    parts.add(parseUnary(c));
    while (c.acceptWord("and")) {
      parts.add(parseUnary(c));
    }
    return parts.size() == 1 ? parts.get(0) : new FilterExpression.And(parts);
  }

  private FilterExpression parseUnary(Cursor c) {
    if (c.atEnd()) throw c.error("Unexpected end of filter");
    if (c.acceptWord("not")) {
      return new FilterExpression.Not(parseUnary(c));
    }
    Token t = c.peek();
    if (t.kind == Kind.LPAREN) {
      c.next();
      FilterExpression inner = parseOr(c);
      c.expect(Kind.RPAREN, "')'");
      return inner;
    }
    if (t.kind == Kind.WORD && c.peekAhead(1) != null && c.peekAhead(1).kind == Kind.LPAREN) {
      return parseFunction(c);
    }
    return parseComparison(c);
  }

  private FilterExpression parseFunction(Cursor c) {
    String name = c.next().text;
    c.expect(Kind.LPAREN, "'('");
    String field = parseField(c, true);
    List<Literal> args = new ArrayList<>();
    while (c.peek() != null && c.peek().kind == Kind.COMMA) {
      c.next();
      args.add(parseLiteral(c));
    }
    c.expect(Kind.RPAREN, "')'");
    return new FilterExpression.FunctionCall(name, field, args);
  }

  private FilterExpression parseComparison(Cursor c) {
    String field = parseField(c, false);
    Token opToken = c.next();
    ComparisonOperator op = (opToken != null && opToken.kind == Kind.WORD)
        ? ComparisonOperator.fromKeyword(opToken.text) : null;
    if (op == null) {
      throw c.error("Expected comparison operator after '" + field + "'");
    }
    return new FilterExpression.Comparison(field, op, parseLiteral(c));
  }

  private String parseField(Cursor c, boolean insideFunction) {
    Token t = c.peek();
    if (t == null) throw c.error("Expected field name");
    if (t.kind == Kind.QUOTED_NAME) {
      c.next();
      return t.text;
    }
    if (t.kind != Kind.WORD || RESERVED.contains(t.text)) {
      throw c.error("Expected field name but found '" + t.text + "'");
    }
    StringBuilder name = new StringBuilder(c.next().text);
    // Multi-word bare names run until an operator (or the argument separator inside a function).
    while (c.peek() != null && c.peek().kind == Kind.WORD
        && ComparisonOperator.fromKeyword(c.peek().text) == null
        && !RESERVED.contains(c.peek().text)) {
      name.append(' ').append(c.next().text);
    }
    if (insideFunction && c.peek() != null && c.peek().kind != Kind.COMMA && c.peek().kind != Kind.RPAREN) {
      throw c.error("Unexpected '" + c.peek().text + "' in function arguments");
    }
    return name.toString();
  }

  private Literal parseLiteral(Cursor c) {
    Token t = c.next();
    if (t == null) throw c.error("Expected a value");
    switch (t.kind) {
      case STRING:
        return Literal.ofString(t.text);
      case NUMBER:
        return Literal.ofNumber(new BigDecimal(t.text));
      case DATE:
        try {
          return Literal.ofDate(LocalDate.parse(t.text));
        } catch (DateTimeParseException e) {
          throw new InvalidRequestException("Invalid date '" + t.text + "' in filter", e);
        }
      case WORD:
        if ("true".equals(t.text)) return Literal.ofBoolean(true);
        if ("false".equals(t.text)) return Literal.ofBoolean(false);
        if ("null".equals(t.text)) return Literal.nullValue();
        throw c.error("Expected a value but found '" + t.text + "' (string values need single quotes)");
      default:
        throw c.error("Expected a value but found '" + t.text + "'");
    }
  }

  // ================== tokenizer ==================

  enum Kind { WORD, QUOTED_NAME, STRING, NUMBER, DATE, LPAREN, RPAREN, COMMA }

  static final class Token {
    final Kind kind;
    final String text;
    final int pos;

    Token(Kind kind, String text, int pos) {
      this.kind = kind;
      this.text = text;
      this.pos = pos;
    }
  }

  List<Token> tokenize(String s) {
    List<Token> out = new ArrayList<>();
    int i = 0;
    int n = s.length();
    while (i < n) {
      char ch = s.charAt(i);
      if (Character.isWhitespace(ch)) {
        i++;
      } else if (ch == '(') {
        out.add(new Token(Kind.LPAREN, "(", i++));
      } else if (ch == ')') {
        out.add(new Token(Kind.RPAREN, ")", i++));
      } else if (ch == ',') {
        out.add(new Token(Kind.COMMA, ",", i++));
      } else if (ch == '\'') {
        int start = i;
        StringBuilder sb = new StringBuilder();
        i++;
        boolean closed = false;
        while (i < n) {
          char c = s.charAt(i);
          if (c == '\'') {
            if (i + 1 < n && s.charAt(i + 1) == '\'') {
              sb.append('\'');
              i += 2;
              continue;
            }
            closed = true;
            i++;
            break;
          }
          sb.append(c);
          i++;
        }
        if (!closed) throw new InvalidRequestException("Unterminated string starting at position " + start);
        out.add(new Token(Kind.STRING, sb.toString(), start));
      } else if (ch == '"') {
        int end = s.indexOf('"', i + 1);
        if (end < 0) throw new InvalidRequestException("Unterminated field name starting at position " + i);
        String name = s.substring(i + 1, end);
        if (name.isBlank()) throw new InvalidRequestException("Empty field name at position " + i);
        out.add(new Token(Kind.QUOTED_NAME, name, i));
        i = end + 1;
      } else if (Character.isDigit(ch) || (ch == '-' && i + 1 < n && Character.isDigit(s.charAt(i + 1)))) {
        int start = i;
        i++;
        while (i < n && (Character.isDigit(s.charAt(i)) || s.charAt(i) == '.' || s.charAt(i) == '-')) i++;
        String text = s.substring(start, i);
        if (text.matches("\\d{4}-\\d{2}-\\d{2}")) {
          out.add(new Token(Kind.DATE, text, start));
        } else if (text.matches("-?\\d+(\\.\\d+)?")) {
          out.add(new Token(Kind.NUMBER, text, start));
        } else {
          throw new InvalidRequestException("Malformed value '" + text + "' at position " + start);
        }
      } else if (isWordChar(ch)) {
        int start = i;
        while (i < n && isWordChar(s.charAt(i))) i++;
        out.add(new Token(Kind.WORD, s.substring(start, i), start));
      } else {
        throw new InvalidRequestException("Unexpected character '" + ch + "' at position " + i);
      }
    }
    return out;
  }

  private static boolean isWordChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  private static final class Cursor {
    private final String source;
    private final List<Token> tokens;
    private int index;

    Cursor(String source, List<Token> tokens) {
      this.source = source;
      this.tokens = tokens;
    }

    boolean atEnd() {
      return index >= tokens.size();
    }

    Token peek() {
      return atEnd() ? null : tokens.get(index);
    }

    Token peekAhead(int offset) {
      int i = index + offset;
      return i < tokens.size() ? tokens.get(i) : null;
    }

    Token next() {
      return atEnd() ? null : tokens.get(index++);
    }

    boolean acceptWord(String word) {
      Token t = peek();
      if (t != null && t.kind == Kind.WORD && t.text.equals(word)) {
        index++;
        return true;
      }
      return false;
    }

    void expect(Kind kind, String what) {
      Token t = next();
      if (t == null || t.kind != kind) throw error("Expected " + what);
    }

    InvalidRequestException error(String message) {
      Token t = peek();
      String where = (t != null) ? " at position " + t.pos : " at end of input";
      return new InvalidRequestException("Malformed filter: " + message + where + " in \"" + source + "\"");
    }
  }
}
