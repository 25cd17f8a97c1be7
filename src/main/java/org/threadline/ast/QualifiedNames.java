/*
 * Copyright 2025 The Threadline Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.threadline.ast;

import com.google.common.base.CharMatcher;
import java.util.List;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * Static methods for working with variable names. A variable name is either <i>simple</i> (a bare
 * identifier such as {@code x}) or <i>qualified</i> (the source text of an attribute or subscript
 * expression, such as {@code self.x} or {@code a[0].b}).
 */
public final class QualifiedNames {

  // Static methods only
  private QualifiedNames() {}

  private static final CharMatcher IDENTIFIER_START =
      CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('A', 'Z')).or(CharMatcher.is('_'));

  private static final CharMatcher DIGIT = CharMatcher.inRange('0', '9');

  private static final CharMatcher IDENTIFIER_PART = IDENTIFIER_START.or(DIGIT);

  /** Returns true if {@code s} is a syntactically valid identifier. */
  public static boolean isIdentifier(String s) {
    return !s.isEmpty()
        && IDENTIFIER_START.matches(s.charAt(0))
        && IDENTIFIER_PART.matchesAllOf(s);
  }

  /**
   * Returns true if {@code name} is simple, i.e. contains neither {@code .} nor {@code [}. Only
   * simple names may appear in global or nonlocal declarations.
   */
  public static boolean isSimpleName(String name) {
    return name.indexOf('.') < 0 && name.indexOf('[') < 0;
  }

  /**
   * Rebuilds an expression from a variable name. A simple name becomes an {@link Expr.Name}; a
   * qualified name is parsed into the corresponding chain of attribute and subscript nodes, where
   * subscripts may contain integers, quoted strings (with the escapes {@link SourcePrinter}
   * writes), or (recursively) qualified names.
   *
   * <p>Only the outermost node gets {@code ctx}; everything it is applied to is loaded.
   *
   * <p>Qualified names whose subscripts or receivers are arbitrary expressions (such as {@code
   * a[i + 1].x} or {@code g().x}) can't be read back from their text; callers that have the
   * original target expression should copy it with {@link Nodes#copy} instead.
   *
   * @throws IllegalArgumentException if {@code name} isn't a variable name this can read
   */
  public static Expr toExpression(String name, Context ctx) {
    Expr result = parse(name, ctx);
    if (result == null) {
      throw new IllegalArgumentException(String.format("Not a variable name: '%s'", name));
    }
    return result;
  }

  /** Like {@link #toExpression}, but returns null if {@code name} can't be read. */
  public static @Nullable Expr parse(String name, Context ctx) {
    Reader reader = new Reader(name);
    Expr result = reader.readQualified();
    if (result == null || !reader.atEnd()) {
      return null;
    }
    return Reader.withContext(result, ctx);
  }

  /** Returns true if {@link #toExpression} would succeed for {@code name}. */
  public static boolean isVariableName(String name) {
    return parse(name, Context.LOAD) != null;
  }

  /**
   * Returns source text for a tuple of string literals, one per name, e.g. {@code ('x', 'y', )};
   * returns {@code None} if there are no names.
   */
  public static String toStringLiteral(List<String> names) {
    if (names.isEmpty()) {
      return "None";
    }
    return names.stream()
        .map(name -> "'" + name.replace("'", "\\'") + "'")
        .collect(Collectors.joining(",", "(", ", )"));
  }

  /**
   * A minimal recursive-descent reader for qualified names. Each {@code read} method returns null
   * if the text at the current position isn't what it expects.
   */
  private static class Reader {
    final String text;
    int pos;

    Reader(String text) {
      this.text = text;
    }

    boolean atEnd() {
      return pos == text.length();
    }

    char peek() {
      return atEnd() ? 0 : text.charAt(pos);
    }

    @Nullable String readIdentifier() {
      if (!IDENTIFIER_START.matches(peek())) {
        return null;
      }
      int start = pos;
      while (!atEnd() && IDENTIFIER_PART.matches(peek())) {
        pos++;
      }
      return text.substring(start, pos);
    }

    /** Reads an identifier followed by any number of {@code .attr} or {@code [index]} suffixes. */
    @Nullable Expr readQualified() {
      String id = readIdentifier();
      if (id == null) {
        return null;
      }
      Expr result = new Expr.Name(id, Context.LOAD);
      for (; ; ) {
        char c = peek();
        if (c == '.') {
          pos++;
          String attr = readIdentifier();
          if (attr == null) {
            return null;
          }
          result = new Expr.Attribute(result, attr, Context.LOAD);
        } else if (c == '[') {
          pos++;
          Expr index = readIndex();
          if (index == null || peek() != ']') {
            return null;
          }
          pos++;
          result = new Expr.Subscript(result, index, Context.LOAD);
        } else {
          return result;
        }
      }
    }

    @Nullable Expr readIndex() {
      char c = peek();
      if (c == '\'' || c == '"') {
        return readString(c);
      } else if (c == '-' || DIGIT.matches(c)) {
        int start = pos++;
        while (DIGIT.matches(peek())) {
          pos++;
        }
        int numDigits = pos - start - ((c == '-') ? 1 : 0);
        // Up to 18 digits always fits in a long.
        if (numDigits == 0 || numDigits > 18) {
          return null;
        }
        return new Expr.Constant(Long.parseLong(text.substring(start, pos)));
      }
      return readQualified();
    }

    /** Reads a quoted string, undoing the escapes that {@link SourcePrinter} writes. */
    @Nullable Expr readString(char quote) {
      StringBuilder sb = new StringBuilder();
      pos++;
      while (!atEnd()) {
        char c = text.charAt(pos++);
        if (c == quote) {
          return new Expr.Constant(sb.toString());
        } else if (c != '\\') {
          sb.append(c);
        } else if (atEnd()) {
          return null;
        } else {
          char escaped = text.charAt(pos++);
          sb.append(escaped == 'n' ? '\n' : escaped);
        }
      }
      return null;
    }

    /** Returns a copy of the outermost node with the given context. */
    static Expr withContext(Expr expr, Context ctx) {
      if (ctx == Context.LOAD) {
        return expr;
      }
      switch (expr.kind()) {
        case NAME:
          return new Expr.Name(((Expr.Name) expr).id, ctx);
        case ATTRIBUTE:
          Expr.Attribute attribute = (Expr.Attribute) expr;
          return new Expr.Attribute(attribute.value, attribute.attr, ctx);
        case SUBSCRIPT:
          Expr.Subscript subscript = (Expr.Subscript) expr;
          return new Expr.Subscript(subscript.value, subscript.slice, ctx);
        default:
          throw new AssertionError(expr.kind());
      }
    }
  }
}
