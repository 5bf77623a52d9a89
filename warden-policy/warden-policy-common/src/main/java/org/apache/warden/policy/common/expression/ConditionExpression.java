/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.warden.policy.common.expression;

import java.util.ArrayList;
import java.util.List;

import org.apache.warden.core.common.exception.ExpressionSyntaxException;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;

/**
 * Recursive descent parser for condition expressions.
 * <pre>
 *   expr    := and ("or" and)*
 *   and     := not ("and" not)*
 *   not     := "not" not | primary
 *   primary := "(" expr ")" | "True" | "False" | word
 *   word    := [A-Za-z0-9_:.*]{1,256}
 * </pre>
 * Keywords are case sensitive and only recognised as whole words.
 */
public final class ConditionExpression {

  static final int MAX_WORD_LENGTH = 256;

  private static final CharMatcher WORD_CHARS = CharMatcher.inRange('a', 'z')
      .or(CharMatcher.inRange('A', 'Z'))
      .or(CharMatcher.inRange('0', '9'))
      .or(CharMatcher.anyOf("_:.*"))
      .precomputed();

  private static final String AND = "and";
  private static final String OR = "or";
  private static final String NOT = "not";
  private static final String TRUE = "True";
  private static final String FALSE = "False";

  private final String expression;
  private final List<Token> tokens;
  private int index;

  private ConditionExpression(String expression) {
    this.expression = expression;
    this.tokens = tokenize(expression);
  }

  /**
   * Parses an expression into an evaluable tree.
   *
   * @throws ExpressionSyntaxException if the expression is malformed
   */
  public static Expression compile(String expression) {
    Preconditions.checkNotNull(expression, "Condition expression cannot be null");
    ConditionExpression parser = new ConditionExpression(expression);
    Expression result = parser.parseOr();
    if (!parser.atEnd()) {
      throw parser.error("Unexpected \"" + parser.peek().text + "\"");
    }
    return result;
  }

  private Expression parseOr() {
    List<Expression> operands = new ArrayList<Expression>();
    operands.add(parseAnd());
    while (nextIsKeyword(OR)) {
      index++;
      operands.add(parseAnd());
    }
    return operands.size() == 1 ? operands.get(0) : new Expression.Or(operands);
  }

  private Expression parseAnd() {
    List<Expression> operands = new ArrayList<Expression>();
    operands.add(parseNot());
    while (nextIsKeyword(AND)) {
      index++;
      operands.add(parseNot());
    }
    return operands.size() == 1 ? operands.get(0) : new Expression.And(operands);
  }

  private Expression parseNot() {
    if (nextIsKeyword(NOT)) {
      index++;
      return new Expression.Not(parseNot());
    }
    return parsePrimary();
  }

  private Expression parsePrimary() {
    if (atEnd()) {
      throw error("Expected a condition");
    }
    Token token = tokens.get(index);
    if (token.kind == TokenKind.LPAREN) {
      index++;
      Expression inner = parseOr();
      if (atEnd() || peek().kind != TokenKind.RPAREN) {
        throw error("Expected \")\"");
      }
      index++;
      return inner;
    }
    if (token.kind == TokenKind.RPAREN || isKeyword(token)) {
      throw error("Unexpected \"" + token.text + "\"");
    }
    index++;
    if (TRUE.equals(token.text)) {
      return Expression.Literal.TRUE;
    }
    if (FALSE.equals(token.text)) {
      return Expression.Literal.FALSE;
    }
    return new Expression.Atom(token.text);
  }

  private boolean nextIsKeyword(String keyword) {
    return !atEnd() && peek().kind == TokenKind.WORD && keyword.equals(peek().text);
  }

  private static boolean isKeyword(Token token) {
    return token.kind == TokenKind.WORD
        && (AND.equals(token.text) || OR.equals(token.text) || NOT.equals(token.text));
  }

  private boolean atEnd() {
    return index >= tokens.size();
  }

  private Token peek() {
    return tokens.get(index);
  }

  private ExpressionSyntaxException error(String message) {
    int position = atEnd() ? expression.length() : peek().position;
    return new ExpressionSyntaxException(expression, position, message);
  }

  private static List<Token> tokenize(String expression) {
    List<Token> tokens = new ArrayList<Token>();
    int i = 0;
    while (i < expression.length()) {
      char c = expression.charAt(i);
      if (CharMatcher.whitespace().matches(c)) {
        i++;
      } else if (c == '(') {
        tokens.add(new Token(TokenKind.LPAREN, "(", i++));
      } else if (c == ')') {
        tokens.add(new Token(TokenKind.RPAREN, ")", i++));
      } else if (WORD_CHARS.matches(c)) {
        int start = i;
        while (i < expression.length() && WORD_CHARS.matches(expression.charAt(i))) {
          i++;
        }
        if (i - start > MAX_WORD_LENGTH) {
          throw new ExpressionSyntaxException(expression, start,
              "Condition longer than " + MAX_WORD_LENGTH + " characters");
        }
        tokens.add(new Token(TokenKind.WORD, expression.substring(start, i), start));
      } else {
        throw new ExpressionSyntaxException(expression, i, "Unexpected character '" + c + "'");
      }
    }
    return tokens;
  }

  private enum TokenKind {
    LPAREN, RPAREN, WORD
  }

  private static final class Token {
    private final TokenKind kind;
    private final String text;
    private final int position;

    private Token(TokenKind kind, String text, int position) {
      this.kind = kind;
      this.text = text;
      this.position = position;
    }
  }
}
