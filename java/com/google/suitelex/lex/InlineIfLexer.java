/*
 * Copyright 2016 Google Inc. All Rights Reserved.
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

package com.google.suitelex.lex;

import static com.google.common.collect.Iterables.getLast;
import static com.google.suitelex.lex.BodyKind.BREAK;
import static com.google.suitelex.lex.BodyKind.CONTINUE;
import static com.google.suitelex.lex.BodyKind.ELSE_HEADER;
import static com.google.suitelex.lex.BodyKind.ELSE_IF_HEADER;
import static com.google.suitelex.lex.BodyKind.INLINE_IF_HEADER;
import static com.google.suitelex.lex.BodyKind.KEYWORD_CALL;
import static com.google.suitelex.lex.BodyKind.RETURN;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.suitelex.context.TestOrKeywordContext;
import java.util.ArrayList;
import java.util.List;

/**
 * A single-line {@code IF}, such as {@code IF  $x  Log  yes  ELSE  Log  no}.
 *
 * <p>The line is split into the statements of the equivalent multi-line block, which are lexed
 * independently. End-of-statement markers are requested at the split points, so the emitted
 * tokens have the same structure as the block form apart from the missing {@code END}.
 */
public class InlineIfLexer extends BlockLexer<TestOrKeywordContext, BodyKind> {

  static final ImmutableList<BodyKind> CLAUSES =
      ImmutableList.of(
          INLINE_IF_HEADER, ELSE_IF_HEADER, ELSE_HEADER, RETURN, CONTINUE, BREAK, KEYWORD_CALL);

  InlineIfLexer(TestOrKeywordContext ctx) {
    super(ctx, CLAUSES);
  }

  @Override
  public boolean acceptsMore(List<Token> statement) {
    return false;
  }

  @CanIgnoreReturnValue
  @Override
  public Lexer input(List<Token> statement) {
    for (List<Token> part : split(statement)) {
      if (!part.isEmpty()) {
        route(part);
      }
    }
    return this;
  }

  /** Splits a single-line {@code IF} at its condition and branch markers. */
  static ImmutableList<List<Token>> split(List<Token> statement) {
    ImmutableList.Builder<List<Token>> parts = ImmutableList.builder();
    Token last = getLast(statement);
    List<Token> current = new ArrayList<>();
    boolean expectCondition = false;
    for (Token token : statement) {
      if (expectCondition) {
        if (token != last) {
          token.requestEosAfter();
        }
        current.add(token);
        parts.add(current);
        current = new ArrayList<>();
        expectCondition = false;
      } else if (token.value().equals("IF")) {
        current.add(token);
        expectCondition = true;
      } else if (TokenValues.normalizeWhitespace(token.value()).equals("ELSE IF")) {
        token.requestEosBefore();
        parts.add(current);
        current = new ArrayList<>();
        current.add(token);
        expectCondition = true;
      } else if (token.value().equals("ELSE")) {
        token.requestEosBefore();
        if (token != last) {
          token.requestEosAfter();
        }
        parts.add(current);
        current = new ArrayList<>();
        List<Token> elseMarker = new ArrayList<>();
        elseMarker.add(token);
        parts.add(elseMarker);
      } else {
        current.add(token);
      }
    }
    parts.add(current);
    return parts.build();
  }
}
