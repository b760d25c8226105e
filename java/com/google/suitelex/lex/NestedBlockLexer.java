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

import static com.google.common.base.Verify.verify;
import static com.google.suitelex.lex.BodyKind.BREAK;
import static com.google.suitelex.lex.BodyKind.CONTINUE;
import static com.google.suitelex.lex.BodyKind.ELSE_HEADER;
import static com.google.suitelex.lex.BodyKind.ELSE_IF_HEADER;
import static com.google.suitelex.lex.BodyKind.END;
import static com.google.suitelex.lex.BodyKind.EXCEPT_HEADER;
import static com.google.suitelex.lex.BodyKind.FINALLY_HEADER;
import static com.google.suitelex.lex.BodyKind.FOR;
import static com.google.suitelex.lex.BodyKind.FOR_HEADER;
import static com.google.suitelex.lex.BodyKind.IF;
import static com.google.suitelex.lex.BodyKind.IF_HEADER;
import static com.google.suitelex.lex.BodyKind.INLINE_IF;
import static com.google.suitelex.lex.BodyKind.KEYWORD_CALL;
import static com.google.suitelex.lex.BodyKind.RETURN;
import static com.google.suitelex.lex.BodyKind.TRY;
import static com.google.suitelex.lex.BodyKind.TRY_HEADER;
import static com.google.suitelex.lex.BodyKind.WHILE;
import static com.google.suitelex.lex.BodyKind.WHILE_HEADER;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.suitelex.context.TestOrKeywordContext;
import java.util.List;

/**
 * A {@code FOR}, {@code WHILE}, {@code TRY} or {@code IF} block.
 *
 * <p>The block stays open while its depth is positive. Every block header received directly by
 * this lexer opens a level and every {@code END} closes one, so blocks of the same kind nested
 * inside it are absorbed without creating another nested lexer. Blocks of other kinds get their
 * own child lexer, which tracks its own depth.
 */
public class NestedBlockLexer extends BlockLexer<TestOrKeywordContext, BodyKind> {

  static final ImmutableList<BodyKind> FOR_BLOCK =
      ImmutableList.of(
          FOR_HEADER, INLINE_IF, IF, TRY, WHILE, END, RETURN, CONTINUE, BREAK, KEYWORD_CALL);

  static final ImmutableList<BodyKind> WHILE_BLOCK =
      ImmutableList.of(
          WHILE_HEADER, FOR, INLINE_IF, IF, TRY, END, RETURN, CONTINUE, BREAK, KEYWORD_CALL);

  static final ImmutableList<BodyKind> TRY_BLOCK =
      ImmutableList.of(
          TRY_HEADER,
          EXCEPT_HEADER,
          ELSE_HEADER,
          FINALLY_HEADER,
          FOR,
          INLINE_IF,
          IF,
          WHILE,
          END,
          RETURN,
          BREAK,
          CONTINUE,
          KEYWORD_CALL);

  static final ImmutableList<BodyKind> IF_BLOCK =
      ImmutableList.of(
          INLINE_IF,
          IF_HEADER,
          ELSE_IF_HEADER,
          ELSE_HEADER,
          FOR,
          TRY,
          WHILE,
          END,
          RETURN,
          CONTINUE,
          BREAK,
          KEYWORD_CALL);

  private int blockLevel = 0;

  NestedBlockLexer(TestOrKeywordContext ctx, ImmutableList<BodyKind> candidates) {
    super(ctx, candidates);
  }

  @Override
  public boolean acceptsMore(List<Token> statement) {
    return blockLevel > 0;
  }

  @CanIgnoreReturnValue
  @Override
  public Lexer input(List<Token> statement) {
    BodyKind kind = route(statement);
    if (kind.opensBlock()) {
      blockLevel++;
    }
    if (kind == END) {
      blockLevel--;
      verify(blockLevel >= 0, "unbalanced END at line %s", statement.get(0).lineno());
    }
    return lastChild();
  }

  int blockLevel() {
    return blockLevel;
  }
}
