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

import static com.google.suitelex.lex.BodyKind.BREAK;
import static com.google.suitelex.lex.BodyKind.CONTINUE;
import static com.google.suitelex.lex.BodyKind.FOR;
import static com.google.suitelex.lex.BodyKind.IF;
import static com.google.suitelex.lex.BodyKind.INLINE_IF;
import static com.google.suitelex.lex.BodyKind.KEYWORD_CALL;
import static com.google.suitelex.lex.BodyKind.RETURN;
import static com.google.suitelex.lex.BodyKind.SETTING;
import static com.google.suitelex.lex.BodyKind.TRY;
import static com.google.suitelex.lex.BodyKind.WHILE;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.suitelex.context.TestOrKeywordContext;
import java.util.List;

/**
 * A test case, task or keyword. The first token of its first statement is the name; every later
 * statement is indented, i.e. starts with an empty cell.
 */
public class TestOrKeywordLexer extends BlockLexer<TestOrKeywordContext, BodyKind> {

  static final ImmutableList<BodyKind> BODY =
      ImmutableList.of(
          SETTING, BREAK, CONTINUE, FOR, INLINE_IF, IF, RETURN, TRY, WHILE, KEYWORD_CALL);

  private static final ImmutableSet<BodyKind> PRIORITY = ImmutableSet.of(SETTING);

  private final TokenType nameType;
  private boolean nameSeen = false;

  public TestOrKeywordLexer(TestOrKeywordContext ctx, TokenType nameType) {
    super(ctx, BODY);
    this.nameType = nameType;
  }

  @Override
  public boolean acceptsMore(List<Token> statement) {
    return statement.get(0).value().isEmpty();
  }

  @CanIgnoreReturnValue
  @Override
  public Lexer input(List<Token> statement) {
    if (!nameSeen) {
      Token name = statement.remove(0);
      name.setType(nameType);
      if (!statement.isEmpty()) {
        name.requestEosAfter();
      }
      nameSeen = true;
    }
    while (!statement.isEmpty() && statement.get(0).value().isEmpty()) {
      statement.remove(0).setType(TokenType.IGNORE);
    }
    if (!statement.isEmpty()) {
      super.input(statement);
    }
    return this;
  }

  /** Lexes the settings first; a {@code [Template]} changes how every other statement is lexed. */
  @Override
  public void lex() {
    lexWithPriority(PRIORITY);
  }
}
