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

import static com.google.common.base.Preconditions.checkState;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** A leaf lexer that owns exactly one statement and types its tokens. */
public abstract class StatementLexer implements Lexer {

  private @Nullable List<Token> statement;

  @Override
  public boolean acceptsMore(List<Token> statement) {
    return false;
  }

  @CanIgnoreReturnValue
  @Override
  public Lexer input(List<Token> statement) {
    checkState(this.statement == null, "%s already owns a statement", getClass().getSimpleName());
    this.statement = statement;
    return this;
  }

  protected final List<Token> statement() {
    checkState(statement != null, "%s has no input", getClass().getSimpleName());
    return statement;
  }

  /** Types the tokens of the statement starting at {@code from} as arguments. */
  protected final void lexArguments(int from) {
    List<Token> tokens = statement();
    for (int i = from; i < tokens.size(); i++) {
      tokens.get(i).setType(TokenType.ARGUMENT);
    }
  }
}
