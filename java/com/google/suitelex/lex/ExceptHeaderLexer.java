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

import java.util.List;
import org.jspecify.annotations.Nullable;

/** Lexes an {@code EXCEPT} branch header: patterns, an optional type option and {@code AS}. */
public class ExceptHeaderLexer extends StatementLexer {

  static boolean handles(List<Token> statement) {
    return statement.get(0).value().equals("EXCEPT");
  }

  @Override
  public void lex() {
    List<Token> statement = statement();
    statement.get(0).setType(TokenType.EXCEPT);
    @Nullable Token lastPattern = null;
    boolean asSeen = false;
    for (Token token : statement.subList(1, statement.size())) {
      if (token.value().equals("AS")) {
        token.setType(TokenType.AS);
        asSeen = true;
      } else if (asSeen) {
        token.setType(TokenType.VARIABLE);
      } else {
        token.setType(TokenType.ARGUMENT);
        lastPattern = token;
      }
    }
    if (lastPattern != null && lastPattern.value().startsWith("type=")) {
      lastPattern.setType(TokenType.OPTION);
    }
  }
}
