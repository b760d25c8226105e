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

import com.google.common.collect.ImmutableSet;
import java.util.List;

/** Lexes a {@code FOR} loop header. */
public class ForHeaderLexer extends StatementLexer {

  private static final ImmutableSet<String> SEPARATORS =
      ImmutableSet.of("IN", "IN RANGE", "IN ENUMERATE", "IN ZIP");

  static boolean handles(List<Token> statement) {
    return statement.get(0).value().equals("FOR");
  }

  @Override
  public void lex() {
    List<Token> statement = statement();
    statement.get(0).setType(TokenType.FOR);
    boolean separatorSeen = false;
    for (Token token : statement.subList(1, statement.size())) {
      if (separatorSeen) {
        token.setType(TokenType.ARGUMENT);
      } else if (SEPARATORS.contains(TokenValues.normalizeWhitespace(token.value()))) {
        token.setType(TokenType.FOR_SEPARATOR);
        separatorSeen = true;
      } else {
        token.setType(TokenType.VARIABLE);
      }
    }
  }
}
