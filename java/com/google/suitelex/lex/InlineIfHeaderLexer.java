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

/**
 * Lexes the leading clause of a single-line {@code IF}: optional assignment targets, the {@code
 * IF} marker and the condition.
 */
public class InlineIfHeaderLexer extends StatementLexer {

  static boolean handles(List<Token> statement) {
    for (Token token : statement) {
      if (token.value().equals("IF")) {
        return true;
      }
      if (!TokenValues.isAssign(token.value(), /* allowAssignMark= */ true)) {
        return false;
      }
    }
    return false;
  }

  @Override
  public void lex() {
    boolean ifSeen = false;
    for (Token token : statement()) {
      if (ifSeen) {
        token.setType(TokenType.ARGUMENT);
      } else if (token.value().equals("IF")) {
        token.setType(TokenType.INLINE_IF);
        ifSeen = true;
      } else {
        token.setType(TokenType.ASSIGN);
      }
    }
  }
}
