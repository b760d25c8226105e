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

import java.util.List;

/** Lexes a {@code WHILE} loop header, with an optional trailing iteration limit. */
public class WhileHeaderLexer extends StatementLexer {

  static boolean handles(List<Token> statement) {
    return statement.get(0).value().equals("WHILE");
  }

  @Override
  public void lex() {
    List<Token> statement = statement();
    statement.get(0).setType(TokenType.WHILE);
    lexArguments(1);
    Token last = getLast(statement);
    if (statement.size() > 1 && last.value().startsWith("limit=")) {
      last.setType(TokenType.OPTION);
    }
  }
}
