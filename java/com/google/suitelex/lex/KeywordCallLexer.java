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

import com.google.suitelex.context.TestOrKeywordContext;

/**
 * Lexes a keyword call: optional assignment targets, the keyword name, and its arguments. In a
 * test that uses a template every token is an argument to the template.
 */
public class KeywordCallLexer extends StatementLexer {

  private final TestOrKeywordContext ctx;

  public KeywordCallLexer(TestOrKeywordContext ctx) {
    this.ctx = ctx;
  }

  @Override
  public void lex() {
    if (ctx.templateSet()) {
      lexArguments(0);
    } else {
      lexAsKeywordCall();
    }
  }

  private void lexAsKeywordCall() {
    boolean keywordSeen = false;
    for (Token token : statement()) {
      if (keywordSeen) {
        token.setType(TokenType.ARGUMENT);
      } else if (TokenValues.isAssign(token.value(), /* allowAssignMark= */ true)) {
        token.setType(TokenType.ASSIGN);
      } else {
        token.setType(TokenType.KEYWORD);
        keywordSeen = true;
      }
    }
  }
}
