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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TokenTest {

  @Test
  public void untyped() {
    Token token = new Token("Log", 3, 4);
    assertThat(token.type()).isNull();
    assertThat(token.toString()).isEqualTo("Log");
    assertThat(token.endColOffset()).isEqualTo(7);
  }

  @Test
  public void typed() {
    Token token = new Token("Log");
    token.setType(TokenType.KEYWORD);
    assertThat(token.toString()).isEqualTo("KEYWORD(Log)");
    assertThat(token.lineno()).isEqualTo(-1);
    assertThat(token.endColOffset()).isEqualTo(-1);
  }

  @Test
  public void eos() {
    Token anchor = new Token("hello", 2, 10);
    Token after = Token.eos(anchor, /* before= */ false);
    assertThat(after.type()).isEqualTo(TokenType.EOS);
    assertThat(after.value()).isEmpty();
    assertThat(after.lineno()).isEqualTo(2);
    assertThat(after.colOffset()).isEqualTo(15);
    assertThat(after.toString()).isEqualTo("EOS");

    Token before = Token.eos(anchor, /* before= */ true);
    assertThat(before.colOffset()).isEqualTo(10);
  }

  @Test
  public void error() {
    Token token = new Token("*** Bogus ***");
    token.setType(TokenType.COMMENT);
    token.setError("bad header", /* fatal= */ false);
    assertThat(token.type()).isEqualTo(TokenType.ERROR);
    assertThat(token.error()).isEqualTo("bad header");

    Token fatal = new Token("*** Test Cases ***");
    fatal.setError("no tests here", /* fatal= */ true);
    assertThat(fatal.type()).isEqualTo(TokenType.FATAL_ERROR);
  }

  @Test
  public void forSetting() {
    assertThat(TokenType.forSetting("Suite Setup")).isEqualTo(TokenType.SUITE_SETUP);
    assertThat(TokenType.forSetting("Documentation")).isEqualTo(TokenType.DOCUMENTATION);
    assertThat(TokenType.forSetting("Return")).isEqualTo(TokenType.RETURN);
  }
}
