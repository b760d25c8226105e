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
import static com.google.suitelex.testing.TestDocuments.lex;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TestOrKeywordLexerTest {

  @Test
  public void fileTemplateDefinedAfterTests() {
    String input =
        """
        *** Test Cases ***
        T
            Log    hi
        *** Settings ***
        Test Template    Tmpl
        """;
    assertThat(lex(input))
        .containsExactly(
            "TESTCASE_HEADER(*** Test Cases ***)",
            "EOS",
            "TESTCASE_NAME(T)",
            "EOS",
            "ARGUMENT(Log)",
            "ARGUMENT(hi)",
            "EOS",
            "SETTING_HEADER(*** Settings ***)",
            "EOS",
            "TEST_TEMPLATE(Test Template)",
            "NAME(Tmpl)",
            "EOS")
        .inOrder();
  }

  @Test
  public void templateSettingAfterBodyStatement() {
    String input =
        """
        *** Test Cases ***
        T
            Log    hi
            [Template]    Tmpl
        """;
    assertThat(lex(input))
        .containsExactly(
            "TESTCASE_HEADER(*** Test Cases ***)",
            "EOS",
            "TESTCASE_NAME(T)",
            "EOS",
            "ARGUMENT(Log)",
            "ARGUMENT(hi)",
            "EOS",
            "TEMPLATE([Template])",
            "NAME(Tmpl)",
            "EOS")
        .inOrder();
  }

  @Test
  public void templateNoneDisablesFileTemplate() {
    String input =
        """
        *** Settings ***
        Test Template    Tmpl
        *** Test Cases ***
        With
            a    b
        Without
            [Template]    NONE
            Log    hi
        """;
    assertThat(lex(input))
        .containsExactly(
            "SETTING_HEADER(*** Settings ***)",
            "EOS",
            "TEST_TEMPLATE(Test Template)",
            "NAME(Tmpl)",
            "EOS",
            "TESTCASE_HEADER(*** Test Cases ***)",
            "EOS",
            "TESTCASE_NAME(With)",
            "EOS",
            "ARGUMENT(a)",
            "ARGUMENT(b)",
            "EOS",
            "TESTCASE_NAME(Without)",
            "EOS",
            "TEMPLATE([Template])",
            "NAME(NONE)",
            "EOS",
            "KEYWORD(Log)",
            "ARGUMENT(hi)",
            "EOS")
        .inOrder();
  }

  @Test
  public void keywordsIgnoreTestTemplate() {
    String input =
        """
        *** Settings ***
        Test Template    Tmpl
        *** Keywords ***
        Kw
            [Tags]    t1
            Log    hi
        """;
    assertThat(lex(input))
        .containsExactly(
            "SETTING_HEADER(*** Settings ***)",
            "EOS",
            "TEST_TEMPLATE(Test Template)",
            "NAME(Tmpl)",
            "EOS",
            "KEYWORD_HEADER(*** Keywords ***)",
            "EOS",
            "KEYWORD_NAME(Kw)",
            "EOS",
            "TAGS([Tags])",
            "ARGUMENT(t1)",
            "EOS",
            "KEYWORD(Log)",
            "ARGUMENT(hi)",
            "EOS")
        .inOrder();
  }

  @Test
  public void tasksUseTestCaseBodies() {
    String input =
        """
        *** Tasks ***
        Do It
            [Setup]    Prepare
            Run    now
        """;
    assertThat(lex(input))
        .containsExactly(
            "TASK_HEADER(*** Tasks ***)",
            "EOS",
            "TESTCASE_NAME(Do It)",
            "EOS",
            "SETUP([Setup])",
            "NAME(Prepare)",
            "EOS",
            "KEYWORD(Run)",
            "ARGUMENT(now)",
            "EOS")
        .inOrder();
  }

  @Test
  public void emptyTestCase() {
    String input =
        """
        *** Test Cases ***
        First
        Second
            Log    x
        """;
    assertThat(lex(input))
        .containsExactly(
            "TESTCASE_HEADER(*** Test Cases ***)",
            "EOS",
            "TESTCASE_NAME(First)",
            "EOS",
            "TESTCASE_NAME(Second)",
            "EOS",
            "KEYWORD(Log)",
            "ARGUMENT(x)",
            "EOS")
        .inOrder();
  }

  @Test
  public void assignments() {
    String input =
        """
        *** Keywords ***
        Kw
            ${a}    @{b}=    Get    ${c}
            &{d} =    Get Dict
            ${not assign    Log
        """;
    assertThat(lex(input))
        .containsExactly(
            "KEYWORD_HEADER(*** Keywords ***)",
            "EOS",
            "KEYWORD_NAME(Kw)",
            "EOS",
            "ASSIGN(${a})",
            "ASSIGN(@{b}=)",
            "KEYWORD(Get)",
            "ARGUMENT(${c})",
            "EOS",
            "ASSIGN(&{d} =)",
            "KEYWORD(Get Dict)",
            "EOS",
            "KEYWORD(${not assign)",
            "ARGUMENT(Log)",
            "EOS")
        .inOrder();
  }
}
