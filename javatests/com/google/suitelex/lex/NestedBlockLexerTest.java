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
import static com.google.suitelex.testing.TestDocuments.statement;

import com.google.suitelex.context.FileContext;
import com.google.suitelex.context.FileKind;
import com.google.suitelex.context.TestOrKeywordContext;
import com.google.suitelex.diag.LexLog;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class NestedBlockLexerTest {

  private final TestOrKeywordContext ctx =
      new FileContext(FileKind.SUITE, new LexLog()).keywordContext();

  @Test
  public void forWithIfAndBreak() {
    String input =
        """
        *** Test Cases ***
        T
            FOR    ${i}    IN RANGE    10
                IF    $i > 5
                    BREAK
                END
                Log    ${i}
            END
            Log    done
        """;
    assertThat(lex(input))
        .containsExactly(
            "TESTCASE_HEADER(*** Test Cases ***)",
            "EOS",
            "TESTCASE_NAME(T)",
            "EOS",
            "FOR(FOR)",
            "VARIABLE(${i})",
            "FOR_SEPARATOR(IN RANGE)",
            "ARGUMENT(10)",
            "EOS",
            "IF(IF)",
            "ARGUMENT($i > 5)",
            "EOS",
            "BREAK(BREAK)",
            "EOS",
            "END(END)",
            "EOS",
            "KEYWORD(Log)",
            "ARGUMENT(${i})",
            "EOS",
            "END(END)",
            "EOS",
            "KEYWORD(Log)",
            "ARGUMENT(done)",
            "EOS")
        .inOrder();
  }

  @Test
  public void sameKindNestingIsAbsorbed() {
    NestedBlockLexer lexer = new NestedBlockLexer(ctx, NestedBlockLexer.FOR_BLOCK);
    lexer.input(statement("FOR", "${i}", "IN", "a", "b"));
    assertThat(lexer.acceptsMore(statement("FOR", "${j}", "IN", "c"))).isTrue();
    lexer.input(statement("FOR", "${j}", "IN", "c"));
    lexer.input(statement("Log", "${j}"));
    lexer.input(statement("END"));
    assertThat(lexer.blockLevel()).isEqualTo(1);
    assertThat(lexer.acceptsMore(statement("Log", "x"))).isTrue();
    lexer.input(statement("END"));

    assertThat(lexer.childKinds())
        .containsExactly(
            BodyKind.FOR_HEADER,
            BodyKind.FOR_HEADER,
            BodyKind.KEYWORD_CALL,
            BodyKind.END,
            BodyKind.END)
        .inOrder();
    assertThat(lexer.blockLevel()).isEqualTo(0);
    assertThat(lexer.acceptsMore(statement("Log", "x"))).isFalse();
  }

  @Test
  public void otherKindsGetTheirOwnLexer() {
    NestedBlockLexer lexer = new NestedBlockLexer(ctx, NestedBlockLexer.FOR_BLOCK);
    lexer.input(statement("FOR", "${i}", "IN", "a"));
    Lexer inner = lexer.input(statement("WHILE", "True"));
    assertThat(inner).isInstanceOf(NestedBlockLexer.class);
    lexer.input(statement("Log", "x"));
    lexer.input(statement("END"));
    assertThat(((NestedBlockLexer) inner).blockLevel()).isEqualTo(0);
    assertThat(lexer.blockLevel()).isEqualTo(1);
    lexer.input(statement("END"));

    assertThat(lexer.childKinds())
        .containsExactly(BodyKind.FOR_HEADER, BodyKind.WHILE, BodyKind.END)
        .inOrder();
    assertThat(lexer.blockLevel()).isEqualTo(0);
  }

  @Test
  public void inlineIfDoesNotOpenBlock() {
    NestedBlockLexer lexer = new NestedBlockLexer(ctx, NestedBlockLexer.FOR_BLOCK);
    lexer.input(statement("FOR", "${i}", "IN", "a"));
    lexer.input(statement("IF", "$i == 1", "BREAK"));
    assertThat(lexer.blockLevel()).isEqualTo(1);
    lexer.input(statement("END"));

    assertThat(lexer.childKinds())
        .containsExactly(BodyKind.FOR_HEADER, BodyKind.INLINE_IF, BodyKind.END)
        .inOrder();
    assertThat(lexer.blockLevel()).isEqualTo(0);
  }

  @Test
  public void ifBranches() {
    NestedBlockLexer lexer = new NestedBlockLexer(ctx, NestedBlockLexer.IF_BLOCK);
    lexer.input(statement("IF", "$a"));
    lexer.input(statement("Log", "a"));
    lexer.input(statement("ELSE IF", "$b"));
    lexer.input(statement("IF", "$c"));
    lexer.input(statement("END"));
    lexer.input(statement("ELSE"));
    lexer.input(statement("Log", "c"));
    lexer.input(statement("END"));

    assertThat(lexer.childKinds())
        .containsExactly(
            BodyKind.IF_HEADER,
            BodyKind.KEYWORD_CALL,
            BodyKind.ELSE_IF_HEADER,
            BodyKind.IF_HEADER,
            BodyKind.END,
            BodyKind.ELSE_HEADER,
            BodyKind.KEYWORD_CALL,
            BodyKind.END)
        .inOrder();
    assertThat(lexer.blockLevel()).isEqualTo(0);
  }

  @Test
  public void tryExceptFinally() {
    String input =
        """
        *** Keywords ***
        Kw
            TRY
                Fail    boom
            EXCEPT    Error*    type=glob    AS    ${err}
                Log    ${err}
            ELSE
                Log    fine
            FINALLY
                Log    always
            END
        """;
    assertThat(lex(input))
        .containsExactly(
            "KEYWORD_HEADER(*** Keywords ***)",
            "EOS",
            "KEYWORD_NAME(Kw)",
            "EOS",
            "TRY(TRY)",
            "EOS",
            "KEYWORD(Fail)",
            "ARGUMENT(boom)",
            "EOS",
            "EXCEPT(EXCEPT)",
            "ARGUMENT(Error*)",
            "OPTION(type=glob)",
            "AS(AS)",
            "VARIABLE(${err})",
            "EOS",
            "KEYWORD(Log)",
            "ARGUMENT(${err})",
            "EOS",
            "ELSE(ELSE)",
            "EOS",
            "KEYWORD(Log)",
            "ARGUMENT(fine)",
            "EOS",
            "FINALLY(FINALLY)",
            "EOS",
            "KEYWORD(Log)",
            "ARGUMENT(always)",
            "EOS",
            "END(END)",
            "EOS")
        .inOrder();
  }

  @Test
  public void whileWithLimit() {
    String input =
        """
        *** Keywords ***
        Kw
            WHILE    $x < 3    limit=10
                CONTINUE
            END
        """;
    assertThat(lex(input))
        .containsExactly(
            "KEYWORD_HEADER(*** Keywords ***)",
            "EOS",
            "KEYWORD_NAME(Kw)",
            "EOS",
            "WHILE(WHILE)",
            "ARGUMENT($x < 3)",
            "OPTION(limit=10)",
            "EOS",
            "CONTINUE(CONTINUE)",
            "EOS",
            "END(END)",
            "EOS")
        .inOrder();
  }

  @Test
  public void forVariants() {
    String input =
        """
        *** Keywords ***
        Kw
            FOR    ${index}    ${item}    IN ENUMERATE    @{list}
                No Operation
            END
            FOR    ${a}    ${b}    IN ZIP    ${x}    ${y}
                No Operation
            END
        """;
    assertThat(lex(input))
        .containsExactly(
            "KEYWORD_HEADER(*** Keywords ***)",
            "EOS",
            "KEYWORD_NAME(Kw)",
            "EOS",
            "FOR(FOR)",
            "VARIABLE(${index})",
            "VARIABLE(${item})",
            "FOR_SEPARATOR(IN ENUMERATE)",
            "ARGUMENT(@{list})",
            "EOS",
            "KEYWORD(No Operation)",
            "EOS",
            "END(END)",
            "EOS",
            "FOR(FOR)",
            "VARIABLE(${a})",
            "VARIABLE(${b})",
            "FOR_SEPARATOR(IN ZIP)",
            "ARGUMENT(${x})",
            "ARGUMENT(${y})",
            "EOS",
            "KEYWORD(No Operation)",
            "EOS",
            "END(END)",
            "EOS")
        .inOrder();
  }
}
