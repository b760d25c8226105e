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

package com.google.suitelex.diag;

import com.google.common.collect.ImmutableList;
import com.google.suitelex.diag.LexError.ErrorKind;
import com.google.suitelex.lex.Token;
import java.util.ArrayList;
import java.util.List;

/**
 * A log that collects the diagnostics of one document. Every logged problem is also attached to
 * the offending token, which is re-typed as an error.
 */
public class LexLog {

  private final List<LexDiagnostic> diagnostics = new ArrayList<>();

  public void error(Token token, ErrorKind kind, Object... args) {
    report(token, /* fatal= */ false, kind, args);
  }

  public void fatal(Token token, ErrorKind kind, Object... args) {
    report(token, /* fatal= */ true, kind, args);
  }

  private void report(Token token, boolean fatal, ErrorKind kind, Object... args) {
    LexDiagnostic diagnostic = LexDiagnostic.format(token.lineno(), fatal, kind, args);
    token.setError(diagnostic.message(), fatal);
    diagnostics.add(diagnostic);
  }

  public ImmutableList<LexDiagnostic> diagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  public boolean anyFatal() {
    return diagnostics.stream().anyMatch(LexDiagnostic::fatal);
  }
}
