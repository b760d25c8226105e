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

package com.google.suitelex.context;

import com.google.suitelex.diag.LexLog;

/** The context of a keyword body. Keywords never use templates. */
public class KeywordContext extends TestOrKeywordContext {

  KeywordContext(KeywordSettings settings, LexLog log) {
    super(settings, log);
  }

  @Override
  public boolean templateSet() {
    return false;
  }
}
