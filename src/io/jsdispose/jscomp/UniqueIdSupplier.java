/*
 * Copyright 2026 The Closure Compiler Authors.
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

package io.jsdispose.jscomp;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;

/**
 * Generates unique String Ids when requested via a compiler instance.
 *
 * <p>This supplier provides Ids that are deterministic and unique within each input file. The
 * generated ID format is a per-file counter starting at 0.
 */
public final class UniqueIdSupplier {
  private final Multiset<String> counter;

  UniqueIdSupplier() {
    counter = HashMultiset.create();
  }

  /**
   * Creates and returns a unique Id for the given input source file.
   *
   * @param sourceName The name of the source file for which the unique Id is requested.
   * @return unique ID as String
   */
  public String getUniqueId(String sourceName) {
    int id = counter.add(sourceName, 1);
    return Integer.toString(id);
  }
}
