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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.util.Comparator;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps the reported diagnostics sorted and free of duplicates, and writes them to a {@link
 * Logger} when the report is generated: warnings first, then errors, each group ordered by file,
 * line, column and description, followed by a one-line count.
 *
 * <p>A diagnostic whose type defaults to WARNING but was reported at ERROR counts as an error
 * without halting the compilation.
 */
public class LoggingErrorManager implements ErrorManager {

  private record Reported(CheckLevel level, JSError error) {}

  private static final Ordering<String> SOURCE_ORDER = Ordering.<String>natural().nullsFirst();

  private static final Comparator<Reported> REPORT_ORDER =
      (a, b) ->
          ComparisonChain.start()
              .compare(b.level(), a.level())
              .compare(a.error().getSourceName(), b.error().getSourceName(), SOURCE_ORDER)
              .compare(a.error().getLineno(), b.error().getLineno())
              .compare(a.error().getCharno(), b.error().getCharno())
              .compare(a.error().getDescription(), b.error().getDescription())
              .result();

  private final TreeSet<Reported> reported = new TreeSet<>(REPORT_ORDER);
  private final MessageFormatter formatter;
  private final Logger logger;

  public LoggingErrorManager(MessageFormatter formatter, Logger logger) {
    this.formatter = checkNotNull(formatter);
    this.logger = checkNotNull(logger);
  }

  @Override
  public void report(CheckLevel level, JSError error) {
    checkArgument(level.isOn(), "Diagnostics at level OFF are not reported: %s", error);
    reported.add(new Reported(level, error));
  }

  @Override
  public void generateReport() {
    for (Reported r : reported) {
      logger.log(r.level().toLogLevel(), formatter.format(r.level(), r.error()));
    }
    if (!reported.isEmpty()) {
      logger.log(
          Level.WARNING,
          "{0} error(s), {1} warning(s)",
          new Object[] {getErrorCount(), getWarningCount()});
    }
  }

  @Override
  public ImmutableList<JSError> getErrors() {
    return atLevel(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<JSError> getWarnings() {
    return atLevel(CheckLevel.WARNING);
  }

  @Override
  public boolean hasHaltingErrors() {
    return reported.stream()
        .anyMatch(
            r -> r.level() == CheckLevel.ERROR && r.error().getType().level() == CheckLevel.ERROR);
  }

  private ImmutableList<JSError> atLevel(CheckLevel level) {
    return reported.stream()
        .filter(r -> r.level() == level)
        .map(Reported::error)
        .collect(toImmutableList());
  }
}
