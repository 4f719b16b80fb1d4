package io.nosqlbench.runsplit;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */


import java.util.Locale;
import java.util.function.IntPredicate;

/// Where a boundary element is placed when a sequence is split into runs.
public enum SplitMode {

  /// The boundary element opens the following run.
  ///
  /// A boundary at the first position of a run never ends that run, so no empty run is
  /// produced. Splitting `[0, 1, 2]` before `0` yields the single run `[0, 1, 2]`.
  BEFORE {
    @Override
    RunExtent scan(int start, int length, IntPredicate boundaryAt) {
      if (start >= length) {
        return null;
      }
      // the opening element can not close its own run. Later openers were tested by the
      // previous scan, so only the first element of the source still needs its test.
      if (start == 0) {
        boundaryAt.test(0);
      }
      for (int i = start + 1; i < length; i++) {
        if (boundaryAt.test(i)) {
          return new RunExtent(start, i);
        }
      }
      return new RunExtent(start, length);
    }
  },

  /// The boundary element closes the current run.
  AFTER {
    @Override
    RunExtent scan(int start, int length, IntPredicate boundaryAt) {
      if (start >= length) {
        return null;
      }
      for (int i = start; i < length; i++) {
        if (boundaryAt.test(i)) {
          return new RunExtent(start, i + 1);
        }
      }
      return new RunExtent(start, length);
    }
  };

  /// Find the run which starts at the given position.
  /// @param start the first position of the run
  /// @param length the length of the source
  /// @param boundaryAt tests whether the element at a position is a boundary
  /// @return the next run, or null if there are no positions left
  abstract RunExtent scan(int start, int length, IntPredicate boundaryAt);

  /// Resolve a mode by name, ignoring case
  /// @param name `before` or `after`
  /// @return the named mode
  /// @throws IllegalArgumentException if the name is not a known mode
  public static SplitMode fromName(String name) {
    if (name == null) {
      throw new IllegalArgumentException("split mode name must not be null");
    }
    String normalized = name.trim().toUpperCase(Locale.ROOT);
    for (SplitMode mode : values()) {
      if (mode.name().equals(normalized)) {
        return mode;
      }
    }
    throw new IllegalArgumentException(
        "unknown split mode '" + name + "', expected one of: before, after");
  }
}
