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


/// A non-empty run of source positions
/// @param start the first position, inclusive
/// @param end the last position, exclusive
public record RunExtent(int start, int end) {

  /// Validates the positions
  /// @throws IllegalArgumentException if start is negative or the extent is empty
  public RunExtent {
    if (start < 0) {
      throw new IllegalArgumentException("start must be non-negative, got " + start);
    }
    if (end <= start) {
      throw new IllegalArgumentException(
          "end must be greater than start, got start=" + start + ", end=" + end);
    }
  }

  /// @return the number of positions in this run
  public int size() {
    return end - start;
  }

  @Override
  public String toString() {
    return "[" + start + "," + end + ")";
  }
}
