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


/// A predicate of one primitive byte
@FunctionalInterface
public interface BytePredicate {

  /// @param value a byte from the source
  /// @return true if the byte is a boundary
  boolean test(byte value);

  /// @param value the boundary byte
  /// @return a predicate matching only the given byte
  static BytePredicate is(byte value) {
    return b -> b == value;
  }
}
