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


import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntPredicate;

/// Produces the [RunExtent]s of a source of known length, one at a time.
///
/// The cursor only knows positions. Callers which hold their own storage can use it
/// directly, testing elements through the `boundaryAt` predicate.
///
/// If the predicate throws, the cursor stays where it was, and the next pull re-tests the
/// positions which the failed scan had already tested.
///
/// Instances are not thread safe. A cursor is meant to be driven by a single consumer.
public class RunCursor implements Iterator<RunExtent> {
  private final int length;
  private final IntPredicate boundaryAt;
  private final SplitMode mode;

  private int index;
  private RunExtent pending;

  /// create a run cursor at position 0
  /// @param length the number of positions in the source
  /// @param boundaryAt tests whether the element at a position is a boundary
  /// @param mode where boundary elements are placed
  public RunCursor(int length, IntPredicate boundaryAt, SplitMode mode) {
    if (length < 0) {
      throw new IllegalArgumentException("length must be non-negative, got " + length);
    }
    this.length = length;
    this.boundaryAt = Objects.requireNonNull(boundaryAt, "boundary predicate cannot be null");
    this.mode = Objects.requireNonNull(mode, "split mode cannot be null");
  }

  @Override
  public boolean hasNext() {
    if (pending == null && index < length) {
      RunExtent found = mode.scan(index, length, boundaryAt);
      index = found.end();
      pending = found;
    }
    return pending != null;
  }

  @Override
  public RunExtent next() {
    if (!hasNext()) {
      throw new NoSuchElementException("no runs remain after position " + length);
    }
    RunExtent next = pending;
    pending = null;
    return next;
  }

  /// Take the next run, if there is one. Once this returns empty it will always return
  /// empty.
  /// @return the next run, or empty when the source is exhausted
  public Optional<RunExtent> nextExtent() {
    return hasNext() ? Optional.of(next()) : Optional.empty();
  }

  /// @return the first position of the next run not yet returned, or the length when
  /// exhausted
  public int position() {
    return pending != null ? pending.start() : index;
  }

  /// @return the number of positions in the source
  public int length() {
    return length;
  }

  /// @return the placement of boundary elements
  public SplitMode mode() {
    return mode;
  }
}
