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


import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Stream;

/// An [Iterable] of runs over one source. Every [#iterator()] starts a new
/// [RunSplitter] from the beginning of the source.
///
/// A stateful predicate keeps its state from one pass to the next.
/// @param <V> the type of a run view
public class RunSplits<V> implements Iterable<V> {
  private final Supplier<RunSplitter<V>> splitters;

  /// create a reusable split
  /// @param splitters creates a new splitter at position 0 on each call
  public RunSplits(Supplier<RunSplitter<V>> splitters) {
    this.splitters = Objects.requireNonNull(splitters, "splitter supplier cannot be null");
  }

  /// get a new splitter over the whole source
  /// @return a new splitter over the whole source
  @NotNull
  @Override
  public RunSplitter<V> iterator() {
    return splitters.get();
  }

  /// @return a sequential stream of all runs, from a new splitter
  public Stream<V> stream() {
    return iterator().stream();
  }
}
