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


import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/// Splits a source into contiguous runs, producing a view of each run in order.
///
/// Runs are computed lazily, one per pull, and together they cover the source exactly
/// once with no gaps, overlaps or empty runs. A splitter is single-pass. To split the
/// same source again, create a new splitter or use a [RunSplits].
///
/// The source must not change while a splitter is in use, and the views it returns share
/// their elements with the source. Instances are not thread safe: one consumer is
/// expected to drive a splitter, and a stateful predicate is called without any
/// synchronization.
/// @param <V> the type of a run view
public class RunSplitter<V> implements Iterator<V>, DiagToString {
  private static final Logger logger = LogManager.getLogger(RunSplitter.class);

  private final String desc;
  private final RunCursor cursor;
  private final RunView<V> view;
  private long produced;
  private boolean exhaustionLogged;

  /// create a run splitter
  /// @param desc a description, for debugging
  /// @param cursor the cursor over the source positions
  /// @param view creates the view for each run
  public RunSplitter(String desc, RunCursor cursor, RunView<V> view) {
    this.desc = desc;
    this.cursor = Objects.requireNonNull(cursor, "run cursor cannot be null");
    this.view = Objects.requireNonNull(view, "run view cannot be null");
  }

  /// Take the next run. This never fails on exhaustion: once it returns empty, every
  /// later call also returns empty.
  /// @return a view of the next run, or empty if no runs remain
  public Optional<V> nextRun() {
    Optional<RunExtent> extent = cursor.nextExtent();
    if (extent.isEmpty()) {
      if (!exhaustionLogged) {
        exhaustionLogged = true;
        logger.debug("{}: exhausted after {} runs over {} elements", desc, produced,
            cursor.length());
      }
      return Optional.empty();
    }
    produced++;
    logger.trace("{}: run {} is {}", desc, produced, extent.get());
    return Optional.of(view.view(extent.get()));
  }

  /// {@inheritDoc}
  @Override
  public boolean hasNext() {
    return cursor.hasNext();
  }

  /// {@inheritDoc}
  @Override
  public V next() {
    return nextRun().orElseThrow(
        () -> new NoSuchElementException(desc + ": no runs remain"));
  }

  /// Stream the remaining runs, in order
  /// @return a sequential stream of the runs not yet taken
  public Stream<V> stream() {
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  /// @return the position in the source where the next run starts
  public int position() {
    return cursor.position();
  }

  /// @return the placement of boundary elements
  public SplitMode mode() {
    return cursor.mode();
  }

  /// @return the number of runs produced so far
  public long produced() {
    return produced;
  }

  /// {@inheritDoc}
  @Override
  public String toDiagString() {
    return "desc:" + desc + ", mode:" + cursor.mode() + ", position:" + cursor.position()
           + ", length:" + cursor.length() + ", produced:" + produced;
  }

  @Override
  public String toString() {
    return toDiagString();
  }
}
