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


import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/// Entry points for splitting lists, arrays and byte buffers into runs.
///
/// ```java
/// RunSplitter<List<Integer>> runs = Runs.splitBefore(List.of(0, 1, 2), v -> v == 1);
/// runs.next(); // [0]
/// runs.next(); // [1, 2]
/// ```
///
/// Runs of lists and arrays are unmodifiable [List#subList] views. Runs of byte buffers
/// are read-only slices. Nothing is copied, and the source is never modified.
public final class Runs {

  private Runs() {
  }

  /// Split a list so that each boundary element opens the next run
  /// @param source the list to split
  /// @param boundary tests each element for a boundary
  /// @param <T> the element type
  /// @return a splitter over the list
  public static <T> RunSplitter<List<T>> splitBefore(List<T> source, Predicate<? super T> boundary) {
    return split(source, boundary, SplitMode.BEFORE);
  }

  /// Split a list so that each boundary element closes the current run
  /// @param source the list to split
  /// @param boundary tests each element for a boundary
  /// @param <T> the element type
  /// @return a splitter over the list
  public static <T> RunSplitter<List<T>> splitAfter(List<T> source, Predicate<? super T> boundary) {
    return split(source, boundary, SplitMode.AFTER);
  }

  /// Split an array so that each boundary element opens the next run
  /// @param source the array to split
  /// @param boundary tests each element for a boundary
  /// @param <T> the element type
  /// @return a splitter over the array
  public static <T> RunSplitter<List<T>> splitBefore(T[] source, Predicate<? super T> boundary) {
    return split(asList(source), boundary, SplitMode.BEFORE);
  }

  /// Split an array so that each boundary element closes the current run
  /// @param source the array to split
  /// @param boundary tests each element for a boundary
  /// @param <T> the element type
  /// @return a splitter over the array
  public static <T> RunSplitter<List<T>> splitAfter(T[] source, Predicate<? super T> boundary) {
    return split(asList(source), boundary, SplitMode.AFTER);
  }

  /// Split the remaining bytes of a buffer so that each boundary byte opens the next run.
  /// The position of the source buffer is not changed.
  /// @param source the buffer to split
  /// @param boundary tests each byte for a boundary
  /// @return a splitter over the buffer
  public static RunSplitter<ByteBuffer> splitBefore(ByteBuffer source, BytePredicate boundary) {
    return split(source, boundary, SplitMode.BEFORE);
  }

  /// Split the remaining bytes of a buffer so that each boundary byte closes the current run.
  /// The position of the source buffer is not changed.
  /// @param source the buffer to split
  /// @param boundary tests each byte for a boundary
  /// @return a splitter over the buffer
  public static RunSplitter<ByteBuffer> splitAfter(ByteBuffer source, BytePredicate boundary) {
    return split(source, boundary, SplitMode.AFTER);
  }

  /// Split a byte array so that each boundary byte opens the next run
  /// @param source the bytes to split
  /// @param boundary tests each byte for a boundary
  /// @return a splitter over the bytes
  public static RunSplitter<ByteBuffer> splitBefore(byte[] source, BytePredicate boundary) {
    return split(wrap(source), boundary, SplitMode.BEFORE);
  }

  /// Split a byte array so that each boundary byte closes the current run
  /// @param source the bytes to split
  /// @param boundary tests each byte for a boundary
  /// @return a splitter over the bytes
  public static RunSplitter<ByteBuffer> splitAfter(byte[] source, BytePredicate boundary) {
    return split(wrap(source), boundary, SplitMode.AFTER);
  }

  /// Create a reusable split of a list, with boundary elements opening the next run
  /// @param source the list to split
  /// @param boundary tests each element for a boundary
  /// @param <T> the element type
  /// @return an iterable which starts a new split on every iteration
  public static <T> RunSplits<List<T>> beforeEach(List<T> source, Predicate<? super T> boundary) {
    return splits(source, boundary, SplitMode.BEFORE);
  }

  /// Create a reusable split of a list, with boundary elements closing the current run
  /// @param source the list to split
  /// @param boundary tests each element for a boundary
  /// @param <T> the element type
  /// @return an iterable which starts a new split on every iteration
  public static <T> RunSplits<List<T>> afterEach(List<T> source, Predicate<? super T> boundary) {
    return splits(source, boundary, SplitMode.AFTER);
  }

  /// Create a reusable split of an array, with boundary elements opening the next run
  /// @param source the array to split
  /// @param boundary tests each element for a boundary
  /// @param <T> the element type
  /// @return an iterable which starts a new split on every iteration
  public static <T> RunSplits<List<T>> beforeEach(T[] source, Predicate<? super T> boundary) {
    return splits(asList(source), boundary, SplitMode.BEFORE);
  }

  /// Create a reusable split of an array, with boundary elements closing the current run
  /// @param source the array to split
  /// @param boundary tests each element for a boundary
  /// @param <T> the element type
  /// @return an iterable which starts a new split on every iteration
  public static <T> RunSplits<List<T>> afterEach(T[] source, Predicate<? super T> boundary) {
    return splits(asList(source), boundary, SplitMode.AFTER);
  }

  /// Split a list with an explicit mode
  /// @param source the list to split
  /// @param boundary tests each element for a boundary
  /// @param mode where boundary elements are placed
  /// @param <T> the element type
  /// @return a splitter over the list
  public static <T> RunSplitter<List<T>> split(
      List<T> source, Predicate<? super T> boundary, SplitMode mode) {
    Objects.requireNonNull(source, "source list cannot be null");
    Objects.requireNonNull(boundary, "boundary predicate cannot be null");
    RunCursor cursor = new RunCursor(source.size(), i -> boundary.test(source.get(i)), mode);
    return new RunSplitter<>(
        "list[" + source.size() + "]",
        cursor,
        extent -> Collections.unmodifiableList(source.subList(extent.start(), extent.end())));
  }

  /// Split the remaining bytes of a buffer with an explicit mode
  /// @param source the buffer to split
  /// @param boundary tests each byte for a boundary
  /// @param mode where boundary bytes are placed
  /// @return a splitter over the buffer
  public static RunSplitter<ByteBuffer> split(
      ByteBuffer source, BytePredicate boundary, SplitMode mode) {
    Objects.requireNonNull(source, "source buffer cannot be null");
    Objects.requireNonNull(boundary, "boundary predicate cannot be null");
    ByteBuffer buf = source.asReadOnlyBuffer();
    int base = buf.position();
    RunCursor cursor = new RunCursor(buf.remaining(), i -> boundary.test(buf.get(base + i)), mode);
    return new RunSplitter<>("bytes[" + buf.remaining() + "]", cursor, extent -> {
      ByteBuffer run = buf.duplicate();
      run.limit(base + extent.end());
      run.position(base + extent.start());
      return run.slice();
    });
  }

  private static <T> RunSplits<List<T>> splits(
      List<T> source, Predicate<? super T> boundary, SplitMode mode) {
    Objects.requireNonNull(source, "source list cannot be null");
    Objects.requireNonNull(boundary, "boundary predicate cannot be null");
    Objects.requireNonNull(mode, "split mode cannot be null");
    return new RunSplits<>(() -> split(source, boundary, mode));
  }

  private static <T> List<T> asList(T[] source) {
    return Arrays.asList(Objects.requireNonNull(source, "source array cannot be null"));
  }

  private static ByteBuffer wrap(byte[] source) {
    return ByteBuffer.wrap(Objects.requireNonNull(source, "source array cannot be null"));
  }
}
