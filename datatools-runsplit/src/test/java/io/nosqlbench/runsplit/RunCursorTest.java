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


import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntPredicate;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RunCursor")
class RunCursorTest {

  @ParameterizedTest
  @EnumSource(SplitMode.class)
  @DisplayName("should produce nothing for an empty source")
  void shouldProduceNothingWhenEmpty(SplitMode mode) {
    RunCursor cursor = new RunCursor(0, i -> true, mode);
    assertThat(cursor.hasNext()).isFalse();
    assertThat(cursor.nextExtent()).isEmpty();
    assertThat(cursor.position()).isZero();
  }

  @ParameterizedTest
  @EnumSource(SplitMode.class)
  @DisplayName("should stay exhausted once exhausted")
  void shouldStayExhausted(SplitMode mode) {
    RunCursor cursor = new RunCursor(4, i -> i == 1, mode);
    assertThat(cursor.nextExtent()).isPresent();
    cursor.forEachRemaining(extent -> { });
    for (int i = 0; i < 3; i++) {
      assertThat(cursor.nextExtent()).isEmpty();
      assertThat(cursor.hasNext()).isFalse();
      assertThat(cursor.position()).isEqualTo(4);
    }
    assertThatThrownBy(cursor::next).isInstanceOf(NoSuchElementException.class);
  }

  @Test
  @DisplayName("should report the start of the next unreturned run")
  void shouldTrackPosition() {
    RunCursor cursor = new RunCursor(9, i -> i == 2 || i == 5, SplitMode.BEFORE);
    assertThat(cursor.position()).isZero();
    assertThat(cursor.hasNext()).isTrue();
    assertThat(cursor.position()).isZero();
    assertThat(cursor.next()).isEqualTo(new RunExtent(0, 2));
    assertThat(cursor.position()).isEqualTo(2);
    assertThat(cursor.next()).isEqualTo(new RunExtent(2, 5));
    assertThat(cursor.next()).isEqualTo(new RunExtent(5, 9));
    assertThat(cursor.position()).isEqualTo(9);
    assertThat(cursor.hasNext()).isFalse();
  }

  @Test
  @DisplayName("should not test the predicate before the first pull")
  void shouldBeLazy() {
    List<Integer> tested = new ArrayList<>();
    RunCursor cursor = new RunCursor(5, recording(tested, i -> false), SplitMode.AFTER);
    assertThat(tested).isEmpty();
    cursor.hasNext();
    cursor.hasNext();
    assertThat(tested).containsExactly(0, 1, 2, 3, 4);
  }

  @Test
  @DisplayName("should test each position once in after mode")
  void shouldTestEachPositionOnceAfter() {
    List<Integer> tested = new ArrayList<>();
    RunCursor cursor = new RunCursor(9, recording(tested, i -> i == 2 || i == 5), SplitMode.AFTER);
    cursor.forEachRemaining(extent -> { });
    assertThat(tested).containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8);
  }

  @Test
  @DisplayName("should test each position once in before mode")
  void shouldTestEachPositionOnceBefore() {
    List<Integer> tested = new ArrayList<>();
    RunCursor cursor = new RunCursor(9, recording(tested, i -> i == 2 || i == 5), SplitMode.BEFORE);
    cursor.forEachRemaining(extent -> { });
    assertThat(tested).containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8);
  }

  @Test
  @DisplayName("should test a matching first position once in before mode")
  void shouldTestMatchingFirstPositionOnceBefore() {
    List<Integer> tested = new ArrayList<>();
    RunCursor cursor = new RunCursor(4, recording(tested, i -> i == 0 || i == 2), SplitMode.BEFORE);
    assertThat(cursor.next()).isEqualTo(new RunExtent(0, 2));
    assertThat(cursor.next()).isEqualTo(new RunExtent(2, 4));
    assertThat(cursor.hasNext()).isFalse();
    assertThat(tested).containsExactly(0, 1, 2, 3);
  }

  @Test
  @DisplayName("should not advance when the predicate throws, and re-test on retry")
  void shouldNotAdvanceOnPredicateFailure() {
    List<Integer> tested = new ArrayList<>();
    AtomicBoolean fail = new AtomicBoolean(true);
    IntPredicate boundaryAt = i -> {
      if (i == 2 && fail.getAndSet(false)) {
        throw new IllegalStateException("boundary lookup failed");
      }
      return i == 3;
    };
    RunCursor cursor = new RunCursor(5, recording(tested, boundaryAt), SplitMode.AFTER);

    assertThatThrownBy(cursor::hasNext)
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("boundary lookup failed");
    assertThat(cursor.position()).isZero();

    assertThat(cursor.nextExtent()).contains(new RunExtent(0, 4));
    assertThat(cursor.nextExtent()).contains(new RunExtent(4, 5));
    assertThat(cursor.nextExtent()).isEmpty();
    assertThat(tested).containsExactly(0, 1, 2, 0, 1, 2, 3, 4);
  }

  @Test
  @DisplayName("should reject invalid construction")
  void shouldRejectInvalidConstruction() {
    assertThatThrownBy(() -> new RunCursor(-1, i -> true, SplitMode.AFTER))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("must be non-negative");
    assertThatThrownBy(() -> new RunCursor(3, null, SplitMode.AFTER))
        .isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> new RunCursor(3, i -> true, null))
        .isInstanceOf(NullPointerException.class);
  }

  private static IntPredicate recording(List<Integer> tested, IntPredicate inner) {
    return i -> {
      tested.add(i);
      return inner.test(i);
    };
  }
}
