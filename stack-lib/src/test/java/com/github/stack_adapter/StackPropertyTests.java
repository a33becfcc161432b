// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.stack_adapter;

import net.jqwik.api.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/// Property tests that check the stack behaves the same whatever storage it adapts.
/// Tests cover all combinations of:
/// - Storage kind (ARRAY, LINKED, DEQUE, RECORDING)
/// - Sequences of pushed values
public class StackPropertyTests {

  /// The container under the adapter
  enum Storage {ARRAY, LINKED, DEQUE, RECORDING}

  /// A fresh empty stack of the given storage kind, typed with a wildcard container so that one test body runs
  /// against every container.
  static StackAdapter<Integer, ?> emptyStack(Storage storage) {
    return switch (storage) {
      case ARRAY -> StackAdapter.<Integer>ofArray();
      case LINKED -> StackAdapter.<Integer>ofLinked();
      case DEQUE -> StackAdapter.<Integer>ofDeque();
      case RECORDING -> new StackAdapter<>(new RecordingContainer<Integer>());
    };
  }

  /// Pushing without popping: the top is always the latest value and the size counts the pushes.
  @Property
  void topIsLatestPush(@ForAll Storage storage, @ForAll List<Integer> values) {
    final var stack = emptyStack(storage);
    int pushes = 0;
    for (Integer value : values) {
      stack.push(value);
      pushes++;
      assertEquals(value, stack.top());
      assertEquals(pushes, stack.size());
      assertFalse(stack.empty());
    }
  }

  /// Popping everything sees the values in the reverse of the order they were pushed.
  @Property
  void popsReversePushes(@ForAll Storage storage, @ForAll List<Integer> values) {
    final var stack = emptyStack(storage);
    values.forEach(stack::push);

    final var observed = new ArrayList<Integer>();
    while (!stack.empty()) {
      observed.add(stack.top());
      stack.pop();
    }

    final var expected = new ArrayList<>(values);
    Collections.reverse(expected);
    assertEquals(expected, observed);
    assertEquals(0, stack.size());
  }

  /// Interleaved pushes and pops agree with a reference list used as a stack.
  @Property
  void matchesReferenceModel(@ForAll Storage storage, @ForAll("operations") List<Integer> operations) {
    final var stack = emptyStack(storage);
    final var model = new ArrayList<Integer>();
    for (Integer op : operations) {
      if (op == null) {
        if (!model.isEmpty()) {
          assertEquals(model.get(model.size() - 1), stack.top());
          model.remove(model.size() - 1);
          stack.pop();
        }
      } else {
        model.add(op);
        stack.push(op);
      }
      assertEquals(model.size(), stack.size());
      assertEquals(model.isEmpty(), stack.empty());
      assertTrue(stack.validate());
    }
  }

  /// Queries do not change what later queries see.
  @Property
  void queriesAreIdempotent(@ForAll Storage storage, @ForAll("nonEmpty") List<Integer> values) {
    final var stack = emptyStack(storage);
    values.forEach(stack::push);

    final var top = stack.top();
    final var size = stack.size();
    for (int i = 0; i < 3; i++) {
      assertEquals(top, stack.top());
      assertEquals(size, stack.size());
      assertFalse(stack.empty());
    }
  }

  /// Building from initial values is the same as pushing them one at a time.
  @Property
  void initialValuesEqualPushes(@ForAll List<Integer> values) {
    StackAdapter<Integer, ArrayContainer<Integer>> pushed = StackAdapter.ofArray();
    values.forEach(pushed::push);

    StackAdapter<Integer, ArrayContainer<Integer>> built = StackAdapter.of(ArrayContainer::new, values);

    assertEquals(pushed, built);
    assertEquals(0, StackAdapter.compare(pushed, built));
  }

  /// Ordering two stacks agrees with ordering their bottom-to-top lists.
  @Property
  void orderingMatchesListOrdering(@ForAll List<Integer> left, @ForAll List<Integer> right) {
    StackAdapter<Integer, LinkedContainer<Integer>> a = StackAdapter.of(LinkedContainer::new, left);
    StackAdapter<Integer, LinkedContainer<Integer>> b = StackAdapter.of(LinkedContainer::new, right);

    final int expected = Integer.signum(referenceCompare(left, right));
    assertEquals(expected, Integer.signum(StackAdapter.compare(a, b)));
    assertEquals(expected == 0, a.equals(b));
    assertEquals(-expected, Integer.signum(StackAdapter.compare(b, a)));
  }

  /// Swapping twice is the identity and swapping once exchanges contents.
  @Property
  void swapExchanges(@ForAll List<Integer> left, @ForAll List<Integer> right) {
    StackAdapter<Integer, DequeContainer<Integer>> a = StackAdapter.of(DequeContainer::new, left);
    StackAdapter<Integer, DequeContainer<Integer>> b = StackAdapter.of(DequeContainer::new, right);
    final var aBefore = a.copy();
    final var bBefore = b.copy();

    a.swap(b);
    assertEquals(bBefore, a);
    assertEquals(aBefore, b);

    StackAdapter.swap(a, b);
    assertEquals(aBefore, a);
    assertEquals(bBefore, b);
  }

  private static int referenceCompare(List<Integer> left, List<Integer> right) {
    for (int i = 0; i < Math.min(left.size(), right.size()); i++) {
      int c = left.get(i).compareTo(right.get(i));
      if (c != 0) {
        return c;
      }
    }
    return Integer.compare(left.size(), right.size());
  }

  /// A null element means pop, anything else is a value to push.
  @Provide
  Arbitrary<List<Integer>> operations() {
    return Arbitraries.integers().between(-100, 100).injectNull(0.3).list().ofMaxSize(50);
  }

  @Provide
  Arbitrary<List<Integer>> nonEmpty() {
    return Arbitraries.integers().list().ofMinSize(1).ofMaxSize(20);
  }
}
