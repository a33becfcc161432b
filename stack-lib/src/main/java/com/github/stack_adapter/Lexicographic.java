// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.stack_adapter;

import java.util.Comparator;
import java.util.Iterator;

/// Lexicographic ordering of two sequences:
/// 1. Walk both sequences in step and return the comparison of the first pair that differs.
/// 2. If one sequence runs out first it is a prefix of the other and orders first.
/// 3. Otherwise they are equal.
public final class Lexicographic {

  private Lexicographic() {
  }

  public static <T> int compare(Iterable<? extends T> a, Iterable<? extends T> b, Comparator<? super T> order) {
    Iterator<? extends T> left = a.iterator();
    Iterator<? extends T> right = b.iterator();
    while (left.hasNext() && right.hasNext()) {
      int elementComparison = order.compare(left.next(), right.next());
      if (elementComparison != 0) {
        return elementComparison;
      }
    }
    // the shorter one is a prefix of the longer one
    return Boolean.compare(left.hasNext(), right.hasNext());
  }
}
