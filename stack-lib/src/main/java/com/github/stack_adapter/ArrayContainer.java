// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.stack_adapter;

import java.util.ArrayList;
import java.util.Collection;

/// Contiguous storage backed by an [ArrayList]. This is the default choice for a stack: appending and removing at
/// the back is amortised constant time. Back access or removal on an empty container throws
/// [IndexOutOfBoundsException].
public final class ArrayContainer<T> extends AbstractListContainer<T, ArrayContainer<T>> {

  public ArrayContainer() {
    super(new ArrayList<>());
  }

  /// @param initialCapacity the number of elements to reserve space for
  public ArrayContainer(int initialCapacity) {
    super(new ArrayList<>(initialCapacity));
  }

  /// @param values copied in iteration order so that the last one is the back element
  public ArrayContainer(Collection<? extends T> values) {
    super(new ArrayList<>(values));
  }

  @Override
  public void popBack() {
    elements.remove(elements.size() - 1);
  }

  @Override
  public T back() {
    return elements.get(elements.size() - 1);
  }

  @Override
  public ArrayContainer<T> copy() {
    return new ArrayContainer<>(elements);
  }

  @Override
  public ArrayContainer<T> newEmpty() {
    return new ArrayContainer<>();
  }

  /// Reserves space so that the given number of elements can be held without growing.
  public void ensureCapacity(int minCapacity) {
    ((ArrayList<T>) elements).ensureCapacity(minCapacity);
  }
}
