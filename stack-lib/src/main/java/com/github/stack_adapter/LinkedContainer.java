// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.stack_adapter;

import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedList;

/// Doubly linked storage backed by a [LinkedList]. It never reallocates, so pushing does not copy existing
/// elements. Back access or removal on an empty container throws [java.util.NoSuchElementException].
public final class LinkedContainer<T> extends AbstractListContainer<T, LinkedContainer<T>> {

  public LinkedContainer() {
    super(new LinkedList<>());
  }

  public LinkedContainer(Collection<? extends T> values) {
    super(new LinkedList<>(values));
  }

  private LinkedList<T> list() {
    return (LinkedList<T>) elements;
  }

  @Override
  public void pushBack(T value) {
    list().addLast(value);
  }

  @Override
  public void popBack() {
    list().removeLast();
  }

  @Override
  public T back() {
    return list().getLast();
  }

  @Override
  public LinkedContainer<T> copy() {
    return new LinkedContainer<>(elements);
  }

  @Override
  public LinkedContainer<T> newEmpty() {
    return new LinkedContainer<>();
  }

  /// @return the elements from top to bottom
  public Iterator<T> descendingIterator() {
    return list().descendingIterator();
  }

  /// The forward and backward links must agree: walking both ways visits the same number of elements.
  @Override
  public boolean validate() {
    int count = 0;
    for (Iterator<T> it = list().descendingIterator(); it.hasNext(); it.next()) {
      count++;
    }
    return count == elements.size();
  }
}
