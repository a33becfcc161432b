// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.stack_adapter;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Iterator;
import java.util.Objects;

/// Double-ended buffer storage backed by an [ArrayDeque]. Like the deque it wraps it does not accept `null`
/// elements: [#pushBack(Object)] throws [NullPointerException] for them. Back access or removal on an empty container
/// throws [java.util.NoSuchElementException].
public final class DequeContainer<T> implements StackContainer<T, DequeContainer<T>> {

  private final ArrayDeque<T> elements;

  public DequeContainer() {
    this.elements = new ArrayDeque<>();
  }

  public DequeContainer(Collection<? extends T> values) {
    this.elements = new ArrayDeque<>(values);
  }

  @Override
  public void pushBack(T value) {
    elements.addLast(value);
  }

  @Override
  public void popBack() {
    elements.removeLast();
  }

  @Override
  public T back() {
    return elements.getLast();
  }

  @Override
  public int size() {
    return elements.size();
  }

  @Override
  public boolean isEmpty() {
    return elements.isEmpty();
  }

  @Override
  public DequeContainer<T> copy() {
    return new DequeContainer<>(elements);
  }

  @Override
  public DequeContainer<T> newEmpty() {
    return new DequeContainer<>();
  }

  @Override
  public Iterator<T> iterator() {
    return elements.iterator();
  }

  /// [ArrayDeque] has identity equality so we compare element by element.
  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof DequeContainer<?> that) || elements.size() != that.elements.size()) return false;
    Iterator<?> other = that.elements.iterator();
    for (T element : elements) {
      if (!Objects.equals(element, other.next())) {
        return false;
      }
    }
    return true;
  }

  /// Same formula as [java.util.List#hashCode()].
  @Override
  public int hashCode() {
    int hash = 1;
    for (T element : elements) {
      hash = 31 * hash + element.hashCode();
    }
    return hash;
  }

  @Override
  public String toString() {
    return elements.toString();
  }
}
