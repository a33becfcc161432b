// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.stack_adapter;

import java.util.Iterator;
import java.util.List;

/// Shared behaviour of the containers that keep their elements in a [java.util.List] with the back element at the
/// highest index. Two containers are equal when they are of the same class and hold equal elements in the same order.
abstract class AbstractListContainer<T, C extends AbstractListContainer<T, C>> implements StackContainer<T, C> {

  protected final List<T> elements;

  protected AbstractListContainer(List<T> elements) {
    this.elements = elements;
  }

  @Override
  public void pushBack(T value) {
    elements.add(value);
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
  public Iterator<T> iterator() {
    return elements.iterator();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return elements.equals(((AbstractListContainer<?, ?>) o).elements);
  }

  @Override
  public int hashCode() {
    return elements.hashCode();
  }

  @Override
  public String toString() {
    return elements.toString();
  }
}
