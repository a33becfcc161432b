// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.stack_adapter;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/// A container with only the required capabilities that records which back operations the adapter calls.
class RecordingContainer<T> implements StackContainer<T, RecordingContainer<T>> {
  final List<T> elements = new ArrayList<>();
  final List<String> calls = new ArrayList<>();
  boolean valid = true;

  @Override
  public void pushBack(T value) {
    calls.add("pushBack");
    elements.add(value);
  }

  @Override
  public void popBack() {
    calls.add("popBack");
    elements.remove(elements.size() - 1);
  }

  @Override
  public T back() {
    calls.add("back");
    return elements.get(elements.size() - 1);
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
  public RecordingContainer<T> copy() {
    final var copy = new RecordingContainer<T>();
    copy.elements.addAll(elements);
    return copy;
  }

  @Override
  public RecordingContainer<T> newEmpty() {
    return new RecordingContainer<>();
  }

  @Override
  public boolean validate() {
    return valid;
  }

  @Override
  public Iterator<T> iterator() {
    return elements.iterator();
  }
}
