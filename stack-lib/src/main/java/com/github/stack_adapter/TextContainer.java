// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.stack_adapter;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/// A pseudo-container holding characters in a [StringBuilder], with the last character as the back element. Useful
/// for bracket matching and similar parsing jobs where the stack contents are also wanted as text via [#text()].
/// Back access or removal on an empty container throws [StringIndexOutOfBoundsException].
public final class TextContainer implements StackContainer<Character, TextContainer> {

  private final StringBuilder text;

  public TextContainer() {
    this.text = new StringBuilder();
  }

  /// @param initial the characters in order, the last one being the back element
  public TextContainer(CharSequence initial) {
    this.text = new StringBuilder(initial);
  }

  /// @throws NullPointerException if the value is `null` as a character buffer cannot hold it
  @Override
  public void pushBack(Character value) {
    text.append(Objects.requireNonNull(value, "value").charValue());
  }

  @Override
  public void popBack() {
    text.deleteCharAt(text.length() - 1);
  }

  @Override
  public Character back() {
    return text.charAt(text.length() - 1);
  }

  @Override
  public int size() {
    return text.length();
  }

  @Override
  public boolean isEmpty() {
    return text.length() == 0;
  }

  @Override
  public TextContainer copy() {
    return new TextContainer(text);
  }

  @Override
  public TextContainer newEmpty() {
    return new TextContainer();
  }

  /// @return the characters from bottom to top as a string
  public String text() {
    return text.toString();
  }

  @Override
  public Iterator<Character> iterator() {
    return new Iterator<>() {
      int index = 0;

      @Override
      public boolean hasNext() {
        return index < text.length();
      }

      @Override
      public Character next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        return text.charAt(index++);
      }
    };
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    return o instanceof TextContainer that && text.compareTo(that.text) == 0;
  }

  @Override
  public int hashCode() {
    return text.toString().hashCode();
  }

  @Override
  public String toString() {
    return "[" + text + "]";
  }
}
