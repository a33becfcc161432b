// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.stack_adapter;

import java.util.function.Supplier;

/// The capabilities a sequence container must offer to be adapted by a [StackAdapter]:
/// - back insertion [#pushBack(Object)] and in-place back construction [#emplaceBack(Supplier)]
/// - back removal [#popBack()]
/// - back access [#back()]
/// - size and emptiness queries
/// - copying and creating an empty sibling of the same concrete type
/// - bottom-to-top iteration for bulk access and ordering
///
/// The `C` parameter is the implementing type itself so that [#copy()] and [#newEmpty()] keep the concrete type
/// without casts. Containers define their own behaviour on an empty back access or back removal; the adapter does not
/// strengthen it.
///
/// @param <T> the element type
/// @param <C> the implementing container type
public interface StackContainer<T, C extends StackContainer<T, C>> extends Iterable<T> {

  /// Appends the value as the new back element. Any failure to grow the storage propagates unchanged.
  void pushBack(T value);

  /// Removes the back element.
  void popBack();

  /// @return the back element, the one most recently appended and not yet removed
  T back();

  int size();

  boolean isEmpty();

  /// @return a new container of the same type holding the same elements in the same order
  C copy();

  /// @return a new empty container of the same type
  C newEmpty();

  /// Constructs a new back element from the factory. Containers with a cheaper in-place path may override this.
  ///
  /// @return the newly constructed back element
  default T emplaceBack(Supplier<? extends T> factory) {
    pushBack(factory.get());
    return back();
  }

  /// Internal consistency check used for diagnostics only.
  default boolean validate() {
    return true;
  }
}
