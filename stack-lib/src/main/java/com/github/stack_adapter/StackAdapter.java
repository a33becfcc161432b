// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.stack_adapter;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;
import java.util.function.Supplier;

import static com.github.stack_adapter.ErrorStrings.*;
import static com.github.stack_adapter.StackLogger.LOGGER;

/// A last-in-first-out adapter over any [StackContainer]. It owns exactly one container and forwards every stack
/// operation to the back insertion, back removal and back access of that container. The storage strategy is chosen
/// by the type of container:
///
/// ```mermaid
/// graph TD
///   Client([Client]) -->|"push()/pop()/top()"| SA([StackAdapter])
///   SA -->|"pushBack()/popBack()/back()"| SC([StackContainer])
///   SC -->|ArrayList| AC([ArrayContainer])
///   SC -->|LinkedList| LC([LinkedContainer])
///   SC -->|ArrayDeque| DC([DequeContainer])
///   SC -->|StringBuilder| TC([TextContainer])
///```
///
/// Preconditions of [#top()] and [#pop()] are checked with Java assertions. With assertions enabled (`-ea`, which is
/// the default under Maven Surefire) calling either on an empty stack fails fast with an [AssertionError] naming the
/// operation. With assertions disabled the checks cost nothing and the behaviour is whatever the container does on an
/// empty back access or removal.
///
/// This class is not thread safe. Callers sharing an instance between threads must supply their own mutual exclusion.
///
/// @param <T> the element type
/// @param <C> the container type that holds the elements
public final class StackAdapter<T, C extends StackContainer<T, C>> {

  /// The owned storage. Its back element is the top of the stack.
  private C container;

  /// Takes ownership of the container. The caller must not keep using it other than through [#container()].
  ///
  /// @param container The storage, which may already hold elements with its back element as the top.
  public StackAdapter(@NotNull C container) {
    this.container = Objects.requireNonNull(container, "container");
  }

  /// @return an empty stack over the container produced by the factory
  public static <T, C extends StackContainer<T, C>> StackAdapter<T, C> create(@NotNull Supplier<C> factory) {
    Objects.requireNonNull(factory, "factory");
    final C container = factory.get();
    if (container == null) {
      throw new IllegalArgumentException(FACTORY_RETURNED_NULL);
    }
    if (!container.isEmpty()) {
      throw new IllegalArgumentException(FACTORY_NOT_EMPTY + container.size());
    }
    return new StackAdapter<>(container);
  }

  /// @return an empty stack over contiguous storage
  public static <T> StackAdapter<T, ArrayContainer<T>> ofArray() {
    return new StackAdapter<>(new ArrayContainer<>());
  }

  /// @return an empty stack over doubly linked storage
  public static <T> StackAdapter<T, LinkedContainer<T>> ofLinked() {
    return new StackAdapter<>(new LinkedContainer<>());
  }

  /// @return an empty stack over a double-ended buffer
  public static <T> StackAdapter<T, DequeContainer<T>> ofDeque() {
    return new StackAdapter<>(new DequeContainer<>());
  }

  /// @return a stack over a copy of the container, leaving the argument untouched
  public static <T, C extends StackContainer<T, C>> StackAdapter<T, C> copyOf(@NotNull C container) {
    return new StackAdapter<>(Objects.requireNonNull(container, "container").copy());
  }

  /// Pushes the values in the order given so that the last value is the top.
  @SafeVarargs
  public static <T, C extends StackContainer<T, C>> StackAdapter<T, C> of(@NotNull Supplier<C> factory, T... values) {
    Objects.requireNonNull(values, "values");
    return of(factory, Arrays.asList(values));
  }

  /// Pushes the values in iteration order so that the last value is the top.
  public static <T, C extends StackContainer<T, C>> StackAdapter<T, C> of(@NotNull Supplier<C> factory,
                                                                         @NotNull Iterable<? extends T> values) {
    Objects.requireNonNull(values, "values");
    final var stack = StackAdapter.<T, C>create(factory);
    for (T value : values) {
      stack.push(value);
    }
    LOGGER.fine(() -> "Created stack with " + stack.size() + " initial values");
    return stack;
  }

  /// Transfers the container out of the source into a new adapter. The source is left holding a new empty
  /// container of the same type.
  public static <T, C extends StackContainer<T, C>> StackAdapter<T, C> moveFrom(@NotNull StackAdapter<T, C> source) {
    Objects.requireNonNull(source, "source");
    final C taken = source.container;
    source.container = taken.newEmpty();
    return new StackAdapter<>(taken);
  }

  public boolean empty() {
    return container.isEmpty();
  }

  public int size() {
    return container.size();
  }

  /// @return the most recently pushed element that has not been popped. The element is the stored instance so that
  /// changes to a mutable element are visible in the stack.
  public T top() {
    assert nonEmptyOrLog(TOP_ON_EMPTY) : TOP_ON_EMPTY;
    return container.back();
  }

  /// Appends the value as the new top. A failure of the container to grow, or to accept the value, propagates
  /// unchanged.
  public void push(T value) {
    container.pushBack(value);
  }

  /// Constructs the new top through the container's in-place back construction.
  ///
  /// @return whatever the container returns, which for the supplied containers is the new top element
  public T emplace(@NotNull Supplier<? extends T> factory) {
    return container.emplaceBack(factory);
  }

  /// Removes the top element. Read [#top()] first if the value is needed.
  public void pop() {
    assert nonEmptyOrLog(POP_ON_EMPTY) : POP_ON_EMPTY;
    container.popBack();
  }

  /// Exchanges the owned containers in constant time.
  public void swap(@NotNull StackAdapter<T, C> other) {
    final C mine = this.container;
    this.container = other.container;
    other.container = mine;
    LOGGER.finest(() -> "Swapped stacks of size " + other.size() + " and " + this.size());
  }

  public static <T, C extends StackContainer<T, C>> void swap(@NotNull StackAdapter<T, C> a,
                                                              @NotNull StackAdapter<T, C> b) {
    a.swap(b);
  }

  /// Direct access to the owned storage for operations the stack does not expose, such as bulk iteration. This is
  /// the same storage the stack uses, not a copy, so changes made through it are seen by the stack.
  public C container() {
    return container;
  }

  /// @return a new stack holding a copy of this stack's container
  public StackAdapter<T, C> copy() {
    return new StackAdapter<>(container.copy());
  }

  /// Runs the container's own consistency check. Used for testing and debugging.
  public boolean validate() {
    final boolean valid = container.validate();
    if (!valid) {
      LOGGER.warning(() -> VALIDATION_FAILED + container.getClass().getSimpleName() + " size=" + container.size());
    }
    return valid;
  }

  /// Compares two stacks as the lexicographic ordering of their containers from bottom to top. `null` elements
  /// order before all others so that any two stacks that can be compared for equality can also be ordered.
  public static <T extends Comparable<? super T>, C extends StackContainer<T, C>> int compare(
      @NotNull StackAdapter<T, C> a, @NotNull StackAdapter<T, C> b) {
    return Lexicographic.compare(a.container, b.container, Comparator.nullsFirst(Comparator.<T>naturalOrder()));
  }

  public static <T extends Comparable<? super T>, C extends StackContainer<T, C>> boolean lessThan(
      StackAdapter<T, C> a, StackAdapter<T, C> b) {
    return compare(a, b) < 0;
  }

  public static <T extends Comparable<? super T>, C extends StackContainer<T, C>> boolean lessThanOrEqualTo(
      StackAdapter<T, C> a, StackAdapter<T, C> b) {
    return compare(a, b) <= 0;
  }

  public static <T extends Comparable<? super T>, C extends StackContainer<T, C>> boolean greaterThan(
      StackAdapter<T, C> a, StackAdapter<T, C> b) {
    return compare(a, b) > 0;
  }

  public static <T extends Comparable<? super T>, C extends StackContainer<T, C>> boolean greaterThanOrEqualTo(
      StackAdapter<T, C> a, StackAdapter<T, C> b) {
    return compare(a, b) >= 0;
  }

  /// @return the lexicographic ordering of stacks whose elements have a natural order
  public static <T extends Comparable<? super T>, C extends StackContainer<T, C>> Comparator<StackAdapter<T, C>> naturalOrder() {
    return StackAdapter::compare;
  }

  /// @param elementOrder how to order two elements at the same depth
  /// @return the lexicographic ordering of stacks under the given element order
  public static <T, C extends StackContainer<T, C>> Comparator<StackAdapter<T, C>> ordering(
      @NotNull Comparator<? super T> elementOrder) {
    Objects.requireNonNull(elementOrder, "elementOrder");
    return (a, b) -> Lexicographic.compare(a.container, b.container, elementOrder);
  }

  /// Two stacks are equal when their containers are equal, element by element in the same order.
  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    return o instanceof StackAdapter<?, ?> that && container.equals(that.container);
  }

  @Override
  public int hashCode() {
    return container.hashCode();
  }

  @Override
  public String toString() {
    return "StackAdapter" + container;
  }

  private boolean nonEmptyOrLog(String violation) {
    if (container.isEmpty()) {
      LOGGER.severe(violation);
      return false;
    }
    return true;
  }
}

class ErrorStrings {
  static final String TOP_ON_EMPTY = StackAdapter.class.getSimpleName() + ".top -- empty container";
  static final String POP_ON_EMPTY = StackAdapter.class.getSimpleName() + ".pop -- empty container";
  static final String FACTORY_RETURNED_NULL = StackAdapter.class.getSimpleName() + " container factory returned null";
  static final String FACTORY_NOT_EMPTY = StackAdapter.class.getSimpleName() + " container factory returned a non-empty container of size ";
  static final String VALIDATION_FAILED = StackAdapter.class.getSimpleName() + " container failed validation: ";
}
