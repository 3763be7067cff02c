/*
 * Copyright 2025 Andrew Aylett
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package eu.aylett.links;

import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.dataflow.qual.Pure;
import org.jspecify.annotations.Nullable;

import java.util.Iterator;

/**
 * An ordered, index-addressable sequence of {@link Element}s.
 * <p>
 * Lists hold Elements, not bare values: {@link #get}, {@link #removeAt} and
 * iteration hand back the same Element that was stored, so callers may mutate
 * a value in place. Membership and removal by Element compare identity, never
 * value equality.
 * </p>
 * <p>
 * A failed operation throws {@link ListOperationException} and leaves the list
 * unchanged. Implementations are not thread-safe.
 * </p>
 *
 * @param <T>
 *          the type of values held by the list's Elements
 */
public interface ElementList<T extends @Nullable Object> extends Iterable<Element<T>> {

  /**
   * Appends an Element at the tail of the list.
   *
   * @param item
   *          the Element to append
   */
  void add(Element<T> item);

  /**
   * Wraps a value in a fresh Element and appends it at the tail of the list.
   *
   * @param value
   *          the value to append
   */
  default void addValue(T value) {
    add(Element.of(value));
  }

  /**
   * Inserts an Element so that it becomes the element at {@code index}. The
   * element previously at {@code index}, and all those after it, move one place
   * towards the tail.
   *
   * @throws ListOperationException
   *           {@link ListOperationError#INDEX_OUT_OF_BOUNDS} if {@code index} is
   *           negative or not less than {@link #size()}
   */
  void insertAt(Element<T> item, int index);

  /**
   * Wraps a value in a fresh Element and inserts it as {@link #insertAt} does.
   */
  default void insertValueAt(T value, int index) {
    insertAt(Element.of(value), index);
  }

  /**
   * @throws ListOperationException
   *           {@link ListOperationError#INDEX_OUT_OF_BOUNDS} if {@code index} is
   *           negative or not less than {@link #size()}
   */
  Element<T> get(int index);

  /**
   * Removes the given Element, compared by identity.
   *
   * @throws ListOperationException
   *           {@link ListOperationError#OPERATION_ON_EMPTY_LIST} if the list is
   *           empty, or {@link ListOperationError#ELEMENT_NOT_FOUND} if it does
   *           not hold {@code item}
   */
  void remove(Element<T> item);

  /**
   * Removes the Element at {@code index}.
   *
   * @return the removed Element
   * @throws ListOperationException
   *           {@link ListOperationError#INDEX_OUT_OF_BOUNDS} if {@code index} is
   *           negative or not less than {@link #size()}
   */
  Element<T> removeAt(int index);

  /** Whether the list holds this exact Element. */
  @Pure
  boolean contains(Element<T> item);

  @Pure
  @NonNegative
  int size();

  @Pure
  default boolean isEmpty() {
    return size() == 0;
  }

  /**
   * Removes the Element at the head of the list.
   *
   * @throws ListOperationException
   *           {@link ListOperationError#OPERATION_ON_EMPTY_LIST} if the list is
   *           empty
   */
  Element<T> shift();

  /**
   * Removes the Element at the tail of the list.
   *
   * @throws ListOperationException
   *           {@link ListOperationError#OPERATION_ON_EMPTY_LIST} if the list is
   *           empty
   */
  Element<T> pop();

  /**
   * Iterates the list from its current head. The iterator follows live links,
   * so the list must not be modified while it is in use.
   */
  @Override
  Iterator<Element<T>> iterator();

  /**
   * Creates a new, independently linked list holding the same Elements in the
   * same order. Mutating either list's structure does not affect the other, but
   * the Elements themselves are shared.
   */
  ElementList<T> copy();

  /**
   * Walks the whole structure, verifying its invariants.
   *
   * @throws com.google.common.base.VerifyException
   *           if an invariant does not hold
   */
  void checkSafety();
}
