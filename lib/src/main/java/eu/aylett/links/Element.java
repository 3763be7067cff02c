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

import org.checkerframework.checker.lock.qual.NewObject;
import org.checkerframework.dataflow.qual.Pure;
import org.checkerframework.dataflow.qual.SideEffectFree;
import org.jetbrains.annotations.Contract;
import org.jspecify.annotations.Nullable;

import java.util.function.UnaryOperator;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A shared, mutable cell holding one value. An Element is the handle through
 * which values are stored in and retrieved from an {@link ElementList}.
 * <p>
 * The same Element may be held by a list and by any number of callers at once:
 * a {@link #set} through one holder is visible to all of them. Lists compare
 * Elements by identity, so two Elements holding equal values are never
 * interchangeable.
 * </p>
 * <p>
 * Not thread-safe.
 * </p>
 *
 * @param <T>
 *          the type of the held value
 */
public final class Element<T extends @Nullable Object> {
  private T value;

  private Element(T value) {
    this.value = value;
  }

  /**
   * Creates a new Element holding the given value.
   *
   * @param value
   *          the initial value
   * @return a fresh Element, distinct from every other Element
   */
  @Contract("_ -> new")
  public static <T extends @Nullable Object> @NewObject Element<T> of(T value) {
    return new Element<>(value);
  }

  @Pure
  public T get() {
    return value;
  }

  public void set(T value) {
    this.value = value;
  }

  /**
   * Replaces the held value with the result of applying {@code update} to it.
   *
   * @return the new value
   */
  public T update(UnaryOperator<T> update) {
    checkNotNull(update);
    this.value = update.apply(value);
    return value;
  }

  @SideEffectFree
  @Override
  public String toString() {
    return "Element{" + value + '}';
  }
}
