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

package eu.aylett.links.internal;

import eu.aylett.links.ListOperationException;
import org.checkerframework.checker.index.qual.NonNegative;
import org.jetbrains.annotations.Contract;
import org.jspecify.annotations.Nullable;

public final class Invariants {
  private Invariants() {
  }

  /// Follows a link that the list's structural invariants guarantee is present.
  ///
  /// @throws ListOperationException
  ///           with `UNEXPECTED_ERROR` if the link is missing
  @Contract(value = "null -> fail; !null -> param1", pure = true)
  public static <T> T checkLinked(@Nullable T reference) {
    return checkLinked(reference, "Invariant failed: expected link is missing");
  }

  @Contract(value = "null, _ -> fail; !null, _ -> param1", pure = true)
  public static <T> T checkLinked(@Nullable T reference, String message) {
    if (reference == null) {
      throw ListOperationException.unexpected(message);
    }
    return reference;
  }

  /// Checks that `index` addresses an existing element of a list of `size`
  /// elements.
  ///
  /// @throws ListOperationException
  ///           with `INDEX_OUT_OF_BOUNDS` otherwise
  @Contract(pure = true)
  public static @NonNegative int checkIndex(int index, @NonNegative int size) {
    if (index < 0 || index >= size) {
      throw ListOperationException.indexOutOfBounds(index, size);
    }
    return index;
  }
}
