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

import org.checkerframework.dataflow.qual.Pure;
import org.jetbrains.annotations.Contract;

/**
 * Thrown when an operation on an {@link ElementList} cannot be carried out. The
 * list is left exactly as it was before the call.
 */
public class ListOperationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final ListOperationError error;

  public ListOperationException(ListOperationError error, String message) {
    super(message);
    this.error = error;
  }

  @Pure
  public ListOperationError getError() {
    return error;
  }

  @Contract("_, _ -> new")
  public static ListOperationException indexOutOfBounds(int index, int size) {
    return new ListOperationException(ListOperationError.INDEX_OUT_OF_BOUNDS,
        "Index " + index + " out of bounds for size " + size);
  }

  @Contract("_ -> new")
  public static ListOperationException emptyList(String operation) {
    return new ListOperationException(ListOperationError.OPERATION_ON_EMPTY_LIST,
        "Called " + operation + " on an empty list");
  }

  @Contract("_ -> new")
  public static ListOperationException elementNotFound(Element<?> element) {
    return new ListOperationException(ListOperationError.ELEMENT_NOT_FOUND, "Element not in list: " + element);
  }

  @Contract("_ -> new")
  public static ListOperationException unexpected(String message) {
    return new ListOperationException(ListOperationError.UNEXPECTED_ERROR, message);
  }
}
