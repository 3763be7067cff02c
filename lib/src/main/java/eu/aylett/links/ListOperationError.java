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

/// The ways an operation on an [ElementList] can fail.
public enum ListOperationError {
  /// The index was negative, or not less than the size of the list.
  INDEX_OUT_OF_BOUNDS,

  /// The operation needs at least one element, but the list was empty.
  OPERATION_ON_EMPTY_LIST,

  /// The element passed in is not held by the list.
  ELEMENT_NOT_FOUND,

  /// A structural invariant of the list did not hold. This is a bug in the list
  /// implementation, not in the caller.
  UNEXPECTED_ERROR,
}
