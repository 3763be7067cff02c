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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.checkerframework.dataflow.qual.Pure;
import org.jspecify.annotations.Nullable;

/// A node of a [SinglyLinkedList], holding one Element and a link to the next
/// node.
///
/// @param <T>
///            the type of values held by the list's Elements
final class SinglyLinkedNode<T extends @Nullable Object> {

  final Element<T> content;

  private @Nullable SinglyLinkedNode<T> next;

  @SuppressFBWarnings("EI2")
  SinglyLinkedNode(Element<T> content, @Nullable SinglyLinkedNode<T> next) {
    this.content = content;
    this.next = next;
  }

  @Pure
  @Nullable
  SinglyLinkedNode<T> next() {
    return next;
  }

  /// Points this node at `next`.
  ///
  /// @return the node this one linked to before, if any
  @Nullable
  SinglyLinkedNode<T> linkTo(@Nullable SinglyLinkedNode<T> next) {
    var previous = this.next;
    this.next = next;
    return previous;
  }

  /// Severs this node's forward link.
  ///
  /// @return the node this one linked to, if any
  @Nullable
  SinglyLinkedNode<T> breakLink() {
    return linkTo(null);
  }
}
