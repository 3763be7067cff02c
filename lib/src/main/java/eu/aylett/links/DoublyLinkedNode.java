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

/**
 * A node of a {@link DoublyLinkedList}, holding one Element and links to the
 * previous and next nodes.
 * <p>
 * Links are only ever changed in pairs: whenever {@code a.next} is set to or
 * cleared from {@code b}, {@code b.prev} is set to or cleared from {@code a} in
 * the same call. The fields are private so that nothing outside this class can
 * write one side of a link alone.
 * </p>
 *
 * @param <T>
 *          the type of values held by the list's Elements
 */
final class DoublyLinkedNode<T extends @Nullable Object> {

  final Element<T> content;

  private @Nullable DoublyLinkedNode<T> prev;

  private @Nullable DoublyLinkedNode<T> next;

  /** Constructs a node linked to nothing. */
  @SuppressFBWarnings("EI2")
  DoublyLinkedNode(Element<T> content) {
    this.content = content;
  }

  @Pure
  @Nullable
  DoublyLinkedNode<T> prev() {
    return prev;
  }

  @Pure
  @Nullable
  DoublyLinkedNode<T> next() {
    return next;
  }

  /**
   * Breaks the link between this node and the previous one.
   *
   * @return the node that was previous to this one, if any
   */
  @Nullable
  DoublyLinkedNode<T> breakPrev() {
    var previous = this.prev;
    if (previous != null) {
      previous.next = null;
      this.prev = null;
    }
    return previous;
  }

  /**
   * Breaks the link between this node and the next one.
   *
   * @return the node that was next after this one, if any
   */
  @Nullable
  DoublyLinkedNode<T> breakNext() {
    var following = this.next;
    if (following != null) {
      following.prev = null;
      this.next = null;
    }
    return following;
  }

  /**
   * Links {@code first} to {@code second}, so that {@code second} follows
   * {@code first}. Whatever {@code first} was followed by, and whatever
   * {@code second} was preceded by, is detached first.
   *
   * @return the nodes detached from {@code first} and {@code second}
   */
  static <T extends @Nullable Object> Detached<T> linkNodes(DoublyLinkedNode<T> first, DoublyLinkedNode<T> second) {
    var formerNext = first.breakNext();
    var formerPrev = second.breakPrev();

    first.next = second;
    second.prev = first;

    return new Detached<>(formerNext, formerPrev);
  }

  /**
   * The neighbours detached by {@link #linkNodes}.
   *
   * @param formerNext
   *          the node that used to follow {@code first}
   * @param formerPrev
   *          the node that used to precede {@code second}
   */
  record Detached<T extends @Nullable Object>(@Nullable DoublyLinkedNode<T> formerNext,
      @Nullable DoublyLinkedNode<T> formerPrev) {
  }
}
