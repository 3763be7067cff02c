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

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Iterables;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.dataflow.qual.Pure;
import org.checkerframework.dataflow.qual.SideEffectFree;
import org.jetbrains.annotations.Contract;
import org.jspecify.annotations.Nullable;

import java.util.Iterator;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Verify.verify;
import static eu.aylett.links.internal.Invariants.checkIndex;
import static eu.aylett.links.internal.Invariants.checkLinked;

/**
 * An {@link ElementList} whose nodes link forwards only.
 * <p>
 * Appending and removing at the head are O(1). Anything that needs the
 * predecessor of a node, including removing the tail, walks forward from the
 * head.
 * </p>
 * <p>
 * Not thread-safe.
 * </p>
 *
 * @param <T>
 *          the type of values held by the list's Elements
 */
public final class SinglyLinkedList<T extends @Nullable Object> implements ElementList<T> {

  private @Nullable SinglyLinkedNode<T> head;

  private @Nullable SinglyLinkedNode<T> tail;

  private @NonNegative int size;

  /** Constructs an empty list. */
  public SinglyLinkedList() {
  }

  @Override
  public void add(Element<T> item) {
    checkNotNull(item);
    var node = new SinglyLinkedNode<>(item, null);
    var currentTail = tail;
    if (currentTail == null) {
      head = node;
    } else {
      currentTail.linkTo(node);
    }
    tail = node;
    size++;
  }

  @Override
  public void insertAt(Element<T> item, int index) {
    checkNotNull(item);
    checkIndex(index, size);

    if (index == 0) {
      head = new SinglyLinkedNode<>(item, head);
    } else if (index == size - 1) {
      // Splice in ahead of the tail, which stays the tail.
      var beforeTail = predecessorOfTail();
      beforeTail.linkTo(new SinglyLinkedNode<>(item, checkLinked(beforeTail.next())));
    } else {
      var previous = nodeAt(index - 1);
      previous.linkTo(new SinglyLinkedNode<>(item, checkLinked(previous.next())));
    }
    size++;
  }

  @Override
  public Element<T> get(int index) {
    return nodeAt(index).content;
  }

  @Override
  public void remove(Element<T> item) {
    checkNotNull(item);
    if (size == 0) {
      throw ListOperationException.emptyList("remove");
    }

    var currentHead = checkLinked(head);
    if (currentHead.content == item) {
      shift();
      return;
    }

    // Track the predecessor, as that's the node we'll need to relink.
    var previous = currentHead;
    for (var node = previous.next(); node != null; previous = node, node = node.next()) {
      if (node.content == item) {
        unlinkAfter(previous);
        return;
      }
    }
    throw ListOperationException.elementNotFound(item);
  }

  @Override
  public Element<T> removeAt(int index) {
    checkIndex(index, size);
    if (index == 0) {
      return shift();
    }
    if (index == size - 1) {
      return pop();
    }
    return unlinkAfter(nodeAt(index - 1));
  }

  @Pure
  @Override
  public boolean contains(Element<T> item) {
    for (var node = head; node != null; node = node.next()) {
      if (node.content == item) {
        return true;
      }
    }
    return false;
  }

  @Pure
  @Override
  public @NonNegative int size() {
    return size;
  }

  @Override
  public Element<T> shift() {
    var currentHead = head;
    if (currentHead == null) {
      throw ListOperationException.emptyList("shift");
    }
    var next = currentHead.breakLink();
    head = next;
    if (next == null) {
      tail = null;
    }
    size--;
    return currentHead.content;
  }

  @Override
  public Element<T> pop() {
    if (size == 0) {
      throw ListOperationException.emptyList("pop");
    }
    var currentTail = checkLinked(tail);
    if (size == 1) {
      head = null;
      tail = null;
      size = 0;
      return currentTail.content;
    }

    // No backward link, so re-walk from the head to find the new tail.
    var beforeTail = predecessorOfTail();
    if (beforeTail.next() != currentTail) {
      throw ListOperationException.unexpected("Node at " + (size - 2) + " does not link to the tail");
    }
    beforeTail.breakLink();
    tail = beforeTail;
    size--;
    return currentTail.content;
  }

  @Override
  public Iterator<Element<T>> iterator() {
    return new AbstractIterator<>() {
      private @Nullable SinglyLinkedNode<T> next = head;

      @Override
      protected @Nullable Element<T> computeNext() {
        var current = next;
        if (current == null) {
          return endOfData();
        }
        next = current.next();
        return current.content;
      }
    };
  }

  @Contract(" -> new")
  @Override
  public SinglyLinkedList<T> copy() {
    var copy = new SinglyLinkedList<T>();
    for (var element : this) {
      copy.add(element);
    }
    return copy;
  }

  @Override
  public void checkSafety() {
    if (size == 0) {
      verify(head == null && tail == null, "Empty list has a head or tail: %s", this);
      return;
    }
    verify(head != null && tail != null, "Non-empty list of size %s is missing its head or tail", size);

    var count = 0;
    SinglyLinkedNode<T> last = null;
    for (var node = head; node != null; node = node.next()) {
      count++;
      verify(count <= size, "More than %s nodes reachable from the head", size);
      last = node;
    }
    verify(count == size, "Size mismatch: found %s nodes != expected %s", count, size);
    verify(last == tail, "Last reachable node is not the tail");
  }

  @SideEffectFree
  @Override
  public String toString() {
    return "SinglyLinkedList" + Iterables.toString(Iterables.transform(this, Element::get));
  }

  private SinglyLinkedNode<T> nodeAt(int index) {
    checkIndex(index, size);
    if (index == size - 1) {
      return checkLinked(tail);
    }
    var node = checkLinked(head);
    for (var i = 0; i < index; i++) {
      node = checkLinked(node.next(), "List ended before index " + index);
    }
    return node;
  }

  private SinglyLinkedNode<T> predecessorOfTail() {
    return nodeAt(size - 2);
  }

  /// Unlinks the node following `previous`, which must have a successor.
  private Element<T> unlinkAfter(SinglyLinkedNode<T> previous) {
    var target = checkLinked(previous.next());
    previous.linkTo(target.breakLink());
    if (target == tail) {
      tail = previous;
    }
    size--;
    return target.content;
  }
}
