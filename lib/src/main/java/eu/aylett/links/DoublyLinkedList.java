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
import static eu.aylett.links.DoublyLinkedNode.linkNodes;
import static eu.aylett.links.internal.Invariants.checkIndex;
import static eu.aylett.links.internal.Invariants.checkLinked;

/**
 * An {@link ElementList} whose nodes link both forwards and backwards.
 * <p>
 * Every structural change goes through {@link DoublyLinkedNode#linkNodes},
 * {@link DoublyLinkedNode#breakPrev} and {@link DoublyLinkedNode#breakNext},
 * which keep each forward link and its backward mirror in step. Once a node is
 * found its neighbours are O(1) away, so removing the tail never walks the
 * list.
 * </p>
 * <p>
 * Not thread-safe.
 * </p>
 *
 * @param <T>
 *          the type of values held by the list's Elements
 */
public final class DoublyLinkedList<T extends @Nullable Object> implements ElementList<T> {

  private @Nullable DoublyLinkedNode<T> head;

  private @Nullable DoublyLinkedNode<T> tail;

  private @NonNegative int size;

  /** Constructs an empty list. */
  public DoublyLinkedList() {
  }

  @Override
  public void add(Element<T> item) {
    checkNotNull(item);
    var node = new DoublyLinkedNode<>(item);
    var currentTail = tail;
    if (currentTail == null) {
      head = node;
    } else {
      linkNodes(currentTail, node);
    }
    tail = node;
    size++;
  }

  @Override
  public void insertAt(Element<T> item, int index) {
    checkNotNull(item);
    checkIndex(index, size);

    var node = new DoublyLinkedNode<>(item);
    if (index == 0) {
      linkNodes(node, checkLinked(head));
      head = node;
    } else {
      var following = index == size - 1 ? checkLinked(tail) : nodeAt(index);
      var previous = checkLinked(following.prev(), "Node at " + index + " has no predecessor");
      // Detaches following from previous, then closes the gap through the new node.
      linkNodes(previous, node);
      linkNodes(node, following);
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

    var node = head;
    while (node != null && node.content != item) {
      node = node.next();
    }
    if (node == null) {
      throw ListOperationException.elementNotFound(item);
    }

    if (node == head) {
      shift();
    } else if (node == tail) {
      pop();
    } else {
      unlinkInterior(node);
    }
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
    return unlinkInterior(nodeAt(index));
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
    var next = currentHead.breakNext();
    head = next;
    if (next == null) {
      tail = null;
    }
    size--;
    return currentHead.content;
  }

  @Override
  public Element<T> pop() {
    var currentTail = tail;
    if (currentTail == null) {
      throw ListOperationException.emptyList("pop");
    }
    var previous = currentTail.breakPrev();
    tail = previous;
    if (previous == null) {
      head = null;
    }
    size--;
    return currentTail.content;
  }

  @Override
  public Iterator<Element<T>> iterator() {
    return new AbstractIterator<>() {
      private @Nullable DoublyLinkedNode<T> next = head;

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
  public DoublyLinkedList<T> copy() {
    var copy = new DoublyLinkedList<T>();
    for (var element : this) {
      copy.add(element);
    }
    return copy;
  }

  @Override
  public void checkSafety() {
    var currentHead = head;
    var currentTail = tail;
    if (size == 0) {
      verify(currentHead == null && currentTail == null, "Empty list has a head or tail: %s", this);
      return;
    }
    verify(currentHead != null && currentTail != null, "Non-empty list of size %s is missing its head or tail", size);
    verify(currentHead.prev() == null, "Head has a predecessor");
    verify(currentTail.next() == null, "Tail has a successor");

    var count = 0;
    DoublyLinkedNode<T> last = null;
    for (var node = currentHead; node != null; node = node.next()) {
      count++;
      verify(count <= size, "More than %s nodes reachable from the head", size);
      var next = node.next();
      verify(next == null || next.prev() == node, "Asymmetric link after node %s: %s", count - 1, node.content);
      last = node;
    }
    verify(count == size, "Size mismatch: found %s nodes != expected %s", count, size);
    verify(last == currentTail, "Last reachable node is not the tail");
  }

  @SideEffectFree
  @Override
  public String toString() {
    return "DoublyLinkedList" + Iterables.toString(Iterables.transform(this, Element::get));
  }

  private DoublyLinkedNode<T> nodeAt(int index) {
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

  /// Unlinks a node that has both a predecessor and a successor.
  private Element<T> unlinkInterior(DoublyLinkedNode<T> node) {
    var previous = checkLinked(node.prev(), "Interior node has no predecessor");
    var following = checkLinked(node.next(), "Interior node has no successor");
    var detached = linkNodes(previous, following);
    if (detached.formerNext() != node || detached.formerPrev() != node) {
      throw ListOperationException.unexpected("Neighbours of " + node.content + " did not link back to it");
    }
    size--;
    return node.content;
  }
}
