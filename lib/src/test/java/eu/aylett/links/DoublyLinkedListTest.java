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

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;

class DoublyLinkedListTest extends ElementListContractTest {
  @Override
  DoublyLinkedList<Integer> newList() {
    return new DoublyLinkedList<>();
  }

  @Test
  void copyIsADoublyLinkedList() {
    assertThat(listOf(1, 2).copy(), instanceOf(DoublyLinkedList.class));
  }

  @Test
  void toStringShowsTheValues() {
    assertThat(listOf(1, 2, 3).toString(), equalTo("DoublyLinkedList[1, 2, 3]"));
    assertThat(newList().toString(), equalTo("DoublyLinkedList[]"));
  }

  @Test
  void interleavedInsertsKeepLinksSymmetric() {
    var list = listOf(0, 10);
    for (var i = 1; i < 10; i++) {
      list.insertValueAt(i, i);
      list.checkSafety();
    }
    list.insertValueAt(-1, list.size() - 1);
    list.checkSafety();
    assertThat(values(list), contains(0, 1, 2, 3, 4, 5, 6, 7, 8, 9, -1, 10));
  }

  @Test
  void removingFromBothEndsKeepsLinksSymmetric() {
    var list = listOf(1, 2, 3, 4, 5, 6);
    list.removeAt(3);
    list.checkSafety();
    list.pop();
    list.checkSafety();
    list.shift();
    list.checkSafety();
    list.remove(list.get(1));
    list.checkSafety();
    assertThat(values(list), contains(2, 5));
  }
}
