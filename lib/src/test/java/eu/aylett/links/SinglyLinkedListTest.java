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
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;

class SinglyLinkedListTest extends ElementListContractTest {
  @Override
  SinglyLinkedList<Integer> newList() {
    return new SinglyLinkedList<>();
  }

  @Test
  void copyIsASinglyLinkedList() {
    assertThat(listOf(1, 2).copy(), instanceOf(SinglyLinkedList.class));
  }

  @Test
  void toStringShowsTheValues() {
    assertThat(listOf(1, 2, 3).toString(), equalTo("SinglyLinkedList[1, 2, 3]"));
    assertThat(newList().toString(), equalTo("SinglyLinkedList[]"));
  }

  @Test
  void popRepeatedlyWalksBackToTheHead() {
    var list = listOf(1, 2, 3, 4, 5);
    for (var expected = 5; expected > 0; expected--) {
      assertThat(list.pop().get(), equalTo(expected));
      list.checkSafety();
    }
    assertThat(list.isEmpty(), is(true));
  }

  @Test
  void linkToReturnsThePreviousLink() {
    var first = new SinglyLinkedNode<>(Element.of(1), null);
    var second = new SinglyLinkedNode<>(Element.of(2), null);
    var third = new SinglyLinkedNode<>(Element.of(3), null);

    assertThat(first.linkTo(second), nullValue());
    assertThat(first.linkTo(third), sameInstance(second));
    assertThat(first.next(), sameInstance(third));
    assertThat(first.breakLink(), sameInstance(third));
    assertThat(first.next(), nullValue());
  }
}
