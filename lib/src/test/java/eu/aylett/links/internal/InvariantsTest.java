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

import eu.aylett.links.ListOperationError;
import eu.aylett.links.ListOperationException;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

class InvariantsTest {
  @Test
  void checkLinkedPassesThroughPresentLinks() {
    var link = new Object();
    assertThat(Invariants.checkLinked(link), sameInstance(link));
  }

  @Test
  void missingLinkIsAnUnexpectedError() {
    var e = assertThrows(ListOperationException.class, () -> Invariants.checkLinked(null, "no successor"));
    assertThat(e.getError(), equalTo(ListOperationError.UNEXPECTED_ERROR));
    assertThat(e.getMessage(), equalTo("no successor"));
  }

  @Test
  void checkIndexAcceptsIndexesInRange() {
    assertThat(Invariants.checkIndex(0, 1), equalTo(0));
    assertThat(Invariants.checkIndex(4, 5), equalTo(4));
  }

  @Test
  void checkIndexRejectsIndexesOutOfRange() {
    for (var index : new int[] {-1, 5, 6}) {
      var e = assertThrows(ListOperationException.class, () -> Invariants.checkIndex(index, 5));
      assertThat(e.getError(), equalTo(ListOperationError.INDEX_OUT_OF_BOUNDS));
      assertThat(e.getMessage(), equalTo("Index " + index + " out of bounds for size 5"));
    }
    var e = assertThrows(ListOperationException.class, () -> Invariants.checkIndex(0, 0));
    assertThat(e.getError(), equalTo(ListOperationError.INDEX_OUT_OF_BOUNDS));
  }
}
