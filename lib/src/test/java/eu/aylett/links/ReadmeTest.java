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

/**
 * This test is lightly mangled and injected into README.md by cog.
 */
public class ReadmeTest {
  @Test
  void test() {
    ElementList<String> list = new DoublyLinkedList<>();
    list.addValue("a");
    list.addValue("c");
    list.insertValueAt("b", 1);
    var b = list.get(1);
    b.set("B");
    assert list.contains(b);
    assert list.toString().equals("DoublyLinkedList[a, B, c]");
    list.remove(b);
    assert list.pop().get().equals("c");
  }
}
