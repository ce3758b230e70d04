/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.crossword.core;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;

import org.junit.Test;

public class VariableTest {

  @Test public void equality() {
    Variable v = Variable.across(2, 3, 4);
    assertEquals(Variable.of(2, 3, Direction.ACROSS, 4), v);
    assertEquals(Variable.of(2, 3, Direction.ACROSS, 4).hashCode(), v.hashCode());
    assertEquals(false, v.equals(Variable.down(2, 3, 4)));
    assertEquals(false, v.equals(Variable.across(2, 3, 5)));
    assertEquals(false, v.equals(Variable.across(1, 3, 4)));
    assertEquals(false, v.equals(Variable.across(2, 2, 4)));
  }

  @Test public void cells() {
    assertEquals(ImmutableList.of(Cell.of(1, 2), Cell.of(1, 3), Cell.of(1, 4)),
                 Variable.across(1, 2, 3).cells());
    assertEquals(ImmutableList.of(Cell.of(1, 2), Cell.of(2, 2)),
                 Variable.down(1, 2, 2).cells());
    assertEquals(Cell.of(4, 2), Variable.down(1, 2, 4).end());
    assertEquals(Cell.of(2, 2), Variable.down(1, 2, 4).cell(1));
  }

  @Test public void ordering() {
    ImmutableList<Variable> sorted = ImmutableList.of(
        Variable.across(0, 1, 3),
        Variable.down(0, 1, 2),
        Variable.down(0, 1, 5),
        Variable.across(0, 2, 2),
        Variable.across(1, 0, 2));
    assertEquals(sorted, Ordering.natural().sortedCopy(sorted.reverse()));
  }

  @Test public void nonPositiveLength() {
    try {
      Variable.across(0, 0, 0);
      fail();
    } catch (IllegalArgumentException expected) {}
    try {
      Variable.down(0, 0, -2);
      fail();
    } catch (IllegalArgumentException expected) {}
  }

  @Test public void negativeStart() {
    try {
      Variable.across(-1, 0, 3);
      fail();
    } catch (IllegalArgumentException expected) {}
  }
}
