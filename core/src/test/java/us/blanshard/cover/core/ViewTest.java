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
package us.blanshard.cover.core;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import org.junit.Test;

public class ViewTest {
  Incidence incidence = Incidence.fromString(IncidenceTest.KNUTH);
  View view = incidence.view();

  @Test public void wholeRelation() {
    assertSame(incidence, view.getIncidence());
    assertEquals(IndexSet.all(6), view.getRows());
    assertEquals(IndexSet.all(7), view.getColumns());
    assertEquals(6, view.numRows());
    assertEquals(7, view.numColumns());
  }

  @Test public void count() {
    assertEquals(2, view.count(0));
    assertEquals(3, view.count(3));
    assertEquals(4, view.count(6));
  }

  @Test public void rowsCovering() {
    assertArrayEquals(new int[] {0, 2, 4, 5}, view.rowsCovering(6));
    assertArrayEquals(new int[] {3, 4}, view.rowsCovering(2));
  }

  @Test public void columnOrder_isStable() {
    assertArrayEquals(new int[] {0, 1, 2, 4, 5, 3, 6}, view.columnOrder());
  }

  @Test public void select_keepsOriginalIndices() {
    View next = view.select(1);  // {0, 3}
    assertEquals(IndexSet.of(6, 3, 4, 5), next.getRows());
    assertEquals(IndexSet.of(7, 1, 2, 4, 5, 6), next.getColumns());
    assertArrayEquals(new int[] {4, 1, 2, 5, 6}, next.columnOrder());
    assertArrayEquals(new int[] {3}, next.rowsCovering(4));

    View last = next.select(3);  // {2, 4, 5}
    assertEquals(IndexSet.of(6, 5), last.getRows());
    assertEquals(IndexSet.of(7, 1, 6), last.getColumns());
  }

  @Test public void select_keepsEmptyRows() {
    View v = Incidence.fromString("000\n110\n001").view();
    View next = v.select(1);
    assertEquals(IndexSet.of(3, 0, 2), next.getRows());
    assertEquals(IndexSet.of(3, 2), next.getColumns());
    assertEquals(1, next.count(2));
  }

  @Test public void select_leavesItselfAlone() {
    view.select(0);
    assertEquals(6, view.numRows());
    assertEquals(7, view.numColumns());
  }

  @Test(expected = IllegalArgumentException.class) public void select_deadRow() {
    view.select(1).select(0);
  }

  @Test(expected = IllegalArgumentException.class) public void count_deadColumn() {
    view.select(1).count(0);
  }
}
