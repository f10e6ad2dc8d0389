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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.primitives.Ints;

import java.util.Arrays;
import java.util.Comparator;

import javax.annotation.concurrent.Immutable;

/**
 * A selection of the live rows and live columns of an {@link Incidence}.
 * Indices are always those of the underlying relation: narrowing a view never
 * renumbers anything.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class View {

  private final Incidence incidence;
  private final IndexSet rows;
  private final IndexSet columns;

  View(Incidence incidence, IndexSet rows, IndexSet columns) {
    this.incidence = incidence;
    this.rows = rows;
    this.columns = columns;
  }

  public Incidence getIncidence() {
    return incidence;
  }

  /** Returns the live rows, as indices into the underlying relation. */
  public IndexSet getRows() {
    return rows.clone();
  }

  /** Returns the live columns, as indices into the underlying relation. */
  public IndexSet getColumns() {
    return columns.clone();
  }

  public int numRows() {
    return rows.size();
  }

  public int numColumns() {
    return columns.size();
  }

  /** Returns the number of live rows that contain the given live column. */
  public int count(int column) {
    checkArgument(columns.contains(column), "column %s is not live", column);
    return incidence.columnBits(column).countCommon(rows);
  }

  /** Returns the live rows containing the given live column, in ascending order. */
  public int[] rowsCovering(int column) {
    checkArgument(columns.contains(column), "column %s is not live", column);
    return IndexSet.intersect(incidence.columnBits(column), rows).toIntArray();
  }

  /**
   * Returns the live columns ordered by the number of live rows covering
   * them, fewest first.  Ties keep ascending column order.
   */
  public int[] columnOrder() {
    int[] live = columns.toIntArray();
    final int[] counts = new int[incidence.numColumns()];
    for (int c : live)
      counts[c] = count(c);
    Integer[] boxed = Ints.asList(live).toArray(new Integer[live.length]);
    // Arrays.sort on objects is stable.
    Arrays.sort(boxed, new Comparator<Integer>() {
      @Override public int compare(Integer c1, Integer c2) {
        return Ints.compare(counts[c1], counts[c2]);
      }
    });
    return Ints.toArray(Arrays.asList(boxed));
  }

  /**
   * Returns the view that remains after choosing the given live row: the
   * columns it covers are gone, and so is every row that covers any of them.
   */
  public View select(int row) {
    checkArgument(rows.contains(row), "row %s is not live", row);
    IndexSet covered = incidence.rowBits(row).and(columns);
    IndexSet remaining = new IndexSet(rows.capacity());
    for (int r : rows.toIntArray())
      if (!incidence.rowBits(r).intersects(covered))
        remaining.add(r);
    return new View(incidence, remaining, columns.minus(covered));
  }

  @Override public String toString() {
    return "View" + rows + "x" + columns;
  }
}
