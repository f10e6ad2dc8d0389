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
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.Lists;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * An immutable boolean incidence relation between rows (candidate subsets)
 * and columns (universe elements): {@code get(r, c)} is true when subset
 * {@code r} contains element {@code c}.  Indices are 0-based.  The nested
 * Builder class assembles a relation one row at a time.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Incidence {

  private static final Splitter LINE_SPLITTER = Splitter.on('\n').trimResults().omitEmptyStrings();

  private final int numColumns;
  private final IndexSet[] rows;     // Each has capacity numColumns
  private final IndexSet[] columns;  // Each has capacity rows.length

  private Incidence(int numColumns, IndexSet[] rows) {
    this.numColumns = numColumns;
    this.rows = rows;
    this.columns = new IndexSet[numColumns];
    for (int c = 0; c < numColumns; ++c)
      columns[c] = new IndexSet(rows.length);
    for (int r = 0; r < rows.length; ++r)
      for (int c : rows[r].toIntArray())
        columns[c].add(r);
  }

  /** Returns a new Builder for relations with the given number of columns. */
  public static Builder builder(int numColumns) {
    return new Builder(numColumns);
  }

  /**
   * Returns the relation expressed by the given rectangular matrix.  A matrix
   * with no rows has no columns either; use {@link #of(int, boolean[][])} to
   * express a relation with columns but no rows.
   */
  public static Incidence of(boolean[][] matrix) {
    return of(matrix.length == 0 ? 0 : matrix[0].length, matrix);
  }

  /** Returns the relation expressed by the given matrix, whose rows must all have the given length. */
  public static Incidence of(int numColumns, boolean[][] matrix) {
    Builder builder = builder(numColumns);
    for (boolean[] row : matrix)
      builder.addFlags(row);
    return builder.build();
  }

  /**
   * Parses a relation from its string form: one row per non-blank line, each
   * row a sequence of '0' and '1' characters.  Whitespace within a line is
   * ignored.
   */
  public static Incidence fromString(String s) {
    List<boolean[]> rows = Lists.newArrayList();
    for (String line : LINE_SPLITTER.split(s)) {
      String bits = CharMatcher.whitespace().removeFrom(line);
      boolean[] row = new boolean[bits.length()];
      for (int c = 0; c < row.length; ++c) {
        char ch = bits.charAt(c);
        checkArgument(ch == '0' || ch == '1', "bad character '%s' in row %s", ch, rows.size());
        row[c] = ch == '1';
      }
      rows.add(row);
    }
    return of(rows.toArray(new boolean[rows.size()][]));
  }

  public static final class Builder {
    private final int numColumns;
    private final List<IndexSet> rows = Lists.newArrayList();

    private Builder(int numColumns) {
      checkArgument(numColumns >= 0, "negative column count %s", numColumns);
      this.numColumns = numColumns;
    }

    /** Adds a row containing the given columns. */
    public Builder addRow(int... columns) {
      IndexSet row = new IndexSet(numColumns);
      for (int c : columns)
        row.add(c);
      rows.add(row);
      return this;
    }

    /** Adds a row containing the given columns. */
    public Builder addRow(Collection<Integer> columns) {
      rows.add(new IndexSet(numColumns, columns));
      return this;
    }

    /** Adds a row whose membership flags are given, one per column. */
    public Builder addFlags(boolean... flags) {
      checkArgument(flags.length == numColumns,
                    "row %s has %s columns, expected %s", rows.size(), flags.length, numColumns);
      IndexSet row = new IndexSet(numColumns);
      for (int c = 0; c < flags.length; ++c)
        if (flags[c]) row.add(c);
      rows.add(row);
      return this;
    }

    /** Returns the number of rows added so far. */
    public int numRows() {
      return rows.size();
    }

    /** Returns an immutable snapshot of the relation built so far. */
    public Incidence build() {
      IndexSet[] array = new IndexSet[rows.size()];
      for (int r = 0; r < array.length; ++r)
        array[r] = rows.get(r).clone();
      return new Incidence(numColumns, array);
    }
  }

  public int numRows() {
    return rows.length;
  }

  public int numColumns() {
    return numColumns;
  }

  public boolean get(int row, int column) {
    checkElementIndex(row, rows.length, "row");
    checkElementIndex(column, numColumns, "column");
    return rows[row].contains(column);
  }

  /** Returns the columns the given row contains. */
  public IndexSet getRow(int row) {
    checkElementIndex(row, rows.length, "row");
    return rows[row].clone();
  }

  /** Returns the rows containing the given column. */
  public IndexSet getColumn(int column) {
    checkElementIndex(column, numColumns, "column");
    return columns[column].clone();
  }

  /** Returns a view of the whole relation. */
  public View view() {
    return new View(this, IndexSet.all(rows.length), IndexSet.all(numColumns));
  }

  /**
   * Tells whether the given rows form an exact cover: every column is
   * contained in precisely one of them.  Duplicate rows never form one.
   */
  public boolean isExactCover(Collection<Integer> selection) {
    IndexSet covered = new IndexSet(numColumns);
    IndexSet seen = new IndexSet(rows.length);
    for (Integer row : selection) {
      checkNotNull(row);
      checkElementIndex(row, rows.length, "row");
      if (!seen.add(row) || covered.intersects(rows[row]))
        return false;
      covered.addAll(rows[row]);
    }
    return covered.size() == numColumns;
  }

  // Shared with View; not to be modified.
  IndexSet rowBits(int row) {
    return rows[row];
  }

  IndexSet columnBits(int column) {
    return columns[column];
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Incidence)) return false;
    Incidence that = (Incidence) o;
    return this.numColumns == that.numColumns && Arrays.equals(this.rows, that.rows);
  }

  @Override public int hashCode() {
    return 31 * numColumns + Arrays.hashCode(rows);
  }

  /** Returns the string form accepted by {@link #fromString}. */
  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    for (IndexSet row : rows) {
      for (int c = 0; c < numColumns; ++c)
        sb.append(row.contains(c) ? '1' : '0');
      sb.append('\n');
    }
    return sb.toString();
  }
}
