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
import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.logging.Level.FINE;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Knuth's Algorithm X over a dense {@link Incidence}: finds a set of rows that
 * covers every column exactly once, stopping at the first one found.
 *
 * <p> The search is depth-first.  At each node it orders the live columns by
 * how many live rows cover them, fewest first, and gives up on the node if
 * the first of them has no covering rows.  Otherwise it tries each row
 * covering each column in turn, narrowing the view to the columns the row
 * leaves uncovered and the rows compatible with it.  The recursion is kept on
 * an explicit stack so deep searches don't exhaust the thread's stack.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class ExactCoverSolver {

  private static final Logger logger = Logger.getLogger(ExactCoverSolver.class.getName());

  /**
   * Solves the given relation.  Returns the chosen rows in the order they were
   * chosen, or an empty list if there is no exact cover.  A relation with no
   * columns yields the empty cover, which is also an empty list; use
   * {@link #search} to tell the two apart.
   */
  public static ImmutableList<Integer> solve(Incidence incidence) {
    return search(incidence).solution;
  }

  /**
   * Solves the given relation, returns a summary of the result.
   */
  public static Result search(Incidence incidence) {
    return search(incidence, Strategy.EXHAUSTIVE);
  }

  /**
   * Solves the given relation using the given strategy, returns a summary of
   * the result.
   */
  public static Result search(Incidence incidence, Strategy strategy) {
    return search(incidence, strategy, Integer.MAX_VALUE);
  }

  /**
   * Solves the given relation using the given strategy, abandoning the search
   * after the given number of steps.  Returns a summary of the result.
   */
  public static Result search(Incidence incidence, Strategy strategy, int maxSteps) {
    return new ExactCoverSolver(incidence, strategy, Listener.NONE).result(maxSteps);
  }

  /**
   * Receives the transitions of a search: each row committed to the partial
   * solution, and each row taken back out of it.  The depth is the number of
   * rows already in the partial solution when the row was committed.
   */
  public interface Listener {
    void committed(int row, int depth);
    void backtracked(int row, int depth);

    Listener NONE = new Listener() {
      @Override public void committed(int row, int depth) {}
      @Override public void backtracked(int row, int depth) {}
    };
  }

  /** The possible outcomes of a search. */
  public enum State {
    SOLVED,     // Found an exact cover.
    NO_COVER,   // Searched everything, there is no exact cover.
    ABANDONED;  // Ran out of steps before finishing.
  }

  /**
   * A summary of a solver's work.
   */
  @Immutable
  public final class Result {
    public final State state;
    public final ImmutableList<Integer> solution;  // Empty unless SOLVED
    public final int numSteps;  // Rows committed, including ones backtracked

    private Result(int maxSteps) {
      checkArgument(maxSteps >= 0, "negative step limit %s", maxSteps);
      Search search = new Search();
      search.run(maxSteps);
      if (search.isSolved()) {
        this.state = State.SOLVED;
        this.solution = search.getSolution();
      } else {
        this.state = search.isComplete() ? State.NO_COVER : State.ABANDONED;
        this.solution = ImmutableList.of();
      }
      this.numSteps = search.getStepCount();
      logger.log(FINE, "{0} {1}x{2} relation: {3} after {4} steps",
                 new Object[] {state, incidence.numRows(), incidence.numColumns(), solution, numSteps});
    }

    public boolean isSolved() {
      return state == State.SOLVED;
    }

    /**
     * Tells whether this is the empty cover of a relation without columns, as
     * opposed to a failure to find one.
     */
    public boolean isTrivial() {
      return isSolved() && incidence.numColumns() == 0;
    }

    public Incidence getIncidence() {
      return incidence;
    }

    @Override public String toString() {
      return state + " " + solution + " in " + numSteps + " steps";
    }
  }

  /**
   * This enumeration decides which columns a search node branches on.
   */
  public enum Strategy {
    /** Branches on every live column, least covered first. */
    EXHAUSTIVE {
      @Override int[] branchColumns(int[] columnOrder) {
        return columnOrder;
      }
    },
    /**
     * Branches only on the least covered column.  Every cover contains a row
     * covering that column, so this finds the same first solution as
     * EXHAUSTIVE in fewer steps when a node fails.
     */
    FIRST_COLUMN {
      @Override int[] branchColumns(int[] columnOrder) {
        return Arrays.copyOf(columnOrder, 1);
      }
    };

    /** Selects the columns to branch on from the ordered live columns. */
    abstract int[] branchColumns(int[] columnOrder);
  }

  private final Incidence incidence;
  private final Strategy strategy;
  private final Listener listener;

  public ExactCoverSolver(Incidence incidence, Strategy strategy, Listener listener) {
    this.incidence = checkNotNull(incidence);
    this.strategy = checkNotNull(strategy);
    this.listener = checkNotNull(listener);
  }

  public Result result(int maxSteps) {
    return new Result(maxSteps);
  }

  /**
   * The search proper: a depth-first walk of the search tree that can be run
   * for a set number of steps, instead of indefinitely.  A step is the
   * commitment of one row to the partial solution.
   */
  @NotThreadSafe
  public final class Search {
    private final ArrayDeque<Frame> stack = new ArrayDeque<Frame>();
    private final List<Integer> solution = Lists.newArrayList();
    private boolean solved;
    private int stepCount;

    public Search() {
      View root = incidence.view();
      if (root.numColumns() == 0) {
        solved = true;
      } else {
        pushFrame(root);
      }
    }

    /** Tells whether the search has found an exact cover. */
    public boolean isSolved() {
      return solved;
    }

    /** Tells whether the search has finished, successfully or not. */
    public boolean isComplete() {
      return solved || stack.isEmpty();
    }

    /** Returns the total number of steps taken. */
    public int getStepCount() {
      return stepCount;
    }

    /**
     * Returns the rows chosen so far: the exact cover once solved, a partial
     * solution while running, and empty when there is no cover.
     */
    public ImmutableList<Integer> getSolution() {
      return ImmutableList.copyOf(solution);
    }

    /**
     * Runs the search, but taking not more than the given number of steps.
     * Returns the number of steps taken in this pass.
     */
    public int run(int maxSteps) {
      int count = 0;
      while (!isComplete() && count < maxSteps) {
        Frame frame = stack.peek();
        if (frame.committed >= 0) {
          int last = frame.committed;
          frame.committed = -1;
          solution.remove(solution.size() - 1);
          listener.backtracked(last, solution.size());
        }
        int row = frame.nextRow();
        if (row < 0) {
          stack.pop();
          continue;
        }
        ++count;
        ++stepCount;
        listener.committed(row, solution.size());
        solution.add(row);
        frame.committed = row;
        View next = frame.view.select(row);
        if (next.numColumns() == 0) {
          solved = true;
        } else {
          pushFrame(next);
        }
      }
      return count;
    }

    /** Pushes a frame for the given view, unless it has a column nothing covers. */
    private void pushFrame(View view) {
      int[] order = view.columnOrder();
      if (view.count(order[0]) == 0) return;
      stack.push(new Frame(view, strategy.branchColumns(order)));
    }
  }

  /**
   * One node of the search tree: the view it works on, the columns it
   * branches on, and its position among their covering rows.
   */
  private static final class Frame {
    final View view;
    final int[] columns;
    int columnIndex;
    @Nullable int[] rows;
    int rowIndex;
    int committed = -1;  // The row currently in the solution, or -1

    Frame(View view, int[] columns) {
      this.view = view;
      this.columns = columns;
    }

    /** Returns the next candidate row, or -1 if there are none left. */
    int nextRow() {
      while (rows == null || rowIndex >= rows.length) {
        if (columnIndex >= columns.length) return -1;
        rows = view.rowsCovering(columns[columnIndex++]);
        rowIndex = 0;
      }
      return rows[rowIndex++];
    }
  }
}
