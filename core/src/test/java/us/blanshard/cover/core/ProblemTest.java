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

import static java.util.Arrays.asList;
import static org.junit.Assert.assertEquals;

import com.google.common.collect.ImmutableList;

import org.junit.Test;

public class ProblemTest {

  static final String SUBSETS =
      "# Knuth's example\n"
      + "1 2 3 4 5 6 7\n"
      + "A: 1 4 7\n"
      + "B: 1 4\n"
      + "C: 4 5 7\n"
      + "D: 3 5 6\n"
      + "E: 2 3 6 7   # trailing comment\n"
      + "\n"
      + "F: 2 7\n";

  @Test public void parse() {
    Problem problem = Problem.parse(SUBSETS);
    assertEquals(ImmutableList.of("1", "2", "3", "4", "5", "6", "7"), problem.getItems());
    assertEquals(ImmutableList.of("A", "B", "C", "D", "E", "F"), problem.getOptionNames());
    assertEquals(ImmutableList.of("2", "3", "6", "7"), problem.getOptions().get("E"));
    assertEquals(Incidence.fromString(IncidenceTest.KNUTH), problem.toIncidence());
  }

  @Test public void solve() {
    assertEquals(ImmutableList.of("B", "D", "F"), Problem.parse(SUBSETS).solve());
  }

  @Test public void solve_noCover() {
    Problem problem = Problem.builder()
        .addItem("x").addItem("y").addItem("z")
        .addOption("xy", "x", "y")
        .build();
    assertEquals(ImmutableList.of(), problem.solve());
  }

  @Test public void optionNames() {
    Problem problem = Problem.parse(SUBSETS);
    assertEquals(ImmutableList.of("F", "A"), problem.optionNames(asList(5, 0)));
  }

  @Test public void toString_roundTrips() {
    Problem problem = Problem.parse(SUBSETS);
    assertEquals(problem, Problem.parse(problem.toString()));
    assertEquals("1 2 3 4 5 6 7\nA: 1 4 7\n", Problem.parse("1 2 3 4 5 6 7\nA: 1 4 7").toString());
  }

  @Test public void toString_roundTripsWithoutItems() {
    Problem problem = Problem.builder().addOption("X").addOption("Y").build();
    Problem read = Problem.parse(problem.toString());
    assertEquals(problem, read);
    assertEquals(ImmutableList.of(), read.getItems());
    assertEquals(ImmutableList.of("X", "Y"), read.getOptionNames());
    assertEquals(0, read.toIncidence().numColumns());
    assertEquals(2, read.toIncidence().numRows());
  }

  @Test public void parse_optionWithoutItems() {
    Problem problem = Problem.parse("a b\nX:\nY: a b\n");
    assertEquals(ImmutableList.of(), problem.getOptions().get("X"));
    assertEquals(ImmutableList.of("Y"), problem.solve());
  }

  @Test(expected = IllegalArgumentException.class) public void unknownItem() {
    Problem.parse("a b\nX: a c\n");
  }

  @Test(expected = IllegalArgumentException.class) public void duplicateItem() {
    Problem.builder().addItem("a").addItem("a");
  }

  @Test(expected = IllegalArgumentException.class) public void duplicateOption() {
    Problem.parse("a b\nX: a\nX: b\n");
  }

  @Test(expected = IllegalArgumentException.class) public void missingColon() {
    Problem.parse("a b\nX a\n");
  }

  @Test(expected = IllegalArgumentException.class) public void itemAfterOption() {
    Problem.builder().addItem("a").addOption("X", "a").addItem("b");
  }

  @Test(expected = IllegalArgumentException.class) public void badOptionName() {
    Problem.builder().addItem("a").addOption("X Y", "a");
  }
}
