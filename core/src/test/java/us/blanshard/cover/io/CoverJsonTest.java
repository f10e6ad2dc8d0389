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
package us.blanshard.cover.io;

import static org.junit.Assert.assertEquals;

import us.blanshard.cover.core.ExactCoverSolver;
import us.blanshard.cover.core.Incidence;
import us.blanshard.cover.core.Problem;

import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import org.junit.Test;

public class CoverJsonTest {

  @Test public void incidence() {
    Incidence incidence = Incidence.fromString("1001\n0110\n0000");
    String json = CoverJson.toJson(incidence);
    assertEquals("{\"columns\":4,\"rows\":[[0,3],[1,2],[]]}", json);
    assertEquals(incidence, CoverJson.toIncidence(json));
  }

  @Test public void incidence_noRows() {
    Incidence incidence = CoverJson.toIncidence("{\"rows\": [], \"columns\": 5, \"comment\": \"x\"}");
    assertEquals(0, incidence.numRows());
    assertEquals(5, incidence.numColumns());
  }

  @Test(expected = JsonParseException.class) public void incidence_missingColumns() {
    CoverJson.toIncidence("{\"rows\": [[0]]}");
  }

  @Test(expected = JsonParseException.class) public void incidence_columnOutOfRange() {
    CoverJson.toIncidence("{\"columns\": 2, \"rows\": [[0, 2]]}");
  }

  @Test(expected = JsonParseException.class) public void incidence_empty() {
    CoverJson.toIncidence("");
  }

  @Test public void problem() {
    Problem problem = Problem.builder()
        .addItem("a").addItem("b").addItem("c")
        .addOption("Y", "b", "c")
        .addOption("X", "a")
        .build();
    String json = CoverJson.toJson(problem);
    assertEquals("{\"items\":[\"a\",\"b\",\"c\"],\"options\":{\"Y\":[\"b\",\"c\"],\"X\":[\"a\"]}}", json);
    Problem read = CoverJson.toProblem(json);
    assertEquals(problem, read);
    assertEquals(ImmutableList.of("X", "Y"), read.solve());
  }

  @Test public void problem_optionsBeforeItems() {
    Problem problem = CoverJson.toProblem("{\"options\":{\"X\":[\"a\"]},\"items\":[\"a\"]}");
    assertEquals(ImmutableList.of("X"), problem.solve());
  }

  @Test(expected = IllegalArgumentException.class) public void problem_unknownItem() {
    CoverJson.toProblem("{\"items\":[\"a\"],\"options\":{\"X\":[\"b\"]}}");
  }

  @Test public void result() {
    ExactCoverSolver.Result result = ExactCoverSolver.search(Incidence.fromString("10\n01\n11"));
    assertEquals("{\"state\":\"SOLVED\",\"rows\":[0,1],\"steps\":2}", CoverJson.toJson(result));
  }

  @Test public void registerAll_otherBuilder() {
    Gson gson = CoverJson.registerAll(new GsonBuilder().setPrettyPrinting()).create();
    Incidence incidence = Incidence.fromString("01");
    assertEquals(incidence, gson.fromJson(gson.toJson(incidence), Incidence.class));
  }
}
