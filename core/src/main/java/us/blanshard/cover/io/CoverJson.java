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

import us.blanshard.cover.core.ExactCoverSolver;
import us.blanshard.cover.core.Incidence;
import us.blanshard.cover.core.Problem;

import com.google.common.collect.Lists;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.List;

/**
 * Static methods that convert relations, problems and solver results to and
 * from json.
 *
 * <p> A relation is written as its column count plus, for each row, the list
 * of columns it contains: <code>{"columns":3,"rows":[[0,1],[2]]}</code>.  A
 * problem is written as its items plus its options in order:
 * <code>{"items":["a","b"],"options":{"X":["a"],"Y":["b"]}}</code>.  Results
 * are written only.
 *
 * @author Luke Blanshard
 */
public class CoverJson {

  /** A convenience for reading/writing relations, problems and results. */
  public static final Gson GSON = registerAll(new GsonBuilder()).create();

  /**
   * Registers type adapters in the given builder so that relations, problems
   * and results can be serialized, and the first two deserialized.
   */
  public static GsonBuilder registerAll(GsonBuilder builder) {
    builder.registerTypeAdapter(Incidence.class, new IncidenceAdapter().nullSafe());
    builder.registerTypeAdapter(Problem.class, new ProblemAdapter().nullSafe());
    builder.registerTypeAdapter(ExactCoverSolver.Result.class, new ResultAdapter().nullSafe());
    return builder;
  }

  public static String toJson(Incidence incidence) {
    return GSON.toJson(incidence, Incidence.class);
  }

  public static String toJson(Problem problem) {
    return GSON.toJson(problem, Problem.class);
  }

  public static String toJson(ExactCoverSolver.Result result) {
    return GSON.toJson(result, ExactCoverSolver.Result.class);
  }

  public static Incidence toIncidence(String json) {
    return checkPresent(GSON.fromJson(json, Incidence.class));
  }

  public static Problem toProblem(String json) {
    return checkPresent(GSON.fromJson(json, Problem.class));
  }

  private static <T> T checkPresent(T value) {
    if (value == null) throw new JsonParseException("empty document");
    return value;
  }

  private static class IncidenceAdapter extends TypeAdapter<Incidence> {
    @Override public void write(JsonWriter out, Incidence value) throws IOException {
      out.beginObject();
      out.name("columns").value(value.numColumns());
      out.name("rows").beginArray();
      for (int r = 0; r < value.numRows(); ++r) {
        out.beginArray();
        for (int c : value.getRow(r).toIntArray())
          out.value(c);
        out.endArray();
      }
      out.endArray();
      out.endObject();
    }

    @Override public Incidence read(JsonReader in) throws IOException {
      int columns = -1;
      List<List<Integer>> rows = Lists.newArrayList();
      in.beginObject();
      while (in.hasNext()) {
        String name = in.nextName();
        if (name.equals("columns")) {
          columns = in.nextInt();
        } else if (name.equals("rows")) {
          in.beginArray();
          while (in.hasNext()) {
            List<Integer> row = Lists.newArrayList();
            in.beginArray();
            while (in.hasNext())
              row.add(in.nextInt());
            in.endArray();
            rows.add(row);
          }
          in.endArray();
        } else {
          in.skipValue();
        }
      }
      in.endObject();
      if (columns < 0) throw new JsonParseException("missing or negative \"columns\"");
      try {
        Incidence.Builder builder = Incidence.builder(columns);
        for (List<Integer> row : rows)
          builder.addRow(row);
        return builder.build();
      } catch (IndexOutOfBoundsException e) {
        throw new JsonParseException("column out of range", e);
      }
    }
  }

  private static class ProblemAdapter extends TypeAdapter<Problem> {
    @Override public void write(JsonWriter out, Problem value) throws IOException {
      out.beginObject();
      out.name("items").beginArray();
      for (String item : value.getItems())
        out.value(item);
      out.endArray();
      out.name("options").beginObject();
      for (String option : value.getOptionNames()) {
        out.name(option).beginArray();
        for (String item : value.getOptions().get(option))
          out.value(item);
        out.endArray();
      }
      out.endObject();
      out.endObject();
    }

    @Override public Problem read(JsonReader in) throws IOException {
      Problem.Builder builder = Problem.builder();
      List<String> items = null;
      List<String> names = Lists.newArrayList();
      List<List<String>> options = Lists.newArrayList();
      in.beginObject();
      while (in.hasNext()) {
        String name = in.nextName();
        if (name.equals("items")) {
          items = readStrings(in);
        } else if (name.equals("options")) {
          in.beginObject();
          while (in.hasNext()) {
            names.add(in.nextName());
            options.add(readStrings(in));
          }
          in.endObject();
        } else {
          in.skipValue();
        }
      }
      in.endObject();
      if (items == null) throw new JsonParseException("missing \"items\"");
      // Items must all be known before options can be checked against them.
      for (String item : items)
        builder.addItem(item);
      for (int i = 0; i < names.size(); ++i)
        builder.addOption(names.get(i), options.get(i));
      return builder.build();
    }

    private static List<String> readStrings(JsonReader in) throws IOException {
      List<String> answer = Lists.newArrayList();
      in.beginArray();
      while (in.hasNext())
        answer.add(in.nextString());
      in.endArray();
      return answer;
    }
  }

  private static class ResultAdapter extends TypeAdapter<ExactCoverSolver.Result> {
    @Override public void write(JsonWriter out, ExactCoverSolver.Result value) throws IOException {
      out.beginObject();
      out.name("state").value(value.state.name());
      out.name("rows").beginArray();
      for (int row : value.solution)
        out.value(row);
      out.endArray();
      out.name("steps").value(value.numSteps);
      out.endObject();
    }

    @Override public ExactCoverSolver.Result read(JsonReader in) throws IOException {
      throw new UnsupportedOperationException("results are written only");
    }
  }
}
