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
package us.blanshard.cover.tools;

import static java.util.concurrent.TimeUnit.MICROSECONDS;

import us.blanshard.cover.core.ExactCoverSolver;
import us.blanshard.cover.core.Incidence;
import us.blanshard.cover.core.Problem;
import us.blanshard.cover.io.CoverJson;

import com.google.common.base.Ascii;
import com.google.common.base.Joiner;
import com.google.common.base.Stopwatch;
import com.google.common.collect.Lists;
import com.google.common.io.CharStreams;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.logging.Logger;

import javax.annotation.Nullable;

/**
 * Reads an exact cover problem from a file (or standard input), solves it,
 * and prints the rows chosen.
 *
 * @author Luke Blanshard
 */
public class SolveCover {

  private static final Logger logger = Logger.getLogger(SolveCover.class.getName());
  private static final Joiner SPACE_JOINER = Joiner.on(' ');

  static final int EXIT_SOLVED = 0;
  static final int EXIT_ERROR = 1;
  static final int EXIT_NO_COVER = 2;
  static final int EXIT_ABANDONED = 3;

  static final String USAGE =
      "Usage: SolveCover [--format=matrix|problem|json] [--strategy=exhaustive|first]\n"
      + "                  [--max-steps=N] [--one-based] [--json] [--verify] <file | ->";

  /** The input formats understood. */
  enum Format {
    MATRIX, PROBLEM, JSON;

    /** Guesses the format from a file name. */
    static Format forFileName(String fileName) {
      String lower = Ascii.toLowerCase(fileName);
      if (lower.endsWith(".json")) return JSON;
      if (lower.endsWith(".txt")) return PROBLEM;
      return MATRIX;
    }
  }

  /** The settings given on the command line. */
  static class Options {
    @Nullable Format format;
    ExactCoverSolver.Strategy strategy = ExactCoverSolver.Strategy.EXHAUSTIVE;
    int maxSteps = Integer.MAX_VALUE;
    boolean oneBased;
    boolean json;
    boolean verify;
    String input;

    static Options parse(String[] args) {
      Options options = new Options();
      for (String arg : args) {
        if (arg.startsWith("--format=")) {
          options.format = Format.valueOf(Ascii.toUpperCase(value(arg)));
        } else if (arg.startsWith("--strategy=")) {
          String s = Ascii.toLowerCase(value(arg));
          if (s.equals("exhaustive")) options.strategy = ExactCoverSolver.Strategy.EXHAUSTIVE;
          else if (s.equals("first")) options.strategy = ExactCoverSolver.Strategy.FIRST_COLUMN;
          else throw new IllegalArgumentException("unknown strategy " + s);
        } else if (arg.startsWith("--max-steps=")) {
          options.maxSteps = Integer.decode(value(arg));
          if (options.maxSteps < 0) throw new IllegalArgumentException("negative step limit");
        } else if (arg.equals("--one-based")) {
          options.oneBased = true;
        } else if (arg.equals("--json")) {
          options.json = true;
        } else if (arg.equals("--verify")) {
          options.verify = true;
        } else if (arg.startsWith("--")) {
          throw new IllegalArgumentException("unknown option " + arg);
        } else if (options.input == null) {
          options.input = arg;
        } else {
          throw new IllegalArgumentException("more than one input given");
        }
      }
      if (options.input == null) throw new IllegalArgumentException("no input given");
      if (options.format == null) options.format = Format.forFileName(options.input);
      return options;
    }

    private static String value(String arg) {
      return arg.substring(arg.indexOf('=') + 1);
    }
  }

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  /** Does the work of {@link #main}, returns the exit status. */
  static int run(String[] args, PrintStream out, PrintStream err) {
    Options options;
    try {
      options = Options.parse(args);
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      err.println(USAGE);
      return EXIT_ERROR;
    }

    String text;
    try {
      text = read(options.input);
    } catch (IOException e) {
      err.println("Unable to read " + options.input + ": " + e.getMessage());
      return EXIT_ERROR;
    }

    Problem problem = null;
    Incidence incidence;
    try {
      switch (options.format) {
        case PROBLEM:
          problem = Problem.parse(text);
          incidence = problem.toIncidence();
          break;
        case JSON:
          JsonElement root = JsonParser.parseString(text);
          if (root.isJsonObject() && root.getAsJsonObject().has("items")) {
            problem = CoverJson.toProblem(text);
            incidence = problem.toIncidence();
          } else {
            incidence = CoverJson.toIncidence(text);
          }
          break;
        default:
          incidence = Incidence.fromString(text);
          break;
      }
    } catch (IllegalArgumentException | JsonParseException e) {
      err.println("Bad input in " + options.input + ": " + e.getMessage());
      return EXIT_ERROR;
    }

    Stopwatch stopwatch = Stopwatch.createStarted();
    ExactCoverSolver.Result result =
        ExactCoverSolver.search(incidence, options.strategy, options.maxSteps);
    stopwatch.stop();
    logger.info(String.format("Solved %dx%d relation in %d steps, %d micros",
        incidence.numRows(), incidence.numColumns(), result.numSteps,
        stopwatch.elapsed(MICROSECONDS)));

    if (options.verify && result.isSolved() && !incidence.isExactCover(result.solution)) {
      err.println("Verification failed for " + result.solution);
      return EXIT_ERROR;
    }

    if (options.json) {
      out.println(CoverJson.toJson(result));
    } else if (result.isSolved()) {
      out.println(render(result.solution, problem, options.oneBased));
    } else if (result.state == ExactCoverSolver.State.NO_COVER) {
      out.println("No exact cover");
    } else {
      out.println("Gave up after " + result.numSteps + " steps");
    }

    switch (result.state) {
      case SOLVED: return EXIT_SOLVED;
      case NO_COVER: return EXIT_NO_COVER;
      default: return EXIT_ABANDONED;
    }
  }

  /** Renders the chosen rows as option names if there are any, otherwise as indices. */
  static String render(List<Integer> rows, @Nullable Problem problem, boolean oneBased) {
    if (problem != null) return SPACE_JOINER.join(problem.optionNames(rows));
    List<Integer> shown = Lists.newArrayList();
    for (int row : rows)
      shown.add(oneBased ? row + 1 : row);
    return SPACE_JOINER.join(shown);
  }

  private static String read(String input) throws IOException {
    if (input.equals("-")) {
      Reader reader = new InputStreamReader(System.in, StandardCharsets.UTF_8);
      return CharStreams.toString(reader);
    }
    return new String(Files.readAllBytes(Paths.get(input)), StandardCharsets.UTF_8);
  }
}
