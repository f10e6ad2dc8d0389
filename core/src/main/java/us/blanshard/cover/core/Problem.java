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

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * An exact cover problem stated with names: a list of items that must each
 * be covered once, and named options that each cover some of the items.
 * Items become the columns of an {@link Incidence} and options its rows, both
 * in the order they were added.
 *
 * <p> The string form has one line listing the items, separated by
 * whitespace, followed by one line per option: its name, a colon, and the
 * items it covers.  A '#' starts a comment.  A problem without items may
 * leave out the items line.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Problem {

  private static final Splitter LINE_SPLITTER = Splitter.on('\n');
  private static final Splitter WORD_SPLITTER =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
  private static final Joiner SPACE_JOINER = Joiner.on(' ');
  private static final CharMatcher RESERVED =
      CharMatcher.whitespace().or(CharMatcher.anyOf(":#"));

  private final ImmutableList<String> items;
  private final ImmutableMap<String, ImmutableList<String>> options;
  private final Incidence incidence;

  private Problem(ImmutableList<String> items, ImmutableMap<String, ImmutableList<String>> options) {
    this.items = items;
    this.options = options;
    Map<String, Integer> columns = Maps.newHashMap();
    for (int i = 0; i < items.size(); ++i)
      columns.put(items.get(i), i);
    Incidence.Builder builder = Incidence.builder(items.size());
    for (List<String> option : options.values()) {
      List<Integer> row = Lists.newArrayList();
      for (String item : option)
        row.add(columns.get(item));
      builder.addRow(row);
    }
    this.incidence = builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Parses a problem from its string form. */
  public static Problem parse(String s) {
    Builder builder = builder();
    boolean sawItems = false;
    int lineNumber = 0;
    for (String line : LINE_SPLITTER.split(s)) {
      ++lineNumber;
      int hash = line.indexOf('#');
      if (hash >= 0) line = line.substring(0, hash);
      line = line.trim();
      if (line.isEmpty()) continue;
      if (!sawItems) {
        sawItems = true;
        // Item names can't contain colons, so this is an option line and
        // the items line was blank.
        if (line.indexOf(':') < 0) {
          for (String item : WORD_SPLITTER.split(line))
            builder.addItem(item);
          continue;
        }
      }
      int colon = line.indexOf(':');
      checkArgument(colon > 0, "line %s: expected 'name: items', got '%s'", lineNumber, line);
      String name = line.substring(0, colon).trim();
      builder.addOption(name, WORD_SPLITTER.splitToList(line.substring(colon + 1)));
    }
    return builder.build();
  }

  @NotThreadSafe
  public static final class Builder {
    private final List<String> items = Lists.newArrayList();
    private final Map<String, ImmutableList<String>> options = Maps.newLinkedHashMap();

    private Builder() {}

    /** Adds an item that options may cover. */
    public Builder addItem(String item) {
      checkArgument(!item.isEmpty() && RESERVED.matchesNoneOf(item), "bad item name '%s'", item);
      checkArgument(!items.contains(item), "duplicate item %s", item);
      checkArgument(options.isEmpty(), "items must be added before options");
      items.add(item);
      return this;
    }

    /** Adds an option covering the given items. */
    public Builder addOption(String name, String... items) {
      return addOption(name, Arrays.asList(items));
    }

    /** Adds an option covering the given items. */
    public Builder addOption(String name, List<String> items) {
      checkArgument(!name.isEmpty() && RESERVED.matchesNoneOf(name), "bad option name '%s'", name);
      checkArgument(!options.containsKey(name), "duplicate option %s", name);
      for (String item : items)
        checkArgument(this.items.contains(item), "option %s: unknown item %s", name, item);
      options.put(name, ImmutableList.copyOf(items));
      return this;
    }

    public Problem build() {
      return new Problem(ImmutableList.copyOf(items), ImmutableMap.copyOf(options));
    }
  }

  /** The items, in column order. */
  public ImmutableList<String> getItems() {
    return items;
  }

  /** The option names, in row order. */
  public ImmutableList<String> getOptionNames() {
    return options.keySet().asList();
  }

  /** The items each option covers, in row order. */
  public ImmutableMap<String, ImmutableList<String>> getOptions() {
    return options;
  }

  /** The relation with items as columns and options as rows. */
  public Incidence toIncidence() {
    return incidence;
  }

  /** Translates row indices of {@link #toIncidence} to option names. */
  public ImmutableList<String> optionNames(List<Integer> rows) {
    ImmutableList<String> names = getOptionNames();
    ImmutableList.Builder<String> answer = ImmutableList.builder();
    for (int row : rows)
      answer.add(names.get(row));
    return answer.build();
  }

  /**
   * Solves the problem, returns the names of the chosen options, or an empty
   * list if there is no exact cover.
   */
  public ImmutableList<String> solve() {
    return optionNames(ExactCoverSolver.solve(incidence));
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Problem)) return false;
    Problem that = (Problem) o;
    return this.items.equals(that.items)
        && this.options.equals(that.options)
        && this.getOptionNames().equals(that.getOptionNames());
  }

  @Override public int hashCode() {
    return 31 * items.hashCode() + options.hashCode();
  }

  /** Returns the string form accepted by {@link #parse}. */
  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    SPACE_JOINER.appendTo(sb, items).append('\n');
    for (Map.Entry<String, ImmutableList<String>> e : options.entrySet()) {
      sb.append(e.getKey()).append(':');
      for (String item : e.getValue())
        sb.append(' ').append(item);
      sb.append('\n');
    }
    return sb.toString();
  }
}
