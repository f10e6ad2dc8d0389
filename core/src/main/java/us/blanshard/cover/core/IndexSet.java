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

import java.util.AbstractSet;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.NoSuchElementException;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * A mutable set of non-negative indices below a fixed capacity, stored as a
 * bit set.  Iteration is in ascending order.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class IndexSet extends AbstractSet<Integer> implements Cloneable {

  private final int capacity;
  private long[] words;
  private int size;  // redundant

  public IndexSet(int capacity) {
    checkArgument(capacity >= 0, "negative capacity %s", capacity);
    this.capacity = capacity;
    this.words = new long[(capacity + 63) >>> 6];
  }

  public IndexSet(int capacity, Collection<Integer> indices) {
    this(capacity);
    addAll(indices);
  }

  /** Returns the set of indices given. */
  public static IndexSet of(int capacity, int... indices) {
    IndexSet answer = new IndexSet(capacity);
    for (int index : indices)
      answer.add(index);
    return answer;
  }

  /** Returns the set containing every index below the given capacity. */
  public static IndexSet all(int capacity) {
    IndexSet answer = new IndexSet(capacity);
    Arrays.fill(answer.words, -1L);
    int extra = capacity & 63;
    if (extra != 0) answer.words[answer.words.length - 1] = (1L << extra) - 1;
    answer.size = capacity;
    return answer;
  }

  public static IndexSet union(IndexSet s1, IndexSet s2) {
    IndexSet answer = s1.clone();
    answer.addAll(s2);
    return answer;
  }

  public static IndexSet intersect(IndexSet s1, IndexSet s2) {
    IndexSet answer = s1.clone();
    answer.retainAll(s2);
    return answer;
  }

  public static IndexSet subtract(IndexSet s1, IndexSet s2) {
    IndexSet answer = s1.clone();
    answer.removeAll(s2);
    return answer;
  }

  public IndexSet and(IndexSet that) {
    return intersect(this, that);
  }

  public IndexSet minus(IndexSet that) {
    return subtract(this, that);
  }

  /** The exclusive upper bound on the indices this set can hold. */
  public int capacity() {
    return capacity;
  }

  @Override public IndexSet clone() {
    try {
      IndexSet answer = (IndexSet) super.clone();
      answer.words = words.clone();
      return answer;
    } catch (CloneNotSupportedException e) {
      throw new AssertionError(e);
    }
  }

  public boolean contains(int index) {
    if (index < 0 || index >= capacity) return false;
    return (words[index >>> 6] & (1L << index)) != 0;
  }

  @Override public boolean contains(Object o) {
    if (o instanceof Integer) {
      return contains(((Integer) o).intValue());
    }
    return false;
  }

  /** Tells whether this set and the given one have any index in common. */
  public boolean intersects(IndexSet that) {
    int n = Math.min(this.words.length, that.words.length);
    for (int i = 0; i < n; ++i)
      if ((this.words[i] & that.words[i]) != 0)
        return true;
    return false;
  }

  /** Returns the number of indices this set and the given one have in common. */
  public int countCommon(IndexSet that) {
    int n = Math.min(this.words.length, that.words.length);
    int count = 0;
    for (int i = 0; i < n; ++i)
      count += Long.bitCount(this.words[i] & that.words[i]);
    return count;
  }

  /** Returns the indices in ascending order. */
  public int[] toIntArray() {
    int[] answer = new int[size];
    int i = 0;
    for (Iter it = new Iter(); it.hasNext(); )
      answer[i++] = it.nextIndex();
    return answer;
  }

  @Override public Iterator<Integer> iterator() {
    return new Iter();
  }

  @Override public int size() {
    return size;
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (o instanceof IndexSet) {
      IndexSet that = (IndexSet) o;
      return this.size == that.size && this.countCommon(that) == size;
    }
    return super.equals(o);
  }

  @Override public int hashCode() {
    // Must match Set's contract.
    return super.hashCode();
  }

  public boolean add(int index) {
    checkElementIndex(index, capacity);
    long bit = 1L << index;  // << only uses bottom 6 bits
    int w = index >>> 6;
    boolean answer = (words[w] & bit) == 0;
    if (answer) {
      words[w] |= bit;
      ++size;
    }
    return answer;
  }

  @Override public boolean add(Integer index) {
    return add(index.intValue());
  }

  public boolean remove(int index) {
    if (!contains(index)) return false;
    words[index >>> 6] &= ~(1L << index);
    --size;
    return true;
  }

  @Override public boolean remove(Object o) {
    if (o instanceof Integer) return remove(((Integer) o).intValue());
    return false;
  }

  @Override public boolean containsAll(Collection<?> c) {
    if (!(c instanceof IndexSet)) return super.containsAll(c);
    IndexSet that = (IndexSet) c;
    return countCommon(that) == that.size;
  }

  @Override public boolean addAll(Collection<? extends Integer> c) {
    if (!(c instanceof IndexSet)) return super.addAll(c);
    IndexSet that = (IndexSet) c;
    checkArgument(that.last() < capacity, "index %s out of range", that.last());
    int n = Math.min(this.words.length, that.words.length);
    for (int i = 0; i < n; ++i)
      this.words[i] |= that.words[i];
    return fixSize();
  }

  @Override public boolean removeAll(Collection<?> c) {
    if (!(c instanceof IndexSet)) return super.removeAll(c);
    IndexSet that = (IndexSet) c;
    int n = Math.min(this.words.length, that.words.length);
    for (int i = 0; i < n; ++i)
      this.words[i] &= ~that.words[i];
    return fixSize();
  }

  @Override public boolean retainAll(Collection<?> c) {
    if (!(c instanceof IndexSet)) return super.retainAll(c);
    IndexSet that = (IndexSet) c;
    for (int i = 0; i < words.length; ++i)
      this.words[i] &= i < that.words.length ? that.words[i] : 0;
    return fixSize();
  }

  @Override public void clear() {
    Arrays.fill(words, 0);
    size = 0;
  }

  /** Returns the smallest index in the set, or -1 if it's empty. */
  public int first() {
    for (int i = 0; i < words.length; ++i)
      if (words[i] != 0)
        return (i << 6) + Long.numberOfTrailingZeros(words[i]);
    return -1;
  }

  /** Returns the largest index in the set, or -1 if it's empty. */
  public int last() {
    for (int i = words.length; i-- > 0; )
      if (words[i] != 0)
        return (i << 6) + 63 - Long.numberOfLeadingZeros(words[i]);
    return -1;
  }

  private boolean fixSize() {
    int size = 0;
    for (long word : words)
      size += Long.bitCount(word);
    boolean answer = size != this.size;
    if (answer) this.size = size;
    return answer;
  }

  private class Iter implements Iterator<Integer> {
    private int wordIndex;
    private long remaining;
    private int last = -1;

    Iter() {
      remaining = words.length == 0 ? 0 : words[0];
    }

    @Override public boolean hasNext() {
      while (remaining == 0 && wordIndex + 1 < words.length) {
        remaining = words[++wordIndex];
      }
      return remaining != 0;
    }

    int nextIndex() {
      if (!hasNext()) throw new NoSuchElementException();
      long nextBit = remaining & -remaining;
      remaining -= nextBit;
      return last = (wordIndex << 6) + Long.numberOfTrailingZeros(nextBit);
    }

    @Override public Integer next() {
      return nextIndex();
    }

    @Override public void remove() {
      if (last < 0) throw new IllegalStateException();
      IndexSet.this.remove(last);
      last = -1;
    }
  }
}
