/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package storm.ranker;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.ListIterator;
import java.util.NoSuchElementException;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A bounded, ordered collection that retains only the best {@link #capacity()} elements it has been offered.
 * <p/>
 * Elements are kept sorted by a comparator fixed at creation time: the {@link #top()} element is the one that
 * compares lowest, the {@link #bottom()} element the one that compares highest. Inserting into a full ranker evicts
 * the bottom element, which may be the element just inserted. Ties between elements that compare equal are broken
 * by the configured {@link SameValueBehavior} at the moment of insertion.
 * <p/>
 * The ranker owns its elements. Whenever an element leaves it, be it through eviction, removal or {@link #clear()},
 * the element is first unlinked and then handed to the configured {@link DisposalPolicy} exactly once. Closing the
 * ranker clears it.
 * <p/>
 * Instances are not thread-safe. Concurrent access must be guarded by a single external lock around every read and
 * write.
 *
 * <pre>
 *   Ranker&lt;Integer&gt; lowest = Ranker.create(3);
 *
 *   Ranker&lt;Rankable&gt; mostFrequent = Ranker.orderedBy(Rankables.byCountDescending())
 *       .capacity(10)
 *       .sameValueBehavior(SameValueBehavior.INSERT_BEFORE_EQUAL)
 *       .create();
 * </pre>
 *
 * @param <T> The type of the ranked elements.
 */
public final class Ranker<T> implements Iterable<T>, Closeable {

  private static final Logger LOG = LoggerFactory.getLogger(Ranker.class);

  public static final int DEFAULT_CAPACITY = 10;

  private final LinkedList<T> rankedItems = Lists.newLinkedList();
  private final int capacity;
  private final Comparator<? super T> comparator;
  private final SameValueBehavior sameValueBehavior;
  private final DisposalPolicy<? super T> disposalPolicy;

  private Ranker(int capacity, Comparator<? super T> comparator, SameValueBehavior sameValueBehavior,
      DisposalPolicy<? super T> disposalPolicy) {
    this.capacity = capacity;
    this.comparator = comparator;
    this.sameValueBehavior = sameValueBehavior;
    this.disposalPolicy = disposalPolicy;
  }

  /**
   * Creates a ranker over naturally ordered elements that keeps the {@code capacity} lowest of them, breaking ties
   * with {@link SameValueBehavior#INSERT_AFTER_EQUAL} and not disposing anything.
   */
  public static <T extends Comparable<? super T>> Ranker<T> create(int capacity) {
    return Ranker.<T>orderedBy(Ordering.<T>natural()).capacity(capacity).create();
  }

  /**
   * @return a builder for rankers over naturally ordered elements
   */
  @SuppressWarnings("rawtypes")
  public static Builder<Comparable> naturalOrder() {
    return new Builder<Comparable>(Ordering.natural());
  }

  /**
   * @return a builder for rankers whose top element is the lowest according to {@code comparator}
   */
  public static <B> Builder<B> orderedBy(Comparator<B> comparator) {
    return new Builder<B>(comparator);
  }

  /**
   * Inserts an element at its rank, evicting the bottom element if the ranker overflows.
   *
   * @return true if the element is still held afterwards, false if it was evicted right away because the ranker was
   * full and the element did not rank above the previous bottom
   */
  public boolean insert(T element) {
    checkNotNull(element, "element");
    ListIterator<T> cursor = rankedItems.listIterator();
    while (cursor.hasNext()) {
      if (belongsBefore(element, cursor.next())) {
        cursor.previous();
        break;
      }
    }
    cursor.add(element);
    boolean insertedAsBottom = !cursor.hasNext();

    if (rankedItems.size() > capacity) {
      T evicted = rankedItems.removeLast();
      LOG.debug("Evicting {} to stay within capacity {}", evicted, capacity);
      disposalPolicy.dispose(evicted);
      return !insertedAsBottom;
    }
    return true;
  }

  /**
   * Inserts the given elements one after the other.
   *
   * @return the number of insertions that returned true
   */
  public int insertAll(Iterable<? extends T> elements) {
    checkNotNull(elements, "elements");
    int retained = 0;
    for (T element : elements) {
      if (insert(element)) {
        retained++;
      }
    }
    return retained;
  }

  private boolean belongsBefore(T element, T ranked) {
    int delta = comparator.compare(element, ranked);
    if (sameValueBehavior == SameValueBehavior.INSERT_BEFORE_EQUAL) {
      return delta <= 0;
    }
    return delta < 0;
  }

  /**
   * Removes and disposes the highest ranked element equal to {@code element}.
   *
   * @return false if there was no such element, in which case nothing changed
   */
  public boolean removeFirst(T element) {
    checkNotNull(element, "element");
    Iterator<T> it = rankedItems.iterator();
    while (it.hasNext()) {
      T ranked = it.next();
      if (element.equals(ranked)) {
        it.remove();
        disposalPolicy.dispose(ranked);
        return true;
      }
    }
    return false;
  }

  /**
   * Removes and disposes every element equal to {@code element}. The remaining elements keep their order.
   *
   * @return the number of removed elements
   */
  public int removeAll(T element) {
    checkNotNull(element, "element");
    List<T> removed = Lists.newArrayList();
    Iterator<T> it = rankedItems.iterator();
    while (it.hasNext()) {
      T ranked = it.next();
      if (element.equals(ranked)) {
        it.remove();
        removed.add(ranked);
      }
    }
    disposeAll(removed);
    return removed.size();
  }

  /**
   * Like {@link #removeFirst(Object)} but matches by reference, for elements that are handles to owned resources
   * where two equal handles may still own different resources.
   */
  public boolean removeFirstInstance(T instance) {
    checkNotNull(instance, "instance");
    Iterator<T> it = rankedItems.iterator();
    while (it.hasNext()) {
      if (it.next() == instance) {
        it.remove();
        disposalPolicy.dispose(instance);
        return true;
      }
    }
    return false;
  }

  /**
   * Like {@link #removeAll(Object)} but matches by reference. Each removed reference is disposed once.
   */
  public int removeAllInstances(T instance) {
    checkNotNull(instance, "instance");
    List<T> removed = Lists.newArrayList();
    Iterator<T> it = rankedItems.iterator();
    while (it.hasNext()) {
      T ranked = it.next();
      if (ranked == instance) {
        it.remove();
        removed.add(ranked);
      }
    }
    disposeAll(removed);
    return removed.size();
  }

  /**
   * Empties the ranker and disposes every element it held, in rank order. A failing disposal does not stop the
   * remaining ones; the first failure is rethrown at the end with any later ones attached as suppressed.
   */
  public void clear() {
    if (rankedItems.isEmpty()) {
      return;
    }
    List<T> departed = ImmutableList.copyOf(rankedItems);
    rankedItems.clear();
    LOG.debug("Cleared {} ranked elements", departed.size());
    disposeAll(departed);
  }

  /**
   * Same as {@link #clear()}.
   */
  @Override
  public void close() {
    clear();
  }

  private void disposeAll(List<T> departed) {
    RuntimeException failure = null;
    for (T element : departed) {
      try {
        disposalPolicy.dispose(element);
      }
      catch (RuntimeException e) {
        LOG.warn("Failed to dispose " + element, e);
        if (failure == null) {
          failure = e;
        }
        else {
          failure.addSuppressed(e);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }

  public boolean isEmpty() {
    return rankedItems.isEmpty();
  }

  /**
   * @return the number of elements this instance is currently holding
   */
  public int size() {
    return rankedItems.size();
  }

  /**
   * @return the maximum number of elements this instance can hold
   */
  public int capacity() {
    return capacity;
  }

  public boolean isFull() {
    return rankedItems.size() >= capacity;
  }

  /**
   * @throws NoSuchElementException if the ranker is empty
   */
  public T top() {
    if (rankedItems.isEmpty()) {
      throw new NoSuchElementException("ranking is empty");
    }
    return rankedItems.getFirst();
  }

  /**
   * @throws NoSuchElementException if the ranker is empty
   */
  public T bottom() {
    if (rankedItems.isEmpty()) {
      throw new NoSuchElementException("ranking is empty");
    }
    return rankedItems.getLast();
  }

  public boolean contains(Object element) {
    return rankedItems.contains(element);
  }

  /**
   * Iterates from top to bottom. The iterator does not support removal and fails fast once the ranker is modified.
   */
  @Override
  public Iterator<T> iterator() {
    return Iterators.unmodifiableIterator(rankedItems.iterator());
  }

  /**
   * @return an immutable snapshot of the ranked elements, top first
   */
  public List<T> asList() {
    return ImmutableList.copyOf(rankedItems);
  }

  public Comparator<? super T> comparator() {
    return comparator;
  }

  public SameValueBehavior sameValueBehavior() {
    return sameValueBehavior;
  }

  public String toString() {
    return rankedItems.toString();
  }

  /**
   * Configures a {@link Ranker}. All settings are fixed for the lifetime of the rankers it creates.
   *
   * @param <B> The upper bound of the element type of the rankers this builder creates.
   */
  public static final class Builder<B> {

    private final Comparator<B> comparator;
    private int capacity = DEFAULT_CAPACITY;
    private SameValueBehavior sameValueBehavior = SameValueBehavior.INSERT_AFTER_EQUAL;
    private DisposalPolicy<? super B> disposalPolicy = DisposalPolicies.noop();

    private Builder(Comparator<B> comparator) {
      this.comparator = checkNotNull(comparator, "comparator");
    }

    /**
     * Zero is allowed and yields a ranker that rejects, and disposes, everything inserted into it.
     */
    public Builder<B> capacity(int capacity) {
      checkArgument(capacity >= 0, "The capacity must be >= 0 (you requested %s)", capacity);
      this.capacity = capacity;
      return this;
    }

    public Builder<B> sameValueBehavior(SameValueBehavior sameValueBehavior) {
      this.sameValueBehavior = checkNotNull(sameValueBehavior, "sameValueBehavior");
      return this;
    }

    public Builder<B> disposalPolicy(DisposalPolicy<? super B> disposalPolicy) {
      this.disposalPolicy = checkNotNull(disposalPolicy, "disposalPolicy");
      return this;
    }

    public <T extends B> Ranker<T> create() {
      return new Ranker<T>(capacity, comparator, sameValueBehavior, disposalPolicy);
    }
  }
}
