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
package storm.ranker.tools;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Longs;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * This class wraps an object and its associated count, including any additional data fields.
 * <p/>
 * It is the element type of choice for leaderboards of the form "the N most frequent objects", e.g. a
 * {@link storm.ranker.Ranker} ordered by {@link Rankables#byCountDescending()}.
 */
public class RankableObjectWithFields implements Rankable {

  private static final String toStringSeparator = "|";

  private final Object obj;
  private final long count;
  private final ImmutableList<Object> fields;

  public RankableObjectWithFields(Object obj, long count, Object... otherFields) {
    checkArgument(obj != null, "The object must not be null");
    checkArgument(count >= 0, "The count must be >= 0 (you requested %s)", count);
    this.obj = obj;
    this.count = count;
    fields = ImmutableList.copyOf(otherFields);
  }

  /**
   * Builds an instance from a flat list of values: the object to be ranked at index 0, its count at index 1 and any
   * additional fields after that.
   */
  public static RankableObjectWithFields from(List<?> values) {
    checkArgument(values.size() >= 2, "Expected at least an object and a count but got %s", values);
    Object obj = values.get(0);
    Object count = values.get(1);
    checkArgument(count instanceof Number, "The count must be a number but was %s", count);
    List<?> otherFields = values.subList(2, values.size());
    return new RankableObjectWithFields(obj, ((Number) count).longValue(), otherFields.toArray());
  }

  public Object getObject() {
    return obj;
  }

  public long getCount() {
    return count;
  }

  /**
   * @return an immutable list of any additional data fields of the object (may be empty but will never be null)
   */
  public List<Object> getFields() {
    return fields;
  }

  @Override
  public int compareTo(Rankable other) {
    return Longs.compare(getCount(), other.getCount());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RankableObjectWithFields)) {
      return false;
    }
    RankableObjectWithFields other = (RankableObjectWithFields) o;
    return obj.equals(other.obj) && count == other.count;
  }

  @Override
  public int hashCode() {
    int result = 17;
    int countHash = (int) (count ^ (count >>> 32));
    result = 31 * result + countHash;
    result = 31 * result + obj.hashCode();
    return result;
  }

  public String toString() {
    StringBuilder buf = new StringBuilder();
    buf.append("[");
    buf.append(obj);
    buf.append(toStringSeparator);
    buf.append(count);
    for (Object field : fields) {
      buf.append(toStringSeparator);
      buf.append(field);
    }
    buf.append("]");
    return buf.toString();
  }
}
