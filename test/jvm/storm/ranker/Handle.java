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

import com.google.common.base.Objects;
import com.google.common.primitives.Ints;

import java.io.Closeable;
import java.io.IOException;

/**
 * A closeable test resource. Handles are equal when their names and scores are, regardless of identity.
 */
class Handle implements Closeable, Comparable<Handle> {

  private final String name;
  private final int score;
  private int timesClosed;
  private boolean failOnClose;

  Handle(String name, int score) {
    this.name = name;
    this.score = score;
  }

  Handle failingOnClose() {
    failOnClose = true;
    return this;
  }

  int timesClosed() {
    return timesClosed;
  }

  @Override
  public void close() throws IOException {
    timesClosed++;
    if (failOnClose) {
      throw new IOException("cannot close " + name);
    }
  }

  @Override
  public int compareTo(Handle other) {
    return Ints.compare(score, other.score);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Handle)) {
      return false;
    }
    Handle other = (Handle) o;
    return name.equals(other.name) && score == other.score;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, score);
  }

  @Override
  public String toString() {
    return name + "@" + score;
  }
}
