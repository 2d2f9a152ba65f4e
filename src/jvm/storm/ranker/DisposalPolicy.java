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

/**
 * Releases whatever an element owns once it has left a {@link Ranker}, be it through eviction, removal or clearing.
 * <p/>
 * A ranker calls {@link #dispose(Object)} exactly once per departing element and only after the element has been
 * unlinked, so an implementation never sees an element that is still reachable through the ranker.
 *
 * @param <T> The type of the ranked elements.
 */
public interface DisposalPolicy<T> {

  /**
   * @param element the element that just left the ranking (never null)
   *
   * @throws DisposalException if the element's resources could not be released
   */
  void dispose(T element);
}
