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
 * Decides where a newly inserted element goes relative to the elements already in a {@link Ranker} that compare
 * equal to it.
 */
public enum SameValueBehavior {

  /**
   * The new element is placed immediately before the first equal element, so among equals the most recently
   * inserted one ranks highest.
   */
  INSERT_BEFORE_EQUAL,

  /**
   * The new element is placed immediately after the last equal element, so equals keep their insertion order.
   */
  INSERT_AFTER_EQUAL
}
