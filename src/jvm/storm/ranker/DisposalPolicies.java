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

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Stock {@link DisposalPolicy} implementations.
 */
public final class DisposalPolicies {

  private DisposalPolicies() {
  }

  /**
   * @return a policy that does nothing, leaving cleanup of departed elements to the caller
   */
  @SuppressWarnings("unchecked")
  public static <T> DisposalPolicy<T> noop() {
    DisposalPolicy<?> policy = NoopPolicy.INSTANCE;
    return (DisposalPolicy<T>) policy;
  }

  /**
   * @return a policy that closes each departing element. A checked exception from {@code close()} is wrapped in a
   * {@link DisposalException}; unchecked ones propagate as they are
   */
  @SuppressWarnings("unchecked")
  public static <T extends AutoCloseable> DisposalPolicy<T> closing() {
    DisposalPolicy<?> policy = ClosingPolicy.INSTANCE;
    return (DisposalPolicy<T>) policy;
  }

  /**
   * Runs the given policies in order. A failing policy does not stop the ones after it; the first failure is
   * rethrown once all of them ran.
   */
  @SafeVarargs
  public static <T> DisposalPolicy<T> compose(DisposalPolicy<? super T>... policies) {
    checkNotNull(policies, "policies");
    // copyOf rejects null members
    return new CompositePolicy<T>(ImmutableList.<DisposalPolicy<? super T>>copyOf(policies));
  }

  private enum NoopPolicy implements DisposalPolicy<Object> {
    INSTANCE;

    @Override
    public void dispose(Object element) {
    }

    @Override
    public String toString() {
      return "DisposalPolicies.noop()";
    }
  }

  private enum ClosingPolicy implements DisposalPolicy<AutoCloseable> {
    INSTANCE;

    @Override
    public void dispose(AutoCloseable element) {
      try {
        element.close();
      }
      catch (RuntimeException e) {
        throw e;
      }
      catch (Exception e) {
        throw new DisposalException("Could not close " + element, e);
      }
    }

    @Override
    public String toString() {
      return "DisposalPolicies.closing()";
    }
  }

  private static final class CompositePolicy<T> implements DisposalPolicy<T> {

    private final List<DisposalPolicy<? super T>> policies;

    CompositePolicy(List<DisposalPolicy<? super T>> policies) {
      this.policies = policies;
    }

    @Override
    public void dispose(T element) {
      RuntimeException failure = null;
      for (DisposalPolicy<? super T> policy : policies) {
        try {
          policy.dispose(element);
        }
        catch (RuntimeException e) {
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

    @Override
    public String toString() {
      return "DisposalPolicies.compose(" + policies + ")";
    }
  }
}
