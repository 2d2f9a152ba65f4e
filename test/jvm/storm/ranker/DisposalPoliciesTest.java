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

import org.testng.annotations.Test;

import java.io.IOException;

import static org.fest.assertions.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

public class DisposalPoliciesTest {

  @Test
  public void noopShouldLeaveElementUntouched() {
    // given
    Handle handle = new Handle("a", 1);

    // when
    DisposalPolicies.<Handle>noop().dispose(handle);

    // then
    assertThat(handle.timesClosed()).isEqualTo(0);
  }

  @Test
  public void closingShouldCloseElement() {
    // given
    Handle handle = new Handle("a", 1);

    // when
    DisposalPolicies.<Handle>closing().dispose(handle);

    // then
    assertThat(handle.timesClosed()).isEqualTo(1);
  }

  @Test
  public void closingShouldWrapCheckedFailures() {
    // given
    Handle handle = new Handle("a", 1).failingOnClose();

    // when
    DisposalException failure = null;
    try {
      DisposalPolicies.<Handle>closing().dispose(handle);
    }
    catch (DisposalException e) {
      failure = e;
    }

    // then
    assertThat(failure).isNotNull();
    assertThat(failure.getCause()).isInstanceOf(IOException.class);
    assertThat(failure.getMessage()).contains("a@1");
  }

  @Test(expectedExceptions = IllegalStateException.class)
  public void closingShouldPassUncheckedFailuresThrough() throws Exception {
    // given
    AutoCloseable resource = mock(AutoCloseable.class);
    doThrow(new IllegalStateException("already closed")).when(resource).close();

    // when
    DisposalPolicies.<AutoCloseable>closing().dispose(resource);

    // then (exception)
  }

  @Test
  public void composeShouldRunEveryPolicyInOrder() {
    // given
    @SuppressWarnings("unchecked")
    DisposalPolicy<Object> first = mock(DisposalPolicy.class);
    @SuppressWarnings("unchecked")
    DisposalPolicy<Object> second = mock(DisposalPolicy.class);
    DisposalPolicy<String> composed = DisposalPolicies.<String>compose(first, second);

    // when
    composed.dispose("x");

    // then
    org.mockito.InOrder inOrder = inOrder(first, second);
    inOrder.verify(first).dispose("x");
    inOrder.verify(second).dispose("x");
  }

  @Test
  public void composeShouldKeepGoingAfterAFailureAndRethrowTheFirstOne() {
    // given
    @SuppressWarnings("unchecked")
    DisposalPolicy<Object> failing = mock(DisposalPolicy.class);
    doThrow(new DisposalException("first", null)).when(failing).dispose("x");
    @SuppressWarnings("unchecked")
    DisposalPolicy<Object> alsoFailing = mock(DisposalPolicy.class);
    doThrow(new DisposalException("second", null)).when(alsoFailing).dispose("x");
    @SuppressWarnings("unchecked")
    DisposalPolicy<Object> last = mock(DisposalPolicy.class);

    // when
    DisposalException failure = null;
    try {
      DisposalPolicies.<String>compose(failing, alsoFailing, last).dispose("x");
    }
    catch (DisposalException e) {
      failure = e;
    }

    // then
    assertThat(failure).isNotNull();
    assertThat(failure.getMessage()).isEqualTo("first");
    assertThat(failure.getSuppressed()).hasSize(1);
    verify(last).dispose("x");
  }

  @Test(expectedExceptions = NullPointerException.class)
  public void composeShouldRejectNullPolicies() {
    DisposalPolicies.<String>compose(DisposalPolicies.<String>noop(), null);
  }
}
