/*
 * Copyright (C) 2026 The Needle Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package needle;

import static com.google.common.truth.Truth.assertThat;
import static needle.testing.Nodes.key;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ScopeStackTest {
  private final ScopeStack stack = ScopeStack.create();

  @Test public void enterAndExit() {
    ScopeHandle app = stack.enter("app");
    ScopeHandle request = stack.enter("request");
    assertThat(stack.activeScopes()).containsExactly("app", "request").inOrder();
    assertThat(stack.cache("request").get()).isSameInstanceAs(request.cache());

    request.exit();
    assertThat(request.isActive()).isFalse();
    assertThat(stack.activeScopes()).containsExactly("app");
    app.exit();
    assertThat(stack.activeScopes()).isEmpty();
    assertThat(stack.isActive("app")).isFalse();
  }

  @Test public void enteringAnActiveScopeFails() {
    stack.enter("app");
    try {
      stack.enter("app");
      fail();
    } catch (DuplicateScopeException expected) {
      assertThat(expected).hasMessageThat().contains("app");
    }
  }

  @Test public void exitMustBeLastInFirstOut() {
    ScopeHandle app = stack.enter("app");
    stack.enter("request");
    try {
      app.exit();
      fail();
    } catch (ScopeOrderException expected) {
      assertThat(expected).hasMessageThat().contains("request is still active");
    }
    assertThat(stack.activeScopes()).containsExactly("app", "request").inOrder();
  }

  @Test public void exitTwiceFails() {
    ScopeHandle app = stack.enter("app");
    app.exit();
    try {
      app.exit();
      fail();
    } catch (ScopeOrderException expected) {
      assertThat(expected).hasMessageThat().contains("already exited");
    }
  }

  @Test public void reenteringAfterExitStartsEmpty() {
    ScopeHandle first = stack.enter("app");
    first.cache().getOrCreate(key("A"), () -> "a");
    first.exit();

    ScopeHandle second = stack.enter("app");
    assertThat(second.cache()).isNotSameInstanceAs(first.cache());
    assertThat(second.cache().contains(key("A"))).isFalse();
  }

  @Test public void exitRunsCleanups() {
    final List<String> released = new ArrayList<>();
    try (ScopeHandle app = stack.enter("app")) {
      app.cache().getOrCreate(key("A"), () -> "a", released::add);
      assertThat(released).isEmpty();
    }
    assertThat(released).containsExactly("a");
  }

  @Test public void forkSharesActiveScopes() {
    ScopeHandle app = stack.enter("app");
    ScopeStack fork = stack.fork();

    assertThat(fork.activeScopes()).containsExactly("app");
    assertThat(fork.cache("app").get()).isSameInstanceAs(app.cache());
  }

  @Test public void forksEnterScopesIndependently() {
    stack.enter("app");
    ScopeStack first = stack.fork();
    ScopeStack second = stack.fork();

    ScopeHandle firstRequest = first.enter("request");
    ScopeHandle secondRequest = second.enter("request");
    assertThat(firstRequest.cache()).isNotSameInstanceAs(secondRequest.cache());
    assertThat(stack.activeScopes()).containsExactly("app");

    // Forks only exit what they entered.
    firstRequest.exit();
    assertThat(first.activeScopes()).containsExactly("app");
    assertThat(second.activeScopes()).containsExactly("app", "request").inOrder();
  }

  @Test public void forkDoesNotSeeLaterParentScopes() {
    stack.enter("app");
    ScopeStack fork = stack.fork();
    stack.enter("session");

    assertThat(fork.isActive("session")).isFalse();
  }

  @Test public void forkCannotReenterInheritedScope() {
    stack.enter("app");
    try {
      stack.fork().enter("app");
      fail();
    } catch (DuplicateScopeException expected) {
    }
  }

  @Test public void toStringListsScopes() {
    stack.enter("app");
    stack.enter("request");
    assertThat(stack.toString()).isEqualTo("ScopeStack[app, request]");
  }
}
