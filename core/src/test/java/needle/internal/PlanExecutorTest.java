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


package needle.internal;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.util.concurrent.MoreExecutors.directExecutor;
import static needle.testing.Nodes.key;
import static org.junit.Assert.fail;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.ListenableFuture;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import needle.BindingTable;
import needle.ConstructionException;
import needle.Dependant;
import needle.ExecutionPlan;
import needle.InactiveScopeException;
import needle.Key;
import needle.MissingBindingException;
import needle.ScopeHandle;
import needle.ScopeOrderException;
import needle.ScopeStack;
import needle.testing.Nodes;
import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class PlanExecutorTest {
  private static final Map<Key<?>, Object> NO_VALUES = ImmutableMap.of();

  private final Nodes nodes = new Nodes();
  private final Solver solver = new Solver(ImmutableList.of("app", "request"));
  private final PlanExecutor executor = new PlanExecutor(directExecutor());
  private final ScopeStack scopes = ScopeStack.create();
  private final ExecutorService es = Executors.newFixedThreadPool(8);

  @After public void tearDown() {
    es.shutdownNow();
  }

  @Test public void sharedDependencyIsConstructedOnce() {
    Dependant<String> c = nodes.node("C", "app").build();
    Dependant<String> b = nodes.node("B", "app").dependsOn(c).build();
    Dependant<String> a = nodes.node("A", "app").dependsOn(b).dependsOn(c).build();
    scopes.enter("app");

    String value = executor.execute(solver.solve(a, BindingTable.empty()), scopes, NO_VALUES);

    assertThat(value).isEqualTo("A(B(C), C)");
    assertThat(nodes.callCount("C")).isEqualTo(1);
  }

  @Test public void sharedValuesAreReusedWithinTheirScope() {
    Dependant<String> config = nodes.node("config", "app").build();
    Dependant<String> handler = nodes.node("handler", "request").dependsOn(config).build();
    ExecutionPlan<String> plan = solver.solve(handler, BindingTable.empty());
    scopes.enter("app");

    try (ScopeHandle request = scopes.enter("request")) {
      assertThat(executor.execute(plan, scopes, NO_VALUES)).isEqualTo("handler(config)");
      assertThat(executor.execute(plan, scopes, NO_VALUES)).isEqualTo("handler(config)");
    }
    try (ScopeHandle request = scopes.enter("request")) {
      executor.execute(plan, scopes, NO_VALUES);
    }

    assertThat(nodes.callCount("config")).isEqualTo(1);
    assertThat(nodes.callCount("handler")).isEqualTo(2);
  }

  @Test public void unsharedValuesAreConstructedForEveryExecution() {
    Dependant<String> id = nodes.node("id", "request").shared(false).build();
    Dependant<String> left = nodes.node("left", "request").dependsOn(id).shared(false).build();
    Dependant<String> right = nodes.node("right", "request").dependsOn(id).shared(false).build();
    Dependant<String> root =
        nodes.node("root", "request").dependsOn(left).dependsOn(right).shared(false).build();
    ExecutionPlan<String> plan = solver.solve(root, BindingTable.empty());
    scopes.enter("request");

    executor.execute(plan, scopes, NO_VALUES);
    executor.execute(plan, scopes, NO_VALUES);

    // Once per execution, even though two steps consume it.
    assertThat(nodes.callCount("id")).isEqualTo(2);
    assertThat(nodes.callCount("root")).isEqualTo(2);
  }

  @Test public void cachedValuesPruneTheirDependencies() {
    Dependant<String> connection = nodes.node("connection", "app").shared(false).build();
    Dependant<String> pool = nodes.node("pool", "app").dependsOn(connection).build();
    Dependant<String> handler = nodes.node("handler", "request").dependsOn(pool).build();
    ExecutionPlan<String> plan = solver.solve(handler, BindingTable.empty());
    scopes.enter("app");

    for (int i = 0; i < 3; i++) {
      try (ScopeHandle request = scopes.enter("request")) {
        assertThat(executor.execute(plan, scopes, NO_VALUES))
            .isEqualTo("handler(pool(connection))");
      }
    }

    assertThat(nodes.callCount("pool")).isEqualTo(1);
    assertThat(nodes.callCount("connection")).isEqualTo(1);
    assertThat(nodes.callCount("handler")).isEqualTo(3);
  }

  @Test public void suppliedValuesAreNotConstructed() {
    Dependant<String> request = Dependant.unwired(key("request"), "request");
    Dependant<String> user = nodes.node("user", "request").dependsOn(request).build();
    Dependant<String> handler =
        nodes.node("handler", "request").dependsOn(user).dependsOn(request).build();
    ExecutionPlan<String> plan = solver.solve(handler, BindingTable.empty());
    scopes.enter("request");

    String value =
        executor.execute(plan, scopes, ImmutableMap.<Key<?>, Object>of(key("request"), "GET /"));

    assertThat(value).isEqualTo("handler(user(GET /), GET /)");
  }

  @Test public void suppliedValueReplacesFactory() {
    Dependant<String> b = nodes.node("B", "app").build();
    Dependant<String> a = nodes.node("A", "app").dependsOn(b).build();
    scopes.enter("app");

    String value =
        executor.execute(
            solver.solve(a, BindingTable.empty()),
            scopes,
            ImmutableMap.<Key<?>, Object>of(key("B"), "given"));

    assertThat(value).isEqualTo("A(given)");
    assertThat(nodes.callCount("B")).isEqualTo(0);
  }

  @Test public void suppliedValueOfWrongTypeIsRejected() {
    Dependant<String> a = nodes.node("A", "app").dependsOn(nodes.node("B", "app").build()).build();
    scopes.enter("app");

    try {
      executor.execute(
          solver.solve(a, BindingTable.empty()),
          scopes,
          ImmutableMap.<Key<?>, Object>of(key("B"), 42));
      fail();
    } catch (IllegalArgumentException expected) {
    }
  }

  @Test public void unwiredWithoutValueFailsBeforeAnythingRuns() {
    Dependant<String> request = Dependant.unwired(key("request"), "request");
    Dependant<String> config = nodes.node("config", "request").build();
    Dependant<String> handler =
        nodes.node("handler", "request").dependsOn(config).dependsOn(request).build();
    scopes.enter("request");

    try {
      executor.execute(solver.solve(handler, BindingTable.empty()), scopes, NO_VALUES);
      fail();
    } catch (MissingBindingException expected) {
      assertThat(expected.key()).isEqualTo(key("request"));
    }
    assertThat(nodes.callCount("config")).isEqualTo(0);
  }

  @Test public void optionalAbsentParameterIsNull() {
    Dependant<String> a = nodes.node("A", "app").optionallyDependsOn(key("X")).build();
    scopes.enter("app");

    assertThat(executor.execute(solver.solve(a, BindingTable.empty()), scopes, NO_VALUES))
        .isEqualTo("A(-)");
  }

  @Test public void factoryFailureStopsLaterStagesAndKeepsCompletedSiblings() {
    final IOException failure = new IOException("unreachable");
    Dependant<String> broken =
        Dependant.builder(key("broken"))
            .scope("app")
            .factory(
                arguments -> {
                  throw failure;
                })
            .build();
    Dependant<String> healthy = nodes.node("healthy", "app").build();
    Dependant<String> root = nodes.node("root", "app").dependsOn(broken).dependsOn(healthy).build();
    ScopeHandle app = scopes.enter("app");

    try {
      executor.execute(solver.solve(root, BindingTable.empty()), scopes, NO_VALUES);
      fail();
    } catch (ConstructionException expected) {
      assertThat(expected.key()).isEqualTo(key("broken"));
      assertThat(expected).hasCauseThat().isSameInstanceAs(failure);
    }
    assertThat(nodes.callCount("healthy")).isEqualTo(1);
    assertThat(nodes.callCount("root")).isEqualTo(0);
    assertThat(app.cache().contains(key("healthy"))).isTrue();
    assertThat(app.cache().contains(key("broken"))).isFalse();
  }

  @Test public void failedExecutionCanBeRetried() {
    final boolean[] broken = {true};
    Dependant<String> flaky =
        Dependant.builder(key("flaky"))
            .scope("app")
            .factory(
                arguments -> {
                  if (broken[0]) {
                    throw new IllegalStateException("not yet");
                  }
                  return "flaky";
                })
            .build();
    ExecutionPlan<String> plan = solver.solve(flaky, BindingTable.empty());
    scopes.enter("app");

    try {
      executor.execute(plan, scopes, NO_VALUES);
      fail();
    } catch (ConstructionException expected) {
      assertThat(expected).hasCauseThat().isInstanceOf(IllegalStateException.class);
    }
    broken[0] = false;
    assertThat(executor.execute(plan, scopes, NO_VALUES)).isEqualTo("flaky");
  }

  @Test public void nullValueIsAConstructionFailure() {
    Dependant<String> a =
        Dependant.builder(key("A")).scope("app").shared(false).factory(arguments -> null).build();
    scopes.enter("app");

    try {
      executor.execute(solver.solve(a, BindingTable.empty()), scopes, NO_VALUES);
      fail();
    } catch (ConstructionException expected) {
      assertThat(expected).hasCauseThat().isInstanceOf(NullPointerException.class);
    }
  }

  @Test public void stepsOfAStageRunConcurrently() throws Exception {
    final int width = 8;
    final CountDownLatch allStarted = new CountDownLatch(width);
    Dependant.Builder<String> root = nodes.node("root", "app");
    for (int i = 0; i < width; i++) {
      root.dependsOn(
          Dependant.builder(key("leaf" + i))
              .scope("app")
              .factory(
                  arguments -> {
                    allStarted.countDown();
                    // Only completes if every leaf is running at the same time.
                    return allStarted.await(5, TimeUnit.SECONDS) ? "leaf" : "timeout";
                  })
              .build());
    }
    ExecutionPlan<String> plan = solver.solve(root.build(), BindingTable.empty());
    scopes.enter("app");

    ListenableFuture<String> result =
        new PlanExecutor(es).executeAsync(plan, scopes, NO_VALUES);

    assertThat(result.get(10, TimeUnit.SECONDS))
        .isEqualTo("root(leaf, leaf, leaf, leaf, leaf, leaf, leaf, leaf)");
  }

  @Test public void stagesRunInOrder() throws Exception {
    final List<String> order = Collections.synchronizedList(new ArrayList<String>());
    Dependant<String> c = recording("C", order).build();
    Dependant<String> b = recording("B", order).dependsOn(c).build();
    Dependant<String> d = recording("D", order).build();
    Dependant<String> a = recording("A", order).dependsOn(b).dependsOn(d).build();
    scopes.enter("app");

    new PlanExecutor(es)
        .executeAsync(solver.solve(a, BindingTable.empty()), scopes, NO_VALUES)
        .get(5, TimeUnit.SECONDS);

    assertThat(order).hasSize(4);
    assertThat(order.subList(0, 2)).containsExactly("C", "D");
    assertThat(order.subList(2, 4)).containsExactly("B", "A").inOrder();
  }

  @Test public void asyncFailureCarriesConstructionException() throws Exception {
    Dependant<String> a =
        Dependant.builder(key("A"))
            .scope("app")
            .factory(
                arguments -> {
                  throw new IOException("io");
                })
            .build();
    scopes.enter("app");

    ListenableFuture<String> result =
        new PlanExecutor(es).executeAsync(solver.solve(a, BindingTable.empty()), scopes, NO_VALUES);
    try {
      result.get(5, TimeUnit.SECONDS);
      fail();
    } catch (ExecutionException expected) {
      assertThat(expected).hasCauseThat().isInstanceOf(ConstructionException.class);
    }
  }

  @Test public void longChainRunsOnTheCallingThread() {
    ExecutionPlan<Integer> plan = solver.solve(Nodes.chain(10_000, null), BindingTable.empty());
    scopes.enter("app");

    assertThat(executor.execute(plan, scopes, NO_VALUES)).isEqualTo(9_999);
    // Every link is cached now, so the second execution skips all 10 000 stages.
    assertThat(executor.execute(plan, scopes, NO_VALUES)).isEqualTo(9_999);
  }

  @Test public void longChainRunsOnAThreadPool() throws Exception {
    ExecutionPlan<Integer> plan = solver.solve(Nodes.chain(10_000, null), BindingTable.empty());
    scopes.enter("app");

    ListenableFuture<Integer> result = new PlanExecutor(es).executeAsync(plan, scopes, NO_VALUES);

    assertThat(result.get(30, TimeUnit.SECONDS)).isEqualTo(9_999);
  }

  @Test public void inactiveScopeIsReported() {
    Dependant<String> a = nodes.node("A", "request").build();
    scopes.enter("app");

    try {
      executor.execute(solver.solve(a, BindingTable.empty()), scopes, NO_VALUES);
      fail();
    } catch (InactiveScopeException expected) {
      assertThat(expected).hasMessageThat().contains("requires scope request");
    }
    assertThat(nodes.callCount("A")).isEqualTo(0);
  }

  @Test public void scopesEnteredOutOfOrderAreReported() {
    Dependant<String> a = nodes.node("A", "request").build();
    scopes.enter("request");
    scopes.enter("app");

    try {
      executor.execute(solver.solve(a, BindingTable.empty()), scopes, NO_VALUES);
      fail();
    } catch (ScopeOrderException expected) {
    }
  }

  @Test public void cleanupsRunWhenOwningScopeExits() {
    final List<String> released = new ArrayList<>();
    Dependant<String> pool = nodes.node("pool", "app").cleanup(released::add).build();
    Dependant<String> session =
        nodes
            .node("session", "request")
            .dependsOn(pool)
            .shared(false)
            .cleanup(released::add)
            .build();
    Dependant<String> handler =
        nodes.node("handler", "request").dependsOn(session).cleanup(released::add).build();
    ExecutionPlan<String> plan = solver.solve(handler, BindingTable.empty());

    ScopeHandle app = scopes.enter("app");
    try (ScopeHandle request = scopes.enter("request")) {
      executor.execute(plan, scopes, NO_VALUES);
    }
    assertThat(released).containsExactly("handler(session(pool))", "session(pool)").inOrder();

    app.exit();
    assertThat(released).hasSize(3);
    assertThat(released.get(2)).isEqualTo("pool");
  }

  private Dependant.Builder<String> recording(final String name, final List<String> order) {
    return Dependant.builder(key(name))
        .scope("app")
        .factory(
            arguments -> {
              order.add(name);
              return Nodes.format(name, arguments);
            });
  }
}
