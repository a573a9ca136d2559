package io.stagerelay.graph;

import io.stagerelay.validation.OutputPolicy;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class TaskGraphBuilderTest {
    private static final OutputPolicy POLICY = new OutputPolicy(List.of(), List.of(), true);

    @Test
    void orderIsTopologicalWithDeclarationTieBreak() {
        TaskGraph graph = new TaskGraphBuilder().build(List.of(
                task("d", "b", "c"),
                task("c", "a"),
                task("b", "a"),
                task("a"),
                task("e")
        ));

        Assertions.assertEquals(List.of("a", "c", "b", "d", "e"), graph.orderIds());
        Assertions.assertEquals(List.of("a", "e"), graph.entryPoints());
        Assertions.assertEquals(List.of("c", "b"), graph.dependentsOf("a"));
        Assertions.assertEquals(List.of("d", "e"), graph.sinks());
    }

    @Test
    void sameDeclarationAlwaysYieldsSameOrder() {
        List<TaskSpec> tasks = List.of(task("a"), task("b", "a"), task("c", "a"), task("d", "b", "c"));
        List<String> first = new TaskGraphBuilder().build(tasks).orderIds();
        for (int i = 0; i < 10; i++) {
            Assertions.assertEquals(first, new TaskGraphBuilder().build(tasks).orderIds());
        }
    }

    @Test
    void explicitSinksKeepCanonicalOrder() {
        TaskGraph graph = new TaskGraphBuilder().build(
                List.of(task("a"), task("b", "a"), task("c", "a")),
                List.of("c", "a"));

        Assertions.assertEquals(List.of("a", "c"), graph.sinks());
    }

    @Test
    void rejectsCycle() {
        GraphException e = Assertions.assertThrows(GraphException.class, () -> new TaskGraphBuilder().build(List.of(
                task("a", "c"),
                task("b", "a"),
                task("c", "b"),
                task("root")
        )));
        Assertions.assertTrue(e.getMessage().contains("cycle"), e.getMessage());
        Assertions.assertTrue(e.getMessage().contains("a, b, c"), e.getMessage());
    }

    @Test
    void rejectsStructuralDefects() {
        TaskGraphBuilder builder = new TaskGraphBuilder();
        Assertions.assertThrows(GraphException.class, () -> builder.build(List.of()));
        Assertions.assertThrows(GraphException.class, () -> builder.build(List.of(task("a"), task("a"))));
        Assertions.assertThrows(GraphException.class, () -> builder.build(List.of(task("a", "missing"))));
        Assertions.assertThrows(GraphException.class, () -> builder.build(List.of(task("a", "a"))));
        Assertions.assertThrows(GraphException.class, () -> builder.build(List.of(task("a"), task("b", "a", "a"))));
        Assertions.assertThrows(GraphException.class, () -> builder.build(List.of(task(InputBinding.PARAMS))));
        Assertions.assertThrows(GraphException.class, () -> builder.build(List.of(task("a")), List.of("nope")));
        Assertions.assertThrows(GraphException.class, () -> builder.build(List.of(task("a")), List.of("a", "a")));
    }

    @Test
    void rejectsInputBoundToNonDependency() {
        TaskSpec reader = new TaskSpec("b", "b", List.of(), List.of(InputBinding.parse("screen", "a#/companies")),
                POLICY, 1000L, 1, null, Map.of(), null);

        GraphException e = Assertions.assertThrows(GraphException.class,
                () -> new TaskGraphBuilder().build(List.of(task("a"), reader)));
        Assertions.assertTrue(e.getMessage().contains("not one of its dependencies"), e.getMessage());
    }

    @Test
    void defaultInputsBindEachDependencyUnderItsId() {
        TaskSpec d = task("d", "b", "c");

        Assertions.assertEquals(List.of(new InputBinding("b", "b", ""), new InputBinding("c", "c", "")), d.inputs());
    }

    @Test
    void parsesBindingExpressions() {
        Assertions.assertEquals(new InputBinding("x", "screen", "/companies/0"), InputBinding.parse("x", "screen#/companies/0"));
        Assertions.assertEquals(new InputBinding("m", "params", "/market"), InputBinding.parse("m", " params#/market "));
        Assertions.assertTrue(InputBinding.parse("m", "params#/market").fromParams());
        Assertions.assertThrows(GraphException.class, () -> InputBinding.parse("x", "screen#companies"));
        Assertions.assertThrows(GraphException.class, () -> InputBinding.parse("x", " "));
    }

    @Test
    void rejectsInvalidTaskFields() {
        Assertions.assertThrows(GraphException.class, () -> TaskSpec.of(" ", "k", List.of(), POLICY, 1000L, 1));
        Assertions.assertThrows(GraphException.class, () -> TaskSpec.of("a", "", List.of(), POLICY, 1000L, 1));
        Assertions.assertThrows(GraphException.class, () -> TaskSpec.of("a", "k", List.of(), POLICY, 0L, 1));
        Assertions.assertThrows(GraphException.class, () -> TaskSpec.of("a", "k", List.of(), POLICY, 1000L, 0));
    }

    private static TaskSpec task(String id, String... deps) {
        return TaskSpec.of(id, id, List.of(deps), POLICY, 1000L, 2);
    }
}
