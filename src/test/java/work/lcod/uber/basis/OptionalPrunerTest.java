package work.lcod.uber.basis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.lcod.uber.shared.UberException;

class OptionalPrunerTest {
    @Test
    void returnsInputWhenNothingIsOptional() {
        var libs = libs(
            LibraryNode.required("a", jars("a"), Set.of()),
            LibraryNode.required("b", jars("b"), Set.of("a"))
        );
        assertSame(libs, OptionalPruner.prune(libs));
    }

    @Test
    void dropsOptionalLibAndItsExclusiveDependency() {
        var libs = libs(
            LibraryNode.required("app", jars("app"), Set.of()),
            LibraryNode.optional("b", jars("b"), Set.of("app")),
            LibraryNode.required("c", jars("c"), Set.of("b"))
        );
        assertEquals(List.of("app"), List.copyOf(OptionalPruner.prune(libs).keySet()));
    }

    @Test
    void keepsDependencyWithAnotherRequiredDependent() {
        var libs = libs(
            LibraryNode.required("app", jars("app"), Set.of()),
            LibraryNode.optional("b", jars("b"), Set.of("app")),
            LibraryNode.required("d", jars("d"), Set.of("app")),
            LibraryNode.required("c", jars("c"), Set.of("b", "d"))
        );
        assertEquals(List.of("app", "d", "c"), List.copyOf(OptionalPruner.prune(libs).keySet()));
    }

    @Test
    void propagatesThroughChains() {
        var libs = libs(
            LibraryNode.required("app", jars("app"), Set.of()),
            LibraryNode.optional("b", jars("b"), Set.of("app")),
            LibraryNode.required("c", jars("c"), Set.of("b")),
            LibraryNode.required("e", jars("e"), Set.of("c")),
            LibraryNode.required("f", jars("f"), Set.of("e", "c"))
        );
        assertEquals(List.of("app"), List.copyOf(OptionalPruner.prune(libs).keySet()));
    }

    @Test
    void optionalFlagWinsOverRequiredDependents() {
        var libs = libs(
            LibraryNode.required("app", jars("app"), Set.of()),
            LibraryNode.optional("b", jars("b"), Set.of("app"))
        );
        assertEquals(List.of("app"), List.copyOf(OptionalPruner.prune(libs).keySet()));
    }

    @Test
    void rootsAreNeverPrunedByPropagation() {
        var libs = libs(
            LibraryNode.required("tool", jars("tool"), Set.of()),
            LibraryNode.optional("x", jars("x"), Set.of("tool"))
        );
        assertEquals(List.of("tool"), List.copyOf(OptionalPruner.prune(libs).keySet()));
    }

    @Test
    void unknownDependentsCountAsRequired() {
        var libs = libs(
            LibraryNode.optional("b", jars("b"), Set.of()),
            LibraryNode.required("c", jars("c"), Set.of("b", "outside/lib"))
        );
        assertEquals(List.of("c"), List.copyOf(OptionalPruner.prune(libs).keySet()));
    }

    @Test
    void rejectsSelfLoops() {
        var libs = libs(
            LibraryNode.optional("a", jars("a"), Set.of()),
            LibraryNode.required("b", jars("b"), Set.of("b"))
        );
        var ex = assertThrows(UberException.class, () -> OptionalPruner.prune(libs));
        assertEquals(UberException.INVALID_BASIS, ex.code());
    }

    @Test
    void rejectsCycles() {
        var libs = libs(
            LibraryNode.required("a", jars("a"), Set.of("b")),
            LibraryNode.required("b", jars("b"), Set.of("a"))
        );
        var ex = assertThrows(UberException.class, () -> OptionalPruner.prune(libs));
        assertEquals(UberException.INVALID_BASIS, ex.code());
    }

    private static Map<String, LibraryNode> libs(LibraryNode... nodes) {
        Map<String, LibraryNode> libs = new LinkedHashMap<>();
        for (LibraryNode node : nodes) {
            libs.put(node.coordinate(), node);
        }
        return libs;
    }

    private static List<Path> jars(String name) {
        return List.of(Path.of("/repo", name + ".jar"));
    }
}
