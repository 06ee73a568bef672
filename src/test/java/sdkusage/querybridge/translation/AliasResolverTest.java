package sdkusage.querybridge.translation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class AliasResolverTest {

    private static final List<String> PRODUCTS = List.of(
        "Go-SDK", "Python-SDK", "JavaScript", "JavaScript (Node.JS)", "JavaScript RLC",
        "Java Fluent Premium", "Java Fluent Lite");

    private final AliasResolver aliases = new AliasResolver();

    @Test
    @DisplayName("Verbatim canonical values win over aliases")
    void canonicalFirst() {
        assertEquals(Set.of("Python-SDK"), aliases.resolve("python-sdk usage", PRODUCTS));
        assertEquals(Set.of("Java Fluent Lite"), aliases.resolve("Java Fluent Lite with java", PRODUCTS));
    }

    @Test
    @DisplayName("Aliases expand to every canonical value the schema offers")
    void aliasExpansion() {
        assertEquals(List.of("JavaScript", "JavaScript (Node.JS)", "JavaScript RLC"),
            List.copyOf(aliases.resolve("js usage", PRODUCTS)));
        assertEquals(Set.of("Go-SDK"), aliases.resolve("golang requests", PRODUCTS));
        assertTrue(aliases.resolve("terraform usage", PRODUCTS).isEmpty(), "targets outside the enum are dropped");
    }

    @Test
    @DisplayName("Matches are word-bounded")
    void wordBoundaries() {
        assertTrue(aliases.resolve("three days ago", PRODUCTS).isEmpty());
        assertEquals(Set.of("Java Fluent Lite", "Java Fluent Premium"), aliases.resolve("java only", PRODUCTS));
    }

    @Test
    @DisplayName("Null and empty input resolve to nothing")
    void emptyInputs() {
        assertTrue(aliases.resolve(null, PRODUCTS).isEmpty());
        assertTrue(aliases.resolve("go", List.of()).isEmpty());
    }

    @Test
    @DisplayName("Reverse lookup lists the aliases of a canonical value")
    void aliasesFor() {
        assertTrue(aliases.aliasesFor("Go-SDK").containsAll(List.of("go", "golang")));
        assertTrue(aliases.aliasesFor("Unknown").isEmpty());
    }
}
