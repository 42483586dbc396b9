package work.lcod.uber.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.lcod.uber.shared.UberException;

class ParamsFileTest {
    @Test
    void readsBuildAndManifestTables() {
        var params = ParamsFile.parse("""
            [build]
            class-dir = "out/classes"
            uber-file = "dist/app.jar"
            main = "my-app.core"

            [manifest]
            "Implementation-Title" = "my-app"
            "Build-Number" = 7
            """, "uber.toml");

        assertEquals("out/classes", params.get("class-dir"));
        assertEquals("dist/app.jar", params.get("uber-file"));
        assertEquals("my-app.core", params.get("main"));
        assertEquals("my-app", params.manifest().get("Implementation-Title"));
        assertEquals("7", params.manifest().get("Build-Number"));
    }

    @Test
    void missingTablesAreEmpty() {
        var params = ParamsFile.parse("", "uber.toml");
        assertTrue(params.build().isEmpty());
        assertTrue(params.manifest().isEmpty());
    }

    @Test
    void syntaxErrorsAreConfigFailures() {
        var ex = assertThrows(UberException.class, () -> ParamsFile.parse("[build\nmain = ", "uber.toml"));
        assertEquals(UberException.CONFIG, ex.code());
    }
}
