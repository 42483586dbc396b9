package work.lcod.uber.manifest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.jar.Attributes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.lcod.uber.shared.UberException;
import work.lcod.uber.support.UberTestSupport;

class ManifestSynthesizerTest {
    private Path workingDir;

    @BeforeEach
    void setUp() throws Exception {
        workingDir = Files.createTempDirectory("manifest-test");
    }

    @AfterEach
    void tearDown() {
        UberTestSupport.deleteQuietly(workingDir);
    }

    @Test
    void setsFixedAttributesInOrder() {
        var attributes = ManifestSynthesizer.synthesize(workingDir, Optional.empty(), Map.of(), "acme/build");

        assertEquals(List.of("Manifest-Version", "Created-By", "Build-Jdk-Spec"), List.copyOf(attributes.keySet()));
        assertEquals("1.0", attributes.get("Manifest-Version"));
        assertEquals("acme/build", attributes.get("Created-By"));
        assertEquals(System.getProperty("java.specification.version"), attributes.get("Build-Jdk-Spec"));
    }

    @Test
    void normalizesMainNamespaceToClassName() {
        var attributes = ManifestSynthesizer.synthesize(workingDir, Optional.of("my-app.core"), Map.of(), "acme/build");
        assertEquals("my_app.core", attributes.get("Main-Class"));
    }

    @Test
    void overridesWinOverDerivedAttributes() {
        var attributes = ManifestSynthesizer.synthesize(
            workingDir,
            Optional.of("my-app.core"),
            Map.of("Main-Class", "acme.Launcher", "Created-By", "someone"),
            "acme/build"
        );
        assertEquals("acme.Launcher", attributes.get("Main-Class"));
        assertEquals("someone", attributes.get("Created-By"));
    }

    @Test
    void overrideReplacesAttributeRegardlessOfCase() {
        var attributes = ManifestSynthesizer.synthesize(
            workingDir,
            Optional.of("x-y.z"),
            Map.of("main-class", "lower.Main"),
            "acme/build"
        );
        assertFalse(attributes.containsKey("Main-Class"));
        assertEquals("lower.Main", attributes.get("main-class"));
    }

    @Test
    void flagsMultiReleaseOnlyWhenVersionsDirectoryExists() throws Exception {
        var before = ManifestSynthesizer.synthesize(workingDir, Optional.empty(), Map.of(), "acme/build");
        assertFalse(before.containsKey("Multi-Release"));

        Files.createDirectories(workingDir.resolve("META-INF/versions/17"));
        var after = ManifestSynthesizer.synthesize(workingDir, Optional.empty(), Map.of(), "acme/build");
        assertEquals("true", after.get("Multi-Release"));
    }

    @Test
    void buildsJarManifest() {
        var manifest = ManifestSynthesizer.toManifest(Map.of("Manifest-Version", "1.0", "Main-Class", "a.B"));
        assertEquals("a.B", manifest.getMainAttributes().get(Attributes.Name.MAIN_CLASS));
    }

    @Test
    void rejectsValuesThatWouldInjectAttributes() {
        for (String value : List.of("line1\nEvil-Attr: injected", "a\rb", "a\u0000b")) {
            var ex = assertThrows(UberException.class, () -> ManifestSynthesizer.toManifest(Map.of("X-Note", value)));
            assertEquals(UberException.CONFIG, ex.code());
        }
    }

    @Test
    void rejectsInvalidAttributeNames() {
        var ex = assertThrows(UberException.class, () -> ManifestSynthesizer.toManifest(Map.of("bad name", "x")));
        assertEquals(UberException.CONFIG, ex.code());
    }
}
