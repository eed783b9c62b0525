package co.fanki.depgraph.graph.domain.java;

import co.fanki.depgraph.graph.domain.CandidateFiles;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link JavaImportResolver}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class JavaImportResolverTest {

    private static final String ROOT = "/repo/src/main/java/co/fanki/app/";

    private final JavaImportResolver resolver = new JavaImportResolver();

    private final CandidateFiles candidates = new CandidateFiles(List.of(
            ROOT + "controller/UserController.java",
            ROOT + "service/UserService.java",
            ROOT + "service/Defaults.java",
            ROOT + "model/User.kt"));

    // -- extractImports --

    @Test
    void whenExtracting_givenRegularAndStaticImports_shouldReturnClasses() {
        final List<String> imports = resolver.extractImports("""
                package co.fanki.app.controller;

                import co.fanki.app.service.UserService;
                import static co.fanki.app.service.Defaults.PAGE_SIZE;
                import java.util.*;
                import org.springframework.web.bind.annotation.GetMapping;

                public class UserController {
                    // import co.fanki.app.Ignored;
                }
                """);

        assertEquals(List.of(
                "co.fanki.app.service.UserService",
                "co.fanki.app.service.Defaults",
                "org.springframework.web.bind.annotation.GetMapping"),
                imports);
    }

    @Test
    void whenExtracting_givenImportAfterTypeDeclaration_shouldStopScanning() {
        final List<String> imports = resolver.extractImports("""
                public class A {
                }
                import co.fanki.app.Late;
                """);

        assertTrue(imports.isEmpty());
    }

    @Test
    void whenParsingImportLine_givenWildcard_shouldReturnNull() {
        assertNull(resolver.parseImportLine("import co.fanki.app.*;"));
        assertNull(resolver.parseImportLine("package co.fanki.app;"));
        assertEquals("a.b.C", resolver.parseImportLine("import a.b.C; // x"));
    }

    // -- resolve --

    @Test
    void whenResolving_givenProjectClass_shouldFindItsFile() {
        assertEquals(Optional.of(ROOT + "service/UserService.java"),
                resolver.resolve("co.fanki.app.service.UserService",
                        ROOT + "controller/UserController.java",
                        candidates));
    }

    @Test
    void whenResolving_givenKotlinClass_shouldFindKotlinFile() {
        assertEquals(Optional.of(ROOT + "model/User.kt"),
                resolver.resolve("co.fanki.app.model.User",
                        ROOT + "service/UserService.java", candidates));
    }

    @Test
    void whenResolving_givenLibraryClass_shouldReturnEmpty() {
        assertFalse(resolver.resolve("org.springframework.stereotype.Service",
                ROOT + "service/UserService.java", candidates).isPresent());
    }

    @Test
    void whenResolving_givenNestedTypeOfSameFile_shouldReturnEmpty() {
        assertFalse(resolver.resolve("co.fanki.app.service.UserService.Page",
                ROOT + "service/UserService.java", candidates).isPresent());
    }

    // -- isTestFile --

    @Test
    void whenCheckingTestFile_givenConventions_shouldDetectTests() {
        assertTrue(resolver.isTestFile("/repo/src/test/java/a/B.java"));
        assertTrue(resolver.isTestFile("/repo/src/main/java/a/BTest.java"));
        assertFalse(resolver.isTestFile(ROOT + "service/UserService.java"));
    }

}
