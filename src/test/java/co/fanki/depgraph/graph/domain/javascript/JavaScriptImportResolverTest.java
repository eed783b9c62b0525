package co.fanki.depgraph.graph.domain.javascript;

import co.fanki.depgraph.graph.domain.CandidateFiles;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link JavaScriptImportResolver}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class JavaScriptImportResolverTest {

    private static final String APP = "/web/src/app.ts";

    private final JavaScriptImportResolver resolver =
            new JavaScriptImportResolver();

    private final CandidateFiles candidates = new CandidateFiles(List.of(
            APP,
            "/web/src/api.ts",
            "/web/src/util/index.ts",
            "/web/src/legacy.js",
            "/web/src/view.tsx",
            "/web/src/app.test.ts"));

    // -- extractImports --

    @Test
    void whenExtracting_givenEveryImportForm_shouldKeepSourceOrder() {
        final List<String> imports = resolver.extractImports("""
                import { a } from './api.js';
                import type { T } from "./types";
                import {
                  first,
                  second,
                } from './multi';
                export * from './util';
                import './polyfill';
                export const answer = 42;
                const lazy = () => import('./view');
                const legacy = require('./legacy');
                import React from 'react';
                """);

        assertEquals(List.of("./api.js", "./types", "./multi", "./util",
                "./polyfill", "./view", "./legacy", "react"), imports);
    }

    // -- resolve --

    @Test
    void whenResolving_givenJsSpecifierForTsSource_shouldFindTsFile() {
        assertEquals(Optional.of("/web/src/api.ts"),
                resolver.resolve("./api.js", APP, candidates));
    }

    @Test
    void whenResolving_givenDirectory_shouldFindIndexFile() {
        assertEquals(Optional.of("/web/src/util/index.ts"),
                resolver.resolve("./util", APP, candidates));
    }

    @Test
    void whenResolving_givenExtensionlessSpecifier_shouldTryKnownExtensions() {
        assertEquals(Optional.of("/web/src/view.tsx"),
                resolver.resolve("./view", APP, candidates));
        assertEquals(Optional.of("/web/src/legacy.js"),
                resolver.resolve("./legacy", APP, candidates));
    }

    @Test
    void whenResolving_givenParentDirectory_shouldNormalizePath() {
        assertEquals(Optional.of("/web/src/api.ts"),
                resolver.resolve("../api", "/web/src/util/index.ts",
                        candidates));
    }

    @Test
    void whenResolving_givenPackageOrMissingFile_shouldReturnEmpty() {
        assertFalse(resolver.resolve("react", APP, candidates).isPresent());
        assertFalse(resolver.resolve("../outside", APP, candidates)
                .isPresent());
    }

    // -- isTestFile --

    @Test
    void whenCheckingTestFile_givenConventions_shouldDetectTests() {
        assertTrue(resolver.isTestFile("/web/src/app.test.ts"));
        assertTrue(resolver.isTestFile("/web/src/app.spec.js"));
        assertTrue(resolver.isTestFile("/web/src/__tests__/app.js"));
        assertFalse(resolver.isTestFile(APP));
    }

}
