package com.docbinder.core.translate.highlight;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class LanguageDetectorTest {

    private final LanguageDetector detector = new LanguageDetector();

    @Test
    void langForBlock_pythonSession_isPycon() {
        assertThat(detector.langForBlock(">>> 1 + 1\n2", "python")).isEqualTo("pycon");
        assertThat(detector.langForBlock(">>> 1 + 1\n2", "py3")).isEqualTo("pycon3");
    }

    @Test
    void langForBlock_validPython_staysPython() {
        assertThat(detector.langForBlock("def f(x):\n    return [x, (x + 1)]", "python")).isEqualTo("python");
    }

    @Test
    void langForBlock_multiLineDictMarkedPython_staysPython() {
        assertThat(detector.langForBlock("config = {\n    'debug': True,\n}\n", "python")).isEqualTo("python");
        assertThat(detector.langForBlock("names = {\n    'a',\n    'b'\n}", "py")).isEqualTo("python");
    }

    @Test
    void langForBlock_bracedCodeMarkedPython_isGuessed() {
        assertThat(detector.langForBlock("public class Widget {\n    int size = 1;\n}", "python")).isEqualTo("java");
    }

    @Test
    void langForBlock_cLikeCodeMarkedPython_isGuessed() {
        assertThat(detector.langForBlock("#include <stdio.h>\nint x = 1;", "python")).isEqualTo("c");
    }

    @Test
    void langForBlock_explicitLanguage_isKept() {
        assertThat(detector.langForBlock("SELECT 1", "Ruby")).isEqualTo("ruby");
        assertThat(detector.langForBlock(">>> not a session", "python3x")).isEqualTo("python3x");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "#!/usr/bin/env python|python",
        "#!/bin/sh|bash",
        "<?xml version=\"1.0\"?>|xml",
        "<html><body></body></html>|html",
        "$ ls -la|console",
        "{\"key\": 1}|json",
        "package com.example;|java",
        "select * from widgets|sql",
        "import os|python",
        "just some words|text"
    })
    void langForBlock_guess_usesContent(String source, String expected) {
        assertThat(detector.langForBlock(source, "guess")).isEqualTo(expected);
    }

    @Test
    void looksLikePython_ellipsisAndComments_areTolerated() {
        assertThat(detector.looksLikePython("def f():\n    ...\n# a comment with ( unbalanced")).isTrue();
        assertThat(detector.looksLikePython("x = f(\n")).isFalse();
        assertThat(detector.looksLikePython("int x = 1;")).isFalse();
        assertThat(detector.looksLikePython("s = ')'")).isTrue();
    }
}
