package org.pragmatica.nix.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.nix.tree.NodeCache;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The tree text always equals the input, whatever the input looks like.
 */
class RoundTripTest {
    private static final List<String> CORPUS = List.of(
        "{ pkgs ? import <nixpkgs> {}, lib, ... }@args:\nwith lib;\nlet\n  name = \"hello-${version}\";\n  version = \"2.12\";\nin pkgs.stdenv.mkDerivation {\n  inherit name version;\n  src = ./src/${name};\n  meta.license = licenses.gpl3Plus or null;\n}\n",
        "rec {\n  # comment\n  a = ''\n    indented ''${escaped}\n    ${toString b}\n  '';\n  b = [ 1 2.5 (-3) https://example.org/x ];\n  c = if a ? x.y then !false else a // { z = 1; };\n}\n",
        "let { body = assert x != null; x: y: x ++ y; x = /* block */ 1 -> 2 || 3 && 4; }",
        "map (x: x * 2 / 3 - 1 + 4) (builtins.filter (v: v >= 0 && v <= 9 || v < 0 == v > 9) list)"
    );

    private static final String FRAGMENTS = "{}[]();:=.,?@!+-*/<>|&\"'$ \n\tab1";

    @Test
    void corpus_parsesWithoutErrors() {
        for (var source : CORPUS) {
            var output = Parser.parse(source);
            assertEquals(List.of(), output.errors(), source);
            assertEquals(source, output.green().text());
        }
    }

    @Test
    void mutatedCorpus_isLossless() {
        var random = new Random(0x5EED);
        for (int round = 0; round < 400; round++) {
            var source = mutate(CORPUS.get(random.nextInt(CORPUS.size())), random);
            assertLossless(source);
        }
    }

    @Test
    void randomCharacters_areLossless() {
        var random = new Random(42);
        for (int round = 0; round < 400; round++) {
            var sb = new StringBuilder();
            int length = random.nextInt(60);
            for (int i = 0; i < length; i++) {
                sb.append(FRAGMENTS.charAt(random.nextInt(FRAGMENTS.length())));
            }
            assertLossless(sb.toString());
        }
    }

    @Test
    void unbalancedDelimiters_areLossless() {
        for (var source : List.of("{", "}", "[[[", ")))", "\"${", "''${ {", "${", "./a/${", "let in", "if then else",
                                  "a.", "a.${", "{ a.b", "x: ", "{ a, b", "{ a, a }: a", "a@{ }@b: 1", "'''", "/*")) {
            assertLossless(source);
        }
    }

    @Test
    void sharedCache_reusesEqualSubtrees() {
        var cache = new NodeCache();
        var first = Parser.parse(CORPUS.get(0), ParserConfig.DEFAULT, cache);
        var second = Parser.parse(CORPUS.get(0), ParserConfig.DEFAULT, cache);

        assertEquals(first.green(), second.green());
        assertEquals(first.errors(), second.errors());
    }

    private static void assertLossless(String source) {
        var output = assertDoesNotThrow(() -> Parser.parse(source), source);
        assertEquals(source, output.green().text(), source);
        assertEquals(source.length(), output.green().textLength(), source);
        assertEquals(output.green(), Parser.parse(source).green(), source);
    }

    private static String mutate(String source, Random random) {
        var sb = new StringBuilder(source);
        int edits = 1 + random.nextInt(4);
        for (int i = 0; i < edits && sb.length() > 0; i++) {
            int at = random.nextInt(sb.length());
            switch (random.nextInt(3)) {
                case 0 -> sb.deleteCharAt(at);
                case 1 -> sb.insert(at, FRAGMENTS.charAt(random.nextInt(FRAGMENTS.length())));
                default -> sb.replace(at, Math.min(sb.length(), at + random.nextInt(8)), "");
            }
        }
        return sb.toString();
    }
}
