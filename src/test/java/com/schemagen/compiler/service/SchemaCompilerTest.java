package com.schemagen.compiler.service;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.schemagen.compiler.context.CompilerConfig;
import com.schemagen.compiler.error.ParseException;
import com.schemagen.compiler.error.UnknownTypeException;

/**
 * Integration tests for the compile pipeline.
 */
class SchemaCompilerTest {

    @TempDir
    Path tempDir;

    @Test
    void testCompileFiles() throws IOException {
        Path point = write("point.lcm", """
                package geo;
                struct Point {
                    double x;
                    double y;
                }
                """);
        Path route = write("route.lcm", """
                package nav;
                struct Route {
                    int32_t n;
                    geo.Point points[n];
                }
                """);

        CompileResult result = new SchemaCompiler(CompilerConfig.defaults()).compile(List.of(point, route));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getFilesParsed()).isEqualTo(2);
        assertThat(result.getTypesResolved()).isEqualTo(2);
        assertThat(result.getHashes()).containsOnlyKeys("geo.Point", "nav.Route");
        assertThat(result.getHashes().get("geo.Point")).isEqualTo(0xac98c8e6f2f4c650L);
        assertThat(result.getUnit().findType("nav.Route").orElseThrow().isHashed()).isTrue();
    }

    @Test
    void testParallelParseGivesSameResult() throws IOException {
        Path point = write("point.lcm", "package geo; struct Point { double x; double y; }");
        Path line = write("line.lcm", "package geo; struct Line { Point a; Point b; }");
        Path color = write("color.lcm", "package geo; enum Color { RED, GREEN }");

        CompileResult sequential = new SchemaCompiler(CompilerConfig.defaults())
                .compile(List.of(point, line, color));
        CompileResult parallel = new SchemaCompiler(CompilerConfig.builder().parallelParse(true).build())
                .compile(List.of(point, line, color));

        assertThat(parallel.isSuccess()).isTrue();
        assertThat(parallel.getHashes()).isEqualTo(sequential.getHashes());
        assertThat(parallel.getUnit().getFiles()).extracting(f -> f.getFileName())
                .containsExactly(point.toString(), line.toString(), color.toString());
    }

    @Test
    void testOneErrorPerFileIsCollected() throws IOException {
        Path good = write("good.lcm", "struct Good { int8_t v; }");
        Path bad1 = write("bad1.lcm", "struct Bad1 { int8_t v }");
        Path bad2 = write("bad2.lcm", "struct Bad2 { int8_t v; int8_t v; }");

        CompileResult result = new SchemaCompiler(CompilerConfig.defaults()).compile(List.of(good, bad1, bad2));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getDiagnostics().getErrors()).hasSize(2);
        assertThat(result.getDiagnostics().getErrors().get(0)).isInstanceOf(ParseException.class);
        assertThat(result.getDiagnostics().getErrors().get(0).getPosition().getFile()).isEqualTo(bad1.toString());
        assertThat(result.getErrorMessage()).startsWith(bad1.toString());
    }

    @Test
    void testResolutionErrorAbortsUnit() {
        CompileResult result = new SchemaCompiler(CompilerConfig.defaults())
                .compileSources(Map.of("wrapper.lcm", "struct Wrapper { InnerType field; }"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getUnit()).isNull();
        assertThat(result.getDiagnostics().getErrors()).singleElement().isInstanceOf(UnknownTypeException.class);
        assertThat(result.getErrorMessage())
                .isEqualTo("wrapper.lcm:1:17: unknown type 'InnerType' used in 'Wrapper'");
    }

    @Test
    void testMissingFileIsReported() {
        Path missing = tempDir.resolve("missing.lcm");

        CompileResult result = new SchemaCompiler(CompilerConfig.defaults()).compile(List.of(missing));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).startsWith(missing + ":0:0: cannot read file");
    }

    @Test
    void testPackagePrefix() {
        CompilerConfig config = CompilerConfig.builder().packagePrefix("com.acme").build();

        CompileResult result = new SchemaCompiler(config).compileSources(Map.of(
                "a.lcm", "package geo; struct Point { double x; }",
                "b.lcm", "package nav; struct Route { geo.Point start; }"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getHashes()).containsOnlyKeys("com.acme.geo.Point", "com.acme.nav.Route");
    }

    @Test
    void testIntWarningIsKeptWhenResolutionFails() {
        CompileResult result = new SchemaCompiler(CompilerConfig.defaults())
                .compileSources(Map.of("a.lcm", "struct A { int n; }"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getDiagnostics().getWarnings()).hasSize(1);
        assertThat(result.getDiagnostics().getErrors()).singleElement().isInstanceOf(UnknownTypeException.class);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
