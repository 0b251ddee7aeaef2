package com.schemagen.compiler.hash;

import static org.assertj.core.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.schemagen.compiler.context.CompileDiagnostics;
import com.schemagen.compiler.context.CompilerConfig;
import com.schemagen.compiler.model.SchemaFile;
import com.schemagen.compiler.model.StructNode;
import com.schemagen.compiler.parser.SchemaParser;
import com.schemagen.compiler.parser.SchemaTokenizer;
import com.schemagen.compiler.resolve.ResolvedUnit;
import com.schemagen.compiler.resolve.SchemaResolver;
import com.schemagen.compiler.service.CompileResult;
import com.schemagen.compiler.service.SchemaCompiler;

/**
 * Unit tests for TypeHashEngine.
 */
class TypeHashEngineTest {

    private static final String POINT = """
            package geo;
            struct Point {
                double x;
                double y;
            }
            """;

    private static final String ROUTE = """
            package nav;
            struct Route {
                int32_t n;
                geo.Point points[n];
                geo.Point corners[4];
            }
            """;

    @Test
    void testKnownFingerprints() {
        ResolvedUnit unit = resolve(POINT + """
                struct Line {
                    Point a;
                    Point b;
                }
                enum Color {
                    RED,
                    GREEN
                }
                """);

        Map<String, Long> hashes = TypeHashEngine.hashAll(unit);

        assertThat(hashes.get("geo.Point")).isEqualTo(0xac98c8e6f2f4c650L);
        assertThat(hashes.get("geo.Line")).isEqualTo(0xc450c4fad0afcb54L);
        assertThat(hashes.get("geo.Color")).isEqualTo(0xcc2678087a52545cL);
        assertThat(unit.getHash("geo.Point")).isEqualTo(0xac98c8e6f2f4c650L);
    }

    @Test
    void testSwappingFieldsChangesFingerprint() {
        long original = hashOf(POINT, "geo.Point");
        long swapped = hashOf("""
                package geo;
                struct Point {
                    double y;
                    double x;
                }
                """, "geo.Point");

        assertThat(original).isNotZero();
        assertThat(swapped).isNotZero();
        assertThat(swapped).isNotEqualTo(original).isEqualTo(0xac98c8e6f2f4c452L);
    }

    @Test
    void testFingerprintIgnoresFileOrder() {
        Map<String, String> forward = new LinkedHashMap<>();
        forward.put("point.lcm", POINT);
        forward.put("route.lcm", ROUTE);

        Map<String, String> reversed = new LinkedHashMap<>();
        reversed.put("route.lcm", ROUTE);
        reversed.put("point.lcm", POINT);

        SchemaCompiler compiler = new SchemaCompiler(CompilerConfig.defaults());
        CompileResult a = compiler.compileSources(forward);
        CompileResult b = compiler.compileSources(reversed);

        assertThat(a.isSuccess()).isTrue();
        assertThat(b.isSuccess()).isTrue();
        assertThat(a.getHashes()).isEqualTo(b.getHashes());
    }

    @Test
    void testFingerprintIsDeterministicAcrossIndependentBuilds() {
        long first = hashOf(POINT + ROUTE, "nav.Route");
        long second = hashOf(POINT + ROUTE, "nav.Route");

        assertThat(first).isEqualTo(second);
    }

    @Test
    void testNestedTypeChangesPropagate() {
        long before = hashOf(POINT + ROUTE, "nav.Route");
        long after = hashOf(POINT.replace("double y;", "float y;") + ROUTE, "nav.Route");

        assertThat(after).isNotEqualTo(before);
    }

    @Test
    void testArrayShapeIsPartOfFingerprint() {
        long four = hashOf("struct A { int8_t v[4]; }", "A");
        long five = hashOf("struct A { int8_t v[5]; }", "A");
        long dynamic = hashOf("struct A { int32_t n; int8_t v[n]; }", "A");
        long scalar = hashOf("struct A { int8_t v; }", "A");

        assertThat(List.of(four, five, dynamic, scalar)).doesNotHaveDuplicates();
    }

    @Test
    void testEnumFingerprintUsesNamesOnly() {
        long implicit = hashOf("enum E { A, B }", "E");
        long explicit = hashOf("enum E { A = 10, B = 20 }", "E");
        long renamed = hashOf("enum E { A, C }", "E");

        assertThat(explicit).isEqualTo(implicit);
        assertThat(renamed).isNotEqualTo(implicit);
    }

    @Test
    void testDynamicCycleTerminatesAndIsStable() {
        String schema = """
                struct A {
                    int32_t n;
                    B items[n];
                }
                struct B {
                    A owner;
                }
                """;

        ResolvedUnit unit = resolve(schema);
        TypeHashEngine engine = new TypeHashEngine(unit.getGraph());

        long a1 = engine.hash(unit.findType("A").orElseThrow());
        long b1 = engine.hash(unit.findType("B").orElseThrow());
        long a2 = engine.hash(unit.findType("A").orElseThrow());

        assertThat(a1).isNotZero().isEqualTo(a2);
        assertThat(b1).isNotZero().isNotEqualTo(a1);

        Map<String, Long> all = TypeHashEngine.hashAll(resolve(schema));
        assertThat(all).containsEntry("A", a1).containsEntry("B", b1);
    }

    @Test
    void testFixedRecursionReachingEngineIsAFault() {
        SchemaFile file = parseFile("struct N { int8_t v; N next; }");
        StructNode node = file.getStructs().get(0);
        node.getFields().get(1).getType().resolveTo(node);

        TypeHashEngine engine = new TypeHashEngine(null);

        assertThatThrownBy(() -> engine.hash(node))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("fixed-size recursion");
    }

    @Test
    void testUnresolvedTypeIsAFault() {
        StructNode wrapper = parseFile("struct Wrapper { InnerType field; }").getStructs().get(0);

        assertThatThrownBy(() -> new TypeHashEngine(null).hash(wrapper))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("unresolved type 'InnerType'");
    }

    @Test
    void testMixingPrimitives() {
        assertThat(TypeHashEngine.mixByte(0x12345678L, 0x9A)).isEqualTo(0x123456789AL);
        assertThat(TypeHashEngine.mixByte(0xFF00000000000000L, 0)).isEqualTo(0xFFL);
        assertThat(TypeHashEngine.mixWord(0L, 0x0102030405060708L)).isEqualTo(0x0102030405060708L);
        assertThat(TypeHashEngine.mixBytes(0L, "AB")).isEqualTo(0x4142L);
    }

    private long hashOf(String source, String qualifiedName) {
        ResolvedUnit unit = resolve(source);
        return TypeHashEngine.hashAll(unit).get(qualifiedName);
    }

    private ResolvedUnit resolve(String source) {
        return new SchemaResolver().resolve(List.of(parseFile(source)));
    }

    private SchemaFile parseFile(String source) {
        SchemaTokenizer tokenizer = new SchemaTokenizer(source, "test.lcm");
        return new SchemaParser(tokenizer.tokenize(), "test.lcm").parse(new CompileDiagnostics());
    }
}
