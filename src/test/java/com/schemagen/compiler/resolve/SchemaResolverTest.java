package com.schemagen.compiler.resolve;

import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.schemagen.compiler.context.CompileDiagnostics;
import com.schemagen.compiler.error.DuplicateTypeException;
import com.schemagen.compiler.error.IllegalRecursionException;
import com.schemagen.compiler.error.UnknownDimensionFieldException;
import com.schemagen.compiler.error.UnknownTypeException;
import com.schemagen.compiler.model.Dimension;
import com.schemagen.compiler.model.DimensionMode;
import com.schemagen.compiler.model.FieldNode;
import com.schemagen.compiler.model.SchemaFile;
import com.schemagen.compiler.model.StructNode;
import com.schemagen.compiler.parser.SchemaParser;
import com.schemagen.compiler.parser.SchemaTokenizer;

/**
 * Unit tests for SchemaResolver and TypeGraph.
 */
class SchemaResolverTest {

    private final SchemaResolver resolver = new SchemaResolver();

    @Test
    void testUnknownTypeNamesReferenceAndUser() {
        String schema = """
                struct Wrapper {
                    InnerType field;
                }
                """;

        UnknownTypeException e = catchThrowableOfType(() -> resolve(schema), UnknownTypeException.class);

        assertThat(e.getReference()).isEqualTo("InnerType");
        assertThat(e.getUsedIn()).isEqualTo("Wrapper");
        assertThat(e.getPosition().getLine()).isEqualTo(2);
        assertThat(e).hasMessageContaining("InnerType").hasMessageContaining("Wrapper");
    }

    @Test
    void testResolveAcrossFiles() {
        String points = """
                package geo;
                struct Point {
                    double x;
                    double y;
                }
                """;
        String routes = """
                package nav;
                struct Route {
                    int32_t n;
                    geo.Point points[n];
                }
                """;

        ResolvedUnit unit = resolve(points, routes);

        StructNode route = (StructNode) unit.findType("nav.Route").orElseThrow();
        FieldNode field = route.findField("points").orElseThrow();
        assertThat(field.getType().isDeclared()).isTrue();
        assertThat(field.getType().getDeclaration()).isSameAs(unit.findType("geo.Point").orElseThrow());

        Dimension dimension = field.getDimensions().get(0);
        assertThat(dimension.getMode()).isEqualTo(DimensionMode.VAR);
        assertThat(dimension.getLengthField()).isSameAs(route.findField("n").orElseThrow());
        assertThat(field.isDynamic()).isTrue();

        assertThat(unit.getTypes().keySet()).containsExactly("geo.Point", "nav.Route");
        assertThat(unit.getPackages().keySet()).containsExactly("geo", "nav");
    }

    @Test
    void testSamePackageFallback() {
        String schema = """
                package geo;
                struct Line {
                    Point a;
                    Point b;
                }
                struct Point {
                    double x;
                }
                """;

        ResolvedUnit unit = resolve(schema);

        StructNode line = (StructNode) unit.findType("geo.Line").orElseThrow();
        assertThat(line.getFields().get(0).getType().getDisplayName()).isEqualTo("geo.Point");
    }

    @Test
    void testSimpleNameBindsToItsOwnPackage() {
        String schema = """
                struct Point {
                    double x;
                }
                package geo;
                struct Point {
                    double y;
                }
                struct Holder {
                    Point p;
                }
                """;

        ResolvedUnit unit = resolve(schema);

        StructNode holder = (StructNode) unit.findType("geo.Holder").orElseThrow();
        assertThat(holder.getFields().get(0).getType().getDeclaration().getQualifiedName()).isEqualTo("geo.Point");
    }

    @Test
    void testSimpleNameDoesNotReachDefaultPackage() {
        String schema = """
                struct Point {
                    double x;
                }
                package geo;
                struct Holder {
                    Point p;
                }
                """;

        UnknownTypeException e = catchThrowableOfType(() -> resolve(schema), UnknownTypeException.class);

        assertThat(e).hasMessageContaining("unknown type 'Point' used in 'geo.Holder'");
    }

    @Test
    void testDuplicateTypeAcrossFiles() {
        String first = """
                package geo;
                struct Point { double x; }
                """;
        String second = """
                package geo;

                struct Point { double y; }
                """;

        DuplicateTypeException e = catchThrowableOfType(() -> resolve(first, second), DuplicateTypeException.class);

        assertThat(e.getQualifiedName()).isEqualTo("geo.Point");
        assertThat(e.getFirstDeclaredAt().getFile()).isEqualTo("file0.lcm");
        assertThat(e.getPosition().getFile()).isEqualTo("file1.lcm");
        assertThat(e.getPosition().getLine()).isEqualTo(3);
    }

    @Test
    void testConstantDimension() {
        String schema = """
                struct Buffer {
                    const int32_t SIZE = 16;
                    int8_t data[SIZE];
                }
                """;

        StructNode buffer = (StructNode) resolve(schema).findType("Buffer").orElseThrow();
        Dimension dimension = buffer.getFields().get(0).getDimensions().get(0);

        assertThat(dimension.getMode()).isEqualTo(DimensionMode.CONST);
        assertThat(dimension.getSizeText()).isEqualTo("16");
        assertThat(dimension.getConstantValue()).isEqualTo(16L);
        assertThat(dimension.getConstant().getName()).isEqualTo("SIZE");
    }

    @Test
    void testUnknownDimension() {
        UnknownDimensionFieldException e = catchThrowableOfType(
                () -> resolve("struct A { int8_t data[len]; }"), UnknownDimensionFieldException.class);

        assertThat(e.getFieldName()).isEqualTo("len");
        assertThat(e.getStructName()).isEqualTo("A");
        assertThat(e.getReason()).isEqualTo(SchemaResolver.REASON_UNKNOWN);
    }

    @Test
    void testDimensionDeclaredAfterArray() {
        UnknownDimensionFieldException e = catchThrowableOfType(
                () -> resolve("struct A { int8_t data[n]; int32_t n; }"), UnknownDimensionFieldException.class);

        assertThat(e.getReason()).isEqualTo(SchemaResolver.REASON_DECLARED_LATER);
    }

    @Test
    void testDimensionMustBeScalarInteger() {
        assertThat(catchThrowableOfType(() -> resolve("struct A { double n; int8_t data[n]; }"),
                UnknownDimensionFieldException.class).getReason())
                .isEqualTo(SchemaResolver.REASON_NOT_SCALAR_INTEGER);
        assertThat(catchThrowableOfType(() -> resolve("struct A { int32_t n[2]; int8_t data[n]; }"),
                UnknownDimensionFieldException.class).getReason())
                .isEqualTo(SchemaResolver.REASON_NOT_SCALAR_INTEGER);
        assertThat(catchThrowableOfType(() -> resolve("struct A { const double N = 2.0; int8_t data[N]; }"),
                UnknownDimensionFieldException.class).getReason())
                .isEqualTo(SchemaResolver.REASON_CONSTANT_NOT_INTEGER);
        assertThat(catchThrowableOfType(() -> resolve("struct A { const int8_t N = -1; int8_t data[N]; }"),
                UnknownDimensionFieldException.class).getReason())
                .isEqualTo(SchemaResolver.REASON_CONSTANT_NOT_POSITIVE);
    }

    @Test
    void testFixedSelfEmbeddingIsRejected() {
        String schema = """
                struct Node {
                    int32_t value;
                    Node next;
                }
                """;

        IllegalRecursionException e = catchThrowableOfType(() -> resolve(schema), IllegalRecursionException.class);

        assertThat(e.getCycle()).containsExactly("Node", "Node");
        assertThat(e.getPosition().getLine()).isEqualTo(3);
    }

    @Test
    void testFixedArrayRecursionIsRejected() {
        assertThatThrownBy(() -> resolve("struct Node { Node kids[4]; }"))
                .isInstanceOf(IllegalRecursionException.class);
    }

    @Test
    void testFixedCycleThroughTwoTypes() {
        String schema = """
                struct B { A a; }
                struct A { B b; }
                """;

        IllegalRecursionException e = catchThrowableOfType(() -> resolve(schema), IllegalRecursionException.class);

        assertThat(e.getCycle()).containsExactly("A", "B", "A");
        assertThat(e).hasMessageContaining("illegal fixed-size recursion: A -> B -> A");
    }

    @Test
    void testDynamicCycleIsAllowed() {
        String schema = """
                struct Tree {
                    int32_t count;
                    Tree children[count];
                }
                struct Leaf {
                    double weight;
                }
                """;

        ResolvedUnit unit = resolve(schema);
        TypeGraph graph = unit.getGraph();

        assertThat(graph.findFixedCycle()).isEmpty();
        assertThat(graph.isOnCycle(unit.findType("Tree").orElseThrow())).isTrue();
        assertThat(graph.isOnCycle(unit.findType("Leaf").orElseThrow())).isFalse();
        assertThat(graph.getEdges(unit.findType("Tree").orElseThrow()))
                .extracting(TypeGraph.Edge::getKind)
                .containsExactly(TypeGraph.EdgeKind.DYNAMIC);
    }

    @Test
    void testBindDimensionsIsRepeatable() {
        SchemaFile file = parseFile("struct A { int32_t n; int8_t data[n]; }", "a.lcm");

        resolver.bindDimensions(file);
        resolver.bindDimensions(file);

        Dimension dimension = file.getStructs().get(0).getFields().get(1).getDimensions().get(0);
        assertThat(dimension.isDynamic()).isTrue();
    }

    private ResolvedUnit resolve(String... sources) {
        List<SchemaFile> files = new ArrayList<>();
        for (int i = 0; i < sources.length; i++) {
            files.add(parseFile(sources[i], "file" + i + ".lcm"));
        }
        return resolver.resolve(files);
    }

    private SchemaFile parseFile(String source, String fileName) {
        SchemaTokenizer tokenizer = new SchemaTokenizer(source, fileName);
        return new SchemaParser(tokenizer.tokenize(), fileName).parse(new CompileDiagnostics());
    }
}
