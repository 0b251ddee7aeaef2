package com.schemagen.compiler.diagnostics;

import static org.assertj.core.api.Assertions.*;

import java.io.PrintWriter;
import java.io.StringWriter;

import org.junit.jupiter.api.Test;

import com.schemagen.compiler.context.CompileDiagnostics;
import com.schemagen.compiler.model.SchemaFile;
import com.schemagen.compiler.parser.SchemaParser;
import com.schemagen.compiler.parser.SchemaTokenizer;
import com.schemagen.compiler.resolve.SchemaResolver;

class StructureDumpPrinterTest {

    @Test
    void testDump() {
        String schema = """
                // Geometry types.
                package geo;

                // A point.
                struct Point {
                    double x;
                    double y;
                }

                struct Buf {
                    const int32_t MAX = 4;
                    // length
                    int32_t n;
                    byte data[n];
                    int16_t fixed[MAX];
                }

                enum Color {
                    RED,
                    GREEN
                }
                """;

        assertThat(dump(schema)).isEqualTo(
                "// Geometry types.\n"
                + "package geo\n"
                + "// A point.\n"
                + "struct geo.Point [hash=0xd259512e30b44885]\n"
                + "\tdouble                x\n"
                + "\tdouble                y\n"
                + "struct geo.Buf [hash=0x2b420f19dbd0e004]\n"
                + "\tconst int32_t         MAX = 4\n"
                + "\t// length\n"
                + "\tint32_t               n\n"
                + "\tbyte                  data [ (var) n ]\n"
                + "\tint16_t               fixed [ (const) 4 ]\n"
                + "enum geo.Color [hash=0x246df4424be9d889]\n"
                + "\tRED                   = 0\n"
                + "\tGREEN                 = 1\n");
    }

    @Test
    void testDefaultPackageAndUnresolvedTypes() {
        String schema = """
                struct Holder {
                    Thing item;
                    other.Thing remote;
                }
                """;

        assertThat(dump(schema)).isEqualTo(
                "struct Holder [hash=0xb3626e40583f782e]\n"
                + "\tThing                 item\n"
                + "\tother.Thing           remote\n");
    }

    @Test
    void testMultiLineComments() {
        String block = """
                /*
                 * First.
                 *
                 * Third.
                 */
                struct Empty { }
                """;
        String lines = """
                // First.
                //
                // Third.
                struct Empty { }
                """;

        assertThat(dump(block)).startsWith("// First.\n// Third.\nstruct Empty [hash=");
        assertThat(dump(lines)).startsWith("// First.\n//\n// Third.\nstruct Empty [hash=");
    }

    @Test
    void testFormatHashPadsToFourteenDigits() {
        assertThat(StructureDumpPrinter.formatHash(0x12345678L)).isEqualTo("0x00000012345678");
        assertThat(StructureDumpPrinter.formatHash(-1L)).isEqualTo("0xffffffffffffffff");
    }

    private String dump(String source) {
        SchemaTokenizer tokenizer = new SchemaTokenizer(source, "test.lcm");
        SchemaFile file = new SchemaParser(tokenizer.tokenize(), "test.lcm").parse(new CompileDiagnostics());
        new SchemaResolver().bindDimensions(file);

        StringWriter buffer = new StringWriter();
        new StructureDumpPrinter(new PrintWriter(buffer)).print(file);
        return buffer.toString();
    }
}
