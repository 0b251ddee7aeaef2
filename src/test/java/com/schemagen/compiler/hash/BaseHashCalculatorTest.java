package com.schemagen.compiler.hash;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.schemagen.compiler.context.CompileDiagnostics;
import com.schemagen.compiler.model.EnumNode;
import com.schemagen.compiler.model.SchemaFile;
import com.schemagen.compiler.model.StructNode;
import com.schemagen.compiler.parser.SchemaParser;
import com.schemagen.compiler.parser.SchemaTokenizer;
import com.schemagen.compiler.resolve.SchemaResolver;

class BaseHashCalculatorTest {

    @Test
    void testStructBaseHash() {
        StructNode point = parse("struct Point { double x; double y; }").getStructs().get(0);

        assertThat(BaseHashCalculator.compute(point)).isEqualTo(0xd259512e30b44885L);
    }

    @Test
    void testArrayDimensionsAreHashed() {
        String schema = """
                struct Buf {
                    int32_t n;
                    byte data[n];
                    int16_t fixed[4];
                }
                """;

        assertThat(BaseHashCalculator.compute(parse(schema).getStructs().get(0))).isEqualTo(0x2b420f19dbd0e004L);
    }

    @Test
    void testStructNameIsNotHashed() {
        long a = BaseHashCalculator.compute(parse("struct A { int8_t x; }").getStructs().get(0));
        long b = BaseHashCalculator.compute(parse("struct B { int8_t x; }").getStructs().get(0));

        assertThat(a).isEqualTo(b).isEqualTo(0x066992dce54f76f0L);
    }

    @Test
    void testDeclaredMemberTypesContributeOnlyTheirShape() {
        String schema = """
                struct Inner { double d; }
                struct Other { int8_t i; }
                struct OuterA { Inner v; }
                struct OuterB { Other v; }
                """;

        SchemaFile file = parse(schema);

        assertThat(BaseHashCalculator.compute(file.getStructs().get(2)))
                .isEqualTo(BaseHashCalculator.compute(file.getStructs().get(3)));
    }

    @Test
    void testEnumBaseHash() {
        EnumNode color = (EnumNode) parse("enum Color { RED, GREEN }").getDeclarations().get(0);

        assertThat(BaseHashCalculator.compute(color)).isEqualTo(0x246df4424be9d889L);
    }

    @Test
    void testUpdate() {
        assertThat(BaseHashCalculator.update(0x12345678L, 1)).isEqualTo(0x1234567801L);
        assertThat(BaseHashCalculator.update(-1L, 0)).isEqualTo(0xFFL);
    }

    private SchemaFile parse(String source) {
        SchemaTokenizer tokenizer = new SchemaTokenizer(source, "test.lcm");
        SchemaFile file = new SchemaParser(tokenizer.tokenize(), "test.lcm").parse(new CompileDiagnostics());
        new SchemaResolver().bindDimensions(file);
        return file;
    }
}
