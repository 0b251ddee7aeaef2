package com.schemagen.compiler.diagnostics;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import com.schemagen.compiler.hash.BaseHashCalculator;
import com.schemagen.compiler.model.ConstantNode;
import com.schemagen.compiler.model.Dimension;
import com.schemagen.compiler.model.DimensionMode;
import com.schemagen.compiler.model.EnumNode;
import com.schemagen.compiler.model.EnumValueNode;
import com.schemagen.compiler.model.FieldNode;
import com.schemagen.compiler.model.PackageNode;
import com.schemagen.compiler.model.SchemaFile;
import com.schemagen.compiler.model.SchemaNode;
import com.schemagen.compiler.model.SchemaNodeVisitor;
import com.schemagen.compiler.model.StructNode;
import com.schemagen.compiler.model.TypeDeclaration;

/**
 * Writes the structure dump of parsed files.
 *
 * Struct and field lines keep the legacy layout exactly:
 * <pre>
 * struct geo.Point [hash=0x0000123456789a]
 * 	double                x
 * 	int8_t                data [ (var) n ]
 * </pre>
 * Comment, package, constant and enum lines are added around them. Array
 * dimensions must be bound before printing.
 */
public class StructureDumpPrinter implements SchemaNodeVisitor {

    private final PrintWriter out;

    public StructureDumpPrinter(PrintWriter out) {
        this.out = out;
    }

    public void print(List<SchemaFile> files) {
        files.forEach(this::print);
    }

    public void print(SchemaFile file) {
        for (PackageNode packageNode : file.getPackages()) {
            packageNode.accept(this);
        }
        out.flush();
    }

    @Override
    public void visit(PackageNode packageNode) {
        printComment("", packageNode.getComment());
        if (!packageNode.isDefaultPackage()) {
            line("package " + packageNode.getName());
        }
        for (TypeDeclaration declaration : packageNode.getDeclarations()) {
            declaration.accept(this);
        }
    }

    @Override
    public void visit(StructNode struct) {
        printComment("", struct.getComment());
        line("struct " + struct.getQualifiedName() + " [hash=" + formatHash(BaseHashCalculator.compute(struct)) + "]");

        List<SchemaNode> members = new ArrayList<>();
        members.addAll(struct.getConstants());
        members.addAll(struct.getFields());
        members.sort(Comparator.comparingInt(StructureDumpPrinter::memberIndex));
        members.forEach(member -> member.accept(this));
    }

    @Override
    public void visit(EnumNode enumNode) {
        printComment("", enumNode.getComment());
        line("enum " + enumNode.getQualifiedName() + " [hash=" + formatHash(BaseHashCalculator.compute(enumNode)) + "]");
        enumNode.getValues().forEach(value -> value.accept(this));
    }

    @Override
    public void visit(FieldNode field) {
        printComment("\t", field.getComment());

        StringBuilder sb = new StringBuilder();
        sb.append('\t').append(String.format("%-20s", field.getType().getDisplayName()));
        sb.append("  ").append(field.getName());
        for (Dimension dimension : field.getDimensions()) {
            if (!dimension.isBound()) {
                throw new IllegalStateException("unbound array dimension '" + dimension.getSize() + "' on field "
                        + field.getName());
            }
            String mode = dimension.getMode() == DimensionMode.CONST ? "const" : "var";
            sb.append(" [ (").append(mode).append(") ").append(dimension.getSizeText()).append(" ]");
        }
        line(sb.toString());
    }

    @Override
    public void visit(ConstantNode constant) {
        printComment("\t", constant.getComment());
        line("\tconst " + String.format("%-14s", constant.getType().getTypeName()) + "  "
                + constant.getName() + " = " + constant.getValue());
    }

    @Override
    public void visit(EnumValueNode value) {
        printComment("\t", value.getComment());
        line("\t" + String.format("%-20s", value.getName()) + "  = " + value.getOrdinal());
    }

    /**
     * {@code 0x} followed by at least 14 hex digits of the unsigned value.
     */
    static String formatHash(long hash) {
        return "0x" + String.format("%014x", hash);
    }

    private void printComment(String indent, String comment) {
        if (comment == null) {
            return;
        }
        List<String> lines = new ArrayList<>(Arrays.asList(comment.split("\n", -1)));
        if (lines.size() > 1 && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        for (String text : lines) {
            line(text.isEmpty() ? indent + "//" : indent + "// " + text);
        }
    }

    private static int memberIndex(SchemaNode member) {
        if (member instanceof FieldNode field) {
            return field.getMemberIndex();
        }
        return ((ConstantNode) member).getMemberIndex();
    }

    private void line(String text) {
        out.print(text);
        out.print('\n');
    }
}
