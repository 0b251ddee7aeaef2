package com.schemagen.compiler.model;

/**
 * Visitor pattern interface for traversing the schema AST.
 */
public interface SchemaNodeVisitor {
    void visit(PackageNode packageNode);
    void visit(StructNode struct);
    void visit(EnumNode enumNode);
    void visit(FieldNode field);
    void visit(ConstantNode constant);
    void visit(EnumValueNode value);
}
