package com.schemagen.compiler.model;

/**
 * A named struct or enum, owned by its package.
 *
 * After resolution the only change a declaration sees is {@link #setHash(long)}.
 */
public abstract class TypeDeclaration extends SchemaNode {
    private final String packageName;
    private Long hash;

    protected TypeDeclaration(String name, String packageName, String comment, SourcePosition position) {
        super(name, comment, position);
        this.packageName = packageName == null ? "" : packageName;
    }

    public String getPackageName() {
        return packageName;
    }

    public String getQualifiedName() {
        return packageName.isEmpty() ? name : packageName + "." + name;
    }

    /**
     * "struct" or "enum", as written in the schema language.
     */
    public abstract String getKeyword();

    public boolean isHashed() {
        return hash != null;
    }

    public long getHash() {
        if (hash == null) {
            throw new IllegalStateException(getQualifiedName() + " has not been hashed");
        }
        return hash;
    }

    public void setHash(long hash) {
        this.hash = hash;
    }

    @Override
    public String toString() {
        return getKeyword() + " " + getQualifiedName();
    }
}
