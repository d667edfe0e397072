package org.astx.ast.types;

import org.astx.ast.AstKind;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

import java.util.Objects;

/**
 * A calendar or clock type. Temporal types are only compatible with the same kind.
 */
public final class TemporalType extends DataType {

    /**
     * The temporal kinds and the labels they are written with.
     */
    public enum Kind {
        DATE("Date"),
        TIME("Time"),
        DATE_TIME("DateTime"),
        TIMESTAMP("Timestamp");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final Kind temporalKind;

    public TemporalType(Kind temporalKind) {
        this.temporalKind = Objects.requireNonNull(temporalKind, "temporalKind");
    }

    public Kind temporalKind() {
        return temporalKind;
    }

    @Override
    public TypeFamily family() {
        return TypeFamily.TEMPORAL;
    }

    @Override
    public AstKind kind() {
        return AstKind.TEMPORAL_TYPE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitTemporalType(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
    }

    @Override
    public String toString() {
        return temporalKind.label();
    }
}
