package org.astx.ast.literals;

import org.astx.ast.AstKind;
import org.astx.ast.types.DataTypes;
import org.astx.ast.visitor.AstVisitor;

import java.time.LocalDate;

/**
 * A calendar date in {@code yyyy-MM-dd} form.
 */
public final class LiteralDate extends TemporalLiteral<LocalDate> {

    public LiteralDate(String text) {
        this(TemporalLiteral.<LocalDate>parse(text, LocalDate::parse, "yyyy-MM-dd", DataTypes.date()));
    }

    public LiteralDate(LocalDate value) {
        super(DataTypes.date(), value);
    }

    @Override
    public AstKind kind() {
        return AstKind.LITERAL_DATE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLiteralDate(this);
    }
}
