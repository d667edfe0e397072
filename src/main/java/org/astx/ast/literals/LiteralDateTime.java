package org.astx.ast.literals;

import org.astx.ast.AstKind;
import org.astx.ast.types.DataTypes;
import org.astx.ast.visitor.AstVisitor;

import java.time.LocalDateTime;

/**
 * A local date and time in {@code yyyy-MM-ddTHH:mm[:ss]} form.
 */
public final class LiteralDateTime extends TemporalLiteral<LocalDateTime> {

    public LiteralDateTime(String text) {
        this(TemporalLiteral.<LocalDateTime>parse(text, LocalDateTime::parse, "yyyy-MM-ddTHH:mm[:ss]", DataTypes.dateTime()));
    }

    public LiteralDateTime(LocalDateTime value) {
        super(DataTypes.dateTime(), value);
    }

    @Override
    public AstKind kind() {
        return AstKind.LITERAL_DATE_TIME;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLiteralDateTime(this);
    }
}
