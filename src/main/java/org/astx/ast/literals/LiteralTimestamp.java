package org.astx.ast.literals;

import org.astx.ast.AstKind;
import org.astx.ast.types.DataTypes;
import org.astx.ast.visitor.AstVisitor;

import java.time.LocalDateTime;

/**
 * A point in time with optional fractional seconds. Either {@code T} or a single
 * space may separate date and time.
 */
public final class LiteralTimestamp extends TemporalLiteral<LocalDateTime> {

    public LiteralTimestamp(String text) {
        this(TemporalLiteral.<LocalDateTime>parse(text, s -> LocalDateTime.parse(s.replace(' ', 'T')),
                "yyyy-MM-dd[T| ]HH:mm:ss[.fffffffff]", DataTypes.timestamp()));
    }

    public LiteralTimestamp(LocalDateTime value) {
        super(DataTypes.timestamp(), value);
    }

    @Override
    public AstKind kind() {
        return AstKind.LITERAL_TIMESTAMP;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLiteralTimestamp(this);
    }
}
