package org.astx.ast.literals;

import org.astx.ast.AstKind;
import org.astx.ast.types.DataTypes;
import org.astx.ast.visitor.AstVisitor;

import java.time.LocalTime;

/**
 * A time of day in {@code HH:mm} or {@code HH:mm:ss} form.
 */
public final class LiteralTime extends TemporalLiteral<LocalTime> {

    public LiteralTime(String text) {
        this(TemporalLiteral.<LocalTime>parse(text, LocalTime::parse, "HH:mm[:ss]", DataTypes.time()));
    }

    public LiteralTime(LocalTime value) {
        super(DataTypes.time(), value);
    }

    @Override
    public AstKind kind() {
        return AstKind.LITERAL_TIME;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLiteralTime(this);
    }
}
