package com.descant.ast;

import com.descant.Lexeme;
import com.descant.SourcePosition;
import com.descant.Token;

import java.util.List;

/**
 * A primary expression followed by one or more postfix operators.
 *
 * <p>This is a class rather than a record: capture groups refer to postfix
 * expressions by identity, and two textually equal captures are still two
 * captures.</p>
 */
public final class PostfixExpression implements Expression {

    /**
     * One postfix operator. Calls and subscripts carry their argument list,
     * member access carries the member name; both are null otherwise.
     */
    public record Op(Token op, ExpressionList arguments, IdExpression member) {

        public boolean isCall() {
            return op.is(Lexeme.LEFT_PAREN);
        }
    }

    private final Expression primary;
    private final List<Op> ops;
    private String captureSymbol;

    public PostfixExpression(Expression primary, List<Op> ops) {
        this.primary = primary;
        this.ops = List.copyOf(ops);
    }

    @Override
    public Kind kind() {
        return Kind.POSTFIX;
    }

    @Override
    public SourcePosition position() {
        return primary.position();
    }

    public Expression primary() {
        return primary;
    }

    public List<Op> ops() {
        return ops;
    }

    public boolean isCapture() {
        return !ops.isEmpty() && ops.get(ops.size() - 1).op().is(Lexeme.DOLLAR);
    }

    /** Name assigned when the capture group registered this expression, or null. */
    public String captureSymbol() {
        return captureSymbol;
    }

    void setCaptureSymbol(String symbol) {
        this.captureSymbol = symbol;
    }

    @Override
    public String toString() {
        return TreePrinter.print(this);
    }
}
