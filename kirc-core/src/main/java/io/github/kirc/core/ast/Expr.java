package io.github.kirc.core.ast;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A typed expression. Every expression carries the type the front end resolved for it.
 */
public abstract class Expr extends AstNode {
    public final AstType type;

    protected Expr(Span span, AstType type) {
        super(span);
        this.type = type;
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visitLiteral(Literal expr);

        R visitVarRef(VarRef expr);

        R visitGlobalVar(GlobalVar expr);

        R visitUnary(Unary expr);

        R visitBinary(Binary expr);

        R visitCast(Cast expr);

        R visitCall(Call expr);

        R visitIf(If expr);

        R visitMatch(Match expr);

        R visitBlock(BlockExpr expr);

        R visitAddrOf(AddrOf expr);

        R visitDeref(Deref expr);
    }

    public enum UnaryOp {
        NEG,
        /** Logical not on {@code bool}, bitwise complement on integers. */
        NOT,
    }

    public enum BinaryOp {
        ADD, SUB, MUL, DIV, REM,
        EQ, NE, LT, LE, GT, GE,
        BIT_AND, BIT_OR, BIT_XOR, SHL, SHR,
        /** Short-circuiting {@code &&}. */
        AND,
        /** Short-circuiting {@code ||}. */
        OR,
    }

    /**
     * A literal; the value is a {@link Long}, {@link Double} or {@link Boolean}.
     */
    public static final class Literal extends Expr {
        public final Object value;

        public Literal(Span span, AstType type, Object value) {
            super(span, type);
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    public static final class VarRef extends Expr {
        public final Binding binding;

        public VarRef(Span span, Binding binding) {
            super(span, binding.type);
            this.binding = binding;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVarRef(this);
        }
    }

    /**
     * A read of a global variable of the program.
     */
    public static final class GlobalVar extends Expr {
        public final String name;

        public GlobalVar(Span span, AstType type, String name) {
            super(span, type);
            this.name = name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGlobalVar(this);
        }
    }

    public static final class Unary extends Expr {
        public final UnaryOp op;
        public final Expr operand;

        public Unary(Span span, AstType type, UnaryOp op, Expr operand) {
            super(span, type);
            this.op = op;
            this.operand = operand;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnary(this);
        }
    }

    public static final class Binary extends Expr {
        public final BinaryOp op;
        public final Expr lhs;
        public final Expr rhs;

        public Binary(Span span, AstType type, BinaryOp op, Expr lhs, Expr rhs) {
            super(span, type);
            this.op = op;
            this.lhs = lhs;
            this.rhs = rhs;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    public static final class Cast extends Expr {
        public final Expr operand;

        public Cast(Span span, AstType target, Expr operand) {
            super(span, target);
            this.operand = operand;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCast(this);
        }
    }

    public static final class Call extends Expr {
        public final String callee;
        public final List<Expr> args;

        public Call(Span span, AstType type, String callee, List<Expr> args) {
            super(span, type);
            this.callee = callee;
            this.args = Collections.unmodifiableList(new ArrayList<>(args));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }

    /**
     * An {@code if}, producing a value when its type has one (in which case it has an else branch).
     */
    public static final class If extends Expr {
        public final Expr cond;
        public final Expr then;
        @Nullable
        public final Expr otherwise;

        public If(Span span, AstType type, Expr cond, Expr then, @Nullable Expr otherwise) {
            super(span, type);
            this.cond = cond;
            this.then = then;
            this.otherwise = otherwise;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIf(this);
        }
    }

    public static final class MatchArm {
        public final long[] patterns;
        public final Expr body;

        public MatchArm(long[] patterns, Expr body) {
            this.patterns = patterns.clone();
            this.body = body;
        }
    }

    /**
     * A match on an integer scrutinee, with literal patterns and a default arm.
     */
    public static final class Match extends Expr {
        public final Expr scrutinee;
        public final List<MatchArm> arms;
        public final Expr fallback;

        public Match(Span span, AstType type, Expr scrutinee, List<MatchArm> arms, Expr fallback) {
            super(span, type);
            this.scrutinee = scrutinee;
            this.arms = Collections.unmodifiableList(new ArrayList<>(arms));
            this.fallback = fallback;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMatch(this);
        }
    }

    /**
     * A block of statements with an optional tail expression giving its value.
     */
    public static final class BlockExpr extends Expr {
        public final List<Stmt> stmts;
        @Nullable
        public final Expr tail;

        public BlockExpr(Span span, AstType type, List<Stmt> stmts, @Nullable Expr tail) {
            super(span, type);
            this.stmts = Collections.unmodifiableList(new ArrayList<>(stmts));
            this.tail = tail;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBlock(this);
        }
    }

    /**
     * Takes the address of a local binding, which then stays in memory.
     */
    public static final class AddrOf extends Expr {
        public final Binding binding;

        public AddrOf(Span span, Binding binding) {
            super(span, AstType.PTR);
            this.binding = binding;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAddrOf(this);
        }
    }

    public static final class Deref extends Expr {
        public final Expr pointer;

        public Deref(Span span, AstType type, Expr pointer) {
            super(span, type);
            this.pointer = pointer;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDeref(this);
        }
    }
}
