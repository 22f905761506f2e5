package io.github.kirc.core.ast;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A statement of a function body.
 */
public abstract class Stmt extends AstNode {
    protected Stmt(Span span) {
        super(span);
    }

    public abstract void accept(Visitor visitor);

    public interface Visitor {
        void visitLet(Let stmt);

        void visitAssign(Assign stmt);

        void visitExpr(ExprStmt stmt);

        void visitReturn(Return stmt);

        void visitWhile(While stmt);

        void visitFor(For stmt);

        void visitLoop(Loop stmt);

        void visitBreak(Break stmt);

        void visitContinue(Continue stmt);

        void visitIf(If stmt);

        void visitBlock(Block stmt);
    }

    /**
     * Introduces a mutable binding, optionally initialized.
     */
    public static final class Let extends Stmt {
        public final Binding binding;
        @Nullable
        public final Expr init;

        public Let(Span span, Binding binding, @Nullable Expr init) {
            super(span);
            this.binding = binding;
            this.init = init;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visitLet(this);
        }
    }

    /**
     * Assigns to a place: a {@link Expr.VarRef}, a {@link Expr.GlobalVar} or a {@link Expr.Deref}.
     */
    public static final class Assign extends Stmt {
        public final Expr target;
        public final Expr value;

        public Assign(Span span, Expr target, Expr value) {
            super(span);
            this.target = target;
            this.value = value;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visitAssign(this);
        }
    }

    public static final class ExprStmt extends Stmt {
        public final Expr expr;

        public ExprStmt(Span span, Expr expr) {
            super(span);
            this.expr = expr;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visitExpr(this);
        }
    }

    public static final class Return extends Stmt {
        @Nullable
        public final Expr value;

        public Return(Span span, @Nullable Expr value) {
            super(span);
            this.value = value;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visitReturn(this);
        }
    }

    public static final class While extends Stmt {
        @Nullable
        public final String label;
        public final Expr cond;
        public final Stmt body;

        public While(Span span, @Nullable String label, Expr cond, Stmt body) {
            super(span);
            this.label = label;
            this.cond = cond;
            this.body = body;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visitWhile(this);
        }
    }

    /**
     * A loop over the integer range {@code start..end}, or {@code start..=end} if inclusive, stepping by one.
     */
    public static final class For extends Stmt {
        @Nullable
        public final String label;
        public final Binding var;
        public final Expr start;
        public final Expr end;
        public final boolean inclusive;
        public final Stmt body;

        public For(Span span, @Nullable String label, Binding var, Expr start, Expr end, boolean inclusive, Stmt body) {
            super(span);
            this.label = label;
            this.var = var;
            this.start = start;
            this.end = end;
            this.inclusive = inclusive;
            this.body = body;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visitFor(this);
        }
    }

    /**
     * An infinite loop, left only by {@code break} or {@code return}.
     */
    public static final class Loop extends Stmt {
        @Nullable
        public final String label;
        public final Stmt body;

        public Loop(Span span, @Nullable String label, Stmt body) {
            super(span);
            this.label = label;
            this.body = body;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visitLoop(this);
        }
    }

    public static final class Break extends Stmt {
        @Nullable
        public final String label;

        public Break(Span span, @Nullable String label) {
            super(span);
            this.label = label;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visitBreak(this);
        }
    }

    public static final class Continue extends Stmt {
        @Nullable
        public final String label;

        public Continue(Span span, @Nullable String label) {
            super(span);
            this.label = label;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visitContinue(this);
        }
    }

    public static final class If extends Stmt {
        public final Expr cond;
        public final Stmt then;
        @Nullable
        public final Stmt otherwise;

        public If(Span span, Expr cond, Stmt then, @Nullable Stmt otherwise) {
            super(span);
            this.cond = cond;
            this.then = then;
            this.otherwise = otherwise;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visitIf(this);
        }
    }

    public static final class Block extends Stmt {
        public final List<Stmt> stmts;

        public Block(Span span, List<Stmt> stmts) {
            super(span);
            this.stmts = Collections.unmodifiableList(new ArrayList<>(stmts));
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visitBlock(this);
        }
    }
}
