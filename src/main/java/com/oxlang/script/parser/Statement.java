package com.oxlang.script.parser;

import java.util.List;

public class Statement {

    public interface Stmt {
        void accept(StmtVisitor visitor);
    }

    public interface StmtVisitor {
        void visitExprStmt(ExprStmt stmt);
        void visitAssignStmt(AssignStmt stmt);
        void visitBlockStmt(Block stmt);
        void visitIfStmt(If stmt);
        void visitWhileStmt(While stmt);
        void visitForStmt(For stmt);
        void visitForInStmt(ForIn stmt);
        void visitFunctionStmt(FunctionStmt stmt);
        void visitStructStmt(StructStmt stmt);
        void visitImportStmt(ImportStmt stmt);
        void visitReturnStmt(ReturnStmt stmt);
        void visitBreakStmt(BreakStmt stmt);
        void visitContinueStmt(ContinueStmt stmt);
    }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;
        ExprStmt(Expr.ExprInterface expression) { this.expression = expression; }
        public void accept(StmtVisitor visitor) { visitor.visitExprStmt(this); }
    }

    /**
     * target op value, where target is a Variable, GetExpr or IndexExpr and op is
     * one of = += -= *= /= ^=.
     */
    public static final class AssignStmt implements Stmt {
        public final Expr.ExprInterface target;
        public final Token operator;
        public final Expr.ExprInterface value;

        AssignStmt(Expr.ExprInterface target, Token operator, Expr.ExprInterface value) {
            this.target = target;
            this.operator = operator;
            this.value = value;
        }

        public boolean isCompound() { return operator.type != TokenType.EQUAL; }

        public void accept(StmtVisitor visitor) { visitor.visitAssignStmt(this); }
    }

    public static final class Block implements Stmt {
        public final List<Stmt> statements;
        Block(List<Stmt> statements) { this.statements = statements; }
        public void accept(StmtVisitor visitor) { visitor.visitBlockStmt(this); }
    }

    public static final class If implements Stmt {
        final Token keyword;
        final Expr.ExprInterface condition;
        public final Block thenBranch;
        public final Stmt elseBranch; // Block, chained If, or null
        If(Token keyword, Expr.ExprInterface condition, Block thenBranch, Stmt elseBranch) {
            this.keyword = keyword;
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }
        public void accept(StmtVisitor visitor) { visitor.visitIfStmt(this); }
    }

    public static final class While implements Stmt {
        final Token keyword;
        final Expr.ExprInterface condition;
        public final Block body;
        While(Token keyword, Expr.ExprInterface condition, Block body) {
            this.keyword = keyword;
            this.condition = condition;
            this.body = body;
        }
        public void accept(StmtVisitor visitor) { visitor.visitWhileStmt(this); }
    }

    // for i = 0, i < n, i += 1 { body }
    public static final class For implements Stmt {
        final Token keyword;
        final AssignStmt initializer;
        final Expr.ExprInterface condition;
        final AssignStmt increment;
        public final Block body;
        For(Token keyword, AssignStmt initializer, Expr.ExprInterface condition, AssignStmt increment, Block body) {
            this.keyword = keyword;
            this.initializer = initializer;
            this.condition = condition;
            this.increment = increment;
            this.body = body;
        }
        public void accept(StmtVisitor visitor) { visitor.visitForStmt(this); }
    }

    // for x in expr { body }
    public static final class ForIn implements Stmt {
        final Token keyword;
        final Token variable;
        final Expr.ExprInterface iterable;
        public final Block body;
        ForIn(Token keyword, Token variable, Expr.ExprInterface iterable, Block body) {
            this.keyword = keyword;
            this.variable = variable;
            this.iterable = iterable;
            this.body = body;
        }
        public void accept(StmtVisitor visitor) { visitor.visitForInStmt(this); }
    }

    public static final class FunctionStmt implements Stmt {
        public enum Kind { PLAIN, STATIC, INSTANCE }

        public final Token name;
        public final Token owner; // struct name for STATIC/INSTANCE, else null
        public final Kind kind;
        final List<Token> params;
        final List<Stmt> body;

        FunctionStmt(Token name, Token owner, Kind kind, List<Token> params, List<Stmt> body) {
            this.name = name;
            this.owner = owner;
            this.kind = kind;
            this.params = params;
            this.body = body;
        }

        public String qualifiedName() {
            switch (kind) {
                case STATIC: return owner.lexeme + "." + name.lexeme;
                case INSTANCE: return owner.lexeme + ":" + name.lexeme;
                default: return name.lexeme;
            }
        }

        public void accept(StmtVisitor visitor) { visitor.visitFunctionStmt(this); }
    }

    public static final class StructStmt implements Stmt {
        public final Token name;
        final Token parent; // may be null
        final List<Token> fields;

        StructStmt(Token name, Token parent, List<Token> fields) {
            this.name = name;
            this.parent = parent;
            this.fields = fields;
        }

        public void accept(StmtVisitor visitor) { visitor.visitStructStmt(this); }
    }

    public static final class ImportStmt implements Stmt {
        final Token keyword;
        public final String module; // dotted name, e.g. "std.math"

        ImportStmt(Token keyword, String module) {
            this.keyword = keyword;
            this.module = module;
        }

        public void accept(StmtVisitor visitor) { visitor.visitImportStmt(this); }
    }

    public static final class ReturnStmt implements Stmt {
        final Token keyword;
        final Expr.ExprInterface value; // may be null

        ReturnStmt(Token keyword, Expr.ExprInterface value) {
            this.keyword = keyword;
            this.value = value;
        }

        public void accept(StmtVisitor visitor) { visitor.visitReturnStmt(this); }
    }

    public static final class BreakStmt implements Stmt {
        final Token keyword;
        BreakStmt(Token keyword) { this.keyword = keyword; }
        public void accept(StmtVisitor visitor) { visitor.visitBreakStmt(this); }
    }

    public static final class ContinueStmt implements Stmt {
        final Token keyword;
        ContinueStmt(Token keyword) { this.keyword = keyword; }
        public void accept(StmtVisitor visitor) { visitor.visitContinueStmt(this); }
    }
}
