package com.unnc.script.parser;

import java.util.List;

public class Statement {

    public interface Stmt {
        void accept(StmtVisitor visitor);
        /** 1-based source line the statement was read from. */
        int line();
    }

    public interface StmtVisitor {
        void visitBlockStmt(Block stmt);
        void visitIfStmt(If stmt);
        void visitWhileStmt(While stmt);
        void visitForRangeStmt(ForRange stmt);
        void visitForEachStmt(ForEach stmt);
        void visitLetStmt(Let stmt);
        void visitReturnStmt(ReturnStmt stmt);
        void visitExprStmt(ExprStmt stmt);
    }

    private abstract static class Base implements Stmt {
        private final int line;
        Base(int line) { this.line = line; }
        @Override public int line() { return line; }
    }

    public static final class Block extends Base {
        public final List<Stmt> statements;
        Block(int line, List<Stmt> statements) { super(line); this.statements = statements; }
        public void accept(StmtVisitor visitor) { visitor.visitBlockStmt(this); }
    }

    /** One {@code if}/{@code elseif} arm. */
    public static final class Branch {
        public final Resolvable condition;
        public final Block body;
        Branch(Resolvable condition, Block body) {
            this.condition = condition;
            this.body = body;
        }
    }

    public static final class If extends Base {
        public final List<Branch> branches;   // if, then every elseif in source order
        public final Block elseBranch;        // may be null
        If(int line, List<Branch> branches, Block elseBranch) {
            super(line);
            this.branches = branches;
            this.elseBranch = elseBranch;
        }
        public void accept(StmtVisitor visitor) { visitor.visitIfStmt(this); }
    }

    public static final class While extends Base {
        public final Resolvable condition;
        public final Block body;
        While(int line, Resolvable condition, Block body) {
            super(line);
            this.condition = condition;
            this.body = body;
        }
        public void accept(StmtVisitor visitor) { visitor.visitWhileStmt(this); }
    }

    /** {@code for v from a to b}: inclusive, ascending, bounds evaluated once. */
    public static final class ForRange extends Base {
        public final String variable;
        public final Resolvable from;
        public final Resolvable to;
        public final Block body;
        ForRange(int line, String variable, Resolvable from, Resolvable to, Block body) {
            super(line);
            this.variable = variable;
            this.from = from;
            this.to = to;
            this.body = body;
        }
        public void accept(StmtVisitor visitor) { visitor.visitForRangeStmt(this); }
    }

    /** {@code for v in e}. */
    public static final class ForEach extends Base {
        public final String variable;
        public final Resolvable collection;
        public final Block body;
        ForEach(int line, String variable, Resolvable collection, Block body) {
            super(line);
            this.variable = variable;
            this.collection = collection;
            this.body = body;
        }
        public void accept(StmtVisitor visitor) { visitor.visitForEachStmt(this); }
    }

    /** {@code let x = e}, {@code x ← e} and bare {@code x = e}. */
    public static final class Let extends Base {
        public final String name;
        public final Resolvable value;
        Let(int line, String name, Resolvable value) {
            super(line);
            this.name = name;
            this.value = value;
        }
        public void accept(StmtVisitor visitor) { visitor.visitLetStmt(this); }
    }

    public static final class ReturnStmt extends Base {
        public final Resolvable value; // may be null
        ReturnStmt(int line, Resolvable value) {
            super(line);
            this.value = value;
        }
        public void accept(StmtVisitor visitor) { visitor.visitReturnStmt(this); }
    }

    public static final class ExprStmt extends Base {
        public final Resolvable expression;
        ExprStmt(int line, Resolvable expression) {
            super(line);
            this.expression = expression;
        }
        public void accept(StmtVisitor visitor) { visitor.visitExprStmt(this); }
    }
}
