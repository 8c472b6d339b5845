package io.github.eutro.tirpass.core.passes.form;

import io.github.eutro.tirpass.core.ir.*;
import io.github.eutro.tirpass.core.passes.IRPass;
import io.github.eutro.tirpass.core.util.StmtExprMutator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Renames variables so that each one is defined at most once.
 * <p>
 * The first definition of a variable keeps it, as long as the variable has not already been referenced
 * as a free variable. Every other definition binds a fresh variable with the same name and type,
 * and the uses in its scope are rewritten to the fresh variable.
 * <p>
 * A statement that is already in SSA form is returned as-is.
 */
public class ConvertSSA implements IRPass<Stmt, Stmt> {
    private static final Logger logger = LoggerFactory.getLogger(ConvertSSA.class);

    public static final ConvertSSA INSTANCE = new ConvertSSA();

    @Override
    public Stmt run(Stmt stmt) {
        Renamer renamer = new Renamer();
        Stmt ret = renamer.visitStmt(stmt);
        if (renamer.renames != 0) {
            logger.debug("renamed {} colliding definition(s)", renamer.renames);
        }
        return ret;
    }

    private static class Renamer extends StmtExprMutator {
        final Set<Var> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        final Map<Var, Deque<Var>> scope = new IdentityHashMap<>();
        final Map<String, Integer> nextIndex = new HashMap<>();
        int renames = 0;

        private Var lookup(Var var) {
            Deque<Var> stack = scope.get(var);
            if (stack == null || stack.isEmpty()) {
                seen.add(var);
                return var;
            }
            return stack.peek();
        }

        /**
         * Enter the scope of a definition of {@code var}.
         *
         * @return The variable to bind instead.
         */
        private Var define(Var var) {
            if (seen.add(var)) return var;
            int index = nextIndex.merge(var.name, 1, Integer::sum);
            Var fresh = new Var(var.name, index, var.type);
            scope.computeIfAbsent(var, $ -> new ArrayDeque<>()).push(fresh);
            renames++;
            return fresh;
        }

        private void leave(Var var, Var bound) {
            if (var != bound) scope.get(var).pop();
        }

        @Override
        public Expr visitVar(Var e) {
            return lookup(e);
        }

        @Override
        public Expr visitLoad(Load e) {
            Var buffer = lookup(e.bufferVar);
            Expr index = visitExpr(e.index);
            if (buffer == e.bufferVar && index == e.index) return e;
            return new Load(e.type, buffer, index);
        }

        @Override
        public Stmt visitStore(Store s) {
            Var buffer = lookup(s.bufferVar);
            Expr value = visitExpr(s.value);
            Expr index = visitExpr(s.index);
            if (buffer == s.bufferVar && value == s.value && index == s.index) return s;
            return new Store(buffer, value, index);
        }

        @Override
        public Expr visitLet(Let e) {
            List<Let> chain = new ArrayList<>();
            List<Expr> values = new ArrayList<>();
            List<Var> vars = new ArrayList<>();
            Expr inner = e;
            while (inner instanceof Let) {
                Let let = (Let) inner;
                values.add(visitExpr(let.value));
                vars.add(define(let.var));
                chain.add(let);
                inner = let.body;
            }
            Expr body = visitExpr(inner);
            for (int i = chain.size() - 1; i >= 0; i--) {
                Let let = chain.get(i);
                Var var = vars.get(i);
                Expr value = values.get(i);
                leave(let.var, var);
                if (var != let.var || value != let.value || body != let.body) {
                    body = new Let(var, value, body);
                } else {
                    body = let;
                }
            }
            return body;
        }

        @Override
        public Stmt visitLetStmt(LetStmt s) {
            List<LetStmt> chain = new ArrayList<>();
            List<Expr> values = new ArrayList<>();
            List<Var> vars = new ArrayList<>();
            Stmt inner = s;
            while (inner instanceof LetStmt) {
                LetStmt let = (LetStmt) inner;
                values.add(visitExpr(let.value));
                vars.add(define(let.var));
                chain.add(let);
                inner = let.body;
            }
            Stmt body = visitStmt(inner);
            for (int i = chain.size() - 1; i >= 0; i--) {
                LetStmt let = chain.get(i);
                Var var = vars.get(i);
                Expr value = values.get(i);
                leave(let.var, var);
                if (var != let.var || value != let.value || body != let.body) {
                    body = new LetStmt(var, value, body);
                } else {
                    body = let;
                }
            }
            return body;
        }

        @Override
        public Stmt visitFor(For s) {
            Expr min = visitExpr(s.min);
            Expr extent = visitExpr(s.extent);
            Var var = define(s.loopVar);
            Stmt body = visitStmt(s.body);
            leave(s.loopVar, var);
            if (var == s.loopVar && min == s.min && extent == s.extent && body == s.body) return s;
            return new For(var, min, extent, s.kind, body);
        }

        @Override
        public Stmt visitAllocate(Allocate s) {
            List<Expr> extents = visitExprs(s.extents);
            Expr condition = visitExpr(s.condition);
            Var var = define(s.bufferVar);
            Stmt body = visitStmt(s.body);
            leave(s.bufferVar, var);
            if (var == s.bufferVar && extents == s.extents && condition == s.condition && body == s.body) return s;
            return new Allocate(var, s.elemType, extents, condition, body);
        }

        @Override
        public Stmt visitAttrStmt(AttrStmt s) {
            Object node = s.node;
            if (node instanceof Var) node = lookup((Var) node);
            Expr value = visitExpr(s.value);
            Stmt body = visitStmt(s.body);
            if (node == s.node && value == s.value && body == s.body) return s;
            return new AttrStmt(node, s.key, value, body);
        }
    }
}
