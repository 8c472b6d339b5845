package io.github.eutro.tirpass.core.util;

import io.github.eutro.tirpass.core.ir.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Deep equality of IR trees.
 * <p>
 * Free variables must be the very same {@link Var}s on both sides. Variables bound
 * within the trees (by lets, loops, allocations and thread bindings) may differ, as long as
 * they are bound at corresponding places and used consistently, so a tree and a
 * copy of it with renamed bindings compare equal.
 */
public final class StructuralEquality {
    private final Map<Var, Var> bound = new HashMap<>();
    private final Map<IterVar, IterVar> boundIterVars = new HashMap<>();

    private StructuralEquality() {
    }

    public static boolean equal(Node lhs, Node rhs) {
        return new StructuralEquality().nodes(lhs, rhs);
    }

    private boolean nodes(Node lhs, Node rhs) {
        if (lhs instanceof Expr && rhs instanceof Expr) return exprs((Expr) lhs, (Expr) rhs);
        if (lhs instanceof Stmt && rhs instanceof Stmt) return stmts((Stmt) lhs, (Stmt) rhs);
        return false;
    }

    private boolean bind(Var lhs, Var rhs) {
        if (!lhs.type.equals(rhs.type)) return false;
        bound.put(lhs, rhs);
        return true;
    }

    // lets, loops and allocations bind only within their body
    private boolean scoped(Var lhs, Var rhs, BooleanSupplier body) {
        if (!lhs.type.equals(rhs.type)) return false;
        Var shadowed = bound.put(lhs, rhs);
        try {
            return body.getAsBoolean();
        } finally {
            if (shadowed == null) {
                bound.remove(lhs);
            } else {
                bound.put(lhs, shadowed);
            }
        }
    }

    private boolean vars(Var lhs, Var rhs) {
        Var mapped = bound.get(lhs);
        return mapped != null ? mapped == rhs : lhs == rhs;
    }

    private boolean attrNodes(Object lhs, Object rhs) {
        if (lhs == null || rhs == null) return lhs == rhs;
        if (lhs == rhs && bound.isEmpty()) return true;
        if (lhs instanceof Var && rhs instanceof Var) return vars((Var) lhs, (Var) rhs);
        if (lhs instanceof IterVar && rhs instanceof IterVar) {
            IterVar l = (IterVar) lhs, r = (IterVar) rhs;
            IterVar mapped = boundIterVars.get(l);
            if (mapped != null) return mapped == r;
            if (!l.threadTag.equals(r.threadTag)) return false;
            if (bound.containsKey(l.var) || l.var == r.var) {
                return vars(l.var, r.var);
            }
            boundIterVars.put(l, r);
            return bind(l.var, r.var);
        }
        if (lhs instanceof Node && rhs instanceof Node) return nodes((Node) lhs, (Node) rhs);
        return lhs != null && lhs.equals(rhs);
    }

    private boolean exprLists(List<Expr> lhs, List<Expr> rhs) {
        if (lhs.size() != rhs.size()) return false;
        for (int i = 0; i < lhs.size(); i++) {
            if (!exprs(lhs.get(i), rhs.get(i))) return false;
        }
        return true;
    }

    private boolean exprs(Expr lhs, Expr rhs) {
        if (lhs == rhs && bound.isEmpty()) return true;
        if (lhs.getClass() != rhs.getClass() || !lhs.type.equals(rhs.type)) return false;
        if (lhs instanceof IntImm) {
            return ((IntImm) lhs).value == ((IntImm) rhs).value;
        } else if (lhs instanceof FloatImm) {
            return Double.compare(((FloatImm) lhs).value, ((FloatImm) rhs).value) == 0;
        } else if (lhs instanceof StringImm) {
            return ((StringImm) lhs).value.equals(((StringImm) rhs).value);
        } else if (lhs instanceof Var) {
            return vars((Var) lhs, (Var) rhs);
        } else if (lhs instanceof Binary) {
            Binary l = (Binary) lhs, r = (Binary) rhs;
            return l.op == r.op && exprs(l.a, r.a) && exprs(l.b, r.b);
        } else if (lhs instanceof Cast) {
            return exprs(((Cast) lhs).value, ((Cast) rhs).value);
        } else if (lhs instanceof Select) {
            Select l = (Select) lhs, r = (Select) rhs;
            return exprs(l.cond, r.cond) && exprs(l.trueValue, r.trueValue) && exprs(l.falseValue, r.falseValue);
        } else if (lhs instanceof Load) {
            Load l = (Load) lhs, r = (Load) rhs;
            return vars(l.bufferVar, r.bufferVar) && exprs(l.index, r.index);
        } else if (lhs instanceof Let) {
            Let l = (Let) lhs, r = (Let) rhs;
            return exprs(l.value, r.value) && scoped(l.var, r.var, () -> exprs(l.body, r.body));
        } else if (lhs instanceof Call) {
            Call l = (Call) lhs, r = (Call) rhs;
            return l.name.equals(r.name)
                    && l.callType == r.callType
                    && l.func == r.func
                    && l.valueIndex == r.valueIndex
                    && exprLists(l.args, r.args);
        }
        throw new IllegalStateException("unknown expression " + lhs.getClass());
    }

    private boolean stmts(Stmt lhs, Stmt rhs) {
        if (lhs == rhs && bound.isEmpty()) return true;
        if (lhs.getClass() != rhs.getClass()) return false;
        if (lhs instanceof LetStmt) {
            LetStmt l = (LetStmt) lhs, r = (LetStmt) rhs;
            return exprs(l.value, r.value) && scoped(l.var, r.var, () -> stmts(l.body, r.body));
        } else if (lhs instanceof AttrStmt) {
            AttrStmt l = (AttrStmt) lhs, r = (AttrStmt) rhs;
            return l.key.equals(r.key)
                    && exprs(l.value, r.value)
                    && attrNodes(l.node, r.node)
                    && stmts(l.body, r.body);
        } else if (lhs instanceof For) {
            For l = (For) lhs, r = (For) rhs;
            return l.kind == r.kind
                    && exprs(l.min, r.min)
                    && exprs(l.extent, r.extent)
                    && scoped(l.loopVar, r.loopVar, () -> stmts(l.body, r.body));
        } else if (lhs instanceof Allocate) {
            Allocate l = (Allocate) lhs, r = (Allocate) rhs;
            return l.elemType.equals(r.elemType)
                    && exprLists(l.extents, r.extents)
                    && exprs(l.condition, r.condition)
                    && scoped(l.bufferVar, r.bufferVar, () -> stmts(l.body, r.body));
        } else if (lhs instanceof Store) {
            Store l = (Store) lhs, r = (Store) rhs;
            return vars(l.bufferVar, r.bufferVar) && exprs(l.value, r.value) && exprs(l.index, r.index);
        } else if (lhs instanceof Evaluate) {
            return exprs(((Evaluate) lhs).value, ((Evaluate) rhs).value);
        } else if (lhs instanceof SeqStmt) {
            List<Stmt> l = ((SeqStmt) lhs).seq, r = ((SeqStmt) rhs).seq;
            if (l.size() != r.size()) return false;
            for (int i = 0; i < l.size(); i++) {
                if (!stmts(l.get(i), r.get(i))) return false;
            }
            return true;
        } else if (lhs instanceof IfThenElse) {
            IfThenElse l = (IfThenElse) lhs, r = (IfThenElse) rhs;
            if (!exprs(l.cond, r.cond) || !stmts(l.thenCase, r.thenCase)) return false;
            if (l.elseCase == null || r.elseCase == null) return l.elseCase == r.elseCase;
            return stmts(l.elseCase, r.elseCase);
        }
        throw new IllegalStateException("unknown statement " + lhs.getClass());
    }
}
