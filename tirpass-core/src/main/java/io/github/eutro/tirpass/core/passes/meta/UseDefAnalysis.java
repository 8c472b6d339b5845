package io.github.eutro.tirpass.core.passes.meta;

import io.github.eutro.tirpass.core.ir.*;
import io.github.eutro.tirpass.core.passes.IRPass;
import io.github.eutro.tirpass.core.util.StmtExprMutator;

import java.util.*;

/**
 * Counts the definitions and uses of each variable in a statement, finds its free variables
 * and the thread axes it binds, and removes lets of pure values that are never used.
 * <p>
 * The statement must be in SSA form: a variable defined twice, or defined after it has been used,
 * is an {@link SSAViolationException}.
 * <p>
 * Only the first {@link AttrKeys#THREAD_EXTENT thread extent} attribute of an axis defines its
 * variable, and later ones for the same axis are treated as more uses of the same hardware thread.
 */
public class UseDefAnalysis implements IRPass<Stmt, UseDefAnalysis.Result> {
    /**
     * The use count of a variable that is not defined in the statement.
     */
    public static final int FREE = -1;

    public static final UseDefAnalysis INSTANCE = new UseDefAnalysis(Collections.emptyList(), true);

    private final List<Var> bound;
    private final boolean visitThreadExtent;

    /**
     * @param bound             Variables defined outside the statement, which will not be reported as free.
     * @param visitThreadExtent Whether to count uses in the extents of thread extent attributes.
     */
    public UseDefAnalysis(Collection<Var> bound, boolean visitThreadExtent) {
        this.bound = new ArrayList<>(bound);
        this.visitThreadExtent = visitThreadExtent;
    }

    public static Result analyze(Stmt stmt, Collection<Var> bound, boolean visitThreadExtent) {
        return new UseDefAnalysis(bound, visitThreadExtent).run(stmt);
    }

    /**
     * Find the variables of a statement that are neither defined in it nor in {@code bound},
     * in the order they are first encountered.
     *
     * @param stmt  The statement.
     * @param bound The variables defined outside the statement.
     * @return The free variables.
     */
    public static List<Var> undefinedVars(Stmt stmt, Collection<Var> bound) {
        return analyze(stmt, bound, true).undefined;
    }

    @Override
    public Result run(Stmt stmt) {
        Analyzer analyzer = new Analyzer(visitThreadExtent);
        for (Var var : bound) {
            analyzer.useCount.put(var, 0);
        }
        Stmt body = analyzer.visitStmt(stmt);
        return new Result(body, analyzer);
    }

    public static class Result {
        /**
         * The analysed statement, with unused pure lets removed.
         */
        public final Stmt body;
        public final Map<Var, Integer> useCount;
        public final Map<Var, Integer> defCount;
        /**
         * The free variables, in the order they were first encountered.
         */
        public final List<Var> undefined;
        public final List<IterVar> threadAxis;
        /**
         * The extents of {@link #threadAxis}, pairwise.
         */
        public final List<Expr> threadExtent;

        private Result(Stmt body, Analyzer analyzer) {
            this.body = body;
            this.useCount = Collections.unmodifiableMap(analyzer.useCount);
            this.defCount = Collections.unmodifiableMap(analyzer.defCount);
            this.undefined = Collections.unmodifiableList(analyzer.undefined);
            this.threadAxis = Collections.unmodifiableList(analyzer.threadAxis);
            this.threadExtent = Collections.unmodifiableList(analyzer.threadExtent);
        }

        public boolean isFree(Var var) {
            Integer count = useCount.get(var);
            return count != null && count == FREE;
        }

        public int useCount(Var var) {
            Integer count = useCount.get(var);
            return count == null || count == FREE ? 0 : count;
        }
    }

    private static class Analyzer extends StmtExprMutator {
        final boolean visitThreadExtent;
        final Map<Var, Integer> useCount = new LinkedHashMap<>();
        final Map<Var, Integer> defCount = new LinkedHashMap<>();
        final List<Var> undefined = new ArrayList<>();
        final List<IterVar> threadAxis = new ArrayList<>();
        final List<Expr> threadExtent = new ArrayList<>();

        Analyzer(boolean visitThreadExtent) {
            this.visitThreadExtent = visitThreadExtent;
        }

        void handleDef(Var var) {
            if (defCount.containsKey(var)) {
                throw new SSAViolationException(var, "variable " + var.displayName()
                        + " has already been defined, the statement is not in SSA form");
            }
            if (useCount.containsKey(var)) {
                throw new SSAViolationException(var, "variable " + var.displayName()
                        + " has been used before its definition");
            }
            useCount.put(var, 0);
            defCount.put(var, 1);
        }

        void handleUse(Var var) {
            Integer count = useCount.get(var);
            if (count == null) {
                undefined.add(var);
                useCount.put(var, FREE);
            } else if (count != FREE) {
                useCount.put(var, count + 1);
            }
        }

        private boolean isDead(Var var, Expr value) {
            return useCount.get(var) == 0 && !SideEffects.hasSideEffect(value);
        }

        @Override
        public Stmt visitAttrStmt(AttrStmt s) {
            if (!AttrKeys.THREAD_EXTENT.equals(s.key)) return super.visitAttrStmt(s);
            if (!(s.node instanceof IterVar)) {
                throw new IRInvariantException("thread extent attribute on " + s.node + ", not an iteration variable");
            }
            IterVar iv = (IterVar) s.node;
            if (iv.threadTag.isEmpty()) {
                throw new IRInvariantException("thread extent attribute on " + iv + " with no thread tag");
            }
            if (!useCount.containsKey(iv.var)) {
                handleDef(iv.var);
                threadAxis.add(iv);
                threadExtent.add(s.value);
            }
            Expr value = visitThreadExtent ? visitExpr(s.value) : s.value;
            Stmt body = visitStmt(s.body);
            if (value == s.value && body == s.body) return s;
            return new AttrStmt(s.node, s.key, value, body);
        }

        // let chains are walked iteratively, they can nest thousands deep

        @Override
        public Stmt visitLetStmt(LetStmt s) {
            List<LetStmt> chain = new ArrayList<>();
            Stmt inner = s;
            while (inner instanceof LetStmt) {
                LetStmt let = (LetStmt) inner;
                handleDef(let.var);
                chain.add(let);
                inner = let.body;
            }
            Stmt body = visitStmt(inner);
            for (int i = chain.size() - 1; i >= 0; i--) {
                LetStmt let = chain.get(i);
                if (isDead(let.var, let.value)) continue;
                Expr value = visitExpr(let.value);
                body = value == let.value && body == let.body ? let : new LetStmt(let.var, value, body);
            }
            return body;
        }

        @Override
        public Expr visitLet(Let e) {
            List<Let> chain = new ArrayList<>();
            Expr inner = e;
            while (inner instanceof Let) {
                Let let = (Let) inner;
                handleDef(let.var);
                chain.add(let);
                inner = let.body;
            }
            Expr body = visitExpr(inner);
            for (int i = chain.size() - 1; i >= 0; i--) {
                Let let = chain.get(i);
                if (isDead(let.var, let.value)) continue;
                Expr value = visitExpr(let.value);
                body = value == let.value && body == let.body ? let : new Let(let.var, value, body);
            }
            return body;
        }

        @Override
        public Stmt visitFor(For s) {
            handleDef(s.loopVar);
            return super.visitFor(s);
        }

        @Override
        public Stmt visitAllocate(Allocate s) {
            handleDef(s.bufferVar);
            return super.visitAllocate(s);
        }

        @Override
        public Stmt visitStore(Store s) {
            handleUse(s.bufferVar);
            return super.visitStore(s);
        }

        @Override
        public Expr visitLoad(Load e) {
            handleUse(e.bufferVar);
            return super.visitLoad(e);
        }

        @Override
        public Expr visitVar(Var e) {
            handleUse(e);
            return e;
        }
    }
}
