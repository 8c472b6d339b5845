package io.github.eutro.tirpass.core.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A function that can be inlined: its reference, its formal parameters, and the expression it computes.
 */
public final class Callee {
    public final FunctionRef ref;
    public final List<Var> params;
    public final Expr body;

    public Callee(FunctionRef ref, List<Var> params, Expr body) {
        this.ref = ref;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.body = body;
    }

    /**
     * Build a call to this function.
     *
     * @param args The arguments.
     * @return The call.
     */
    public Call call(Expr... args) {
        List<Expr> argList = new ArrayList<>();
        Collections.addAll(argList, args);
        return new Call(body.type, ref, argList, 0);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(ref.name).append('(');
        for (int i = 0; i < params.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(params.get(i).displayName());
        }
        return sb.append(") = ").append(body).toString();
    }
}
