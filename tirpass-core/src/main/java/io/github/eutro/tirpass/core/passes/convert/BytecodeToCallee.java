package io.github.eutro.tirpass.core.passes.convert;

import io.github.eutro.tirpass.core.ext.CommonExts;
import io.github.eutro.tirpass.core.ir.*;
import io.github.eutro.tirpass.core.passes.IRPass;
import io.github.eutro.tirpass.core.util.ClassBytes;
import org.jetbrains.annotations.Nullable;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Lifts a straight-line static Java method into a {@link Callee}, so that it can be {@link
 * io.github.eutro.tirpass.core.passes.form.Inline inlined}.
 * <p>
 * The method may only use its parameters, constants, local variables, arithmetic,
 * primitive conversions and {@link Math#min}/{@link Math#max}, and must end in a single return.
 * Anything else, including any branch, is an {@link IllegalArgumentException}.
 * <p>
 * The resulting function is marked {@link CommonExts#IS_PURE pure}.
 */
public class BytecodeToCallee implements IRPass<MethodNode, Callee> {
    public static final BytecodeToCallee INSTANCE = new BytecodeToCallee();

    /**
     * Lift the only method named {@code name} in a class.
     *
     * @param clazz The class.
     * @param name  The name of the method.
     * @return The lifted method.
     */
    public static Callee lift(Class<?> clazz, String name) {
        ClassNode cn = new ClassNode();
        ClassBytes.getClassReaderFor(clazz).accept(cn, ClassReader.SKIP_FRAMES);
        MethodNode found = null;
        for (MethodNode method : cn.methods) {
            if (!method.name.equals(name)) continue;
            if (found != null) {
                throw new IllegalArgumentException("more than one method named " + name + " in " + clazz.getName());
            }
            found = method;
        }
        if (found == null) {
            throw new IllegalArgumentException("no method named " + name + " in " + clazz.getName());
        }
        return INSTANCE.run(found);
    }

    @Override
    public Callee run(MethodNode method) {
        if ((method.access & Opcodes.ACC_STATIC) == 0) {
            throw new IllegalArgumentException("method " + method.name + " is not static");
        }
        FunctionRef ref = CommonExts.markPure(new FunctionRef(method.name, 1));
        ref.attachExt(CommonExts.LIFTED_FROM, method.name + method.desc);
        Converter converter = new Converter(method);
        Expr body = converter.convert();
        return new Callee(ref, converter.params, body);
    }

    static DataType typeOf(Type type) {
        switch (type.getSort()) {
            case Type.BOOLEAN:
            case Type.BYTE:
            case Type.CHAR:
            case Type.SHORT:
            case Type.INT:
                return DataType.INT32;
            case Type.LONG:
                return DataType.INT64;
            case Type.FLOAT:
                return DataType.FLOAT32;
            case Type.DOUBLE:
                return DataType.FLOAT64;
            default:
                throw new IllegalArgumentException("unsupported type " + type);
        }
    }

    private static class Converter {
        final MethodNode method;
        final List<Var> params = new ArrayList<>();
        final List<Expr> locals = new ArrayList<>();
        final Deque<Expr> stack = new ArrayDeque<>();
        @Nullable Expr returned;

        Converter(MethodNode method) {
            this.method = method;
        }

        Expr convert() {
            Type[] paramTypes = Type.getArgumentTypes(method.desc);
            for (int i = 0; i < paramTypes.length; i++) {
                Var param = new Var(paramName(locals.size(), i), typeOf(paramTypes[i]));
                params.add(param);
                locals.add(param);
                if (paramTypes[i].getSize() > 1) {
                    locals.add(null);
                }
            }
            for (AbstractInsnNode insn : method.instructions) {
                if (insn.getOpcode() == -1) continue; // labels, line numbers
                if (returned != null) {
                    throw new IllegalArgumentException("code after return in " + method.name);
                }
                execute(insn);
            }
            if (returned == null) {
                throw new IllegalArgumentException("method " + method.name + " does not return a value");
            }
            return returned;
        }

        private String paramName(int slot, int index) {
            if (method.localVariables != null) {
                for (LocalVariableNode lv : method.localVariables) {
                    if (lv.index == slot) return lv.name;
                }
            }
            return "param" + index;
        }

        private Expr pop() {
            Expr expr = stack.poll();
            if (expr == null) throw new IllegalArgumentException("stack underflow in " + method.name);
            return expr;
        }

        private void binary(Binary.Op op) {
            Expr b = pop();
            Expr a = pop();
            stack.push(new Binary(op, a, b));
        }

        private void cast(DataType type) {
            stack.push(new Cast(type, pop()));
        }

        private void negate(Expr zero) {
            stack.push(Binary.sub(zero, pop()));
        }

        private void load(int slot) {
            Expr value = slot < locals.size() ? locals.get(slot) : null;
            if (value == null) {
                throw new IllegalArgumentException("load of unset local " + slot + " in " + method.name);
            }
            stack.push(value);
        }

        private void store(int slot) {
            while (locals.size() <= slot) locals.add(null);
            locals.set(slot, pop());
        }

        private void constant(Object cst) {
            if (cst instanceof Integer) {
                stack.push(IntImm.int32((Integer) cst));
            } else if (cst instanceof Long) {
                stack.push(new IntImm(DataType.INT64, (Long) cst));
            } else if (cst instanceof Float) {
                stack.push(new FloatImm(DataType.FLOAT32, (Float) cst));
            } else if (cst instanceof Double) {
                stack.push(new FloatImm(DataType.FLOAT64, (Double) cst));
            } else {
                throw new IllegalArgumentException("unsupported constant " + cst + " in " + method.name);
            }
        }

        private void invokeStatic(MethodInsnNode insn) {
            if (!"java/lang/Math".equals(insn.owner)) {
                throw new IllegalArgumentException("unsupported call to " + insn.owner + "." + insn.name);
            }
            switch (insn.name) {
                case "min":
                    binary(Binary.Op.MIN);
                    break;
                case "max":
                    binary(Binary.Op.MAX);
                    break;
                default:
                    throw new IllegalArgumentException("unsupported call to Math." + insn.name);
            }
        }

        private void execute(AbstractInsnNode insn) {
            int opcode = insn.getOpcode();
            switch (opcode) {
                case Opcodes.NOP:
                    break;
                case Opcodes.ICONST_M1:
                case Opcodes.ICONST_0:
                case Opcodes.ICONST_1:
                case Opcodes.ICONST_2:
                case Opcodes.ICONST_3:
                case Opcodes.ICONST_4:
                case Opcodes.ICONST_5:
                    constant(opcode - Opcodes.ICONST_0);
                    break;
                case Opcodes.LCONST_0:
                case Opcodes.LCONST_1:
                    constant((long) (opcode - Opcodes.LCONST_0));
                    break;
                case Opcodes.FCONST_0:
                case Opcodes.FCONST_1:
                case Opcodes.FCONST_2:
                    constant((float) (opcode - Opcodes.FCONST_0));
                    break;
                case Opcodes.DCONST_0:
                case Opcodes.DCONST_1:
                    constant((double) (opcode - Opcodes.DCONST_0));
                    break;
                case Opcodes.BIPUSH:
                case Opcodes.SIPUSH:
                    constant(((IntInsnNode) insn).operand);
                    break;
                case Opcodes.LDC:
                    constant(((LdcInsnNode) insn).cst);
                    break;
                case Opcodes.ILOAD:
                case Opcodes.LLOAD:
                case Opcodes.FLOAD:
                case Opcodes.DLOAD:
                    load(((VarInsnNode) insn).var);
                    break;
                case Opcodes.ISTORE:
                case Opcodes.LSTORE:
                case Opcodes.FSTORE:
                case Opcodes.DSTORE:
                    store(((VarInsnNode) insn).var);
                    break;
                case Opcodes.IINC: {
                    IincInsnNode iinc = (IincInsnNode) insn;
                    load(iinc.var);
                    constant(iinc.incr);
                    binary(Binary.Op.ADD);
                    store(iinc.var);
                    break;
                }
                case Opcodes.IADD:
                case Opcodes.LADD:
                case Opcodes.FADD:
                case Opcodes.DADD:
                    binary(Binary.Op.ADD);
                    break;
                case Opcodes.ISUB:
                case Opcodes.LSUB:
                case Opcodes.FSUB:
                case Opcodes.DSUB:
                    binary(Binary.Op.SUB);
                    break;
                case Opcodes.IMUL:
                case Opcodes.LMUL:
                case Opcodes.FMUL:
                case Opcodes.DMUL:
                    binary(Binary.Op.MUL);
                    break;
                case Opcodes.IDIV:
                case Opcodes.LDIV:
                case Opcodes.FDIV:
                case Opcodes.DDIV:
                    binary(Binary.Op.DIV);
                    break;
                case Opcodes.IREM:
                case Opcodes.LREM:
                case Opcodes.FREM:
                case Opcodes.DREM:
                    binary(Binary.Op.MOD);
                    break;
                case Opcodes.INEG:
                    negate(IntImm.int32(0));
                    break;
                case Opcodes.LNEG:
                    negate(new IntImm(DataType.INT64, 0));
                    break;
                case Opcodes.FNEG:
                    negate(new FloatImm(DataType.FLOAT32, 0));
                    break;
                case Opcodes.DNEG:
                    negate(new FloatImm(DataType.FLOAT64, 0));
                    break;
                case Opcodes.L2I:
                case Opcodes.F2I:
                case Opcodes.D2I:
                    cast(DataType.INT32);
                    break;
                case Opcodes.I2L:
                case Opcodes.F2L:
                case Opcodes.D2L:
                    cast(DataType.INT64);
                    break;
                case Opcodes.I2F:
                case Opcodes.L2F:
                case Opcodes.D2F:
                    cast(DataType.FLOAT32);
                    break;
                case Opcodes.I2D:
                case Opcodes.L2D:
                case Opcodes.F2D:
                    cast(DataType.FLOAT64);
                    break;
                case Opcodes.INVOKESTATIC:
                    invokeStatic((MethodInsnNode) insn);
                    break;
                case Opcodes.IRETURN:
                case Opcodes.LRETURN:
                case Opcodes.FRETURN:
                case Opcodes.DRETURN:
                    returned = pop();
                    break;
                default:
                    throw new IllegalArgumentException("unsupported instruction " + opcode + " in " + method.name);
            }
        }
    }
}
