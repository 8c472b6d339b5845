package io.github.eutro.tirpass.core.ir;

import java.util.Objects;

/**
 * The type of a value: a scalar (or vector of scalars), or an opaque handle.
 */
public final class DataType {
    public enum Code {
        INT("int"),
        UINT("uint"),
        FLOAT("float"),
        HANDLE("handle");

        public final String mnemonic;

        Code(String mnemonic) {
            this.mnemonic = mnemonic;
        }
    }

    public static final DataType BOOL = new DataType(Code.UINT, 1, 1);
    public static final DataType INT8 = new DataType(Code.INT, 8, 1);
    public static final DataType INT16 = new DataType(Code.INT, 16, 1);
    public static final DataType INT32 = new DataType(Code.INT, 32, 1);
    public static final DataType INT64 = new DataType(Code.INT, 64, 1);
    public static final DataType UINT8 = new DataType(Code.UINT, 8, 1);
    public static final DataType UINT16 = new DataType(Code.UINT, 16, 1);
    public static final DataType FLOAT32 = new DataType(Code.FLOAT, 32, 1);
    public static final DataType FLOAT64 = new DataType(Code.FLOAT, 64, 1);
    public static final DataType HANDLE = new DataType(Code.HANDLE, 64, 1);

    public final Code code;
    public final int bits;
    public final int lanes;

    public DataType(Code code, int bits, int lanes) {
        if (bits <= 0 || lanes <= 0) {
            throw new IllegalArgumentException("bad type " + code.mnemonic + bits + "x" + lanes);
        }
        this.code = code;
        this.bits = bits;
        this.lanes = lanes;
    }

    public boolean isHandle() {
        return code == Code.HANDLE;
    }

    public boolean isBool() {
        return code == Code.UINT && bits == 1;
    }

    public boolean isFloat() {
        return code == Code.FLOAT;
    }

    public boolean isInt() {
        return code == Code.INT;
    }

    public DataType withLanes(int lanes) {
        return new DataType(code, bits, lanes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataType)) return false;
        DataType that = (DataType) o;
        return code == that.code && bits == that.bits && lanes == that.lanes;
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, bits, lanes);
    }

    @Override
    public String toString() {
        if (isHandle()) return "handle";
        if (isBool() && lanes == 1) return "bool";
        return code.mnemonic + bits + (lanes == 1 ? "" : "x" + lanes);
    }
}
