package com.lucas.script.parser;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import com.lucas.script.errors.LucasError;

public class Value {
    public enum Type {
        NUMBER("numero"), TEXT("texto"), BOOL("booleano"), NIL("nulo"), ARRAY("array"), FUNCTION("funcao");

        private final String displayName;

        Type(String displayName) {
            this.displayName = displayName;
        }

        /** Name returned by the {@code tipo} builtin and used in error messages. */
        public String displayName() {
            return displayName;
        }
    }

    /** Numbers closer than this compare equal. */
    public static final double EPSILON = 1e-10;

    private static final Value NIL = new Value(Type.NIL, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value text(String s) { return new Value(Type.TEXT, s); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value nil() { return NIL; }
    public static Value function(LucasCallable fn) { return new Value(Type.FUNCTION, fn); }

    /** Wraps the given list without copying; arrays are shared by reference. */
    public static Value array(List<Value> items) { return new Value(Type.ARRAY, items); }

    public static Value array() { return new Value(Type.ARRAY, new ArrayList<Value>()); }

    /** Converts a parser literal (Double, String, Boolean or null). */
    public static Value fromLiteral(Object literal) {
        if (literal == null) return NIL;
        if (literal instanceof Double) return number((Double) literal);
        if (literal instanceof String) return text((String) literal);
        if (literal instanceof Boolean) return bool((Boolean) literal);
        throw new IllegalArgumentException("Unsupported literal: " + literal.getClass().getName());
    }

    public Type getType() { return type; }

    public boolean isNil() { return type == Type.NIL; }

    public double asNumber() {
        if (type != Type.NUMBER) throw LucasError.runtime("Esperado numero, recebeu " + type.displayName());
        return (Double) value;
    }

    public String asText() {
        if (type != Type.TEXT) throw LucasError.runtime("Esperado texto, recebeu " + type.displayName());
        return (String) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw LucasError.runtime("Esperado booleano, recebeu " + type.displayName());
        return (Boolean) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asArray() {
        if (type != Type.ARRAY) throw LucasError.runtime("Esperado array, recebeu " + type.displayName());
        return (List<Value>) value;
    }

    public LucasCallable asFunction() {
        if (type != Type.FUNCTION) throw LucasError.runtime("Esperado funcao, recebeu " + type.displayName());
        return (LucasCallable) value;
    }

    public boolean isTruthy() {
        switch (type) {
            case NIL: return false;
            case BOOL: return (Boolean) value;
            case NUMBER: return (Double) value != 0.0;
            case TEXT: return !((String) value).isEmpty();
            case ARRAY: return !asArray().isEmpty();
            case FUNCTION: return true;
            default: return false;
        }
    }

    /** Cross-kind values are never equal; arrays and functions compare by identity. */
    public static boolean isEqual(Value a, Value b) {
        return isEqual(a, b, new IdentityHashMap<>());
    }

    /** Arrays compare element-wise; a pair already under comparison counts as equal, so cycles terminate. */
    private static boolean isEqual(Value a, Value b, IdentityHashMap<Object, Object> comparing) {
        if (a.type != b.type) return false;
        switch (a.type) {
            case NIL: return true;
            case NUMBER: return Math.abs((Double) a.value - (Double) b.value) < EPSILON;
            case TEXT:
            case BOOL: return a.value.equals(b.value);
            case ARRAY: {
                if (a.value == b.value) return true;
                if (comparing.get(a.value) == b.value) return true;
                List<Value> left = a.asArray();
                List<Value> right = b.asArray();
                if (left.size() != right.size()) return false;
                Object previous = comparing.put(left, right);
                try {
                    for (int i = 0; i < left.size(); i++) {
                        if (!isEqual(left.get(i), right.get(i), comparing)) return false;
                    }
                    return true;
                } finally {
                    if (previous == null) comparing.remove(left);
                    else comparing.put(left, previous);
                }
            }
            case FUNCTION: return a.value == b.value;
            default: return false;
        }
    }

    public String stringify() {
        return stringify(Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private String stringify(Set<Object> inProgress) {
        switch (type) {
            case NIL: return "nulo";
            case BOOL: return ((Boolean) value) ? "verdadeiro" : "falso";
            case NUMBER: return formatNumber((Double) value);
            case TEXT: return (String) value;
            case FUNCTION: return "<fn " + asFunction().name() + ">";
            case ARRAY: {
                if (!inProgress.add(value)) return "[...]";
                StringBuilder sb = new StringBuilder("[");
                List<Value> items = asArray();
                for (int i = 0; i < items.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(items.get(i).stringify(inProgress));
                }
                inProgress.remove(value);
                return sb.append(']').toString();
            }
            default: return String.valueOf(value);
        }
    }

    /** Integral values print without a decimal point; others in shortest plain form. */
    public static String formatNumber(double n) {
        if (Double.isNaN(n)) return "NaN";
        if (Double.isInfinite(n)) return n > 0 ? "inf" : "-inf";
        if (Math.abs(n % 1.0) < EPSILON) {
            if (Math.abs(n) < 9.2e18) return Long.toString((long) n);
            return new BigDecimal(n).setScale(0, RoundingMode.DOWN).toPlainString();
        }
        return BigDecimal.valueOf(n).stripTrailingZeros().toPlainString();
    }

    @Override
    public String toString() {
        return stringify();
    }
}
