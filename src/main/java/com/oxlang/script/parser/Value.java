package com.oxlang.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.oxlang.script.ErrorKind;
import com.oxlang.script.OxError;

public class Value {
    public enum Type { NUMBER, STRING, BOOL, ARRAY, STRUCT_TYPE, STRUCT_INSTANCE, FUNCTION, NIL }

    private static final Value NIL = new Value(Type.NIL, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    public Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value string(String s) { return new Value(Type.STRING, s); }
    public static Value array(List<Value> a) { return new Value(Type.ARRAY, a); }
    public static Value structType(StructDef def) { return new Value(Type.STRUCT_TYPE, def); }
    public static Value instance(StructInstance inst) { return new Value(Type.STRUCT_INSTANCE, inst); }
    public static Value function(Callable fn) { return new Value(Type.FUNCTION, fn); }
    public static Value nil() { return NIL; }

    /**
     * A struct declaration: own fields in declaration order, optional parent,
     * and the method tables filled by later {@code func S.m} / {@code func S:m}.
     */
    public static final class StructDef {
        public final String name;
        public final List<String> fields;
        public final StructDef parent;
        public final Map<String, Callable> staticMethods = new LinkedHashMap<>();
        public final Map<String, Callable> instanceMethods = new LinkedHashMap<>();

        public StructDef(String name, List<String> fields, StructDef parent) {
            this.name = name;
            this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
            this.parent = parent;
        }

        /** Parent's fields first, then own. */
        public List<String> allFields() {
            List<String> out = new ArrayList<>();
            if (parent != null) out.addAll(parent.allFields());
            out.addAll(fields);
            return out;
        }

        public boolean hasField(String field) {
            for (StructDef d = this; d != null; d = d.parent) {
                if (d.fields.contains(field)) return true;
            }
            return false;
        }

        public Callable findStatic(String method) {
            for (StructDef d = this; d != null; d = d.parent) {
                Callable c = d.staticMethods.get(method);
                if (c != null) return c;
            }
            return null;
        }

        public Callable findInstance(String method) {
            for (StructDef d = this; d != null; d = d.parent) {
                Callable c = d.instanceMethods.get(method);
                if (c != null) return c;
            }
            return null;
        }

        public boolean isSubtypeOf(StructDef other) {
            for (StructDef d = this; d != null; d = d.parent) {
                if (d == other) return true;
            }
            return false;
        }

        @Override
        public String toString() {
            return "<struct " + name + ">";
        }
    }

    public static final class StructInstance {
        public final StructDef def;
        // construction order == def.allFields()
        public final Map<String, Value> fields = new LinkedHashMap<>();

        public StructInstance(StructDef def, List<Value> values) {
            this.def = def;
            List<String> names = def.allFields();
            if (values.size() != names.size()) {
                throw new OxError(ErrorKind.ARITY, def.name + " expects " + names.size()
                        + " field values, got " + values.size(), 0, 0);
            }
            for (int i = 0; i < names.size(); i++) {
                fields.put(names.get(i), values.get(i));
            }
        }

        @Override
        public String toString() {
            return render(newOpenSet());
        }

        String render(Set<Object> open) {
            if (!open.add(this)) return def.name + "(...)";
            StringBuilder sb = new StringBuilder(def.name).append('(');
            boolean first = true;
            for (Map.Entry<String, Value> e : fields.entrySet()) {
                if (!first) sb.append(", ");
                sb.append(e.getKey()).append('=').append(e.getValue().render(false, open));
                first = false;
            }
            open.remove(this);
            return sb.append(')').toString();
        }
    }

    public boolean isNil() { return type == Type.NIL; }

    public double asNumber() {
        if (type != Type.NUMBER) throw expected("number");
        return (double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw expected("bool");
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw expected("string");
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asArray() {
        if (type != Type.ARRAY) throw expected("array");
        return (List<Value>) value;
    }

    public StructDef asStructType() {
        if (type != Type.STRUCT_TYPE) throw expected("struct type");
        return (StructDef) value;
    }

    public StructInstance asInstance() {
        if (type != Type.STRUCT_INSTANCE) throw expected("struct instance");
        return (StructInstance) value;
    }

    public Callable asFunction() {
        if (type != Type.FUNCTION) throw expected("function");
        return (Callable) value;
    }

    /** Name used by {@code type(x)} and in error messages. */
    public String typeName() {
        switch (type) {
            case NUMBER: return "number";
            case STRING: return "string";
            case BOOL: return "bool";
            case ARRAY: return "array";
            case STRUCT_TYPE: return "struct";
            case STRUCT_INSTANCE: return asInstance().def.name;
            case FUNCTION: return "function";
            default: return "nil";
        }
    }

    private OxError expected(String what) {
        return new OxError(ErrorKind.TYPE, "Expected " + what + ", got " + typeName(), 0, 0);
    }

    /**
     * Display form: numbers without a trailing ".0" when integral, strings unquoted.
     * An array or instance that contains itself prints as "[...]" or "Name(...)".
     */
    public String display() {
        return render(true, newOpenSet());
    }

    @Override
    public String toString() {
        return render(false, newOpenSet());
    }

    // open holds the arrays and instances on the current rendering path
    String render(boolean forDisplay, Set<Object> open) {
        switch (type) {
            case NUMBER: {
                double d = asNumber();
                if (forDisplay && d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
                    return Long.toString((long) d);
                }
                return Double.toString(d);
            }
            case BOOL:
                return Boolean.toString(asBool());
            case STRING:
                return forDisplay ? asString() : '"' + asString() + '"';
            case ARRAY: {
                List<Value> items = asArray();
                if (!open.add(items)) return "[...]";
                StringBuilder sb = new StringBuilder("[");
                for (int i = 0; i < items.size(); i++) {
                    if (i > 0) sb.append(", ");
                    Value v = items.get(i);
                    sb.append(v.render(forDisplay && v.type != Type.STRING, open));
                }
                open.remove(items);
                return sb.append(']').toString();
            }
            case STRUCT_INSTANCE:
                return asInstance().render(open);
            case STRUCT_TYPE:
            case FUNCTION:
                return String.valueOf(value);
            default:
                return "nil";
        }
    }

    static Set<Object> newOpenSet() {
        return Collections.newSetFromMap(new IdentityHashMap<Object, Boolean>());
    }
}
