package com.oxlang.script;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.oxlang.script.parser.Value;

/**
 * JSON views of engine state for hosts and tooling.
 *
 * Numbers map to JSON numbers, nil to null, arrays to arrays. Structs and
 * functions, which have no JSON counterpart, become tagged objects:
 * {@code {"$struct": "Point", "x": 1.0}}, {@code {"$type": "Point", ...}},
 * {@code {"$function": "name"}}. An array or instance met again inside itself
 * becomes {@code {"$cycle": "array"}} or {@code {"$cycle": "Point"}}.
 */
public final class StateDump {
    private static final ObjectMapper om = new ObjectMapper();

    private StateDump() {}

    public static JsonNode toJson(Value v) {
        return toJson(v, Collections.newSetFromMap(new IdentityHashMap<Object, Boolean>()));
    }

    private static JsonNode toJson(Value v, Set<Object> open) {
        switch (v.type) {
            case NUMBER: return om.getNodeFactory().numberNode(v.asNumber());
            case STRING: return om.getNodeFactory().textNode(v.asString());
            case BOOL: return om.getNodeFactory().booleanNode(v.asBool());
            case ARRAY: {
                if (!open.add(v.asArray())) return cycle("array");
                ArrayNode a = om.createArrayNode();
                for (Value item : v.asArray()) a.add(toJson(item, open));
                open.remove(v.asArray());
                return a;
            }
            case STRUCT_INSTANCE: {
                Value.StructInstance inst = v.asInstance();
                if (!open.add(inst)) return cycle(inst.def.name);
                ObjectNode o = om.createObjectNode();
                o.put("$struct", inst.def.name);
                for (Map.Entry<String, Value> e : inst.fields.entrySet()) {
                    o.set(e.getKey(), toJson(e.getValue(), open));
                }
                open.remove(inst);
                return o;
            }
            case STRUCT_TYPE: {
                Value.StructDef def = v.asStructType();
                ObjectNode o = om.createObjectNode();
                o.put("$type", def.name);
                if (def.parent != null) o.put("parent", def.parent.name);
                ArrayNode fields = o.putArray("fields");
                for (String f : def.allFields()) fields.add(f);
                ArrayNode statics = o.putArray("staticMethods");
                for (String m : def.staticMethods.keySet()) statics.add(m);
                ArrayNode methods = o.putArray("methods");
                for (String m : def.instanceMethods.keySet()) methods.add(m);
                return o;
            }
            case FUNCTION: {
                ObjectNode o = om.createObjectNode();
                o.put("$function", v.asFunction().name());
                return o;
            }
            default:
                return om.getNodeFactory().nullNode();
        }
    }

    private static ObjectNode cycle(String what) {
        ObjectNode o = om.createObjectNode();
        o.put("$cycle", what);
        return o;
    }

    /** One property per global binding, in binding order. */
    public static ObjectNode globals(Map<String, Value> globals) {
        ObjectNode o = om.createObjectNode();
        for (Map.Entry<String, Value> e : globals.entrySet()) {
            o.set(e.getKey(), toJson(e.getValue()));
        }
        return o;
    }

    public static ObjectNode error(OxError error) {
        ObjectNode o = om.createObjectNode();
        o.put("kind", error.kind().displayName());
        o.put("message", error.detail());
        o.put("line", error.line());
        o.put("column", error.column());
        ArrayNode trace = o.putArray("trace");
        for (String frame : error.callTrace()) trace.add(frame);
        return o;
    }

    public static String pretty(JsonNode node) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render JSON", e);
        }
    }
}
