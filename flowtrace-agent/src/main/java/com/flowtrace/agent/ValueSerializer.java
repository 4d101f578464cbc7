package com.flowtrace.agent;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns captured argument and return values into bounded strings.
 *
 * Fallback chain, each step only taken when the previous one throws:
 * <ol>
 *   <li>Gson encoding of the whole value</li>
 *   <li>member-by-member JSON tree; members Gson cannot encode become {@code String.valueOf(member)},
 *       cycles become {@code "<circular>"}</li>
 *   <li>{@code String.valueOf(value)}</li>
 *   <li>{@link #UNSERIALIZABLE}</li>
 * </ol>
 * {@link #serialize} never throws. A positive {@code maxLength} cuts the result to exactly
 * {@code maxLength} characters followed by {@link #TRUNCATION_MARKER}; 0 disables truncation.
 */
public final class ValueSerializer {

    public static final String TRUNCATION_MARKER = "...[truncated]";
    public static final String UNSERIALIZABLE = "<unserializable>";
    static final String CIRCULAR = "<circular>";

    /** Object graph depth at which the member-by-member pass stops recursing. */
    static final int DEPTH_LIMIT = 4;

    private static final Gson GSON = new GsonBuilder()
        .disableHtmlEscaping()
        .create();

    private ValueSerializer() {}

    public static String serialize(Object value, int maxLength) {
        String encoded;
        try {
            encoded = encode(value);
        } catch (RuntimeException | StackOverflowError e) {
            encoded = textual(value);
        }
        return truncate(encoded, maxLength);
    }

    static String truncate(String encoded, int maxLength) {
        if (encoded == null) return UNSERIALIZABLE;
        if (maxLength > 0 && encoded.length() > maxLength) {
            return encoded.substring(0, maxLength) + TRUNCATION_MARKER;
        }
        return encoded;
    }

    private static String encode(Object value) {
        if (value != null && isOpaque(value.getClass())) {
            return textual(value);
        }
        try {
            return GSON.toJson(value);
        } catch (RuntimeException | StackOverflowError first) {
            // Rebuild the tree one member at a time so a single bad field does not lose the rest
            JsonElement tree = toTree(value, 0, new IdentityHashMap<>());
            return GSON.toJson(tree);
        }
    }

    /** {@code String.valueOf}, or "null" when a {@code toString()} returns null. */
    private static String textual(Object value) {
        try {
            String text = String.valueOf(value);
            return text != null ? text : "null";
        } catch (RuntimeException | StackOverflowError e) {
            return UNSERIALIZABLE;
        }
    }

    // -----------------------------------------------------------------------
    // Member-by-member pass
    // -----------------------------------------------------------------------

    private static JsonElement toTree(Object obj, int depth, IdentityHashMap<Object, Boolean> visited) {
        if (obj == null) return JsonNull.INSTANCE;

        Class<?> cls = obj.getClass();
        if (obj instanceof Boolean b) return new JsonPrimitive(b);
        if (obj instanceof Number n && cls.getPackageName().startsWith("java.")) return new JsonPrimitive(n);
        if (obj instanceof Character c) return new JsonPrimitive(c);
        if (obj instanceof CharSequence s) return new JsonPrimitive(s.toString());
        if (cls.isEnum()) return new JsonPrimitive(((Enum<?>) obj).name());

        if (visited.containsKey(obj)) return new JsonPrimitive(CIRCULAR);
        if (depth >= DEPTH_LIMIT || isOpaque(cls)) return new JsonPrimitive(textual(obj));

        visited.put(obj, Boolean.TRUE);
        try {
            if (cls.isArray()) {
                JsonArray arr = new JsonArray();
                int len = Array.getLength(obj);
                for (int i = 0; i < len; i++) {
                    arr.add(member(Array.get(obj, i), depth, visited));
                }
                return arr;
            }
            if (obj instanceof Collection<?> col) {
                JsonArray arr = new JsonArray();
                for (Object elem : col) {
                    arr.add(member(elem, depth, visited));
                }
                return arr;
            }
            if (obj instanceof Map<?, ?> map) {
                JsonObject out = new JsonObject();
                for (Map.Entry<?, ?> entry : map.entrySet()) {
                    out.add(textual(entry.getKey()), member(entry.getValue(), depth, visited));
                }
                return out;
            }
            if (cls.getPackageName().startsWith("java.") || cls.getPackageName().startsWith("javax.")) {
                // JDK internals are not reflectively accessible under the module system
                return new JsonPrimitive(textual(obj));
            }
            return pojo(obj, cls, depth, visited);
        } finally {
            visited.remove(obj);
        }
    }

    private static JsonElement member(Object value, int depth, IdentityHashMap<Object, Boolean> visited) {
        try {
            return toTree(value, depth + 1, visited);
        } catch (RuntimeException | StackOverflowError e) {
            return new JsonPrimitive(textual(value));
        }
    }

    private static JsonObject pojo(Object obj, Class<?> cls, int depth, IdentityHashMap<Object, Boolean> visited) {
        // Walk class hierarchy (including superclasses) up to Object
        List<Field> fields = new ArrayList<>();
        Class<?> c = cls;
        while (c != null && c != Object.class) {
            for (Field f : c.getDeclaredFields()) {
                if (f.isSynthetic()) continue;
                int mods = f.getModifiers();
                if (Modifier.isStatic(mods) || Modifier.isTransient(mods)) continue;
                fields.add(f);
            }
            c = c.getSuperclass();
        }

        JsonObject out = new JsonObject();
        for (Field field : fields) {
            if (out.has(field.getName())) continue; // shadowed by a subclass field
            Object fieldValue;
            try {
                field.setAccessible(true);
                fieldValue = field.get(obj);
            } catch (IllegalAccessException | RuntimeException e) {
                out.addProperty(field.getName(), "<inaccessible>");
                continue;
            }
            out.add(field.getName(), member(fieldValue, depth, visited));
        }
        return out;
    }

    /** Types Gson cannot meaningfully encode: it writes anonymous and local classes as null. */
    static boolean isOpaque(Class<?> cls) {
        return cls.isAnonymousClass()
            || cls.isLocalClass()
            || cls.isSynthetic()
            || cls.getName().contains("$$Lambda");
    }
}
