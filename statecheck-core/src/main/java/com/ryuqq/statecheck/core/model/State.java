package com.ryuqq.statecheck.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable snapshot of every modeled variable at one point of a behavior.
 *
 * <p>A State maps variable names to values. Equality and hashing are defined on the
 * <em>canonical form</em>, a deterministic, type-tagged serialization of the content:
 * two states with structurally equal content always have the same canonical form,
 * regardless of the insertion order of maps and sets. The canonical form is what the
 * {@code StateStore} uses as its deduplication key, and a hash collision is resolved
 * by comparing the full canonical form.</p>
 *
 * <p><strong>Supported values:</strong></p>
 * <ul>
 *   <li>{@code null}</li>
 *   <li>{@link Boolean}, {@link String}, {@link Enum}</li>
 *   <li>{@link Byte}, {@link Short}, {@link Integer}, {@link Long} (normalized to {@code Long})</li>
 *   <li>{@link List}, {@link Set}, {@link Map} of supported values, nested arbitrarily</li>
 * </ul>
 *
 * <p>Collections are copied and wrapped unmodifiable on construction, so a State can be
 * shared between threads without further synchronization.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * State initial = State.of("a", 50, "b", 50);
 * State next = initial.with("a", 20L).with("b", 80L);
 *
 * assert initial.equals(State.of("b", 50, "a", 50));
 * </pre>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public final class State {

    private final SortedMap<String, Object> values;
    private final String canonicalForm;
    private final int hash;

    private State(SortedMap<String, Object> values) {
        this.values = Collections.unmodifiableSortedMap(values);
        this.canonicalForm = canonicalize(this.values);
        this.hash = canonicalForm.hashCode();
    }

    /**
     * Creates a State from a variable map.
     *
     * @param values variable name to value
     * @return State instance
     * @throws IllegalArgumentException if values is null, a name is blank or a value type is unsupported
     */
    public static State of(Map<String, ?> values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        SortedMap<String, Object> normalized = new TreeMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            normalized.put(requireName(entry.getKey()), normalize(entry.getValue()));
        }
        return new State(normalized);
    }

    /**
     * Creates a State with a single variable.
     */
    public static State of(String name, Object value) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(name, value);
        return of(values);
    }

    /**
     * Creates a State with two variables.
     */
    public static State of(String name1, Object value1, String name2, Object value2) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(name1, value1);
        putUnique(values, name2, value2);
        return of(values);
    }

    /**
     * Creates a State with three variables.
     */
    public static State of(String name1, Object value1, String name2, Object value2, String name3, Object value3) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(name1, value1);
        putUnique(values, name2, value2);
        putUnique(values, name3, value3);
        return of(values);
    }

    /**
     * Returns a copy of this State with one variable set to a new value.
     *
     * <p>The variable does not need to exist yet.</p>
     *
     * @param name variable name
     * @param value new value
     * @return new State instance (this instance is unchanged)
     */
    public State with(String name, Object value) {
        SortedMap<String, Object> copy = new TreeMap<>(values);
        copy.put(requireName(name), normalize(value));
        return new State(copy);
    }

    /**
     * Returns the value of a variable.
     *
     * @param name variable name
     * @return the value (may be null if the variable holds null)
     * @throws IllegalArgumentException if the variable does not exist
     */
    public Object get(String name) {
        if (!values.containsKey(name)) {
            throw new IllegalArgumentException("Unknown variable: " + name + " (variables: " + values.keySet() + ")");
        }
        return values.get(name);
    }

    public long getLong(String name) {
        return typed(name, Long.class);
    }

    public boolean getBoolean(String name) {
        return typed(name, Boolean.class);
    }

    public String getString(String name) {
        return typed(name, String.class);
    }

    /**
     * Returns the value of an enum variable.
     *
     * @param name variable name
     * @param type enum class
     * @return the enum constant
     * @throws IllegalArgumentException if the variable is missing or holds another type
     */
    public <E extends Enum<E>> E getEnum(String name, Class<E> type) {
        return typed(name, type);
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    /**
     * Variable names in ascending order.
     */
    public Set<String> variables() {
        return values.keySet();
    }

    /**
     * Unmodifiable view of all variables, ordered by name.
     */
    public Map<String, Object> values() {
        return values;
    }

    /**
     * Deterministic, type-tagged serialization of this State's content.
     *
     * <p>Strings are length-prefixed, sets and maps are rendered in canonical element order,
     * so distinct content never shares a canonical form.</p>
     *
     * @return canonical form
     */
    public String canonicalForm() {
        return canonicalForm;
    }

    private <T> T typed(String name, Class<T> type) {
        Object value = get(name);
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException(
                "Variable " + name + " is not a " + type.getSimpleName() + " (value: " + value + ")");
        }
        return type.cast(value);
    }

    private static void putUnique(Map<String, Object> values, String name, Object value) {
        if (values.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate variable name: " + name);
        }
        values.put(name, value);
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Variable name cannot be null or blank");
        }
        return name;
    }

    private static Object normalize(Object value) {
        if (value == null || value instanceof Boolean || value instanceof String
            || value instanceof Enum<?> || value instanceof Long) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(normalize(element));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Set<?> set) {
            Set<Object> copy = new LinkedHashSet<>();
            for (Object element : set) {
                copy.add(normalize(element));
            }
            return Collections.unmodifiableSet(copy);
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(normalize(entry.getKey()), normalize(entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        throw new IllegalArgumentException(
            "Unsupported state value type: " + value.getClass().getName() + " (value: " + value + ")");
    }

    private static String canonicalize(SortedMap<String, Object> values) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            if (!first) {
                sb.append(';');
            }
            first = false;
            appendString(sb, entry.getKey());
            sb.append('=');
            appendValue(sb, entry.getValue());
        }
        return sb.append('}').toString();
    }

    private static void appendValue(StringBuilder sb, Object value) {
        if (value == null) {
            sb.append('N');
        } else if (value instanceof Boolean b) {
            sb.append(b ? "B1" : "B0");
        } else if (value instanceof Long l) {
            sb.append('I').append(l).append('.');
        } else if (value instanceof String s) {
            appendString(sb, s);
        } else if (value instanceof Enum<?> e) {
            sb.append('E');
            appendString(sb, e.getDeclaringClass().getName());
            appendString(sb, e.name());
        } else if (value instanceof List<?> list) {
            sb.append("L[");
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                appendValue(sb, list.get(i));
            }
            sb.append(']');
        } else if (value instanceof Set<?> set) {
            List<String> elements = new ArrayList<>(set.size());
            for (Object element : set) {
                elements.add(render(element));
            }
            Collections.sort(elements);
            sb.append("T{").append(String.join(",", elements)).append('}');
        } else if (value instanceof Map<?, ?> map) {
            List<String> entries = new ArrayList<>(map.size());
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                entries.add(render(entry.getKey()) + "=" + render(entry.getValue()));
            }
            Collections.sort(entries);
            sb.append("M{").append(String.join(",", entries)).append('}');
        } else {
            // normalize() admits nothing else
            throw new IllegalStateException("Unexpected state value: " + value);
        }
    }

    private static String render(Object value) {
        StringBuilder sb = new StringBuilder();
        appendValue(sb, value);
        return sb.toString();
    }

    private static void appendString(StringBuilder sb, String s) {
        sb.append('S').append(s.length()).append(':').append(s);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        State state = (State) o;
        return hash == state.hash && canonicalForm.equals(state.canonicalForm);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "State" + values;
    }
}
