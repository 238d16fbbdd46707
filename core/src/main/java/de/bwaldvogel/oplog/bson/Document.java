package de.bwaldvogel.oplog.bson;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import de.bwaldvogel.oplog.exception.MissingFieldException;

/**
 * An insertion-ordered BSON document.
 * <p>
 * The typed getters are strict: they fail with a {@link MissingFieldException} if the key is absent,
 * maps to {@code null} or maps to a value of another BSON type. Nested values are returned as-is, never copied.
 */
public final class Document implements Map<String, Object>, Bson {

    private static final long serialVersionUID = 1L;

    private final LinkedHashMap<String, Object> documentAsMap = new LinkedHashMap<>();

    public Document() {
    }

    public Document(String key, Object value) {
        this();
        append(key, value);
    }

    public Document(Map<String, Object> map) {
        this();
        putAll(map);
    }

    public Document append(String key, Object value) {
        put(key, value);
        return this;
    }

    public String getString(String key) {
        return getTyped(key, String.class, "string");
    }

    public long getLong(String key) {
        return getTyped(key, Long.class, "int64").longValue();
    }

    public BsonTimestamp getTimestamp(String key) {
        return getTyped(key, BsonTimestamp.class, "timestamp");
    }

    public Document getDocument(String key) {
        return getTyped(key, Document.class, "document");
    }

    private <T> T getTyped(String key, Class<T> type, String bsonTypeName) {
        Object value = documentAsMap.get(key);
        if (value == null) {
            throw MissingFieldException.absent(key, bsonTypeName);
        }
        if (!type.isInstance(value)) {
            throw MissingFieldException.wrongType(key, bsonTypeName, value.getClass());
        }
        return type.cast(value);
    }

    @Override
    public boolean containsValue(Object value) {
        return documentAsMap.containsValue(value);
    }

    @Override
    public Object get(Object key) {
        return documentAsMap.get(key);
    }

    @Override
    public void clear() {
        documentAsMap.clear();
    }

    @Override
    public int size() {
        return documentAsMap.size();
    }

    @Override
    public boolean isEmpty() {
        return documentAsMap.isEmpty();
    }

    @Override
    public boolean containsKey(Object key) {
        return documentAsMap.containsKey(key);
    }

    @Override
    public Object put(String key, Object value) {
        return documentAsMap.put(key, value);
    }

    @Override
    public void putAll(Map<? extends String, ?> m) {
        documentAsMap.putAll(m);
    }

    @Override
    public Object remove(Object key) {
        return documentAsMap.remove(key);
    }

    @Override
    public Set<String> keySet() {
        return documentAsMap.keySet();
    }

    @Override
    public Collection<Object> values() {
        return documentAsMap.values();
    }

    @Override
    public Set<Entry<String, Object>> entrySet() {
        return documentAsMap.entrySet();
    }

    @Override
    public boolean equals(Object o) {
        if (o == null) {
            return false;
        }
        if (o == this) {
            return true;
        }
        if (!(o instanceof Document)) {
            return false;
        }
        return documentAsMap.equals(o);
    }

    @Override
    public int hashCode() {
        return documentAsMap.hashCode();
    }

    @Override
    public String toString() {
        return documentAsMap.entrySet().stream()
            .map(entry -> "\"" + Json.escapeJson(entry.getKey()) + "\" : " + Json.toJsonValue(entry.getValue()))
            .collect(Collectors.joining(", ", "{", "}"));
    }
}
