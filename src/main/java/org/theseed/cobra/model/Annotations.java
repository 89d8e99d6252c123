/**
 *
 */
package org.theseed.cobra.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.github.cliftonlabs.json_simple.JsonArray;
import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * This object holds the annotations for a model entity.  An annotation is a key (usually a
 * database namespace such as "kegg.compound" or "ec-code") with one or more values.  Keys are
 * kept in the order they were first added, and so are the values under each key.
 */
public class Annotations {

    // FIELDS
    /** map of keys to value lists */
    private Map<String, List<String>> valueMap;
    /** return value when a key has no values */
    private static final List<String> NO_VALUES = Collections.emptyList();

    /**
     * Construct an empty annotation set.
     */
    public Annotations() {
        this.valueMap = new LinkedHashMap<String, List<String>>();
    }

    /**
     * Construct a copy of another annotation set.
     *
     * @param other		annotation set to copy
     */
    public Annotations(Annotations other) {
        this();
        for (Map.Entry<String, List<String>> entry : other.valueMap.entrySet())
            this.valueMap.put(entry.getKey(), new ArrayList<String>(entry.getValue()));
    }

    /**
     * Construct an annotation set from a JSON object.  Each key maps to an array of strings.
     *
     * @param json		JSON object to convert
     */
    public Annotations(JsonObject json) {
        this();
        for (Map.Entry<String, Object> entry : json.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Collection<?>) {
                for (Object item : (Collection<?>) value)
                    this.add(entry.getKey(), String.valueOf(item));
            } else if (value != null)
                this.add(entry.getKey(), value.toString());
        }
    }

    /**
     * Add a value to a key.  Duplicate values are ignored.
     *
     * @param key		annotation key
     * @param value		value to add
     */
    public void add(String key, String value) {
        List<String> values = this.valueMap.computeIfAbsent(key, x -> new ArrayList<String>(2));
        if (! values.contains(value))
            values.add(value);
    }

    /**
     * Add all the values in a collection to a key.
     *
     * @param key		annotation key
     * @param values	values to add
     */
    public void addAll(String key, Collection<String> values) {
        for (String value : values)
            this.add(key, value);
    }

    /**
     * Replace the values for a key.
     *
     * @param key		annotation key
     * @param values	new values (if empty, the key is removed)
     */
    public void set(String key, Collection<String> values) {
        if (values.isEmpty())
            this.valueMap.remove(key);
        else
            this.valueMap.put(key, new ArrayList<String>(values));
    }

    /**
     * @return the values for the specified key (empty if none)
     *
     * @param key		annotation key
     */
    public List<String> get(String key) {
        List<String> retVal = this.valueMap.get(key);
        if (retVal == null)
            retVal = NO_VALUES;
        return Collections.unmodifiableList(retVal);
    }

    /**
     * @return TRUE if the specified key has at least one value
     *
     * @param key		annotation key
     */
    public boolean contains(String key) {
        return this.valueMap.containsKey(key);
    }

    /**
     * @return the set of keys, in insertion order
     */
    public Set<String> getKeys() {
        return Collections.unmodifiableSet(this.valueMap.keySet());
    }

    /**
     * @return TRUE if there are no annotations
     */
    public boolean isEmpty() {
        return this.valueMap.isEmpty();
    }

    /**
     * @return the number of keys
     */
    public int size() {
        return this.valueMap.size();
    }

    /**
     * @return a JSON object containing these annotations
     */
    public JsonObject toJson() {
        JsonObject retVal = new JsonObject();
        for (Map.Entry<String, List<String>> entry : this.valueMap.entrySet())
            retVal.put(entry.getKey(), new JsonArray(entry.getValue()));
        return retVal;
    }

    @Override
    public int hashCode() {
        return this.valueMap.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (! (obj instanceof Annotations))
            return false;
        Annotations other = (Annotations) obj;
        return this.valueMap.equals(other.valueMap);
    }

    @Override
    public String toString() {
        return this.valueMap.toString();
    }

}
