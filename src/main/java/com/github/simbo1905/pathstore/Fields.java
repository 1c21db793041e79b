package com.github.simbo1905.pathstore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/// Immutable bag of feature field values keyed by field name. Values may be null where the
/// feature allows it, so presence is tested with {@link #contains(FieldKey)}.
public final class Fields {

  private final Map<String, Object> values;

  private Fields(Map<String, Object> values) {
    this.values = Collections.unmodifiableMap(values);
  }

  public static Builder builder() {
    return new Builder();
  }

  @SuppressWarnings("unchecked")
  public <V> V get(FieldKey<V> key) {
    if (!values.containsKey(key.name())) {
      throw new IllegalArgumentException("No field " + key + " in " + values.keySet());
    }
    return (V) values.get(key.name());
  }

  public boolean contains(FieldKey<?> key) {
    return values.containsKey(key.name());
  }

  public Set<String> names() {
    return values.keySet();
  }

  @Override
  public String toString() {
    return "Fields" + values.keySet();
  }

  public static final class Builder {
    private final Map<String, Object> values = new LinkedHashMap<>();

    private Builder() {}

    public <V> Builder put(FieldKey<V> key, V value) {
      values.put(key.name(), value);
      return this;
    }

    public Fields build() {
      return new Fields(new LinkedHashMap<>(values));
    }
  }
}
