package com.github.simbo1905.pathstore;

import java.util.List;

/// A named int64 reading used to exercise stores without the molecular features.
final class Reading extends StorableObject {

  final long value;

  Reading(long value) {
    this(value, null);
  }

  Reading(long value, String name) {
    super(name);
    this.value = value;
  }

  /// One int64 variable, named `value` unless a test needs a clash.
  static final class ValueFeature implements Feature {
    private final String featureName;
    private final Variable<Long> variable;

    ValueFeature(String featureName, String variableName) {
      this.featureName = featureName;
      this.variable = Variable.int64(variableName, "reading value");
    }

    @Override
    public String getName() {
      return featureName;
    }

    @Override
    public List<Variable<?>> getVariables() {
      return List.of(variable);
    }
  }

  static final FieldKey<Long> VALUE = FieldKey.of("value");

  static final class Store extends ObjectStore<Reading> {

    Store(String name) {
      this(name, List.of(new ValueFeature("value", "value")));
    }

    Store(String name, List<Feature> features) {
      super(name, Reading.class, features, true);
    }

    @Override
    protected Fields toFields(Reading reading) {
      return Fields.builder().put(VALUE, reading.value).build();
    }

    @Override
    protected Reading fromFields(Fields fields, long index, String name) {
      return new Reading(fields.get(VALUE), name);
    }
  }
}
