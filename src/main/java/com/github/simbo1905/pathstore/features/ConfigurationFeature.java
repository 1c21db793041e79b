package com.github.simbo1905.pathstore.features;

import com.github.simbo1905.pathstore.ObjectStore;

/// References a {@link Configuration} in the `configurations` child store.
public final class ConfigurationFeature extends ReferenceFeature<Configuration> {

  public ConfigurationFeature() {
    super("configuration", Configuration.class, "index of the configuration of snapshot '{idx}'");
  }

  @Override
  protected ObjectStore<Configuration> createChildStore() {
    return new ConfigurationStore();
  }
}
