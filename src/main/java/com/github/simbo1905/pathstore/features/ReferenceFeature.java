package com.github.simbo1905.pathstore.features;

import com.github.simbo1905.pathstore.Feature;
import com.github.simbo1905.pathstore.FieldKey;
import com.github.simbo1905.pathstore.Fields;
import com.github.simbo1905.pathstore.LazyProxy;
import com.github.simbo1905.pathstore.ObjectStore;
import com.github.simbo1905.pathstore.StorableObject;
import com.github.simbo1905.pathstore.StoreContext;
import com.github.simbo1905.pathstore.Variable;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.Getter;

/// Stores a record by reference: the snapshot keeps an int64 index into a child store and reads
/// back a {@link LazyProxy}, so loading a snapshot never loads the record it points at.
///
/// On write an attached proxy contributes its index directly. A record that is not yet in the
/// child store is saved there first.
///
/// @param <T> the referenced record type
public abstract class ReferenceFeature<T extends StorableObject> implements Feature {

  private static final Logger logger = Logger.getLogger(ReferenceFeature.class.getName());

  @Getter private final String name;

  @Getter private final Class<T> referencedClass;

  private final Variable<Long> variable;

  @Getter private final FieldKey<LazyProxy<T>> key;

  protected ReferenceFeature(String name, Class<T> referencedClass, String description) {
    this.name = name;
    this.referencedClass = referencedClass;
    this.variable = Variable.int64(name, description);
    this.key = FieldKey.of(name);
  }

  /// A fresh instance of the store that holds the referenced records.
  protected abstract ObjectStore<T> createChildStore();

  @Override
  public List<Variable<?>> getVariables() {
    return List.of(variable);
  }

  @Override
  public List<FieldKey<?>> getFieldKeys() {
    return List.of(key);
  }

  @Override
  public List<ObjectStore<?>> createChildStores() {
    return List.of(createChildStore());
  }

  @Override
  public void validate(Fields fields) {
    if (fields.get(key) == null) {
      throw new IllegalArgumentException("Reference " + name + " must not be null");
    }
  }

  @Override
  public void write(StoreContext context, long row, Fields fields) throws IOException {
    final LazyProxy<T> reference = fields.get(key);
    final ObjectStore<T> child = context.getRegistry().getStore(referencedClass);
    final long index;
    if (reference.isAttachedTo(child)) {
      index = reference.getIndex();
    } else {
      final T target = reference.get();
      final Optional<Long> existing = target.indexIn(child);
      if (existing.isPresent()) {
        index = existing.get();
      } else {
        index = child.save(target);
        logger.log(
            Level.FINE,
            () -> String.format("saved referenced %s into %s[%d]", name, child.getName(), index));
      }
    }
    context.write(variable, row, index);
  }

  @Override
  public void read(StoreContext context, long row, Fields.Builder fields) throws IOException {
    final ObjectStore<T> child = context.getRegistry().getStore(referencedClass);
    fields.put(key, child.proxy(context.read(variable, row)));
  }
}
