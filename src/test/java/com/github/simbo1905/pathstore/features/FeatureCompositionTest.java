package com.github.simbo1905.pathstore.features;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;

import com.github.simbo1905.pathstore.Fields;
import com.github.simbo1905.pathstore.JulLoggingConfig;
import com.github.simbo1905.pathstore.SchemaConflictException;
import com.github.simbo1905.pathstore.SizingMetadata;
import com.github.simbo1905.pathstore.Snapshot;
import com.github.simbo1905.pathstore.SnapshotKind;
import com.github.simbo1905.pathstore.SnapshotStore;
import com.github.simbo1905.pathstore.StoreRegistry;
import org.junit.Assert;
import org.junit.Test;

public class FeatureCompositionTest extends JulLoggingConfig {

  private static final SnapshotKind PERIODIC =
      Features.kind("periodic", "coordinates", "velocities", "box_vectors");

  private static Snapshot periodic(float[][] box) {
    return Snapshot.create(
        PERIODIC,
        Fields.builder()
            .put(CoordinatesFeature.COORDINATES, SnapshotStoreTest.matrix(1))
            .put(VelocitiesFeature.VELOCITIES, SnapshotStoreTest.matrix(2))
            .put(BoxVectorsFeature.BOX_VECTORS, box)
            .build());
  }

  @Test
  public void testKindIsBuiltFromFeatureNamesInOrder() {
    assertThat(PERIODIC.getFeatureNames(), contains("coordinates", "velocities", "box_vectors"));
    Assert.assertEquals(PERIODIC, Features.kind("periodic", "coordinates", "velocities", "box_vectors"));
    Assert.assertNotEquals(PERIODIC, Features.kind("periodic", "velocities", "coordinates", "box_vectors"));
    Assert.assertThrows(IllegalArgumentException.class, () -> Features.byName("temperature"));
  }

  @Test
  public void testSameFeatureTwiceIsSchemaConflict() {
    Assert.assertThrows(
        SchemaConflictException.class, () -> Features.kind("twice", "coordinates", "coordinates"));
  }

  @Test
  public void testMissingOrUnknownFieldsAreRejected() {
    Assert.assertThrows(
        IllegalArgumentException.class,
        () ->
            Snapshot.create(
                Features.TOY,
                Fields.builder().put(CoordinatesFeature.COORDINATES, SnapshotStoreTest.matrix(1)).build()));
    Assert.assertThrows(
        IllegalArgumentException.class,
        () ->
            Snapshot.create(
                Features.TOY,
                Fields.builder()
                    .put(CoordinatesFeature.COORDINATES, SnapshotStoreTest.matrix(1))
                    .put(VelocitiesFeature.VELOCITIES, SnapshotStoreTest.matrix(2))
                    .put(BoxVectorsFeature.BOX_VECTORS, null)
                    .build()));
  }

  @Test
  public void testFeaturesValidateValues() {
    final float[][] bad = SnapshotStoreTest.matrix(1);
    bad[0][0] = Float.NaN;
    Assert.assertThrows(IllegalArgumentException.class, () -> periodic(bad));
  }

  @Test
  public void testReversalTransformIsPerFeature() {
    final float[][] box = {{2, 0, 0}, {0, 2, 0}, {0, 0, 2}};
    final Snapshot twin = periodic(box).reversed();
    Assert.assertArrayEquals(
        SnapshotStoreTest.matrix(1)[2], twin.get(CoordinatesFeature.COORDINATES)[2], 0f);
    Assert.assertArrayEquals(
        Matrices.negate(SnapshotStoreTest.matrix(2))[2], twin.get(VelocitiesFeature.VELOCITIES)[2], 0f);
    Assert.assertArrayEquals(box[0], twin.get(BoxVectorsFeature.BOX_VECTORS)[0], 0f);
    Assert.assertArrayEquals(
        SnapshotStoreTest.matrix(2)[2], twin.getRaw(VelocitiesFeature.VELOCITIES)[2], 0f);
  }

  @Test
  public void testCompositeStoreLaysOutOneColumnPerVariable() throws Exception {
    try (var registry = StoreRegistry.builder().tempFile("composition", ".db").open()) {
      final var store = registry.register(new SnapshotStore("periodic", PERIODIC));
      registry.initialize(SizingMetadata.of(3, 3));
      assertThat(
          registry.getTable().columnNames(),
          contains(
              "periodic.coordinates",
              "periodic.velocities",
              "periodic.box_vectors",
              "periodic.is_reversed"));
      Assert.assertEquals(
          "periodic.pairs", registry.getTable().column("periodic.coordinates").getDefinition().dimension());
      Assert.assertEquals(
          "periodic", registry.getTable().column("periodic.is_reversed").getDefinition().dimension());

      store.save(periodic(null));
      store.invalidate(0);
      Assert.assertNull(store.load(0).get(BoxVectorsFeature.BOX_VECTORS));
      Assert.assertEquals(1, registry.getTable().dimensionLength("periodic.pairs"));
      Assert.assertEquals(2, registry.getTable().dimensionLength("periodic"));
    }
  }

  @Test
  public void testFullKindRegistersItsChildStores() throws Exception {
    try (var registry = StoreRegistry.builder().tempFile("composition", ".db").open()) {
      registry.register(new SnapshotStore("snapshots", Features.FULL));
      assertThat(
          registry.getStores().stream().map(s -> s.getName()).toList(),
          contains(ConfigurationStore.NAME, MomentumStore.NAME, "snapshots"));
      // a second kind reuses the child stores
      registry.register(new SnapshotStore("shooting", Features.kind("shooting", "configuration", "momentum")));
      assertThat(registry.getStores().stream().map(s -> s.getName()).toList(), hasItem("shooting"));
      Assert.assertEquals(4, registry.getStores().size());
    }
  }
}
