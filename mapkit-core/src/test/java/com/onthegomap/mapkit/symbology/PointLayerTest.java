package com.onthegomap.mapkit.symbology;

import static com.onthegomap.mapkit.TestUtils.newLineString;
import static com.onthegomap.mapkit.TestUtils.newMultiPoint;
import static com.onthegomap.mapkit.TestUtils.newPoint;
import static com.onthegomap.mapkit.TestUtils.newPolygon;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.onthegomap.mapkit.config.MapkitConfig;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.locationtech.jts.geom.Envelope;

class PointLayerTest {

  @Test
  void testEmptyFeatureSetHasNullExtent() {
    var layer = new PointLayer(new InMemoryFeatureSet(FeatureType.POINT));
    assertTrue(layer.getExtent().isNull());
    assertEquals(new PointScheme(), layer.getSymbology());
  }

  @Test
  void testDefaultConstructor() {
    var layer = new PointLayer();
    assertEquals(FeatureType.POINT, layer.featureSet().featureType());
    assertEquals(0, layer.featureSet().numRows());
    assertTrue(layer.getExtent().isNull());
  }

  @Test
  void testSinglePointIsPadded() {
    var layer = new PointLayer(new InMemoryFeatureSet(FeatureType.POINT).add(newPoint(3, 4)));
    assertEquals(new Envelope(-7, 13, -6, 14), layer.getExtent());
    assertTrue(layer.getExtent().covers(new Envelope(3 - 10, 3 + 10, 4 - 10, 4 + 10)));
  }

  @Test
  void testSingleMultiPointFeatureIsPadded() {
    var features = new InMemoryFeatureSet(FeatureType.MULTI_POINT).add(newMultiPoint(newPoint(0, 0), newPoint(2, 1)));
    var layer = new PointLayer(features);
    assertEquals(new Envelope(-10, 12, -10, 11), layer.getExtent());
  }

  @Test
  void testSinglePointPaddingFromConfig() {
    var config = new MapkitConfig(25, MapkitConfig.DEFAULT_POINT_SIZE, MapkitConfig.DEFAULT_POINT_COLOR);
    var layer = new PointLayer(InMemoryFeatureSet.of(newPoint(0, 0)), config);
    assertEquals(new Envelope(-25, 25, -25, 25), layer.getExtent());
  }

  @Test
  void testSeveralPointsAreNotPadded() {
    var features = InMemoryFeatureSet.of(newPoint(0, 0), newPoint(10, 5), newPoint(-3, 8));
    var layer = new PointLayer(features);
    assertEquals(new Envelope(-3, 10, 0, 8), layer.getExtent());
    assertEquals(features.extent(), layer.getExtent());
  }

  @Test
  void testExtentIsCopied() {
    var features = InMemoryFeatureSet.of(newPoint(0, 0), newPoint(1, 1));
    var layer = new PointLayer(features);
    assertNotSame(features.extent(), layer.getExtent());

    features.add(newPoint(100, 100));
    features.extent().expandBy(5);
    assertEquals(new Envelope(0, 1, 0, 1), layer.getExtent());
  }

  @Test
  void testSinglePointPaddingDoesNotChangeFeatureSetExtent() {
    var features = InMemoryFeatureSet.of(newPoint(5, 5));
    new PointLayer(features);
    assertEquals(new Envelope(5, 5, 5, 5), features.extent());
  }

  @ParameterizedTest
  @EnumSource(value = FeatureType.class, names = {"POINT", "MULTI_POINT", "UNSPECIFIED"})
  void testAcceptsPointLikeFeatureTypes(FeatureType featureType) {
    var layer = new PointLayer(new InMemoryFeatureSet(featureType));
    assertSame(layer.featureSet().featureType(), featureType);
  }

  @ParameterizedTest
  @EnumSource(value = FeatureType.class, names = {"LINE", "POLYGON"})
  void testRejectsOtherFeatureTypes(FeatureType featureType) {
    var features = new InMemoryFeatureSet(featureType);
    var exception = assertThrows(PointFeatureTypeException.class, () -> new PointLayer(features));
    assertEquals(featureType, exception.featureType());
  }

  @Test
  void testRejectsLinesAndPolygonsInUnspecifiedSet() {
    var lines = InMemoryFeatureSet.of(newLineString(0, 0, 1, 1));
    var polygons = InMemoryFeatureSet.of(newPolygon(0, 0, 1, 0, 1, 1, 0, 0));
    assertThrows(PointFeatureTypeException.class, () -> new PointLayer(lines));
    assertThrows(PointFeatureTypeException.class, () -> new PointLayer(polygons));
  }

  @Test
  void testConfigureIsRepeatable() {
    var features = InMemoryFeatureSet.of(newPoint(1, 2), newPoint(3, 4));
    var first = new PointLayer(features);
    var second = new PointLayer(features);
    assertEquals(first.getExtent(), second.getExtent());
    assertEquals(first.getSymbology(), second.getSymbology());
    assertNotSame(first.getSymbology(), second.getSymbology());
    assertSame(features, first.featureSet());
  }

  @Test
  void testDefaultSchemeUsesConfig() {
    var config = new MapkitConfig(10, 8, "#FF0000");
    var layer = new PointLayer(InMemoryFeatureSet.of(newPoint(1, 2)), config);
    assertEquals(List.of(new PointCategory(PointScheme.DEFAULT_LEGEND_TEXT,
      new PointSymbolizer("#FF0000", 8, PointShape.ELLIPSE))), layer.getSymbology().categories());
  }

  @Test
  void testReplaceSymbology() {
    var layer = new PointLayer();
    var scheme = new PointScheme().addCategory(new PointCategory("big",
      new PointSymbolizer("#000000", 20, PointShape.STAR)));
    layer.setSymbology(scheme);
    assertSame(scheme, layer.getSymbology());
  }

  @Test
  void testOpenFile() throws IOException {
    var pointLayer = new PointLayer(InMemoryFeatureSet.of(newPoint(1, 1)));
    assertEquals(Optional.of(pointLayer), PointLayer.openFile("points.shp", fileName -> pointLayer));

    var otherLayer = new FeatureLayer<PointScheme>(new InMemoryFeatureSet(FeatureType.LINE)) {};
    assertEquals(Optional.empty(), PointLayer.openFile("lines.shp", fileName -> otherLayer));
    assertEquals(Optional.empty(), PointLayer.openFile("unknown.xyz", fileName -> null));
  }

  @Test
  void testOpenFilePropagatesReadErrors() {
    LayerManager failing = fileName -> {
      throw new IOException("cannot read " + fileName);
    };
    assertThrows(IOException.class, () -> PointLayer.openFile("broken.shp", failing));
  }
}
