package com.onthegomap.mapkit.symbology;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;

/**
 * A {@link FeatureSet} backed by a list of JTS geometries.
 * <p>
 * A set created as {@link FeatureType#UNSPECIFIED} takes the type of the first non-empty geometry added to it.
 */
public class InMemoryFeatureSet implements FeatureSet {

  private final List<Geometry> features = new ArrayList<>();
  private final Envelope extent = new Envelope();
  private FeatureType featureType;

  public InMemoryFeatureSet(FeatureType featureType) {
    this.featureType = featureType;
  }

  /** Returns a set containing {@code geometries}, typed after the first one. */
  public static InMemoryFeatureSet of(Geometry... geometries) {
    var result = new InMemoryFeatureSet(FeatureType.UNSPECIFIED);
    for (Geometry geometry : geometries) {
      result.add(geometry);
    }
    return result;
  }

  public InMemoryFeatureSet add(Geometry geometry) {
    if (featureType == FeatureType.UNSPECIFIED) {
      featureType = FeatureType.valueOf(geometry);
    }
    features.add(geometry);
    extent.expandToInclude(geometry.getEnvelopeInternal());
    return this;
  }

  public List<Geometry> features() {
    return Collections.unmodifiableList(features);
  }

  @Override
  public FeatureType featureType() {
    return featureType;
  }

  @Override
  public int numRows() {
    return features.size();
  }

  @Override
  public Envelope extent() {
    return extent;
  }

  @Override
  public String toString() {
    return "InMemoryFeatureSet{type=" + featureType + ", rows=" + features.size() + ", extent=" + extent + '}';
  }
}
