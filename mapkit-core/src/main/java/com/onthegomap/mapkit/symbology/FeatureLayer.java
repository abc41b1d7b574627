package com.onthegomap.mapkit.symbology;

import org.locationtech.jts.geom.Envelope;

/**
 * A map layer that draws the features of one {@link FeatureSet} with a {@link Scheme}.
 * <p>
 * The layer references its feature set without copying it. The extent is a cache derived from the feature set when
 * the layer is built and is not recomputed when the set changes.
 *
 * @param <S> scheme type
 */
public abstract class FeatureLayer<S extends Scheme<?>> {

  private final FeatureSet featureSet;
  private Envelope extent = new Envelope();
  private S symbology;

  protected FeatureLayer(FeatureSet featureSet) {
    this.featureSet = featureSet;
  }

  public FeatureSet featureSet() {
    return featureSet;
  }

  /** Returns the bounds this layer reports to the map, a null envelope when it has nothing to draw. */
  public Envelope getExtent() {
    return extent;
  }

  public void setExtent(Envelope extent) {
    this.extent = extent;
  }

  public S getSymbology() {
    return symbology;
  }

  /** Replaces the scheme used to draw this layer. */
  public void setSymbology(S symbology) {
    this.symbology = symbology;
  }
}
