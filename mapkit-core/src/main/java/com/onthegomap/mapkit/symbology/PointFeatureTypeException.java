package com.onthegomap.mapkit.symbology;

/**
 * Error raised when a {@link PointLayer} is built from a feature set whose features are not points.
 */
public class PointFeatureTypeException extends RuntimeException {

  private final FeatureType featureType;

  public PointFeatureTypeException(FeatureType featureType) {
    super("A point layer requires point, multipoint or unspecified features but got " + featureType);
    this.featureType = featureType;
  }

  public FeatureType featureType() {
    return featureType;
  }
}
