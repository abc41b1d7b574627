package com.onthegomap.mapkit.symbology;

import org.locationtech.jts.geom.Envelope;

/**
 * A collection of features that share one {@link FeatureType}, owned by whoever loaded it.
 */
public interface FeatureSet {

  FeatureType featureType();

  int numRows();

  /**
   * Returns the bounds of all features in this set.
   * <p>
   * This is the set's own envelope: it changes as features are added, so callers that want a stable value must copy it.
   * A set without features returns a null envelope (see {@link Envelope#isNull()}).
   */
  Envelope extent();
}
