package com.onthegomap.mapkit.symbology;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Lineal;
import org.locationtech.jts.geom.MultiPoint;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygonal;

/** The kind of geometry every feature in a {@link FeatureSet} shares. */
public enum FeatureType {
  UNSPECIFIED(false),
  POINT(true),
  MULTI_POINT(true),
  LINE(false),
  POLYGON(false);

  private final boolean puntal;

  FeatureType(boolean puntal) {
    this.puntal = puntal;
  }

  /** Returns the feature type of {@code geom}, or {@link #UNSPECIFIED} for empty or mixed collections. */
  public static FeatureType valueOf(Geometry geom) {
    if (geom == null || geom.isEmpty()) {
      return UNSPECIFIED;
    }
    return geom instanceof Point ? POINT : geom instanceof MultiPoint ? MULTI_POINT :
      geom instanceof Lineal ? LINE : geom instanceof Polygonal ? POLYGON : UNSPECIFIED;
  }

  /** Returns true for {@link #POINT} and {@link #MULTI_POINT}. */
  public boolean isPuntal() {
    return puntal;
  }
}
