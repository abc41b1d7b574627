package com.onthegomap.mapkit.symbology;

/** Marker shapes a {@link PointSymbolizer} can draw. */
public enum PointShape {
  ELLIPSE,
  RECTANGLE,
  TRIANGLE,
  DIAMOND,
  STAR,
  PENTAGON,
  HEXAGON
}
