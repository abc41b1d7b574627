package com.onthegomap.mapkit.convert;

import com.onthegomap.mapkit.measure.Elevation;

/**
 * Converts {@link Elevation} values for property editors, so that typing {@code "45"} produces a 45° elevation and an
 * edited elevation can be persisted as {@code new Elevation(45.0)}.
 */
public final class ElevationConverter extends MeasurementConverter<Elevation> {

  public ElevationConverter() {
    super(ValueType.ELEVATION);
  }
}
