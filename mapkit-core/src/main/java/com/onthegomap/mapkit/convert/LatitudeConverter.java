package com.onthegomap.mapkit.convert;

import com.onthegomap.mapkit.measure.Latitude;

/** Converts {@link Latitude} values for property editors. */
public final class LatitudeConverter extends MeasurementConverter<Latitude> {

  public LatitudeConverter() {
    super(ValueType.LATITUDE);
  }
}
