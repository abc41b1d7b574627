package com.onthegomap.mapkit.convert;

/**
 * Error raised when a converter is asked for a representation outside of the kinds it supports.
 */
public class UnsupportedConversionException extends RuntimeException {

  public UnsupportedConversionException(String message) {
    super(message);
  }
}
