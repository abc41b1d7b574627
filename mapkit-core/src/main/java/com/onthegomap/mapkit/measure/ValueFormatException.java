package com.onthegomap.mapkit.measure;

/**
 * Error raised when text cannot be parsed as a measurement under the requested locale.
 */
public class ValueFormatException extends RuntimeException {

  private final String input;

  public ValueFormatException(String input, String message) {
    super(message + ": " + (input == null ? "null" : '"' + input + '"'));
    this.input = input;
  }

  public ValueFormatException(String input, String message, Throwable cause) {
    super(message + ": " + (input == null ? "null" : '"' + input + '"'), cause);
    this.input = input;
  }

  /** Returns the text that failed to parse. */
  public String input() {
    return input;
  }
}
