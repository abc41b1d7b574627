package com.onthegomap.mapkit.symbology;

import java.io.IOException;

/**
 * Opens layers from files. Implementations pick the file format and the kind of layer to build.
 */
@FunctionalInterface
public interface LayerManager {

  /**
   * Returns a layer for the data in {@code fileName}, or null if no reader handles that file.
   *
   * @throws IOException if the file cannot be read
   */
  FeatureLayer<?> openLayer(String fileName) throws IOException;
}
