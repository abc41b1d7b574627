package com.onthegomap.mapkit.symbology;

import java.util.List;

/**
 * Rendering rules for a layer: an ordered list of categories, each drawn with its own symbolizer.
 *
 * @param <C> category type
 */
public interface Scheme<C> {

  List<C> categories();
}
