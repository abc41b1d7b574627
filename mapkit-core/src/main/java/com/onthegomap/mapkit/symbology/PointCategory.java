package com.onthegomap.mapkit.symbology;

/**
 * A group of point features drawn the same way.
 *
 * @param legendText label shown for this category in a legend
 * @param symbolizer how features in this category are drawn
 */
public record PointCategory(String legendText, PointSymbolizer symbolizer) {}
