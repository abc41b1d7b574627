package com.onthegomap.mapkit.symbology;

import com.onthegomap.mapkit.config.MapkitConfig;
import java.io.IOException;
import java.util.Optional;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A layer that draws point and multipoint features.
 * <p>
 * Construction validates the feature type, derives the extent and installs a default {@link PointScheme}. A layer
 * with a single point gets its extent padded by {@link MapkitConfig#singlePointPadding()} on each side so that it does
 * not have zero width or height.
 */
public class PointLayer extends FeatureLayer<PointScheme> {

  private static final Logger LOGGER = LoggerFactory.getLogger(PointLayer.class);

  /** Creates a layer over a new, empty set of points. */
  public PointLayer() {
    this(new InMemoryFeatureSet(FeatureType.POINT));
  }

  /**
   * Creates a layer over {@code featureSet} using default configuration.
   *
   * @throws PointFeatureTypeException if the feature set is not point, multipoint or unspecified
   */
  public PointLayer(FeatureSet featureSet) {
    this(featureSet, MapkitConfig.defaults());
  }

  /**
   * Creates a layer over {@code featureSet}.
   *
   * @throws PointFeatureTypeException if the feature set is not point, multipoint or unspecified
   */
  public PointLayer(FeatureSet featureSet, MapkitConfig config) {
    super(featureSet);
    configure(featureSet, config);
  }

  /**
   * Opens {@code fileName} through {@code layerManager} and returns the result if it is a point layer.
   *
   * @throws IOException if the layer manager cannot read the file
   */
  public static Optional<PointLayer> openFile(String fileName, LayerManager layerManager) throws IOException {
    return layerManager.openLayer(fileName) instanceof PointLayer pointLayer ? Optional.of(pointLayer) :
      Optional.empty();
  }

  private void configure(FeatureSet featureSet, MapkitConfig config) {
    FeatureType featureType = featureSet.featureType();
    if (!featureType.isPuntal() && featureType != FeatureType.UNSPECIFIED) {
      throw new PointFeatureTypeException(featureType);
    }

    int numRows = featureSet.numRows();
    Envelope extent;
    if (numRows == 0) {
      extent = new Envelope();
    } else if (numRows == 1) {
      extent = new Envelope(featureSet.extent());
      extent.expandBy(config.singlePointPadding(), config.singlePointPadding());
    } else {
      extent = new Envelope(featureSet.extent());
    }
    setExtent(extent);
    setSymbology(new PointScheme(config));
    LOGGER.debug("Configured point layer with {} {} features, extent={}", numRows, featureType, extent);
  }
}
