package com.cario.exam.app.service.preprocess;

import java.awt.geom.AffineTransform;
import java.awt.geom.NoninvertibleTransformException;
import java.awt.image.BufferedImage;
import java.util.List;
import lombok.Value;

@Value
public class PreprocessingResult {

  public static final String ERROR_STEP = "error";

  BufferedImage image;
  List<String> appliedSteps;

  /**
   * Maps input pixel coordinates onto {@link #image}: the product of every resize and rotation
   * that ran. Never mutated after construction.
   */
  AffineTransform transform;

  public static PreprocessingResult unchanged(BufferedImage original) {
    return new PreprocessingResult(original, List.of(), new AffineTransform());
  }

  public static PreprocessingResult failed(BufferedImage original) {
    return new PreprocessingResult(original, List.of(ERROR_STEP), new AffineTransform());
  }

  public boolean isFailed() {
    return appliedSteps.contains(ERROR_STEP);
  }

  /** Mean linear scale of the output against the input. */
  public double getScale() {
    return Math.sqrt(Math.abs(transform.getDeterminant()));
  }

  /** Maps coordinates found on {@link #image} back onto the input raster. */
  public AffineTransform toInputFrame() {
    try {
      return transform.createInverse();
    } catch (NoninvertibleTransformException ex) {
      throw new IllegalStateException("preprocessing transform is not invertible", ex);
    }
  }
}
