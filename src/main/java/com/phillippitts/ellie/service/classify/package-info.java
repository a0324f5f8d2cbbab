/**
 * Complexity classification used to pick a generation provider.
 *
 * <p>{@link com.phillippitts.ellie.service.classify.ComplexityClassifier} is the pluggable seam; the
 * default {@link com.phillippitts.ellie.service.classify.HeuristicComplexityClassifier} uses keyword
 * and length rules tuned through {@code ellie.classifier.*}.
 */
package com.phillippitts.ellie.service.classify;
