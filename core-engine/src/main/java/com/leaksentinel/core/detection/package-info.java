/**
 * One-class boundary classification.
 *
 * <p>
 * {@link com.leaksentinel.core.detection.BoundaryClassifier} selects the
 * reference windows, trains a nu-one-class SVM through
 * {@link com.leaksentinel.core.detection.OneClassSvmTrainer}, backed by
 * Tribuo's libsvm anomaly trainer, and flags the windows whose decision score
 * is negative.
 * </p>
 *
 * @since 1.0.0
 */
package com.leaksentinel.core.detection;
