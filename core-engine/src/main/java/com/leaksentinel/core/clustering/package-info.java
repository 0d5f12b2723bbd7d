/**
 * Cluster-based false-positive filtering.
 *
 * <p>
 * {@link com.leaksentinel.core.clustering.AgglomerativeClusterer} groups the
 * flagged windows; {@link com.leaksentinel.core.clustering.ClusterFilter}
 * labels each group as leak or operational from its score magnitude and how
 * often it recurs.
 * </p>
 *
 * @since 1.0.0
 */
package com.leaksentinel.core.clustering;
