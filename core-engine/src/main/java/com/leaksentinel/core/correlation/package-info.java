/**
 * Multi-source refinement of surviving anomalies using pump frequency.
 *
 * @since 1.0.0
 */
package com.leaksentinel.core.correlation;
