/**
 * Seeded generator of labelled pipeline sensor data used for demonstrations
 * and end-to-end tests.
 *
 * @since 1.0.0
 */
package com.leaksentinel.core.synthetic;
