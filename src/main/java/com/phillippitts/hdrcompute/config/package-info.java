/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.hdrcompute.config.ThreadPoolConfig} - compute executor and
 *       deadline watchdog</li>
 *   <li>{@link com.phillippitts.hdrcompute.config.ThreadPoolMetricsConfig} - Micrometer gauges
 *       for the compute pool</li>
 *   <li>{@link com.phillippitts.hdrcompute.config.EngineConfig} - worker pool and engine wiring</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code threadpool.*} and {@code compute.*} properties</li>
 * </ul>
 */
package com.phillippitts.hdrcompute.config;
