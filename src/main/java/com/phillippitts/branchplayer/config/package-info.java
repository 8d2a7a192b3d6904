/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.branchplayer.config.SchedulerConfig} - single-threaded scheduler
 *       for the flow tick loop</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.flow} - flow component wiring and startup validation</li>
 *   <li>{@code config.backend} - headless media backends, caption display and choice UI</li>
 *   <li>{@code config.properties} - typed {@code flow.*} and {@code backend.simulated.*} properties</li>
 *   <li>{@code config.logging} - logging infrastructure configuration (MDC filters)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.branchplayer.config;
