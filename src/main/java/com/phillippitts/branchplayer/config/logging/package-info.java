/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.branchplayer.config.logging.MdcFilter} - Servlet filter
 *       that injects {@code requestId} into MDC for every HTTP request</li>
 * </ul>
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - Unique identifier for each HTTP request (UUID format)</li>
 *   <li>{@code bundleId} - Media bundle a prepared/finished signal belongs to, set by the tick loop</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2025-10-17 15:42:32.529 [flow-tick-1] [requestId] [bundleId] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.branchplayer.config.logging.MdcFilter
 * @since 1.0
 */
package com.phillippitts.branchplayer.config.logging;
