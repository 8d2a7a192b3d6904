/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.branchplayer.exception.BranchPlayerException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.branchplayer.exception.FlowConfigurationException} - Thrown when
 *       the sequence is empty or a bundle that must play has no video</li>
 * </ul>
 *
 * <p>Malformed caption blocks, stale backend signals and out-of-order choices are not
 * exceptions: the component that detects them drops them and logs at DEBUG.
 *
 * @see com.phillippitts.branchplayer.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.branchplayer.exception;
