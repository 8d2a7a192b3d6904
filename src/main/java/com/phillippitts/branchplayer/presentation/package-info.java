/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>The HTTP boundary is the operator console: it reads flow state and submits choices. It
 * depends on the service layer, never the other way round.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - flow status and choice endpoints</li>
 *   <li>{@code presentation.exception} - global exception handling for HTTP responses</li>
 * </ul>
 *
 * @see com.phillippitts.branchplayer.presentation.controller
 * @since 1.0
 */
package com.phillippitts.branchplayer.presentation;
