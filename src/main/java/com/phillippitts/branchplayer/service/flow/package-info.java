/**
 * Question/outcome state machine and the scheduling loop.
 *
 * <p>Workflow:
 * <ol>
 *   <li>QUESTION plays; when it ends the choice UI is shown</li>
 *   <li>SUCCESS plays the success outcome, then the next question (or completes)</li>
 *   <li>FAILURE plays the failure outcome, then the same question again</li>
 * </ol>
 *
 * @see com.phillippitts.branchplayer.service.playback.PlaybackSession
 * @since 1.0
 */
package com.phillippitts.branchplayer.service.flow;
