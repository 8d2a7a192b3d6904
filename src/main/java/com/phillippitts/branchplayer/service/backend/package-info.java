/**
 * Headless implementations of the external collaborators.
 *
 * <p>Active when {@code backend.type=simulated} (the default). A real deployment replaces them
 * with adapters to an actual media player and UI by providing its own
 * {@link com.phillippitts.branchplayer.service.playback.VideoBackend},
 * {@link com.phillippitts.branchplayer.service.playback.AudioBackend},
 * {@link com.phillippitts.branchplayer.service.subtitle.CaptionDisplay} and
 * {@link com.phillippitts.branchplayer.service.flow.ChoiceUi} beans.
 *
 * @since 1.0
 */
package com.phillippitts.branchplayer.service.backend;
