/**
 * Immutable domain values for the branching flow: question sets, media bundles, phases and
 * caption cues.
 *
 * @since 1.0
 */
package com.phillippitts.branchplayer.domain;
