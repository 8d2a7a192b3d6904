/**
 * SRT-style caption parsing and O(log n) cue lookup.
 *
 * @since 1.0
 */
package com.phillippitts.branchplayer.service.caption;
