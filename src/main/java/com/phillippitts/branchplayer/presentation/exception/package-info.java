/**
 * Global exception handling for the REST API.
 *
 * @since 1.0
 */
package com.phillippitts.branchplayer.presentation.exception;
