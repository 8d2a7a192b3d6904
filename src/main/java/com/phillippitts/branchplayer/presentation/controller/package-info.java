/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code GET /api/flow} - flow snapshot, displayed caption and choice panel state</li>
 *   <li>{@code POST /api/flow/choice/{success|failure}} - 202 when queued, 409 when no choice
 *       is pending</li>
 * </ul>
 *
 * <p>Controllers never mutate flow state directly; choices are queued for the tick thread.
 *
 * @since 1.0
 */
package com.phillippitts.branchplayer.presentation.controller;
