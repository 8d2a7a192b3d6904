/**
 * Flow services: caption parsing and lookup, subtitle driving, multi-track playback sessions,
 * the question/outcome state machine and the tick loop that ties them together.
 *
 * <p>Design Patterns:
 * <ul>
 *   <li><b>Single tick thread:</b> backend callbacks and HTTP choices are queued as
 *       {@link com.phillippitts.branchplayer.service.signal.FlowSignal}s and applied by
 *       {@link com.phillippitts.branchplayer.service.flow.FlowRunner}</li>
 *   <li><b>Tagged signals:</b> prepared/finished signals carry the bundle id; stale ones are dropped</li>
 *   <li><b>Event-Driven:</b> flow milestones are published through Spring's ApplicationEventPublisher</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.branchplayer.service;
