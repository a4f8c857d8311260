/**
 * Per-call pipeline orchestration.
 *
 * <p>{@link com.phillippitts.frontdesk.service.orchestration.SessionOrchestrator} is the only
 * component that knows the whole flow:
 * <pre>
 * carrier audio -> codec -> recognizer -> transcripts
 *     transcripts -> barge-in detection (always)
 *                 -> new turn -> router -> direct answer | streamed reply
 *     sentences   -> synthesis -> outbound audio -> paced playback -> carrier
 * </pre>
 *
 * <p>Stages talk through {@link com.phillippitts.frontdesk.service.bus.PipelineQueues}; one
 * session's messages on a queue are handled in order, sessions run independently. Each turn carries
 * a {@link com.phillippitts.frontdesk.domain.CancellationToken} checked at every stage.
 */
package com.phillippitts.frontdesk.service.orchestration;
