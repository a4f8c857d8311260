/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId}, {@code route} - per HTTP request, set by {@link com.phillippitts.frontdesk.config.logging.CallContextFilter}</li>
 *   <li>{@code callSid} - carrier call id, on webhooks and media-stream frames</li>
 *   <li>{@code sessionId} - set for every pipeline delivery and playback tick, and on session API calls</li>
 *   <li>{@code queue} - bus queue of the delivery being handled</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2026-03-02 15:42:32.529 [pipeline-3] [sessionId] [callSid] INFO logger.name - message
 * </pre>
 */
package com.phillippitts.frontdesk.config.logging;
