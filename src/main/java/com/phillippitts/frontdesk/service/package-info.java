/**
 * Call-handling services.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code audio} - mu-law codec and resampling</li>
 *   <li>{@code playback} - paced outbound audio with backpressure and clear</li>
 *   <li>{@code session} - session registry and per-call state</li>
 *   <li>{@code routing} - knowledge base and confidence-gated query routing</li>
 *   <li>{@code reply} - sentence-streamed reply generation</li>
 *   <li>{@code interruption} - barge-in detection</li>
 *   <li>{@code bus} - in-process per-stage queues</li>
 *   <li>{@code stt}, {@code tts} - provider clients</li>
 *   <li>{@code carrier} - media stream and browser channel adapters</li>
 *   <li>{@code orchestration} - pipeline wiring</li>
 * </ul>
 */
package com.phillippitts.frontdesk.service;
