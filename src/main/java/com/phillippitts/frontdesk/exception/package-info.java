/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.frontdesk.exception.FrontDeskException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.frontdesk.exception.ProviderException} - A speech, synthesis or
 *       generation provider failed; {@link com.phillippitts.frontdesk.exception.ProviderTimeoutException}
 *       when its bounded wait ran out</li>
 *   <li>{@link com.phillippitts.frontdesk.exception.InvalidAudioException} - Inbound media payload
 *       could not be decoded into a frame</li>
 *   <li>{@link com.phillippitts.frontdesk.exception.KnowledgeBaseUnavailableException} - Retrieval
 *       index not loaded or not searchable</li>
 *   <li>{@link com.phillippitts.frontdesk.exception.MessageBusException} - Pipeline queue wiring or
 *       delivery failure</li>
 *   <li>{@link com.phillippitts.frontdesk.exception.UnknownSessionException} - Lookup of an ended or
 *       unknown call session</li>
 * </ul>
 *
 * <p>Inside the pipeline these are caught at component boundaries and turned into a spoken
 * fallback, a degraded route, or a dropped frame. At the HTTP boundary they map to status codes
 * via {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.frontdesk.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.frontdesk.exception;
