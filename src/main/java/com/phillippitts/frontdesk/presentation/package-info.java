/**
 * Presentation layer: carrier webhooks, operator REST endpoints and exception handling.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - voice webhooks and the session API</li>
 *   <li>{@code presentation.exception} - global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Controllers are thin adapters; call handling lives in
 * {@link com.phillippitts.frontdesk.service.orchestration.SessionOrchestrator}.
 */
package com.phillippitts.frontdesk.presentation;
