/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.frontdesk.config.ThreadPoolConfig} - pipeline executor and
 *       playback scheduler</li>
 *   <li>{@link com.phillippitts.frontdesk.config.ProviderConfig} - LangChain4j reply and embedding
 *       models, the embedding index, the provider WebSocket client</li>
 *   <li>{@link com.phillippitts.frontdesk.config.WebSocketConfig} - carrier and browser endpoints</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code @ConfigurationProperties}</li>
 *   <li>{@code config.logging} - MDC filter</li>
 * </ul>
 */
package com.phillippitts.frontdesk.config;
