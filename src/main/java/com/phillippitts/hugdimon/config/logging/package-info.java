/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC keys:
 * <ul>
 *   <li>{@code requestId} - unique identifier for each HTTP request</li>
 *   <li>{@code conversationId} - conversation the current turn belongs to</li>
 *   <li>{@code turnStage} - pipeline stage of the turn being processed</li>
 * </ul>
 *
 * <p>Log format:
 * <pre>
 * 2026-03-02 15:42:32.529 [thread] [requestId] [conversationId] [turnStage] LEVEL logger - message
 * </pre>
 *
 * @see com.phillippitts.hugdimon.config.logging.MdcFilter
 */
package com.phillippitts.hugdimon.config.logging;
