/**
 * REST API controllers.
 *
 * <ul>
 *   <li>{@code POST /chat}, {@code POST /chat/voice} - conversation turns</li>
 *   <li>{@code GET /chat/{id}/history}, {@code DELETE /chat/{id}} - dialog log and reset</li>
 *   <li>{@code GET /ping} - liveness and MDC verification</li>
 * </ul>
 */
package com.phillippitts.hugdimon.presentation.controller;
