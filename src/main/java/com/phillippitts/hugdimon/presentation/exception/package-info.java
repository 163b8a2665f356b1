/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception mapping:
 * <ul>
 *   <li>{@link com.phillippitts.hugdimon.exception.InvalidTurnException} → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.hugdimon.exception.SessionNotFoundException} → 404 Not Found</li>
 *   <li>{@link com.phillippitts.hugdimon.exception.SessionBusyException} → 409 Conflict</li>
 *   <li>{@link com.phillippitts.hugdimon.exception.ExternalServiceException} → 503 Service Unavailable</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response format:
 * <pre>
 * {
 *   "errorCode": "SessionBusyException",
 *   "message": "Conversation is busy",
 *   "details": "Another message for this conversation is still being processed",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.hugdimon.presentation.exception;
