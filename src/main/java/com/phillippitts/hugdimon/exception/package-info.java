/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.hugdimon.exception.HugDimonException}
 * (unchecked) so the REST boundary can translate them in one place.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.hugdimon.exception.InvalidTurnException} - malformed turn input,
 *       rejected at the boundary</li>
 *   <li>{@link com.phillippitts.hugdimon.exception.SessionNotFoundException} - unknown or expired
 *       conversation id</li>
 *   <li>{@link com.phillippitts.hugdimon.exception.SessionBusyException} - session lock not granted
 *       within the wait timeout</li>
 *   <li>{@link com.phillippitts.hugdimon.exception.ExternalServiceException} - completion,
 *       translation or transcription failure, categorised by
 *       {@link com.phillippitts.hugdimon.exception.ExternalServiceException.Kind}</li>
 *   <li>{@link com.phillippitts.hugdimon.exception.DialogScriptException} - malformed dialog
 *       script, raised at load time</li>
 *   <li>{@link com.phillippitts.hugdimon.exception.PromptTooLargeException} - mandatory prompt
 *       sections exceed the token budget</li>
 *   <li>{@link com.phillippitts.hugdimon.exception.TurnCancelledException} - turn interrupted
 *       before commit</li>
 * </ul>
 *
 * <p>Session and validation errors surface to the caller as a declined turn. External service,
 * script and prompt errors are absorbed by the response coordinator and turned into a
 * degraded or apology response.
 *
 * @see com.phillippitts.hugdimon.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.hugdimon.exception;
