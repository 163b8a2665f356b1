/**
 * Per-turn conversation pipeline.
 *
 * <p>{@link com.phillippitts.hugdimon.service.orchestration.DefaultResponseCoordinator} ties the
 * session store, dialog engine, retrieval, prompt assembly, completion and language pipeline
 * together and publishes a
 * {@link com.phillippitts.hugdimon.service.orchestration.event.TurnCompletedEvent} per turn.
 *
 * @since 1.0
 */
package com.phillippitts.hugdimon.service.orchestration;
