/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Presentation depends on service but not vice versa. Controllers are thin adapters over
 * {@link com.phillippitts.hugdimon.service.orchestration.ResponseCoordinator}; the exception
 * handler maps domain exceptions to HTTP status codes.
 *
 * @since 1.0
 */
package com.phillippitts.hugdimon.presentation;
