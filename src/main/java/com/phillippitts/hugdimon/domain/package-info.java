/**
 * Domain model: conversation state, history turns, knowledge chunks and turn request/response.
 *
 * @since 1.0
 */
package com.phillippitts.hugdimon.domain;
