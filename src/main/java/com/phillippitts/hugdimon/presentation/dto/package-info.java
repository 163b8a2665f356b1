/**
 * Request and response bodies of the chat API. Field names are snake_case on the wire.
 */
package com.phillippitts.hugdimon.presentation.dto;
