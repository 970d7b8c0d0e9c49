/**
 * Request and response bodies of the REST API. Field names follow the snake_case wire format.
 */
package com.phillippitts.trackembed.presentation.dto;
