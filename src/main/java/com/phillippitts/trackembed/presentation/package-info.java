/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>This package contains the HTTP/REST boundary of the application. Presentation depends on
 * service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers for job submission and similarity lookups</li>
 *   <li>{@code presentation.dto} - request and response bodies</li>
 *   <li>{@code presentation.exception} - global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Controllers are thin adapters and never throw HTTP-specific exceptions.
 *
 * @see com.phillippitts.trackembed.presentation.controller
 * @see com.phillippitts.trackembed.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.trackembed.presentation;
