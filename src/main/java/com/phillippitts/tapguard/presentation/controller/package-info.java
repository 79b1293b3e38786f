/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code POST /api/v1/terminal/signals} - signal updates from the transport bridge</li>
 *   <li>{@code GET /api/v1/recovery/status} - current recovery state and last cycle report</li>
 *   <li>{@code POST /api/v1/recovery/cycle} - request an immediate cycle</li>
 * </ul>
 *
 * <p>Controllers are thin adapters; exceptions are left to
 * {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.tapguard.presentation.exception
 * @since 1.0
 */
package com.phillippitts.tapguard.presentation.controller;
