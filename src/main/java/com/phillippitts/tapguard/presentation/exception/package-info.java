/**
 * Maps application exceptions to HTTP responses.
 *
 * @see com.phillippitts.tapguard.exception
 */
package com.phillippitts.tapguard.presentation.exception;
