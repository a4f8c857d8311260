/**
 * Maps domain exceptions to HTTP responses.
 */
package com.phillippitts.frontdesk.presentation.exception;
