/**
 * Streaming speech-to-text. One connection per call session, opened at call start and closed
 * with the session.
 */
package com.phillippitts.frontdesk.service.stt;
