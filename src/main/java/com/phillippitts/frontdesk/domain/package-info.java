/**
 * Immutable pipeline messages and value types shared by all stages of a call session.
 */
package com.phillippitts.frontdesk.domain;
