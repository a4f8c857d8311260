/**
 * REST controllers: carrier voice webhooks and the operator session API.
 */
package com.phillippitts.frontdesk.presentation.controller;
