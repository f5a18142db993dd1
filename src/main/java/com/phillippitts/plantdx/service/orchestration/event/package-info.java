/**
 * Events published by the diagnosis orchestrator.
 */
package com.phillippitts.plantdx.service.orchestration.event;
