/**
 * Provider health: failure/recovery events, the tracker that disables and re-enables
 * providers, and the actuator health indicator.
 */
package com.phillippitts.plantdx.service.health;
