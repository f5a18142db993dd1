/**
 * Spring configuration: thread pools, provider registry and adapters, and orchestrator wiring.
 * Property classes live in {@code config.properties}.
 */
package com.phillippitts.plantdx.config;
