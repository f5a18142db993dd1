/**
 * Diagnosis orchestration: the per-request state machine, provider call runner and the
 * primary-with-fallback and ensemble pipelines.
 */
package com.phillippitts.plantdx.service.orchestration;
