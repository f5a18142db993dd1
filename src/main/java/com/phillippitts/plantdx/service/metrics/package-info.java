/**
 * Micrometer instrumentation for provider calls and diagnosis requests.
 */
package com.phillippitts.plantdx.service.metrics;
