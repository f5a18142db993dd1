/**
 * Provider-agnostic retry with per-attempt timeouts and exponential backoff.
 */
package com.phillippitts.plantdx.service.retry;
