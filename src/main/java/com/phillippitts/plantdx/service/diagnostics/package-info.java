/**
 * Operator diagnostics for providers.
 */
package com.phillippitts.plantdx.service.diagnostics;
