/**
 * Consensus across provider results for ensemble mode.
 */
package com.phillippitts.plantdx.service.consensus;
