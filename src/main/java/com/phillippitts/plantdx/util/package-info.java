/**
 * Small stateless helpers shared across packages.
 */
package com.phillippitts.plantdx.util;
