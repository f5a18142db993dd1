/**
 * Google Cloud Vision adapter.
 */
package com.phillippitts.plantdx.service.provider.vision;
