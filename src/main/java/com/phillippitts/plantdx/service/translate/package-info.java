/**
 * Translation of provider and ensemble predictions into the platform's diagnosis record.
 */
package com.phillippitts.plantdx.service.translate;
