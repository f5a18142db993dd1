/**
 * Plant.id adapter.
 */
package com.phillippitts.plantdx.service.provider.plantid;
