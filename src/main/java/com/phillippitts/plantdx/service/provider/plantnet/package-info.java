/**
 * PlantNet adapter. PlantNet identifies plant species, so its predictions carry species names
 * rather than diseases and only contribute agreement when other providers name the same id.
 */
package com.phillippitts.plantdx.service.provider.plantnet;
