/**
 * Image validation and normalization ahead of provider calls.
 */
package com.phillippitts.plantdx.service.image;
