/**
 * Provider configuration registry with lock-free copy-on-write snapshots.
 */
package com.phillippitts.plantdx.service.registry;
