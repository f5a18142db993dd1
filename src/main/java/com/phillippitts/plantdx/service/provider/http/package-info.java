/**
 * RestTemplate-based HTTP plumbing shared by the remote provider adapters, including the
 * mapping from HTTP status and transport failures to retryable or permanent errors.
 */
package com.phillippitts.plantdx.service.provider.http;
