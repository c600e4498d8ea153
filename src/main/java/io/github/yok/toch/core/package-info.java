/**
 * Ingestion pipeline: value coercion, batched export and run orchestration.
 */
package io.github.yok.toch.core;
