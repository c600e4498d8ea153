/**
 * Failure types of the ingestion pipeline.
 *
 * <p>
 * Every type extends {@link io.github.yok.toch.exception.IngestException}. Setup failures
 * (configuration, source access, conversion, schema mismatch, table creation) are always fatal.
 * Row-level failures ({@link io.github.yok.toch.exception.MalformedRowException},
 * {@link io.github.yok.toch.exception.RowRejectedException}) are fatal only when row-error
 * tolerance is off.
 * </p>
 */
package io.github.yok.toch.exception;
