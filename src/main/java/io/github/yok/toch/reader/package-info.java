/**
 * Row-stream abstraction over every supported source format.
 *
 * <p>
 * {@link io.github.yok.toch.reader.DelimitedRowReader} handles tab-delimited text and CSV,
 * {@link io.github.yok.toch.reader.SpreadsheetRowReader} handles XLSX workbooks (and XLS after
 * conversion).
 * </p>
 */
package io.github.yok.toch.reader;
