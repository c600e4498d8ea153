/**
 * Destination boundary ({@link io.github.yok.toch.db.TableWriter}) and its ClickHouse JDBC
 * implementation.
 */
package io.github.yok.toch.db;
