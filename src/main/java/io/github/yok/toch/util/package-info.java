/**
 * Shared helpers: value parsing rules and error reporting.
 */
package io.github.yok.toch.util;
