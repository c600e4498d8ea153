/**
 * Destination schema model, column naming rules and type inference.
 */
package io.github.yok.toch.schema;
