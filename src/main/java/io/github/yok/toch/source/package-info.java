/**
 * Source description and resolution: local files, HTTP(S) URLs and legacy XLS conversion.
 */
package io.github.yok.toch.source;
