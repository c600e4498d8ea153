/**
 * Configuration classes bound from {@code application.yml} and the command-line option model.
 */
package io.github.yok.toch.config;
