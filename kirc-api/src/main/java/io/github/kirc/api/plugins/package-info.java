/**
 * Capabilities that can be plugged into the compiler driver around the core pipeline.
 */
package io.github.kirc.api.plugins;
