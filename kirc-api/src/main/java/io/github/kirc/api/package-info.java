/**
 * The compiler driver: configuration, events and plugins around the core KIR pipeline.
 *
 * @see io.github.kirc.api.KirCompiler
 */
package io.github.kirc.api;
