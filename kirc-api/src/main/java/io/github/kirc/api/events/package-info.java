/**
 * Events fired by the compiler driver, which listeners can observe or modify.
 *
 * @see io.github.kirc.api.events.EventDispatcher
 */
package io.github.kirc.api.events;
