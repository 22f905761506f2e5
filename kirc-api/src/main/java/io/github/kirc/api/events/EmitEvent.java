package io.github.kirc.api.events;

import org.jetbrains.annotations.NotNull;

/**
 * Fired for each output a backend or code generation plugin produces.
 * Cancelling the event keeps the output from later listeners and from the compile result.
 */
public class EmitEvent implements ModuleCompileEvent, CancellableEvent {
    /**
     * The name of the backend or plugin that produced the output.
     */
    @NotNull
    public final String producer;
    /**
     * The output, such as a {@link String} or a JVM class.
     */
    @NotNull
    public Object output;
    private boolean cancelled = false;

    public EmitEvent(@NotNull String producer, @NotNull Object output) {
        this.producer = producer;
        this.output = output;
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public void cancel() {
        cancelled = true;
    }
}
