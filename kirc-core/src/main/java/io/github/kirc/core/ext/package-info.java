/**
 * The ext API allows for associating arbitrary data with
 * instances of {@link io.github.kirc.core.ext.ExtContainer}.
 *
 * <pre>{@code
 * Ext<Integer> INDEX = Ext.create(Integer.class, "INDEX");
 *
 * block.attachExt(INDEX, 3);
 * block.getExtOrThrow(INDEX); // => 3
 * }</pre>
 * <p>
 * Analyses use this to hang their results (predecessors, dominators, liveness)
 * off the IR nodes they describe, and passes use it for scratch data that is
 * discarded once they finish. {@link io.github.kirc.core.ext.MetadataState}
 * records which of these results are still valid.
 * <p>
 * Specialised containers may implement fast-paths for certain
 * {@link io.github.kirc.core.ext.Ext}s by storing them directly in fields.
 */
package io.github.kirc.core.ext;
