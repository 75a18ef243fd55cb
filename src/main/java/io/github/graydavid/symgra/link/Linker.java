/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.link;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import io.github.graydavid.symgra.core.ApplicationNode;
import io.github.graydavid.symgra.core.FunctionGraph;
import io.github.graydavid.symgra.core.ValueNode;

/**
 * Turns a {@link FunctionGraph} into a runnable program. Linkers are immutable: {@link #accept(FunctionGraph)} returns
 * a new Linker bound to the graph, after which {@link #makeThunk()} can be called any number of times, each call
 * producing an independent program with its own storage.
 */
public abstract class Linker {
    private final boolean allowGc;
    private final Function<FunctionGraph, List<ApplicationNode>> scheduler;

    /**
     * @param allowGc whether programs may clear intermediate values as soon as they're no longer needed.
     * @param scheduler orders the ApplicationNodes of a graph. May be null, in which case
     *        {@link FunctionGraph#toposort()} is used.
     */
    protected Linker(boolean allowGc, Function<FunctionGraph, List<ApplicationNode>> scheduler) {
        this.allowGc = allowGc;
        this.scheduler = scheduler;
    }

    public boolean allowsGc() {
        return allowGc;
    }

    /** Returns the scheduler this Linker was created with, if any. */
    protected Optional<Function<FunctionGraph, List<ApplicationNode>>> getScheduler() {
        return Optional.ofNullable(scheduler);
    }

    /** Returns the order in which programs linked by this Linker run fgraph's ApplicationNodes. */
    public List<ApplicationNode> schedule(FunctionGraph fgraph) {
        return (scheduler == null) ? fgraph.toposort() : List.copyOf(scheduler.apply(fgraph));
    }

    /**
     * Returns a new Linker like this one, but bound to fgraph.
     * 
     * @param noRecycling ValueNodes whose storage must be cleared before every run, so that no run ever sees a value
     *        left over by a previous run.
     */
    public abstract Linker accept(FunctionGraph fgraph, Collection<? extends ValueNode> noRecycling);

    /** Same as {@link #accept(FunctionGraph, Collection)}, with nothing to clear between runs. */
    public Linker accept(FunctionGraph fgraph) {
        return accept(fgraph, List.of());
    }

    /**
     * Links the bound graph into a program.
     * 
     * @throws IllegalStateException if this Linker isn't bound to a graph.
     */
    public abstract LinkedProgram makeThunk();

    /** Same as {@link #makeThunk()}, except packaged as a function of the graph's inputs. */
    public CompiledFunction makeFunction() {
        return new CompiledFunction(makeThunk());
    }

    /** Returns a new Linker like this one, but with the given garbage collection policy. */
    public abstract Linker withAllowGc(boolean allowGc);
}
