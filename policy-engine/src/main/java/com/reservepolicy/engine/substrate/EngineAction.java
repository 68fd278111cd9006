package com.reservepolicy.engine.substrate;

@FunctionalInterface
public interface EngineAction<T> {

    T invoke(InvocationContext context);
}
