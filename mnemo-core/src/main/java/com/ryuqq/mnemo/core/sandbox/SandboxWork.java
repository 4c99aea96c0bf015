package com.ryuqq.mnemo.core.sandbox;

/**
 * Unit of work executed inside a scoped sandbox.
 *
 * @param <T> result type
 * @author Mnemo Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SandboxWork<T> {

    /**
     * @param sandbox the sandbox the work runs in
     * @return work result
     */
    T apply(Sandbox sandbox);
}
