package com.agentflow.resilience;

/**
 * Callback for circuit state changes. Invoked while the service key's lock is held, so
 * implementations must be quick and must not call back into the governor.
 */
@FunctionalInterface
public interface CircuitTransitionListener {

    void onTransition(String serviceKey, CircuitState from, CircuitState to);
}
