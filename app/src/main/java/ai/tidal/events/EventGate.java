package ai.tidal.events;

/**
 * Takes ownership of side-message events (see {@link EventType#sideMessage()}) before they reach subscribers.
 *
 * <p>The bus invokes {@link #admit(Event)} on the gate's own serial lane, in publish order relative to every
 * other event delivered to the gate. The gate decides when each event is released with
 * {@link EventBus#deliver(Event)}; it may hold events back, but must never drop error events.
 */
public interface EventGate {

    void admit(Event event);
}
