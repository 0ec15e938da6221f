package org.chainsync.event;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous publish/subscribe channel owned by a single component.
 * <p>
 * Listeners are called on the notifying thread, in registration order.
 * A listener that throws does not prevent delivery to the remaining listeners.
 */
public class EventBus {

	private static final Logger LOGGER = LogManager.getLogger(EventBus.class);

	private final String name;
	private final List<Listener> listeners = new CopyOnWriteArrayList<>();

	public EventBus(String name) {
		this.name = name;
	}

	public void addListener(Listener newListener) {
		this.listeners.add(newListener);
	}

	public void removeListener(Listener listener) {
		this.listeners.remove(listener);
	}

	public void clearListeners() {
		this.listeners.clear();
	}

	public int getListenerCount() {
		return this.listeners.size();
	}

	public void notify(Event event) {
		for (Listener listener : this.listeners) {
			try {
				listener.listen(event);
			} catch (RuntimeException e) {
				LOGGER.error(String.format("%s listener failed on %s", this.name, event.getClass().getSimpleName()), e);
			}
		}
	}
}
