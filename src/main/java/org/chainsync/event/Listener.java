package org.chainsync.event;

@FunctionalInterface
public interface Listener {
	void listen(Event event);
}
