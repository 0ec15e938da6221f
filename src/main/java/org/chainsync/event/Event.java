package org.chainsync.event;

public interface Event {
}
