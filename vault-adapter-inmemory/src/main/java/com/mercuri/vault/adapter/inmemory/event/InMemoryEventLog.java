package com.mercuri.vault.adapter.inmemory.event;

import com.mercuri.vault.core.event.VaultEvent;
import com.mercuri.vault.core.spi.VaultEventListener;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only in-memory event log.
 *
 * <p>Receives only committed events; a reverted vault operation never reaches this log.</p>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public class InMemoryEventLog implements VaultEventListener {

    private final List<VaultEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void onEvent(VaultEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        events.add(event);
    }

    /**
     * @return every committed event in emission order
     */
    public List<VaultEvent> events() {
        return List.copyOf(events);
    }

    public <T extends VaultEvent> List<T> eventsOf(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public void clear() {
        events.clear();
    }
}
