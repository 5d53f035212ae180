package de.bsommerfeld.dashboard.polling.state;

import com.google.common.collect.ImmutableMap;
import com.google.inject.Singleton;
import de.bsommerfeld.dashboard.core.event.ApplicationEventBus;
import de.bsommerfeld.dashboard.polling.SourceKind;
import de.bsommerfeld.dashboard.polling.WidgetId;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Process-wide latest state of every open widget.
 *
 * <p>
 * All slots live in one immutable map behind an {@link AtomicReference}.
 * Writers swap in a new map by compare-and-set, so readers always see a
 * consistent picture of every widget at once ({@link #snapshot()}) and never
 * a half-written slot. Each slot has a single writer, its widget's
 * reconciler running on the widget's poller thread, which keeps CAS retries
 * rare.
 */
@Singleton
public class WidgetStateStore {

    private static final Logger LOG = LoggerFactory.getLogger(WidgetStateStore.class);

    private record Slot(WidgetLease lease, WidgetState<?> state) {
    }

    private final AtomicReference<ImmutableMap<WidgetId, Slot>> slots = new AtomicReference<>(ImmutableMap.of());
    private final AtomicLong epochs = new AtomicLong();
    private final ApplicationEventBus eventBus;

    @Inject
    public WidgetStateStore(ApplicationEventBus eventBus) {
        this.eventBus = eventBus;
    }

    /**
     * Opens a slot in the Loading state.
     *
     * @return the lease required to write the slot
     * @throws IllegalStateException if the widget is already open
     */
    public WidgetLease open(WidgetId widgetId, SourceKind kind) {
        WidgetLease lease = new WidgetLease(widgetId, kind, epochs.incrementAndGet());
        Slot slot = new Slot(lease, WidgetState.loading());
        while (true) {
            ImmutableMap<WidgetId, Slot> current = slots.get();
            if (current.containsKey(widgetId)) {
                throw new IllegalStateException("Widget already open: " + widgetId);
            }
            ImmutableMap<WidgetId, Slot> updated = ImmutableMap.<WidgetId, Slot>builder()
                    .putAll(current)
                    .put(widgetId, slot)
                    .build();
            if (slots.compareAndSet(current, updated)) {
                LOG.debug("Opened widget {} (epoch {})", widgetId, lease.epoch());
                return lease;
            }
        }
    }

    /**
     * Removes the slot if {@code lease} is still the current one. Later writes
     * through the lease are dropped.
     */
    public void close(WidgetLease lease) {
        while (true) {
            ImmutableMap<WidgetId, Slot> current = slots.get();
            Slot slot = current.get(lease.widgetId());
            if (slot == null || !slot.lease().equals(lease)) {
                return;
            }
            ImmutableMap.Builder<WidgetId, Slot> builder = ImmutableMap.builder();
            current.forEach((id, existing) -> {
                if (!id.equals(lease.widgetId())) {
                    builder.put(id, existing);
                }
            });
            if (slots.compareAndSet(current, builder.build())) {
                LOG.debug("Closed widget {} (epoch {})", lease.widgetId(), lease.epoch());
                return;
            }
        }
    }

    /**
     * Atomically replaces the slot's state with {@code transition} applied to
     * it. The function may run more than once under contention and must be
     * free of side effects. An event is only published if the state actually
     * changed.
     *
     * @return the resulting change, or empty if the lease is void
     */
    public Optional<WidgetStateChangedEvent> update(WidgetLease lease, UnaryOperator<WidgetState<?>> transition) {
        while (true) {
            ImmutableMap<WidgetId, Slot> current = slots.get();
            Slot slot = current.get(lease.widgetId());
            if (slot == null || !slot.lease().equals(lease)) {
                return Optional.empty();
            }

            WidgetState<?> next = transition.apply(slot.state());
            if (next.equals(slot.state())) {
                return Optional.of(new WidgetStateChangedEvent(lease.widgetId(), slot.state(), next));
            }
            ImmutableMap<WidgetId, Slot> updated = ImmutableMap.<WidgetId, Slot>builder()
                    .putAll(current)
                    .put(lease.widgetId(), new Slot(lease, next))
                    .buildKeepingLast();

            if (slots.compareAndSet(current, updated)) {
                WidgetStateChangedEvent event = new WidgetStateChangedEvent(lease.widgetId(), slot.state(), next);
                eventBus.post(event);
                return Optional.of(event);
            }
        }
    }

    public Optional<WidgetState<?>> get(WidgetId widgetId) {
        Slot slot = slots.get().get(widgetId);
        return slot == null ? Optional.empty() : Optional.of(slot.state());
    }

    /** The lease of an open widget. */
    public Optional<WidgetLease> lease(WidgetId widgetId) {
        Slot slot = slots.get().get(widgetId);
        return slot == null ? Optional.empty() : Optional.of(slot.lease());
    }

    public boolean isOpen(WidgetId widgetId) {
        return slots.get().containsKey(widgetId);
    }

    /** Consistent view of all open widgets, in the order they were opened. */
    public Map<WidgetId, WidgetState<?>> snapshot() {
        ImmutableMap.Builder<WidgetId, WidgetState<?>> builder = ImmutableMap.builder();
        slots.get().forEach((id, slot) -> builder.put(id, slot.state()));
        return builder.build();
    }
}
