package de.bsommerfeld.dashboard.sources;

import com.google.inject.AbstractModule;
import com.google.inject.Binder;
import com.google.inject.TypeLiteral;
import com.google.inject.multibindings.MapBinder;
import de.bsommerfeld.dashboard.polling.SourceAdapter;
import de.bsommerfeld.dashboard.polling.SourceKind;
import de.bsommerfeld.dashboard.sources.live.SystemCpuAdapter;
import de.bsommerfeld.dashboard.sources.live.SystemMemoryAdapter;

/**
 * Contributes the live adapters this module ships. Backends are plugged in
 * by adding to the same map binder from another module:
 *
 * <pre>{@code
 * SourcesModule.adapterBinder(binder())
 *         .addBinding(SourceKind.TICKETS).to(JiraAdapter.class);
 * }</pre>
 */
public class SourcesModule extends AbstractModule {

    @Override
    protected void configure() {
        MapBinder<SourceKind, SourceAdapter<?>> adapters = adapterBinder(binder());
        adapters.addBinding(SourceKind.CPU).to(SystemCpuAdapter.class);
        adapters.addBinding(SourceKind.RAM).to(SystemMemoryAdapter.class);
    }

    /** The map binder live adapters are contributed to. */
    public static MapBinder<SourceKind, SourceAdapter<?>> adapterBinder(Binder binder) {
        return MapBinder.newMapBinder(binder, TypeLiteral.get(SourceKind.class), new TypeLiteral<SourceAdapter<?>>() {
        });
    }
}
