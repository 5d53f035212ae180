package de.bsommerfeld.dashboard.sources.live;

import com.google.common.collect.ImmutableList;
import com.google.inject.Singleton;
import de.bsommerfeld.dashboard.core.config.Environment;
import de.bsommerfeld.dashboard.polling.SourceAdapter;
import de.bsommerfeld.dashboard.polling.SourceKind;
import de.bsommerfeld.dashboard.polling.WidgetCatalog;
import de.bsommerfeld.dashboard.polling.WidgetDefinition;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Production catalog: one widget per {@link SourceKind}, backed by the
 * adapters contributed to the {@code MapBinder} in {@link SourcesModule}.
 * Kinds without an adapter still get a widget; it reports that nothing is
 * installed for it.
 */
@Singleton
public class LiveSourceCatalog implements WidgetCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(LiveSourceCatalog.class);

    private final List<WidgetDefinition<?>> definitions;

    @Inject
    public LiveSourceCatalog(Map<SourceKind, SourceAdapter<?>> adapters, Environment environment) {
        ImmutableList.Builder<WidgetDefinition<?>> builder = ImmutableList.builder();
        for (SourceKind kind : SourceKind.values()) {
            SourceAdapter<?> adapter = adapters.get(kind);
            if (adapter == null) {
                LOG.info("No adapter installed for {}", kind.key());
                adapter = new MissingAdapter(kind);
            }
            builder.add(define(kind, adapter, environment));
        }
        this.definitions = builder.build();
    }

    @Override
    public List<WidgetDefinition<?>> definitions() {
        return definitions;
    }

    private static <T> WidgetDefinition<T> define(SourceKind kind, SourceAdapter<T> adapter, Environment environment) {
        return WidgetDefinition.of(kind, EnvironmentGuard.wrap(kind, environment, adapter));
    }
}
