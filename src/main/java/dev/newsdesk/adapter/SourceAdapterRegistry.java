package dev.newsdesk.adapter;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Name-to-adapter mapping resolved at dispatch time.
 *
 * <p>A source selects its adapter through the {@code adapter} setting; without one, the source
 * name itself is used as the key. Keys are case-insensitive.
 */
@Component
public class SourceAdapterRegistry {

    public static final String ADAPTER_SETTING = "adapter";

    private static final Logger log = LoggerFactory.getLogger(SourceAdapterRegistry.class);

    private final Map<String, SourceAdapter> adapters = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    public SourceAdapterRegistry(List<SourceAdapter> adapters) {
        for (SourceAdapter adapter : adapters) {
            SourceAdapter previous = this.adapters.putIfAbsent(adapter.key(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate source adapter key '" + adapter.key()
                        + "': " + previous.getClass().getName() + " and "
                        + adapter.getClass().getName());
            }
        }
        log.info("Registered source adapters: {}", this.adapters.keySet());
    }

    /**
     * @throws UnknownAdapterException if nothing answers to the target's adapter key
     */
    public SourceAdapter resolve(CrawlTarget target) {
        String key = adapterKey(target);
        SourceAdapter adapter = adapters.get(key);
        if (adapter == null) {
            throw new UnknownAdapterException(key);
        }
        return adapter;
    }

    public Set<String> keys() {
        return Set.copyOf(adapters.keySet());
    }

    static String adapterKey(CrawlTarget target) {
        String configured = target.setting(ADAPTER_SETTING);
        return configured != null ? configured : target.name();
    }
}
