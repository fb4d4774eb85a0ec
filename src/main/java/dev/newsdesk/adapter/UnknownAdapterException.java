package dev.newsdesk.adapter;

/**
 * Thrown when no {@link SourceAdapter} is registered for a source's adapter key.
 */
public class UnknownAdapterException extends RuntimeException {

    private final String adapterKey;

    public UnknownAdapterException(String adapterKey) {
        super("No source adapter registered for key: " + adapterKey);
        this.adapterKey = adapterKey;
    }

    public String getAdapterKey() {
        return adapterKey;
    }
}
