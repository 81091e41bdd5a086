package orderbookService;

import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Assigns server-side order identifiers to requests that do not bring their own.
 */
public final class OrderIdGenerator {
    private final Supplier<String> source;

    public OrderIdGenerator() {
        this(() -> UUID.randomUUID().toString());
    }

    public OrderIdGenerator(Supplier<String> source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    public String nextId() {
        return source.get();
    }
}
