package orderbookService;

/**
 * Invoked when matching fails after the request was logged. The engine may be inconsistent at that
 * point, so the default halts the JVM without running shutdown hooks (which would snapshot it).
 */
@FunctionalInterface
public interface FatalErrorHandler {
    int EXIT_STATUS = 70;

    void onFatal(RuntimeException error);

    static FatalErrorHandler haltProcess() {
        return error -> Runtime.getRuntime().halt(EXIT_STATUS);
    }
}
