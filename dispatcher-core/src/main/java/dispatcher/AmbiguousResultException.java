package dispatcher;

/**
 * Thrown by {@link Notification#oneAndOnlyResult()} when more than one subscriber produced a result.
 */
public final class AmbiguousResultException extends DispatchException {

    private final int resultCount;

    public AmbiguousResultException(int resultCount) {
        super("Notification content has " + resultCount + " results, expected at most one");
        this.resultCount = resultCount;
    }

    public int resultCount() {
        return resultCount;
    }
}
