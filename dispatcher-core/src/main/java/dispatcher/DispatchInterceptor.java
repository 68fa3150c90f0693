package dispatcher;

/**
 * Cross-cutting hook around {@link Dispatcher#dispatch}.
 *
 * <p>Interceptors run around the subscriber pass:
 * <ol>
 *   <li>{@link #beforeDispatch} in registration order</li>
 *   <li>Subscriber invocation</li>
 *   <li>{@link #afterDispatch} in reverse registration order</li>
 * </ol>
 *
 * <p>If {@code beforeDispatch} throws, the exception reaches the caller of
 * {@code dispatch} and no subscriber runs. {@code afterDispatch} exceptions are logged
 * but swallowed.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * Dispatcher.builder()
 *     .interceptor(DispatchInterceptor.before((event, namespace) ->
 *         audit.log(event.name(), namespace)))
 *     .interceptor(DispatchInterceptor.after(notification -> {
 *         if (notification.hasErrors()) alerts.raise(notification);
 *     }))
 *     .build();
 * }</pre>
 */
public interface DispatchInterceptor {

    /**
     * Called before any subscriber is invoked.
     *
     * @param event the event about to be dispatched
     * @param namespace the namespace being dispatched
     */
    default void beforeDispatch(Event event, String namespace) {
    }

    /**
     * Called with the completed notification.
     *
     * @param notification the dispatch result
     */
    default void afterDispatch(Notification notification) {
    }

    /**
     * Creates an interceptor with only a beforeDispatch hook.
     */
    static DispatchInterceptor before(BeforeHook hook) {
        return new DispatchInterceptor() {
            @Override
            public void beforeDispatch(Event event, String namespace) {
                hook.accept(event, namespace);
            }
        };
    }

    /**
     * Creates an interceptor with only an afterDispatch hook.
     */
    static DispatchInterceptor after(AfterHook hook) {
        return new DispatchInterceptor() {
            @Override
            public void afterDispatch(Notification notification) {
                hook.accept(notification);
            }
        };
    }

    @FunctionalInterface
    interface BeforeHook {
        void accept(Event event, String namespace);
    }

    @FunctionalInterface
    interface AfterHook {
        void accept(Notification notification);
    }
}
