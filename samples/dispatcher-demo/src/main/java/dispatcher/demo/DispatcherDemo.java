package dispatcher.demo;

import dispatcher.DispatchInterceptor;
import dispatcher.Dispatcher;
import dispatcher.Event;
import dispatcher.Namespaces;
import dispatcher.Notification;
import dispatcher.NotificationFailedException;
import dispatcher.Subscriber;
import dispatcher.SubscriberError;
import dispatcher.SubscriptionRequest;

import java.util.List;

/**
 * Simple demo showing dispatcher usage without Spring.
 *
 * Run with: mvn -pl samples/dispatcher-demo exec:java -Dexec.mainClass=dispatcher.demo.DispatcherDemo
 */
public final class DispatcherDemo {

  public static void main(String[] args) {
    // 1. Create the dispatcher with an audit interceptor
    Dispatcher dispatcher = Dispatcher.builder()
        .interceptor(DispatchInterceptor.before((event, namespace) ->
            System.out.println("[Audit] Dispatching " + event.name() + " to " + namespace)))
        .build();

    // 2. Build an event
    Event ping = Event.builder()
        .name("Ping")
        .data("sender", "demo")
        .build();

    // 3. Subscribe a persistent subscriber in namespace "test"
    String functionId = dispatcher.subscribe(ping,
        Subscriber.named("answer", (event, extra) -> 42), "test", true, 0);

    // 4. Dispatch and print the notification
    Notification notification = dispatcher.dispatch(ping, "test");
    System.out.println("[Result] " + notification);
    System.out.println("[Result] answer=" + notification.get("answer")
        + ", lastNotified=" + ping.lastNotified());

    // 5. Subscribers run by priority; a failing one is collected, not thrown
    dispatcher.subscribeAll(List.of(
        new SubscriptionRequest("OrderPlaced", Subscriber.named("tax", (event, extra) -> {
          event.put("tax", (int) event.get("net") / 10);
          return event.get("tax");
        }), Namespaces.GLOBAL, true, 1),
        new SubscriptionRequest("OrderPlaced", Subscriber.named("inventory", (event, extra) -> {
          throw new IllegalStateException("warehouse offline");
        }), Namespaces.GLOBAL, true, 2),
        new SubscriptionRequest("OrderPlaced", Subscriber.named("total", (event, extra) ->
            (int) event.get("net") + (int) event.get("tax")), Namespaces.GLOBAL, true, 3)));

    Event order = dispatcher.newEvent("OrderPlaced").put("net", 250);
    Notification placed = dispatcher.dispatch(order, Namespaces.GLOBAL);
    System.out.println("[Result] status=" + placed.status() + ", content=" + placed.content());
    try {
      placed.handle();
    } catch (NotificationFailedException e) {
      for (SubscriberError error : e.errors()) {
        System.out.println("[Error] " + error.subscriberName() + ": " + error.message());
      }
    }

    // 6. Unsubscribe by function id
    dispatcher.unsubscribeByFunctionId(functionId);
    System.out.println("[Done] remaining=" + dispatcher);
  }
}
