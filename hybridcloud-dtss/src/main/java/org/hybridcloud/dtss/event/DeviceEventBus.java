package org.hybridcloud.dtss.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.Subscribe;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.common.eventbus.SubscriberExceptionHandler;
import com.google.inject.Inject;
import com.google.inject.Singleton;

import java.text.MessageFormat;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Synchronous in-process fan-out of {@link DeviceEvent}s to external observers.
 * Delivery is best effort: a failing subscriber is logged and does not affect the publisher.
 */
@Singleton
public final class DeviceEventBus {
  private static final Logger LOG = Logger.getLogger(DeviceEventBus.class.getName());

  private final EventBus eventBus = new EventBus(new LoggingExceptionHandler());

  @Inject
  public DeviceEventBus() {
  }

  public void subscribe(final EventType eventType, final Consumer<DeviceEvent> callback) {
    eventBus.register(new TypedSubscriber(eventType, callback));
  }

  public void publish(final EventType eventType, final DeviceEvent payload) {
    LOG.log(Level.FINEST, () -> MessageFormat.format("{0}: {1}", eventType.getEventName(), payload));
    eventBus.post(new Notification(eventType, payload));
  }

  private static final class Notification {
    private final EventType eventType;
    private final DeviceEvent payload;

    private Notification(final EventType eventType, final DeviceEvent payload) {
      this.eventType = eventType;
      this.payload = payload;
    }
  }

  private static final class TypedSubscriber {
    private final EventType eventType;
    private final Consumer<DeviceEvent> callback;

    private TypedSubscriber(final EventType eventType, final Consumer<DeviceEvent> callback) {
      this.eventType = eventType;
      this.callback = callback;
    }

    @Subscribe
    public void onNotification(final Notification notification) {
      if (notification.eventType == eventType) {
        callback.accept(notification.payload);
      }
    }
  }

  private static final class LoggingExceptionHandler implements SubscriberExceptionHandler {
    @Override
    public void handleException(final Throwable exception, final SubscriberExceptionContext context) {
      LOG.log(Level.WARNING, MessageFormat.format(
          "Subscriber {0} failed to handle {1}.", context.getSubscriberMethod(), context.getEvent()), exception);
    }
  }
}
