package com.workhub.notify;

/**
 * Delivers manager alerts. Delivery failures are logged, never thrown.
 */
public interface ManagerNotifier {

    void notify(ManagerNotification notification);
}
