package com.chicu.aimodelops.lifecycle.notify;

public interface NotificationChannel {

    String name();

    boolean isEnabled();

    void deliver(AlertMessage alert) throws Exception;
}
