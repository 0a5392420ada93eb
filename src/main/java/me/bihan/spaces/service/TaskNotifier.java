package me.bihan.spaces.service;

/**
 * Manages the listeners subscribed to a task.
 */
public interface TaskNotifier {

    /**
     * Subscribes a listener. Attaching a listener that is already present does nothing.
     */
    void attach(TaskListener listener);

    /**
     * Unsubscribes a listener. Detaching an absent listener does nothing.
     */
    void detach(TaskListener listener);

    /**
     * Calls every subscribed listener in attachment order.
     * A failing listener does not stop the remaining ones from being called.
     */
    void notifyListeners();
}
