package io.github.drompincen.tabsensei.persistence.stream;

public interface StoreChangeListener {
    void onChange(StoreChange change);
    default void onError(Throwable t) {}
}
