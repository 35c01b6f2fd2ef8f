package com.budgetme.reports.events;

@FunctionalInterface
public interface Subscription {

    void unsubscribe();
}
