package com.civicdesk.events;

@FunctionalInterface
public interface EventHandler {

    void handle(DomainEvent event) throws Exception;
}
