package com.indigententerprises.applications.toolkit.serviceinterfaces;

import com.indigententerprises.applications.toolkit.domain.Command;
import com.indigententerprises.applications.toolkit.domain.CommandType;

public interface CommandBus {
    <P, R> void register(CommandType<P, R> commandType, CommandHandler<P, R> handler);

    /**
     * fire-and-forget; failures are retried and then logged.
     */
    <P, R> void send(Command<P, R> command);

    <P, R> R sendSync(Command<P, R> command);
}
