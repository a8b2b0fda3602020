package com.indigententerprises.applications.toolkit.serviceinterfaces;

import com.indigententerprises.applications.toolkit.domain.Command;

@FunctionalInterface
public interface CommandHandler<P, R> {
    R handle(Command<P, R> command) throws Exception;
}
