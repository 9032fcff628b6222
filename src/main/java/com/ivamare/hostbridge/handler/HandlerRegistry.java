package com.ivamare.hostbridge.handler;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping command names to handlers.
 */
public interface HandlerRegistry {

    /**
     * Register a handler for a command.
     *
     * @param command The command name
     * @param handler The handler function
     * @throws com.ivamare.hostbridge.exception.HandlerAlreadyRegisteredException if handler exists
     */
    void register(String command, CommandHandler handler);

    Optional<CommandHandler> get(String command);

    /**
     * Dispatch a command to its registered handler.
     *
     * @param command The command name
     * @param args Command arguments
     * @return Result from handler (may be null)
     * @throws com.ivamare.hostbridge.exception.HandlerNotFoundException if no handler registered
     * @throws Exception from handler execution
     */
    Object dispatch(String command, Map<String, Object> args) throws Exception;

    boolean hasHandler(String command);

    List<String> registeredCommands();

    /**
     * Remove all handlers. Useful for testing.
     */
    void clear();

    /**
     * Scan a bean for @Handler annotated methods and register them.
     *
     * @param bean The bean to scan
     * @return commands registered from the bean
     */
    List<String> registerBean(Object bean);
}
