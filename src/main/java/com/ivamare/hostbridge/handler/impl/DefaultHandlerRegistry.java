package com.ivamare.hostbridge.handler.impl;

import com.ivamare.hostbridge.exception.HandlerAlreadyRegisteredException;
import com.ivamare.hostbridge.exception.HandlerNotFoundException;
import com.ivamare.hostbridge.handler.CommandHandler;
import com.ivamare.hostbridge.handler.Handler;
import com.ivamare.hostbridge.handler.HandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.BeanPostProcessor;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default implementation of HandlerRegistry.
 *
 * <p>Implements BeanPostProcessor to discover and register handlers from Spring beans
 * with @Handler methods.
 */
public class DefaultHandlerRegistry implements HandlerRegistry, BeanPostProcessor {

    private static final Logger log = LoggerFactory.getLogger(DefaultHandlerRegistry.class);

    private final Map<String, CommandHandler> handlers = new ConcurrentHashMap<>();

    @Override
    public void register(String command, CommandHandler handler) {
        if (handlers.putIfAbsent(command, handler) != null) {
            throw new HandlerAlreadyRegisteredException(command);
        }
        log.debug("Registered handler for {}", command);
    }

    @Override
    public Optional<CommandHandler> get(String command) {
        return Optional.ofNullable(handlers.get(command));
    }

    @Override
    public Object dispatch(String command, Map<String, Object> args) throws Exception {
        CommandHandler handler = get(command).orElseThrow(() -> new HandlerNotFoundException(command));
        log.debug("Dispatching {}", command);
        return handler.handle(args);
    }

    @Override
    public boolean hasHandler(String command) {
        return handlers.containsKey(command);
    }

    @Override
    public List<String> registeredCommands() {
        return List.copyOf(handlers.keySet());
    }

    @Override
    public void clear() {
        handlers.clear();
    }

    @Override
    public List<String> registerBean(Object bean) {
        List<String> registered = new ArrayList<>();

        for (Method method : bean.getClass().getMethods()) {
            Handler annotation = method.getAnnotation(Handler.class);
            if (annotation == null) {
                continue;
            }

            validateHandlerMethod(method);

            String command = annotation.command();
            register(command, args -> invoke(method, bean, args));
            registered.add(command);

            log.info("Discovered handler {}.{}() for {}",
                bean.getClass().getSimpleName(), method.getName(), command);
        }

        return registered;
    }

    /**
     * BeanPostProcessor callback - scans beans for @Handler methods.
     */
    @Override
    public Object postProcessAfterInitialization(Object bean, String beanName) {
        boolean hasHandlers = Arrays.stream(bean.getClass().getMethods())
            .anyMatch(m -> m.isAnnotationPresent(Handler.class));

        if (hasHandlers) {
            registerBean(bean);
        }

        return bean;
    }

    private static Object invoke(Method method, Object bean, Map<String, Object> args) throws Exception {
        try {
            return method.invoke(bean, args);
        } catch (InvocationTargetException e) {
            // surface the handler's own exception, not the reflection wrapper
            if (e.getCause() instanceof Exception cause) {
                throw cause;
            }
            throw e;
        }
    }

    private void validateHandlerMethod(Method method) {
        Class<?>[] params = method.getParameterTypes();
        if (params.length != 1 || !params[0].equals(Map.class)) {
            throw new IllegalArgumentException(
                "Handler method " + method.getName() + " must have signature: " +
                "Object methodName(Map<String, Object> args)"
            );
        }
    }
}
