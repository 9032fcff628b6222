package com.ivamare.hostbridge.handler;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method as a command handler.
 *
 * <p>Methods annotated with @Handler are discovered and registered by the
 * HandlerRegistry when it runs as a Spring bean.
 *
 * <p>Handler methods must have the signature:
 * <pre>
 * Object handleXxx(Map&lt;String, Object&gt; args)
 * </pre>
 *
 * <p>Example:
 * <pre>
 * {@literal @}Component
 * public class AppInfoHandlers {
 *
 *     {@literal @}Handler(command = "get_version")
 *     public String version(Map&lt;String, Object&gt; args) {
 *         return "1.0.0";
 *     }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Handler {

    /**
     * The command this handler processes.
     *
     * @return command name (e.g., "settings_load")
     */
    String command();
}
