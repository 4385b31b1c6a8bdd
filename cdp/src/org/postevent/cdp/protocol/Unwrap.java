package org.postevent.cdp.protocol;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Makes a domain method return one field of the command's result object instead of the whole
 * object, for example the {@code targetId} of {@code Target.createTarget}. Other fields are ignored
 * and a missing field yields null.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Unwrap {
    /**
     * The result field to return. Defaults to the return type's simple name with its first letter lowercased.
     */
    String value() default "";
}
