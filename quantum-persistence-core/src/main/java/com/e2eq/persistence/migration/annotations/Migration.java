package com.e2eq.persistence.migration.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 Marks a {@link com.e2eq.persistence.migration.base.MigrationUnit} and carries its metadata so
 the registry can order and validate units without creating them.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface Migration {
   /**
    The schema version this unit moves the store to. Unique and positive, usually a
    timestamp such as 202501010000.
    */
   long version();

   /**
    Name recorded in the history, defaults to the simple class name.
    */
   String name() default "";

   String description();

   /**
    Versions that must already be applied. Each one must be lower than {@link #version()}.
    */
   long[] dependsOn() default {};

   String author() default "";

   /**
    A backup is taken before a risky unit is applied.
    */
   boolean risky() default false;

   /**
    Reverting this unit loses data, reported by the rollback safety check.
    */
   boolean dataDestructive() default false;
}
