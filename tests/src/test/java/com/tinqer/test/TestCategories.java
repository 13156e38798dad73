package com.tinqer.test;

import org.junit.jupiter.api.Tag;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Tags used to select test groups, e.g. {@code mvn test -Dgroups=unit}.
 */
public final class TestCategories {

    private TestCategories() {}

    /** Fast tests of a single component. */
    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("unit")
    public @interface Unit {}

    /** Tests that drive a whole plan from query text to SQL. */
    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("integration")
    public @interface Integration {}

    /** Core behavior every change must keep. */
    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("tier1")
    public @interface Tier1 {}

    /** Edge cases and failure paths. */
    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("tier2")
    public @interface Tier2 {}
}
